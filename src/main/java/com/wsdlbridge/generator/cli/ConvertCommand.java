package com.wsdlbridge.generator.cli;

import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.wsdlbridge.generator.cli.exception.OptionsValidationException;
import com.wsdlbridge.generator.cli.model.ConvertOptions;
import com.wsdlbridge.generator.cli.model.ValidatedConvertOptions;
import com.wsdlbridge.generator.cli.output.ConversionResultsPrinter;
import com.wsdlbridge.generator.cli.validation.CommandOptionsValidator;
import com.wsdlbridge.generator.codegen.ConversionResult;
import com.wsdlbridge.generator.codegen.OpenApiGenerator;
import com.wsdlbridge.generator.codegen.util.FileWriteUtil;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * Converts a single WSDL into an OpenAPI document.
 */
@Command(
        name = "convert",
        mixinStandardHelpOptions = true,
        description = "Converts one WSDL (with its imports and schemas) into an OpenAPI document."
)
public class ConvertCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ConvertCommand.class);

    @Mixin
    private ConvertOptions options;

    private final CommandOptionsValidator validator = new CommandOptionsValidator();
    private final ConversionResultsPrinter printer = new ConversionResultsPrinter();

    @Override
    public Integer call() {
        try {
            ValidatedConvertOptions validated = validator.validate(options);
            printer.printBanner("convert", validated.getConfig());

            OpenApiGenerator generator = new OpenApiGenerator(validated.getConfig());
            ConversionResult result = generator.convert(options.getLocation());
            if (!result.isSuccess()) {
                result.getErrors().forEach(error -> log.error("Conversion failed: {}", error));
                return 1;
            }

            if (validated.getOutputFile() != null) {
                FileWriteUtil.safeWriteString(validated.getOutputFile(), result.getDocument());
            } else {
                System.out.println(result.getDocument());
            }
            printer.printConversion(result, validated.getOutputFile());
            return 0;

        } catch (OptionsValidationException e) {
            e.getErrors().forEach(error -> log.error(error));
            return 1;
        } catch (Exception e) {
            log.error("Conversion failed with exception", e);
            return 1;
        }
    }
}
