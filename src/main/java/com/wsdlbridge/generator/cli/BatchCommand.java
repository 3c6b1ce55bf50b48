package com.wsdlbridge.generator.cli;

import java.util.List;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.wsdlbridge.generator.batch.BatchConfigReader;
import com.wsdlbridge.generator.batch.BatchGenerator;
import com.wsdlbridge.generator.batch.BatchResult;
import com.wsdlbridge.generator.batch.ClientGenerator;
import com.wsdlbridge.generator.batch.ProcessClientGenerator;
import com.wsdlbridge.generator.cli.exception.OptionsValidationException;
import com.wsdlbridge.generator.cli.model.BatchOptions;
import com.wsdlbridge.generator.cli.model.ValidatedBatchOptions;
import com.wsdlbridge.generator.cli.output.ConversionResultsPrinter;
import com.wsdlbridge.generator.cli.validation.CommandOptionsValidator;
import com.wsdlbridge.generator.codegen.OpenApiGenerator;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * Converts every WSDL listed in a JSON config file and optionally regenerates clients.
 */
@Command(
        name = "batch",
        mixinStandardHelpOptions = true,
        description = "Generates OpenAPI files for a list of WSDL locations and runs a client generator when a document changed."
)
public class BatchCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(BatchCommand.class);

    @Mixin
    private BatchOptions options;

    private final CommandOptionsValidator validator = new CommandOptionsValidator();
    private final ConversionResultsPrinter printer = new ConversionResultsPrinter();

    @Override
    public Integer call() {
        try {
            ValidatedBatchOptions validated = validator.validate(options);
            printer.printBatchBanner(validated);

            List<String> locations = new BatchConfigReader().readLocations(validated.getConfigFile());
            log.info("Found {} WSDL location(s) in {}", locations.size(), validated.getConfigFile());

            ClientGenerator clientGenerator = validated.getClientGeneratorCommand() != null
                    ? new ProcessClientGenerator(validated.getClientGeneratorCommand())
                    : null;
            BatchGenerator batch = new BatchGenerator(new OpenApiGenerator(validated.getConfig()),
                    validated.getConfig().getOutputFormat(), clientGenerator, validated.getOutputDirectory());

            BatchResult result = batch.run(locations);
            printer.printBatch(result, validated.getOutputDirectory());
            return result.isSuccess() ? 0 : 1;

        } catch (OptionsValidationException e) {
            e.getErrors().forEach(error -> log.error(error));
            return 1;
        } catch (Exception e) {
            log.error("Batch failed with exception", e);
            return 1;
        }
    }
}
