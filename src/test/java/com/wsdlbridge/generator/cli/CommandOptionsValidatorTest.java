package com.wsdlbridge.generator.cli;

import static org.assertj.core.api.Assertions.*;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.wsdlbridge.generator.cli.exception.OptionsValidationException;
import com.wsdlbridge.generator.cli.model.BatchOptions;
import com.wsdlbridge.generator.cli.model.ConvertOptions;
import com.wsdlbridge.generator.cli.model.ValidatedBatchOptions;
import com.wsdlbridge.generator.cli.model.ValidatedConvertOptions;
import com.wsdlbridge.generator.cli.validation.CommandOptionsValidator;
import com.wsdlbridge.generator.codegen.OutputFormat;

import picocli.CommandLine;

class CommandOptionsValidatorTest {

    @TempDir
    Path tempDir;

    private final CommandOptionsValidator validator = new CommandOptionsValidator();

    @Test
    void testConvertDefaults() {
        ConvertOptions options = CommandLine.populateCommand(new ConvertOptions(), "http://example.com/Guide/wsdl");

        ValidatedConvertOptions validated = validator.validate(options);

        assertThat(validated.getOutputFile()).isNull();
        assertThat(validated.getConfig().getOutputFormat()).isEqualTo(OutputFormat.JSON);
        assertThat(validated.getConfig().getFetchTimeout()).isEqualTo(Duration.ofSeconds(30));
    }

    @Test
    void testConvertCollectsAllErrors() throws Exception {
        Path directory = Files.createDirectory(tempDir.resolve("out"));
        ConvertOptions options = CommandLine.populateCommand(new ConvertOptions(),
                " ", "--timeout-seconds", "0", "-o", directory.toString());

        assertThatThrownBy(() -> validator.validate(options))
                .isInstanceOfSatisfying(OptionsValidationException.class, e -> assertThat(e.getErrors())
                        .hasSize(3)
                        .anySatisfy(error -> assertThat(error).contains("location is required"))
                        .anySatisfy(error -> assertThat(error).contains("Timeout"))
                        .anySatisfy(error -> assertThat(error).contains("is a directory")));
    }

    @Test
    void testBatchOptions() throws Exception {
        Path config = Files.writeString(tempDir.resolve("wsdls.json"), "[]");
        BatchOptions options = CommandLine.populateCommand(new BatchOptions(),
                "-c", config.toString(), "-o", tempDir.resolve("gen").toString(), "-f", "YAML",
                "--client-generator", "kiota generate -d {input} -o {output}");

        ValidatedBatchOptions validated = validator.validate(options);

        assertThat(validated.getConfigFile()).isEqualTo(config.toAbsolutePath().normalize());
        assertThat(validated.getOutputDirectory()).isEqualTo(tempDir.resolve("gen").toAbsolutePath().normalize());
        assertThat(validated.getConfig().getOutputFormat()).isEqualTo(OutputFormat.YAML);
        assertThat(validated.getClientGeneratorCommand()).startsWith("kiota");
    }

    @Test
    void testBatchRejectsFileAsOutputDirectory() throws Exception {
        Path config = Files.writeString(tempDir.resolve("wsdls.json"), "[]");
        BatchOptions options = CommandLine.populateCommand(new BatchOptions(),
                "-c", config.toString(), "-o", config.toString());

        assertThatThrownBy(() -> validator.validate(options))
                .isInstanceOfSatisfying(OptionsValidationException.class, e -> assertThat(e.getErrors())
                        .singleElement().satisfies(error -> assertThat(error).contains("not a directory")));
    }
}
