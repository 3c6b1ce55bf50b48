package com.wsdlbridge.generator.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import com.wsdlbridge.generator.cli.exception.OptionsValidationException;
import com.wsdlbridge.generator.cli.model.BatchOptions;
import com.wsdlbridge.generator.cli.model.ConvertOptions;
import com.wsdlbridge.generator.cli.model.ValidatedBatchOptions;
import com.wsdlbridge.generator.cli.model.ValidatedConvertOptions;
import com.wsdlbridge.generator.codegen.OutputFormat;
import com.wsdlbridge.generator.codegen.context.GeneratorConfig;
import com.wsdlbridge.generator.model.SourceLocation;

public class CommandOptionsValidator {

	public ValidatedConvertOptions validate(ConvertOptions o) {
		List<String> errors = new ArrayList<>();

		if (isBlank(o.getLocation())) {
			errors.add("WSDL location is required.");
		} else {
			try {
				SourceLocation.of(o.getLocation());
			} catch (IllegalArgumentException e) {
				errors.add("Invalid WSDL location: " + o.getLocation());
			}
		}
		validateTimeout(o.getTimeoutSeconds(), errors);

		Path outputFile = o.getOutput() == null ? null : o.getOutput().toAbsolutePath().normalize();
		if (outputFile != null && Files.isDirectory(outputFile)) {
			errors.add("Output file is a directory: " + outputFile);
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		return new ValidatedConvertOptions(buildConfig(o.getFormat(), o.getTimeoutSeconds()), outputFile);
	}

	public ValidatedBatchOptions validate(BatchOptions o) {
		List<String> errors = new ArrayList<>();

		if (o.getConfig() == null || !Files.isRegularFile(o.getConfig())) {
			errors.add("Config file not found: " + (o.getConfig() == null ? "none" : o.getConfig().toAbsolutePath()));
		}
		Path outputDir = (o.getOutputDir() == null ? Path.of(".") : o.getOutputDir()).toAbsolutePath().normalize();
		if (Files.exists(outputDir) && !Files.isDirectory(outputDir)) {
			errors.add("Output path exists and is not a directory: " + outputDir);
		}
		validateTimeout(o.getTimeoutSeconds(), errors);

		String clientCommand = o.getClientGenerator();
		if (clientCommand != null && clientCommand.isBlank()) {
			errors.add("Client generator command must not be blank (--client-generator).");
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		return new ValidatedBatchOptions(buildConfig(o.getFormat(), o.getTimeoutSeconds()),
				o.getConfig().toAbsolutePath().normalize(), outputDir, clientCommand);
	}

	private static GeneratorConfig buildConfig(OutputFormat format, long timeoutSeconds) {
		return GeneratorConfig.builder()
				.outputFormat(format == null ? OutputFormat.JSON : format)
				.fetchTimeout(Duration.ofSeconds(timeoutSeconds))
				.build();
	}

	private static void validateTimeout(long timeoutSeconds, List<String> errors) {
		if (timeoutSeconds <= 0) {
			errors.add("Timeout must be > 0 seconds. Got: " + timeoutSeconds);
		}
	}

	private static boolean isBlank(String s) {
		return s == null || s.trim().isEmpty();
	}
}
