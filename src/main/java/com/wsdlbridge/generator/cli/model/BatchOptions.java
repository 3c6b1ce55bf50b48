package com.wsdlbridge.generator.cli.model;

import java.nio.file.Path;

import com.wsdlbridge.generator.codegen.OutputFormat;

import lombok.Getter;
import picocli.CommandLine.Option;

/**
 * Holds all CLI options for the "batch" command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class BatchOptions {

	@Option(names = { "--config", "-c" }, defaultValue = "wsdls.json", description = "JSON file containing an array of WSDL locations")
	private Path config;

	@Option(names = { "--out", "-o" }, defaultValue = "generated", description = "Output directory for OpenAPI files")
	private Path outputDir;

	@Option(names = { "--format", "-f" }, defaultValue = "JSON", description = "Output format: JSON or YAML")
	private OutputFormat format;

	@Option(names = {
			"--timeout-seconds" }, defaultValue = "30", description = "Timeout for each document fetch in seconds")
	private long timeoutSeconds;

	@Option(names = {
			"--client-generator" }, description = "Client generator command run for changed documents, e.g. \"kiota generate -l java -d {input} -o {output}\"")
	private String clientGenerator;
}
