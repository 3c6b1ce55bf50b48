package com.wsdlbridge.generator.cli.model;

import java.nio.file.Path;

import com.wsdlbridge.generator.codegen.OutputFormat;

import lombok.Getter;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Holds all CLI options for the "convert" command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class ConvertOptions {

	@Parameters(index = "0", description = "WSDL location: a file path, file: URI or http(s) URL")
	private String location;

	@Option(names = { "--output", "-o" }, description = "Output file (defaults to standard output)")
	private Path output;

	@Option(names = { "--format", "-f" }, defaultValue = "JSON", description = "Output format: JSON or YAML")
	private OutputFormat format;

	@Option(names = {
			"--timeout-seconds" }, defaultValue = "30", description = "Timeout for each document fetch in seconds")
	private long timeoutSeconds;
}
