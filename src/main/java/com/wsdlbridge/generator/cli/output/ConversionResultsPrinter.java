package com.wsdlbridge.generator.cli.output;

import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.wsdlbridge.generator.batch.BatchResult;
import com.wsdlbridge.generator.cli.model.ValidatedBatchOptions;
import com.wsdlbridge.generator.codegen.ConversionResult;
import com.wsdlbridge.generator.codegen.context.GeneratorConfig;

/**
 * Responsible only for printing CLI output for the "convert" and "batch" commands.
 * No validation, no execution.
 */
public class ConversionResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(ConversionResultsPrinter.class);

    public void printBanner(String command, GeneratorConfig config) {
        log.info("=================================================");
        log.info("WSDL OpenAPI Generator: {}", command);
        log.info("=================================================");
        log.info("Output Format: {}", config.getOutputFormat());
        log.info("Fetch Timeout: {} s", config.getFetchTimeout().toSeconds());
        log.info("OpenAPI Version: {}", config.getOpenApiVersion());
        log.info("=================================================");
    }

    public void printBatchBanner(ValidatedBatchOptions v) {
        printBanner("batch", v.getConfig());
        log.info("Config File: {}", v.getConfigFile());
        log.info("Output Directory: {}", v.getOutputDirectory());
        log.info("Client Generator: {}", v.getClientGeneratorCommand() != null ? v.getClientGeneratorCommand() : "None");
        log.info("=================================================");
    }

    public void printConversion(ConversionResult result, Path outputFile) {
        log.info("");
        log.info("=================================================");
        log.info("CONVERSION SUCCESSFUL");
        log.info("=================================================");
        log.info("Source: {}", result.getLocation());
        log.info("Output: {}", outputFile != null ? outputFile : "standard output");
        log.info("Interface Documents Loaded: {}", result.getDocumentsLoaded());
        log.info("Schema Fragments Loaded: {}", result.getSchemaFragmentsLoaded());
        log.info("Operations Converted: {}", result.getOperationsConverted());
        log.info("Paths Generated: {}", result.getPathsGenerated());
        log.info("Components Synthesized: {}", result.getComponentsSynthesized());
        printWarnings(result);
        log.info("=================================================");
    }

    public void printBatch(BatchResult result, Path outputDirectory) {
        log.info("");
        log.info("=================================================");
        log.info(result.isSuccess() ? "BATCH SUCCESSFUL" : "BATCH COMPLETED WITH FAILURES");
        log.info("=================================================");
        log.info("Output Directory: {}", outputDirectory);
        log.info("Locations Processed: {}", result.getLocationsProcessed());
        log.info("Documents Written: {}", result.getDocumentsWritten());
        log.info("Clients Generated: {}", result.getClientsGenerated());
        log.info("Clients Skipped (unchanged): {}", result.getClientsSkipped());
        if (!result.getFailures().isEmpty()) {
            log.info("");
            log.info("Failures:");
            result.getFailures().forEach(failure -> log.error("  {}", failure));
        }
        log.info("=================================================");
    }

    private void printWarnings(ConversionResult result) {
        if (result.getWarnings().isEmpty()) {
            return;
        }
        log.info("");
        log.info("Warnings:");
        result.getWarnings().forEach(warning -> log.warn("  {}", warning));
    }
}
