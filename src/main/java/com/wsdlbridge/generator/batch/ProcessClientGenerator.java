package com.wsdlbridge.generator.batch;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.InterruptedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs an external client generator such as kiota or openapi-generator.
 *
 * The command template is split on whitespace; {@code {input}} and {@code {output}} in any
 * argument are replaced with the OpenAPI file and the client directory.
 */
public class ProcessClientGenerator implements ClientGenerator {
    private static final Logger log = LoggerFactory.getLogger(ProcessClientGenerator.class);

    static final String INPUT_PLACEHOLDER = "{input}";
    static final String OUTPUT_PLACEHOLDER = "{output}";

    private final String commandTemplate;

    public ProcessClientGenerator(String commandTemplate) {
        if (commandTemplate == null || commandTemplate.isBlank()) {
            throw new IllegalArgumentException("Client generator command must not be blank");
        }
        this.commandTemplate = commandTemplate.trim();
    }

    List<String> buildCommand(Path openApiFile, Path outputDirectory) {
        List<String> command = new ArrayList<>();
        for (String argument : Arrays.asList(commandTemplate.split("\\s+"))) {
            command.add(argument
                    .replace(INPUT_PLACEHOLDER, openApiFile.toAbsolutePath().toString())
                    .replace(OUTPUT_PLACEHOLDER, outputDirectory.toAbsolutePath().toString()));
        }
        return command;
    }

    @Override
    public boolean generate(Path openApiFile, Path outputDirectory) throws IOException {
        List<String> command = buildCommand(openApiFile, outputDirectory);
        log.info("Running client generator: {}", String.join(" ", command));

        ProcessBuilder pb = new ProcessBuilder(command)
                .redirectErrorStream(true);
        Process process = pb.start();

        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                log.debug("Client generator: {}", line);
            }
        }

        try {
            int exitCode = process.waitFor();
            if (exitCode != 0) {
                log.warn("Client generator exited with code {} for {}", exitCode, openApiFile);
            }
            return exitCode == 0;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroy();
            throw new InterruptedIOException("Interrupted while waiting for client generator");
        }
    }
}
