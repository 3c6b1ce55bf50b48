package com.wsdlbridge.generator.batch;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.wsdlbridge.generator.codegen.ConversionResult;
import com.wsdlbridge.generator.codegen.OpenApiGenerator;
import com.wsdlbridge.generator.codegen.OutputFormat;
import com.wsdlbridge.generator.codegen.util.ContentHashUtil;
import com.wsdlbridge.generator.codegen.util.FileWriteUtil;
import com.wsdlbridge.generator.codegen.util.NamingUtil;
import com.wsdlbridge.generator.model.SourceLocation;

/**
 * Converts a list of WSDL locations into OpenAPI files in one output directory and, when a
 * {@link ClientGenerator} is configured, regenerates clients for documents whose content hash
 * changed or whose client directory is missing.
 *
 * A failing location is recorded and the batch moves on to the next one.
 */
public class BatchGenerator {
    private static final Logger log = LoggerFactory.getLogger(BatchGenerator.class);

    static final String DOCUMENT_SUFFIX = ".openapi";
    static final String CLIENT_SUFFIX = "_client";

    private final OpenApiGenerator generator;
    private final OutputFormat outputFormat;
    private final ClientGenerator clientGenerator;
    private final Path outputDirectory;

    /**
     * @param clientGenerator may be null to only write OpenAPI files
     */
    public BatchGenerator(OpenApiGenerator generator, OutputFormat outputFormat,
                          ClientGenerator clientGenerator, Path outputDirectory) {
        this.generator = Objects.requireNonNull(generator, "generator");
        this.outputFormat = Objects.requireNonNull(outputFormat, "outputFormat");
        this.clientGenerator = clientGenerator;
        this.outputDirectory = Objects.requireNonNull(outputDirectory, "outputDirectory");
    }

    public BatchResult run(List<String> locations) throws IOException {
        Files.createDirectories(outputDirectory);
        GenerationState state = GenerationState.load(outputDirectory);
        Set<String> usedNames = new HashSet<>();

        BatchResult.BatchResultBuilder result = BatchResult.builder();
        int written = 0;
        int generated = 0;
        int skipped = 0;

        for (String location : locations) {
            log.info("Processing {}...", location);
            ConversionResult conversion = generator.convert(location);
            if (!conversion.isSuccess()) {
                result.failure(location + ": " + conversion.getErrorMessage());
                continue;
            }

            String name = NamingUtil.disambiguate(SourceLocation.of(location).getDocumentStem(), usedNames);
            usedNames.add(name);
            String fileName = name + DOCUMENT_SUFFIX + outputFormat.getFileExtension();
            Path documentFile = outputDirectory.resolve(fileName);
            try {
                FileWriteUtil.safeWriteString(documentFile, conversion.getDocument());
            } catch (IOException e) {
                log.error("Failed to write {}: {}", documentFile, e.getMessage());
                result.failure(location + ": " + e.getMessage());
                continue;
            }
            written++;
            result.outputFile(documentFile);
            log.info("Wrote {}", documentFile);

            if (clientGenerator == null) {
                continue;
            }

            String hash = ContentHashUtil.sha256Hex(conversion.getDocument());
            Path clientDirectory = outputDirectory.resolve(name + CLIENT_SUFFIX);
            boolean changed = !hash.equals(state.getHash(fileName));
            if (!changed && Files.isDirectory(clientDirectory)) {
                log.info("Skipping client generation for {} (no changes and client exists)", fileName);
                skipped++;
                continue;
            }

            try {
                if (clientGenerator.generate(documentFile, clientDirectory)) {
                    generated++;
                    state.update(fileName, hash);
                    state.save();
                } else {
                    result.failure(location + ": client generation failed");
                }
            } catch (IOException e) {
                log.error("Client generation for {} failed: {}", fileName, e.getMessage());
                result.failure(location + ": " + e.getMessage());
            }
        }

        return result
                .locationsProcessed(locations.size())
                .documentsWritten(written)
                .clientsGenerated(generated)
                .clientsSkipped(skipped)
                .build();
    }
}
