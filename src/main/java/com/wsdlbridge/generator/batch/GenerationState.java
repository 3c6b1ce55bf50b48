package com.wsdlbridge.generator.batch;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.wsdlbridge.generator.codegen.util.FileWriteUtil;

/**
 * Content hashes of the OpenAPI files whose clients were last generated successfully,
 * persisted as a JSON object keyed by output file name.
 */
public class GenerationState {
    private static final Logger log = LoggerFactory.getLogger(GenerationState.class);

    public static final String STATE_FILE_NAME = "generator-state.json";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Path stateFile;
    private final Map<String, String> hashes;

    private GenerationState(Path stateFile, Map<String, String> hashes) {
        this.stateFile = stateFile;
        this.hashes = hashes;
    }

    /**
     * Loads the state file in {@code outputDirectory}. A missing or unreadable file yields an
     * empty state.
     */
    public static GenerationState load(Path outputDirectory) {
        Path stateFile = outputDirectory.resolve(STATE_FILE_NAME);
        if (!Files.isRegularFile(stateFile)) {
            return new GenerationState(stateFile, new LinkedHashMap<>());
        }
        try {
            Map<String, String> hashes = MAPPER.readValue(stateFile.toFile(),
                    new TypeReference<LinkedHashMap<String, String>>() {});
            return new GenerationState(stateFile, hashes != null ? hashes : new LinkedHashMap<>());
        } catch (IOException e) {
            log.warn("Ignoring unreadable state file {}: {}", stateFile, e.getMessage());
            return new GenerationState(stateFile, new LinkedHashMap<>());
        }
    }

    public String getHash(String outputName) {
        return hashes.get(outputName);
    }

    public void update(String outputName, String hash) {
        hashes.put(outputName, hash);
    }

    public void save() throws IOException {
        FileWriteUtil.safeWriteString(stateFile, toJson());
    }

    public Path getStateFile() {
        return stateFile;
    }

    private String toJson() throws JsonProcessingException {
        return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(hashes);
    }
}
