package com.wsdlbridge.generator.batch;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Reads the batch configuration: a JSON array of WSDL locations.
 */
public class BatchConfigReader {

    private final ObjectMapper mapper = new ObjectMapper();

    public List<String> readLocations(Path configFile) throws IOException {
        List<String> locations = mapper.readValue(configFile.toFile(), new TypeReference<List<String>>() {});
        if (locations == null) {
            return List.of();
        }
        List<String> result = new ArrayList<>();
        for (String location : locations) {
            if (location != null && !location.isBlank()) {
                result.add(location.trim());
            }
        }
        return result;
    }
}
