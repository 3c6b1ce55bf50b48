package com.wsdlbridge.generator.batch;

import java.nio.file.Path;
import java.util.List;

import lombok.Builder;
import lombok.Data;
import lombok.Singular;

/**
 * Outcome of a batch run over several WSDL locations.
 */
@Data
@Builder
public class BatchResult {
    private int locationsProcessed;
    private int documentsWritten;
    private int clientsGenerated;
    private int clientsSkipped;

    @Singular
    private List<Path> outputFiles;

    @Singular
    private List<String> failures;

    public boolean isSuccess() {
        return failures.isEmpty();
    }
}
