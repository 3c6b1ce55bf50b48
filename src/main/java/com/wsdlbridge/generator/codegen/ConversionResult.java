package com.wsdlbridge.generator.codegen;

import java.util.List;

import com.wsdlbridge.generator.codegen.context.ConversionDiagnostics;

import io.swagger.v3.oas.models.OpenAPI;
import lombok.Builder;
import lombok.Data;
import lombok.Singular;

/**
 * Result of converting one WSDL location.
 */
@Data
@Builder
public class ConversionResult {
    private boolean success;
    private String errorMessage;
    private String location;

    private OpenAPI openApi;
    private String document;

    private int documentsLoaded;
    private int schemaFragmentsLoaded;
    private int operationsConverted;
    private int pathsGenerated;
    private int componentsSynthesized;

    @Singular
    private List<String> errors;

    @Singular
    private List<String> warnings;

    @Singular
    private List<String> infos;

    /**
     * Failed conversion; the error message joins every error recorded in {@code diagnostics}.
     */
    public static ConversionResult failure(String location, ConversionDiagnostics diagnostics) {
        return ConversionResult.builder()
                .success(false)
                .location(location)
                .errorMessage(String.join("; ", diagnostics.getErrors()))
                .errors(diagnostics.getErrors())
                .warnings(diagnostics.getWarnings())
                .infos(diagnostics.getInfos())
                .build();
    }
}
