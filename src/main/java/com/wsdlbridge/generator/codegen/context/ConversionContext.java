package com.wsdlbridge.generator.codegen.context;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import com.wsdlbridge.generator.codegen.ComponentRegistry;
import com.wsdlbridge.generator.fetch.DocumentFetcher;
import com.wsdlbridge.generator.model.SourceLocation;

import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;

/**
 * State owned by a single conversion call and passed explicitly through every recursive step.
 *
 * Holds the transport, the visited-location bookkeeping for interface documents and schema
 * fragments, and the component registry shared by all schema synthesis of the run. Nothing
 * here outlives the call.
 */
@Getter
@Builder
public final class ConversionContext {

    @NonNull
    private final GeneratorConfig config;

    @NonNull
    private final DocumentFetcher fetcher;

    @NonNull
    @Builder.Default
    private final ConversionDiagnostics diagnostics = new ConversionDiagnostics();

    @NonNull
    @Builder.Default
    private final ComponentRegistry componentRegistry = new ComponentRegistry();

    /** Interface documents already loaded (or being loaded) in this run. */
    @Builder.Default
    private final Set<SourceLocation> visitedDocuments = new HashSet<>();

    /**
     * Schema fragments fetched in this run, by location. A null value marks a location that
     * failed to load.
     */
    @Builder.Default
    private final Map<SourceLocation, byte[]> schemaFragments = new LinkedHashMap<>();

    public static ConversionContext create(GeneratorConfig config, DocumentFetcher fetcher) {
        return ConversionContext.builder()
                .config(config)
                .fetcher(fetcher)
                .build();
    }

    public long getLoadedFragmentCount() {
        return schemaFragments.values().stream().filter(content -> content != null).count();
    }
}
