package com.wsdlbridge.generator.parser;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.wsdlbridge.generator.codegen.context.ConversionContext;
import com.wsdlbridge.generator.model.InterfaceDocument;
import com.wsdlbridge.generator.model.MergedInterface;
import com.wsdlbridge.generator.model.SourceLocation;

/**
 * Loads the root WSDL and every WSDL it transitively imports, then merges them.
 *
 * Loading is depth-first and sequential. Each location is loaded at most once per run, which
 * also terminates cyclic imports. Any failure to fetch or parse an interface document is
 * fatal.
 */
public class ImportResolver {
    private static final Logger log = LoggerFactory.getLogger(ImportResolver.class);

    private final WsdlParser parser;

    public ImportResolver(WsdlParser parser) {
        this.parser = Objects.requireNonNull(parser, "parser");
    }

    public MergedInterface mergeInterfaceDocuments(SourceLocation rootLocation, ConversionContext context)
            throws IOException {
        Objects.requireNonNull(rootLocation, "rootLocation");
        Objects.requireNonNull(context, "context");

        List<InterfaceDocument> documents = new ArrayList<>();
        loadRecursive(rootLocation, context, documents);

        MergedInterface merged = new MergedInterface(documents.get(0));
        for (int i = 1; i < documents.size(); i++) {
            merged.add(documents.get(i));
        }

        log.info("Merged {} interface document(s): {} messages, {} portTypes, {} bindings, {} services",
                documents.size(), merged.getMessages().size(), merged.getPortTypes().size(),
                merged.getBindings().size(), merged.getServices().size());
        return merged;
    }

    private void loadRecursive(SourceLocation location, ConversionContext context, List<InterfaceDocument> documents)
            throws IOException {
        if (!context.getVisitedDocuments().add(location)) {
            log.debug("Already loaded {}, skipping", location);
            return;
        }

        byte[] content;
        try {
            content = context.getFetcher().fetch(location);
        } catch (IOException e) {
            throw new DocumentLoadException(location, "Failed to fetch interface document", e);
        }

        InterfaceDocument document = parser.parse(content, location);
        documents.add(document);
        log.info("Loaded interface document: {}", location);
        context.getDiagnostics().info("Loaded interface document: " + location);

        for (String importLocation : document.getImportLocations()) {
            SourceLocation target;
            try {
                target = location.resolve(importLocation);
            } catch (IllegalArgumentException e) {
                throw new DocumentLoadException(location, "Invalid wsdl:import location '" + importLocation + "'", e);
            }
            log.debug("Resolved wsdl:import {} -> {}", importLocation, target);
            loadRecursive(target, context, documents);
        }
    }
}
