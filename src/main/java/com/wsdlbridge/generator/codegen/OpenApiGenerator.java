package com.wsdlbridge.generator.codegen;

import java.io.IOException;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.wsdlbridge.generator.codegen.context.ConversionContext;
import com.wsdlbridge.generator.codegen.context.GeneratorConfig;
import com.wsdlbridge.generator.fetch.DocumentFetcher;
import com.wsdlbridge.generator.fetch.UrlDocumentFetcher;
import com.wsdlbridge.generator.model.MergedInterface;
import com.wsdlbridge.generator.model.SourceLocation;
import com.wsdlbridge.generator.parser.ImportResolver;
import com.wsdlbridge.generator.parser.SchemaIncludeResolver;
import com.wsdlbridge.generator.parser.WsdlParser;
import com.wsdlbridge.generator.schema.SchemaUniverse;
import com.wsdlbridge.generator.schema.TypeResolver;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.Paths;
import io.swagger.v3.oas.models.info.Info;

/**
 * Converts a WSDL location, with everything it imports and includes, into an OpenAPI document.
 *
 * Each call works on a fresh {@link ConversionContext}; nothing is shared between calls.
 */
public class OpenApiGenerator {
    private static final Logger log = LoggerFactory.getLogger(OpenApiGenerator.class);

    private final GeneratorConfig config;
    private final DocumentFetcher fetcher;
    private final ImportResolver importResolver;
    private final SchemaIncludeResolver schemaIncludeResolver;
    private final OpenApiSerializer serializer;

    public OpenApiGenerator(GeneratorConfig config) {
        this(config, new UrlDocumentFetcher(config.getFetchTimeout()));
    }

    public OpenApiGenerator(GeneratorConfig config, DocumentFetcher fetcher) {
        this.config = Objects.requireNonNull(config, "config");
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.importResolver = new ImportResolver(new WsdlParser());
        this.schemaIncludeResolver = new SchemaIncludeResolver();
        this.serializer = new OpenApiSerializer();
    }

    /**
     * Converts the document at {@code location}. Failures to load an interface document are
     * reported in the result rather than thrown.
     */
    public ConversionResult convert(String location) {
        ConversionContext context = ConversionContext.create(config, fetcher);
        try {
            return run(location, context);
        } catch (IOException | IllegalArgumentException e) {
            log.error("Conversion of {} failed: {}", location, e.getMessage());
            context.getDiagnostics().error(e.getMessage());
            return ConversionResult.failure(location, context.getDiagnostics());
        }
    }

    /**
     * Converts the document at {@code location} and returns the serialized document.
     *
     * @throws IOException if the root document or an imported interface document cannot be
     *                     fetched or parsed
     */
    public String generateOpenApi(String location) throws IOException {
        return run(location, ConversionContext.create(config, fetcher)).getDocument();
    }

    private ConversionResult run(String location, ConversionContext context) throws IOException {
        SourceLocation root = SourceLocation.of(location);

        log.info("Step 1: Loading interface documents from {}", root);
        MergedInterface merged = importResolver.mergeInterfaceDocuments(root, context);

        log.info("Step 2: Resolving schema includes and imports...");
        SchemaUniverse universe = schemaIncludeResolver.resolveSchemaIncludesAndImports(
                merged.getSchemasByBase(), context);

        log.info("Step 3: Building operations...");
        TypeResolver typeResolver = new TypeResolver(universe, context.getDiagnostics());
        ComponentRegistry registry = context.getComponentRegistry();
        SchemaSynthesizer synthesizer = new SchemaSynthesizer(typeResolver, registry);
        OperationBuilder operationBuilder = new OperationBuilder(merged, typeResolver, synthesizer,
                new StructuralDepthCalculator(typeResolver));
        Paths paths = operationBuilder.buildPaths();

        OpenAPI openApi = new OpenAPI()
                .openapi(config.getOpenApiVersion())
                .info(new Info()
                        .title(merged.getName() != null && !merged.getName().isBlank()
                                ? merged.getName()
                                : config.getDefaultTitle())
                        .version(config.getDocumentVersion()))
                .paths(paths)
                .components(new Components().schemas(registry.getSchemas()));

        log.info("Step 4: Serializing document as {}", config.getOutputFormat());
        String document = serializer.serialize(openApi, config.getOutputFormat());

        log.info("Conversion complete: {} path(s), {} component(s), {} warning(s)",
                paths.size(), registry.size(), context.getDiagnostics().getWarnings().size());

        return ConversionResult.builder()
                .success(true)
                .location(root.toString())
                .openApi(openApi)
                .document(document)
                .documentsLoaded(merged.getDocumentLocations().size())
                .schemaFragmentsLoaded((int) context.getLoadedFragmentCount())
                .operationsConverted(merged.getOperationCount())
                .pathsGenerated(paths.size())
                .componentsSynthesized(registry.size())
                .warnings(context.getDiagnostics().getWarnings())
                .infos(context.getDiagnostics().getInfos())
                .build();
    }
}
