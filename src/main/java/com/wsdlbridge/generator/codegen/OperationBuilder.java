package com.wsdlbridge.generator.codegen;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

import org.apache.ws.commons.schema.XmlSchemaElement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.wsdlbridge.generator.codegen.mapper.PrimitiveSchemaMapper;
import com.wsdlbridge.generator.codegen.util.NamingUtil;
import com.wsdlbridge.generator.model.MergedInterface;
import com.wsdlbridge.generator.model.MessageDefinition;
import com.wsdlbridge.generator.model.MessagePart;
import com.wsdlbridge.generator.model.OperationDefinition;
import com.wsdlbridge.generator.model.PortTypeDefinition;
import com.wsdlbridge.generator.schema.ChildElement;
import com.wsdlbridge.generator.schema.ComplexExtensionType;
import com.wsdlbridge.generator.schema.StructuralType;
import com.wsdlbridge.generator.schema.StructuredType;
import com.wsdlbridge.generator.schema.TypeResolver;

import io.swagger.v3.oas.models.Operation;
import io.swagger.v3.oas.models.PathItem;
import io.swagger.v3.oas.models.Paths;
import io.swagger.v3.oas.models.media.ArraySchema;
import io.swagger.v3.oas.models.media.Content;
import io.swagger.v3.oas.models.media.MediaType;
import io.swagger.v3.oas.models.media.ObjectSchema;
import io.swagger.v3.oas.models.media.Schema;
import io.swagger.v3.oas.models.parameters.Parameter;
import io.swagger.v3.oas.models.parameters.QueryParameter;
import io.swagger.v3.oas.models.parameters.RequestBody;
import io.swagger.v3.oas.models.responses.ApiResponse;
import io.swagger.v3.oas.models.responses.ApiResponses;

/**
 * Builds one path item per portType operation.
 *
 * Input parts become query parameters unless their structure is more than one level deep, in
 * which case the operation takes a JSON request body and is exposed as POST. An operation whose
 * documentation is the word POST is always exposed as POST with a body. The first part of the
 * output message describes the 200 response.
 */
public class OperationBuilder {
    private static final Logger log = LoggerFactory.getLogger(OperationBuilder.class);

    static final String JSON_MEDIA_TYPE = "application/json";
    static final String SUCCESS_STATUS = "200";
    static final String POST_OVERRIDE = "POST";

    private final MergedInterface mergedInterface;
    private final TypeResolver typeResolver;
    private final SchemaSynthesizer synthesizer;
    private final StructuralDepthCalculator depthCalculator;

    public OperationBuilder(MergedInterface mergedInterface, TypeResolver typeResolver,
                            SchemaSynthesizer synthesizer, StructuralDepthCalculator depthCalculator) {
        this.mergedInterface = Objects.requireNonNull(mergedInterface, "mergedInterface");
        this.typeResolver = Objects.requireNonNull(typeResolver, "typeResolver");
        this.synthesizer = Objects.requireNonNull(synthesizer, "synthesizer");
        this.depthCalculator = Objects.requireNonNull(depthCalculator, "depthCalculator");
    }

    /**
     * Builds the paths of every operation of every portType. A later operation whose path key
     * is already taken replaces the earlier path item.
     */
    public Paths buildPaths() {
        Paths paths = new Paths();
        for (PortTypeDefinition portType : mergedInterface.getPortTypeList()) {
            for (OperationDefinition operation : portType.getOperations()) {
                String pathKey = pathKey(portType, operation);
                if (paths.containsKey(pathKey)) {
                    log.warn("Path {} defined more than once, keeping the last operation", pathKey);
                }
                paths.addPathItem(pathKey, buildPathItem(operation));
                log.debug("Built operation {}", pathKey);
            }
        }
        return paths;
    }

    public static String pathKey(PortTypeDefinition portType, OperationDefinition operation) {
        return "/" + NamingUtil.sanitizePathSegment(portType.getName())
                + "/" + NamingUtil.sanitizePathSegment(operation.getName());
    }

    public PathItem buildPathItem(OperationDefinition definition) {
        Operation operation = new Operation()
                .summary(definition.getDocumentation());
        List<Parameter> parameters = new ArrayList<>();
        operation.setParameters(parameters);

        RequestBody requestBody = null;
        boolean requiresBody = false;

        Optional<MessageDefinition> input = mergedInterface.findMessage(definition.getInputMessage());
        if (input.isPresent()) {
            for (MessagePart part : input.get().getParts()) {
                ResolvedPart resolved = resolvePart(part);
                String parameterName = parameterName(part, resolved.element);

                if (resolved.isRepeatedElement()) {
                    Schema<?> items = synthesizer.synthesizeSchema(resolved.type);
                    parameters.add(queryParameter(parameterName, new ArraySchema().items(items)));
                    continue;
                }
                if (typeResolver.isSimple(resolved.type)) {
                    parameters.add(queryParameter(parameterName, synthesizer.synthesizeSchema(resolved.type)));
                    continue;
                }

                StructuredType structured = (StructuredType) resolved.type;
                if (depthCalculator.computeDepth(structured) <= 1) {
                    flattenInto(parameters, parameterName, structured);
                } else {
                    requiresBody = true;
                    requestBody = jsonBody(synthesizer.synthesizeSchema(structured));
                }
            }
        }

        boolean post = requiresBody || isPostOverride(definition.getDocumentation());
        if (post && requestBody == null) {
            requestBody = jsonBody(new ObjectSchema());
        }
        operation.setRequestBody(requestBody);
        operation.setResponses(buildResponses(definition));

        PathItem pathItem = new PathItem();
        if (post) {
            pathItem.post(operation);
        } else {
            pathItem.get(operation);
        }
        return pathItem;
    }

    private ApiResponses buildResponses(OperationDefinition definition) {
        ApiResponses responses = new ApiResponses();
        if (definition.getOutputMessage() == null) {
            return responses.addApiResponse(SUCCESS_STATUS, new ApiResponse().description("No output message"));
        }

        Optional<MessageDefinition> output = mergedInterface.findMessage(definition.getOutputMessage());
        if (output.isEmpty() || output.get().getParts().isEmpty()) {
            return responses.addApiResponse(SUCCESS_STATUS, new ApiResponse().description("No content"));
        }

        ResolvedPart resolved = resolvePart(output.get().getParts().get(0));
        Schema<?> schema = synthesizer.synthesizeSchema(resolved.type);
        if (resolved.isRepeatedElement()) {
            schema = new ArraySchema().items(schema);
        }
        return responses.addApiResponse(SUCCESS_STATUS, new ApiResponse()
                .description("Successful response")
                .content(new Content().addMediaType(JSON_MEDIA_TYPE, new MediaType().schema(schema))));
    }

    /**
     * One scalar parameter per immediate child element. A simple-content extension has no
     * children and yields a single parameter typed from its base.
     */
    private void flattenInto(List<Parameter> parameters, String parameterName, StructuredType type) {
        if (type instanceof ComplexExtensionType extension && extension.isSimpleContent()) {
            StructuralType base = typeResolver.resolveType(extension.getBaseTypeName());
            parameters.add(queryParameter(parameterName, PrimitiveSchemaMapper.toSchema(base)));
            return;
        }
        for (ChildElement child : type.getChildren()) {
            if (child.getName() == null) {
                continue;
            }
            Schema<?> schema = PrimitiveSchemaMapper.toSchema(typeResolver.resolveChildType(child));
            if (child.isRepeated()) {
                schema = new ArraySchema().items(schema);
            }
            parameters.add(queryParameter(child.getName(), schema));
        }
    }

    private ResolvedPart resolvePart(MessagePart part) {
        if (part.referencesElement()) {
            XmlSchemaElement element = typeResolver.findGlobalElement(part.getElementName());
            StructuralType type = element != null ? typeResolver.resolveElementType(element) : null;
            return new ResolvedPart(element, type);
        }
        if (part.referencesType()) {
            return new ResolvedPart(null, typeResolver.resolveType(part.getTypeName()));
        }
        return new ResolvedPart(null, null);
    }

    private static String parameterName(MessagePart part, XmlSchemaElement element) {
        if (part.getName() != null) {
            return part.getName();
        }
        if (element != null && element.getName() != null) {
            return element.getName();
        }
        return part.getElementName() != null ? part.getElementName().getLocalPart() : "unnamed";
    }

    static boolean isPostOverride(String documentation) {
        return documentation != null && POST_OVERRIDE.equals(documentation.trim().toUpperCase(Locale.ROOT));
    }

    private static Parameter queryParameter(String name, Schema<?> schema) {
        return new QueryParameter()
                .name(name)
                .required(false)
                .schema(schema);
    }

    private static RequestBody jsonBody(Schema<?> schema) {
        return new RequestBody().content(new Content().addMediaType(JSON_MEDIA_TYPE, new MediaType().schema(schema)));
    }

    private static final class ResolvedPart {
        private final XmlSchemaElement element;
        private final StructuralType type;

        private ResolvedPart(XmlSchemaElement element, StructuralType type) {
            this.element = element;
            this.type = type;
        }

        boolean isRepeatedElement() {
            return element != null && element.getMaxOccurs() > 1;
        }
    }
}
