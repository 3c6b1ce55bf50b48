package com.wsdlbridge.generator.codegen;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.wsdlbridge.generator.codegen.mapper.PrimitiveSchemaMapper;
import com.wsdlbridge.generator.schema.ChildElement;
import com.wsdlbridge.generator.schema.ChoiceType;
import com.wsdlbridge.generator.schema.ComplexExtensionType;
import com.wsdlbridge.generator.schema.PrimitiveType;
import com.wsdlbridge.generator.schema.SequenceType;
import com.wsdlbridge.generator.schema.SimpleNamedType;
import com.wsdlbridge.generator.schema.StructuralType;
import com.wsdlbridge.generator.schema.StructuralTypeVisitor;
import com.wsdlbridge.generator.schema.StructuredType;
import com.wsdlbridge.generator.schema.TypeResolver;

import io.swagger.v3.oas.models.media.ArraySchema;
import io.swagger.v3.oas.models.media.ObjectSchema;
import io.swagger.v3.oas.models.media.Schema;
import io.swagger.v3.oas.models.media.StringSchema;

/**
 * Turns resolved structural types into OpenAPI schemas.
 *
 * <ul>
 *   <li>null becomes a string schema</li>
 *   <li>simple types go through {@link PrimitiveSchemaMapper}</li>
 *   <li>a wrapper (sequence with a single element particle) becomes an array of that
 *       element's schema and gets no component of its own</li>
 *   <li>any other structured type becomes a $ref to a component in the
 *       {@link ComponentRegistry}</li>
 * </ul>
 */
public class SchemaSynthesizer {
    private static final Logger log = LoggerFactory.getLogger(SchemaSynthesizer.class);

    static final String EXTENDS_PREFIX = "_extends_";
    static final String SIMPLE_CONTENT_PROPERTY = "value";

    private final TypeResolver typeResolver;
    private final ComponentRegistry registry;

    /** Wrappers currently being collapsed; a wrapper that contains itself is not collapsed again. */
    private final Set<StructuralType> collapsing = Collections.newSetFromMap(new IdentityHashMap<>());

    public SchemaSynthesizer(TypeResolver typeResolver, ComponentRegistry registry) {
        this.typeResolver = Objects.requireNonNull(typeResolver, "typeResolver");
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    public Schema<?> synthesizeSchema(StructuralType type) {
        if (type == null) {
            return new StringSchema();
        }
        return type.accept(new StructuralTypeVisitor<Schema<?>>() {
            @Override
            public Schema<?> visit(PrimitiveType primitive) {
                return PrimitiveSchemaMapper.toSchema(primitive);
            }

            @Override
            public Schema<?> visit(SimpleNamedType simple) {
                return PrimitiveSchemaMapper.toSchema(simple);
            }

            @Override
            public Schema<?> visit(SequenceType sequence) {
                return synthesizeStructured(sequence);
            }

            @Override
            public Schema<?> visit(ChoiceType choice) {
                return synthesizeStructured(choice);
            }

            @Override
            public Schema<?> visit(ComplexExtensionType extension) {
                return synthesizeStructured(extension);
            }
        });
    }

    /**
     * Registers a component for the type if it has none yet and returns its name. The registry
     * entry is created before any property is expanded, so recursive references resolve to
     * the name being built.
     */
    public String ensureComponent(StructuredType type) {
        String existing = registry.lookup(type);
        if (existing != null) {
            return existing;
        }

        ObjectSchema component = new ObjectSchema();
        component.setProperties(new LinkedHashMap<>());
        String name = registry.register(type, component);
        log.debug("Registered component {} for {}", name, type);

        if (type instanceof ComplexExtensionType extension) {
            expandExtension(extension, component);
        } else {
            addChildProperties(type, component);
        }
        return name;
    }

    private Schema<?> synthesizeStructured(StructuredType type) {
        ChildElement only = type.getSingleSequenceChild();
        if (only != null && !collapsing.contains(type)) {
            StructuralType itemType = typeResolver.resolveChildType(only);
            if (itemType != null) {
                collapsing.add(type);
                try {
                    return new ArraySchema().items(synthesizeSchema(itemType));
                } finally {
                    collapsing.remove(type);
                }
            }
        }
        return ComponentRegistry.reference(ensureComponent(type));
    }

    private void expandExtension(ComplexExtensionType extension, ObjectSchema component) {
        StructuralType base = typeResolver.resolveType(extension.getBaseTypeName());

        if (extension.isSimpleContent()) {
            component.addProperty(SIMPLE_CONTENT_PROPERTY, synthesizeSchema(base));
            return;
        }
        if (base instanceof StructuredType structuredBase) {
            String baseName = ensureComponent(structuredBase);
            component.addProperty(EXTENDS_PREFIX + extension.getBaseTypeName().getLocalPart(),
                    ComponentRegistry.reference(baseName));
        }
        addChildProperties(extension, component);
    }

    private void addChildProperties(StructuredType type, ObjectSchema component) {
        for (ChildElement child : type.getChildren()) {
            if (child.getName() == null) {
                log.debug("Skipping unnamed particle in {}", type);
                continue;
            }
            StructuralType childType = typeResolver.resolveChildType(child);
            Schema<?> property = childType instanceof StructuredType structuredChild
                    ? ComponentRegistry.reference(ensureComponent(structuredChild))
                    : PrimitiveSchemaMapper.toSchema(childType);
            if (child.isRepeated()) {
                property = new ArraySchema().items(property);
            }
            component.addProperty(child.getName(), property);
        }
    }
}
