package com.wsdlbridge.generator.schema;

import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Objects;

import javax.xml.namespace.QName;

import org.apache.ws.commons.schema.XmlSchemaElement;
import org.apache.ws.commons.schema.XmlSchemaType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.wsdlbridge.generator.codegen.context.ConversionDiagnostics;

/**
 * Finds global elements and types across the schema universe and classifies them into
 * {@link StructuralType} variants.
 *
 * A name found nowhere resolves to null, which the rest of the pipeline treats as a string.
 */
public class TypeResolver {
    private static final Logger log = LoggerFactory.getLogger(TypeResolver.class);

    private final SchemaUniverse universe;
    private final ConversionDiagnostics diagnostics;
    private final Map<XmlSchemaType, StructuralType> classified = new IdentityHashMap<>();

    public TypeResolver(SchemaUniverse universe, ConversionDiagnostics diagnostics) {
        this.universe = Objects.requireNonNull(universe, "universe");
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
    }

    public XmlSchemaElement findGlobalElement(QName name) {
        XmlSchemaElement element = universe.findElement(name);
        if (element == null && name != null) {
            unresolved("element", name);
        }
        return element;
    }

    /**
     * Looks the name up in the universe first, then in the built-in table.
     */
    public StructuralType resolveType(QName name) {
        if (name == null) {
            return null;
        }
        XmlSchemaType type = universe.findType(name);
        if (type != null) {
            return classify(type);
        }
        if (BuiltInTypes.isPrimitive(name)) {
            return PrimitiveType.of(name.getLocalPart());
        }
        if (BuiltInTypes.isXsdNamespace(name)) {
            return new SimpleNamedType(name, null);
        }
        unresolved("type", name);
        return null;
    }

    /**
     * Prefers the type already bound to the element (inline or compiled), else resolves the
     * declared type name. Element references are followed to their global declaration.
     */
    public StructuralType resolveElementType(XmlSchemaElement element) {
        if (element == null) {
            return null;
        }
        XmlSchemaElement target = element;
        if (element.isRef()) {
            target = findGlobalElement(element.getRef().getTargetQName());
            if (target == null) {
                return null;
            }
        }
        if (target.getSchemaType() != null) {
            return classify(target.getSchemaType());
        }
        return resolveType(target.getSchemaTypeName());
    }

    public StructuralType resolveChildType(ChildElement child) {
        return resolveElementType(child.getElement());
    }

    /**
     * Null counts as simple.
     */
    public boolean isSimple(StructuralType type) {
        return type == null || type.isSimple();
    }

    public StructuralType classify(XmlSchemaType type) {
        return classified.computeIfAbsent(type, StructuralTypeFactory::classify);
    }

    private void unresolved(String kind, QName name) {
        log.warn("Unresolved {} {}", kind, name);
        diagnostics.warn("Unresolved " + kind + " " + name);
    }
}
