package com.wsdlbridge.generator.schema;

import java.util.List;

import javax.xml.namespace.QName;

import org.apache.ws.commons.schema.XmlSchemaType;

import lombok.Getter;

/**
 * A complex type with child particles.
 */
@Getter
public abstract class StructuredType extends StructuralType {

    /** Element particles, in document order. */
    private final List<ChildElement> children;

    /** Number of particles in the content model, elements or not. */
    private final int particleCount;

    protected StructuredType(QName qualifiedName, XmlSchemaType source, List<ChildElement> children, int particleCount) {
        super(qualifiedName, source);
        this.children = List.copyOf(children);
        this.particleCount = particleCount;
    }

    @Override
    public boolean isSimple() {
        return false;
    }

    /**
     * The only child of a sequence holding exactly one particle, which must be an element.
     * Such a type is a wrapper and is rendered as an array of that child. Null otherwise.
     */
    public ChildElement getSingleSequenceChild() {
        return null;
    }

    protected ChildElement singleChildOrNull() {
        return particleCount == 1 && children.size() == 1 ? children.get(0) : null;
    }
}
