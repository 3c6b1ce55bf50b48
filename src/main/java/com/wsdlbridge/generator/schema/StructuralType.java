package com.wsdlbridge.generator.schema;

import javax.xml.namespace.QName;

import org.apache.ws.commons.schema.XmlSchemaType;

import lombok.Getter;

/**
 * Base class of the closed set of structural shapes the converter understands:
 * {@link PrimitiveType}, {@link SimpleNamedType}, {@link SequenceType}, {@link ChoiceType}
 * and {@link ComplexExtensionType}. Consumers dispatch through {@link StructuralTypeVisitor}.
 */
@Getter
public abstract class StructuralType {

    /** Global name of the type, null for anonymous (inline) types. */
    private final QName qualifiedName;

    /** The XmlSchema object this shape was read from, null for built-in fallbacks. */
    private final XmlSchemaType source;

    protected StructuralType(QName qualifiedName, XmlSchemaType source) {
        this.qualifiedName = qualifiedName;
        this.source = source;
    }

    public abstract boolean isSimple();

    public abstract <R> R accept(StructuralTypeVisitor<R> visitor);

    public boolean isAnonymous() {
        return qualifiedName == null;
    }

    public String getLocalName() {
        return qualifiedName == null ? null : qualifiedName.getLocalPart();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + (isAnonymous() ? "anonymous" : qualifiedName) + ")";
    }
}
