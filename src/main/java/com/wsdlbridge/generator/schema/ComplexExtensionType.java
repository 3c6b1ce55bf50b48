package com.wsdlbridge.generator.schema;

import java.util.List;

import javax.xml.namespace.QName;

import org.apache.ws.commons.schema.XmlSchemaType;

import lombok.Getter;

/**
 * Complex type derived by extension, either of complex content (base type plus the
 * extension's own particles) or of simple content (a text value of the base type).
 * {@link #getChildren()} holds only the particles the extension itself declares.
 */
@Getter
public class ComplexExtensionType extends StructuredType {

    private final QName baseTypeName;

    private final boolean simpleContent;

    private final boolean sequenceParticle;

    public ComplexExtensionType(QName qualifiedName, XmlSchemaType source, QName baseTypeName, boolean simpleContent,
                                boolean sequenceParticle, List<ChildElement> children, int particleCount) {
        super(qualifiedName, source, children, particleCount);
        this.baseTypeName = baseTypeName;
        this.simpleContent = simpleContent;
        this.sequenceParticle = sequenceParticle;
    }

    @Override
    public ChildElement getSingleSequenceChild() {
        return !simpleContent && sequenceParticle ? singleChildOrNull() : null;
    }

    @Override
    public <R> R accept(StructuralTypeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
