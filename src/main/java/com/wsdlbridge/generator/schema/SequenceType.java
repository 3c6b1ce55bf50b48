package com.wsdlbridge.generator.schema;

import java.util.List;

import javax.xml.namespace.QName;

import org.apache.ws.commons.schema.XmlSchemaType;

/**
 * Complex type whose content is an xs:sequence. Also used for complex types with an
 * unmodeled or empty content model, which then have no children.
 */
public class SequenceType extends StructuredType {

    public SequenceType(QName qualifiedName, XmlSchemaType source, List<ChildElement> children, int particleCount) {
        super(qualifiedName, source, children, particleCount);
    }

    @Override
    public ChildElement getSingleSequenceChild() {
        return singleChildOrNull();
    }

    @Override
    public <R> R accept(StructuralTypeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
