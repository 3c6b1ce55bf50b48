package com.wsdlbridge.generator.schema;

import java.util.List;

import javax.xml.namespace.QName;

import org.apache.ws.commons.schema.XmlSchemaType;

public class ChoiceType extends StructuredType {

    public ChoiceType(QName qualifiedName, XmlSchemaType source, List<ChildElement> children, int particleCount) {
        super(qualifiedName, source, children, particleCount);
    }

    @Override
    public <R> R accept(StructuralTypeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
