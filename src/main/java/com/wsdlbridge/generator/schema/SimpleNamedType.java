package com.wsdlbridge.generator.schema;

import javax.xml.namespace.QName;

import org.apache.ws.commons.schema.XmlSchemaType;

/**
 * A simple type declared by a schema (restriction, list, union), or a built-in outside the
 * primitive table. Rendered as a string.
 */
public class SimpleNamedType extends StructuralType {

    public SimpleNamedType(QName qualifiedName, XmlSchemaType source) {
        super(qualifiedName, source);
    }

    @Override
    public boolean isSimple() {
        return true;
    }

    @Override
    public <R> R accept(StructuralTypeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
