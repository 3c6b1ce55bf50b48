package com.wsdlbridge.generator.schema;

import javax.xml.namespace.QName;

import org.apache.ws.commons.schema.XmlSchemaType;

/**
 * One of the XML Schema built-ins listed in {@link BuiltInTypes}.
 */
public class PrimitiveType extends StructuralType {

    public PrimitiveType(QName qualifiedName, XmlSchemaType source) {
        super(qualifiedName, source);
    }

    public static PrimitiveType of(String localName) {
        return new PrimitiveType(new QName(BuiltInTypes.XSD_NAMESPACE, localName), null);
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
