package com.wsdlbridge.generator.schema;

import java.util.Set;

import javax.xml.XMLConstants;
import javax.xml.namespace.QName;

import lombok.experimental.UtilityClass;

/**
 * The fixed table of XML Schema built-ins the converter maps to typed schemas.
 */
@UtilityClass
public class BuiltInTypes {

    public static final String XSD_NAMESPACE = XMLConstants.W3C_XML_SCHEMA_NS_URI;

    private static final Set<String> PRIMITIVES = Set.of(
            "string", "normalizedString", "boolean",
            "int", "integer", "short", "byte", "long",
            "decimal", "double", "float",
            "dateTime", "date", "base64Binary"
    );

    public boolean isXsdNamespace(QName name) {
        return name != null && XSD_NAMESPACE.equals(name.getNamespaceURI());
    }

    public boolean isPrimitive(QName name) {
        return isXsdNamespace(name) && PRIMITIVES.contains(name.getLocalPart());
    }
}
