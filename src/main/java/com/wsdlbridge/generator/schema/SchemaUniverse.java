package com.wsdlbridge.generator.schema;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

import javax.xml.namespace.QName;

import org.apache.ws.commons.schema.XmlSchema;
import org.apache.ws.commons.schema.XmlSchemaCollection;
import org.apache.ws.commons.schema.XmlSchemaElement;
import org.apache.ws.commons.schema.XmlSchemaType;

/**
 * Every schema fragment gathered for one conversion, compiled into a single collection that
 * answers global element and global type lookups by qualified name.
 */
public class SchemaUniverse {

    private final XmlSchemaCollection collection;

    public SchemaUniverse(XmlSchemaCollection collection) {
        this.collection = Objects.requireNonNull(collection, "collection");
    }

    public static SchemaUniverse empty() {
        return new SchemaUniverse(new XmlSchemaCollection());
    }

    /**
     * Schemas read from documents, excluding the built-in XML Schema namespace.
     */
    public List<XmlSchema> getSchemas() {
        return Arrays.stream(collection.getXmlSchemas())
                .filter(schema -> !BuiltInTypes.XSD_NAMESPACE.equals(schema.getTargetNamespace()))
                .collect(Collectors.toList());
    }

    public XmlSchemaElement findElement(QName name) {
        if (name == null) {
            return null;
        }
        for (XmlSchema schema : getSchemas()) {
            XmlSchemaElement element = schema.getElements().get(name);
            if (element != null) {
                return element;
            }
        }
        return null;
    }

    public XmlSchemaType findType(QName name) {
        if (name == null) {
            return null;
        }
        for (XmlSchema schema : getSchemas()) {
            XmlSchemaType type = schema.getSchemaTypes().get(name);
            if (type != null) {
                return type;
            }
        }
        return null;
    }
}
