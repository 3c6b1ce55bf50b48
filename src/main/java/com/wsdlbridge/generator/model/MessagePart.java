package com.wsdlbridge.generator.model;

import javax.xml.namespace.QName;

import lombok.Builder;
import lombok.Value;

/**
 * One part of a WSDL message. References either a global element or a type, never both.
 */
@Value
@Builder
public class MessagePart {

    String name;

    QName elementName;

    QName typeName;

    public boolean referencesElement() {
        return elementName != null;
    }

    public boolean referencesType() {
        return elementName == null && typeName != null;
    }
}
