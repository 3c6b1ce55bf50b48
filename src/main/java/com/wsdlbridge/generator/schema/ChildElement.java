package com.wsdlbridge.generator.schema;

import org.apache.ws.commons.schema.XmlSchemaElement;

import lombok.NonNull;
import lombok.Value;

/**
 * An element particle directly inside a sequence or choice.
 */
@Value
public class ChildElement {

    /** Local name; for {@code ref=} particles, the referenced element's local name. */
    String name;

    long maxOccurs;

    @NonNull
    XmlSchemaElement element;

    public static ChildElement of(XmlSchemaElement element) {
        String name = element.isRef() && element.getRef().getTargetQName() != null
                ? element.getRef().getTargetQName().getLocalPart()
                : element.getName();
        return new ChildElement(name, element.getMaxOccurs(), element);
    }

    public boolean isRepeated() {
        return maxOccurs > 1;
    }
}
