package com.wsdlbridge.generator.model;

import javax.xml.namespace.QName;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class BindingDefinition {

    String name;

    QName portType;

    /** SOAP binding style ("document" or "rpc"), null when not declared. */
    String style;

    String transport;
}
