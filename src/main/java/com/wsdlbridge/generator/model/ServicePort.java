package com.wsdlbridge.generator.model;

import javax.xml.namespace.QName;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ServicePort {

    String name;

    QName binding;

    /** Endpoint address from the soap:address element, if any. */
    String address;
}
