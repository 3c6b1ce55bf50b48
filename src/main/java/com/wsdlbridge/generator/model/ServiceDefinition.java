package com.wsdlbridge.generator.model;

import java.util.List;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

@Value
@Builder
public class ServiceDefinition {

    String name;

    @Singular
    List<ServicePort> ports;
}
