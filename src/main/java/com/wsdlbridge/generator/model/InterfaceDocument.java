package com.wsdlbridge.generator.model;

import java.util.List;

import org.w3c.dom.Element;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * One parsed WSDL 1.1 document, before merging with the documents it imports.
 *
 * Pure structure only: parsing lives in WsdlParser, merging in ImportResolver.
 */
@Value
@Builder
public class InterfaceDocument {

    @NonNull
    SourceLocation location;

    String name;

    String targetNamespace;

    /** Raw {@code location} attributes of wsdl:import declarations, unresolved. */
    @Singular
    List<String> importLocations;

    @Singular
    List<MessageDefinition> messages;

    @Singular
    List<PortTypeDefinition> portTypes;

    @Singular
    List<BindingDefinition> bindings;

    @Singular
    List<ServiceDefinition> services;

    /**
     * Inline xs:schema elements from wsdl:types. Each one is the document element of its own
     * DOM document and carries the namespace declarations it inherited from the WSDL.
     */
    @Singular
    List<Element> schemaElements;
}
