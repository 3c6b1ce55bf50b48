package com.wsdlbridge.generator.model;

import javax.xml.namespace.QName;

import lombok.Builder;
import lombok.Value;

/**
 * A portType operation: its input/output message references and free-text documentation.
 */
@Value
@Builder
public class OperationDefinition {

    String name;

    /** Text of the wsdl:documentation child, or null when absent. */
    String documentation;

    QName inputMessage;

    QName outputMessage;
}
