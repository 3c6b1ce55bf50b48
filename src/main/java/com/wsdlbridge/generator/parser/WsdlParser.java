package com.wsdlbridge.generator.parser;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import javax.xml.namespace.QName;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.xml.sax.SAXException;

import com.wsdlbridge.generator.model.BindingDefinition;
import com.wsdlbridge.generator.model.InterfaceDocument;
import com.wsdlbridge.generator.model.MessageDefinition;
import com.wsdlbridge.generator.model.MessagePart;
import com.wsdlbridge.generator.model.OperationDefinition;
import com.wsdlbridge.generator.model.PortTypeDefinition;
import com.wsdlbridge.generator.model.ServiceDefinition;
import com.wsdlbridge.generator.model.ServicePort;
import com.wsdlbridge.generator.model.SourceLocation;

/**
 * Parses WSDL 1.1 documents into an {@link InterfaceDocument}.
 *
 * Only the constructs the converter consumes are read: imports, inline schemas, messages,
 * portTypes, bindings and services. SOAP 1.1 and 1.2 extension elements are recognised by
 * local name.
 */
public class WsdlParser {
    private static final Logger log = LoggerFactory.getLogger(WsdlParser.class);

    public static final String WSDL_NAMESPACE = "http://schemas.xmlsoap.org/wsdl/";

    public InterfaceDocument parse(byte[] content, SourceLocation location) throws DocumentLoadException {
        Document document;
        try {
            document = XmlDocuments.parse(content, location.toString());
        } catch (SAXException | IOException e) {
            throw new DocumentLoadException(location, "Malformed interface document", e);
        }
        return read(document, location);
    }

    private InterfaceDocument read(Document document, SourceLocation location) throws DocumentLoadException {
        Element root = document.getDocumentElement();
        if (!XmlDocuments.isElement(root, WSDL_NAMESPACE, "definitions")) {
            throw new DocumentLoadException(location,
                    "Not a WSDL 1.1 document (root element is " + root.getTagName() + ")");
        }

        InterfaceDocument.InterfaceDocumentBuilder builder = InterfaceDocument.builder()
                .location(location)
                .name(attribute(root, "name"))
                .targetNamespace(attribute(root, "targetNamespace"));

        for (Element child : wsdlChildren(root)) {
            switch (child.getLocalName()) {
                case "import" -> {
                    String importLocation = attribute(child, "location");
                    if (importLocation != null) {
                        builder.importLocation(importLocation);
                    }
                }
                case "types" -> childElements(child).stream()
                        .filter(e -> XmlDocuments.isElement(e, XmlDocuments.XSD_NAMESPACE, "schema"))
                        .map(XmlDocuments::detach)
                        .forEach(builder::schemaElement);
                case "message" -> builder.message(parseMessage(child));
                case "portType" -> builder.portType(parsePortType(child));
                case "binding" -> builder.binding(parseBinding(child));
                case "service" -> builder.service(parseService(child));
                default -> log.debug("Ignoring wsdl:{} in {}", child.getLocalName(), location);
            }
        }

        InterfaceDocument parsed = builder.build();
        log.debug("Parsed {}: {} messages, {} portTypes, {} inline schemas",
                location, parsed.getMessages().size(), parsed.getPortTypes().size(), parsed.getSchemaElements().size());
        return parsed;
    }

    private MessageDefinition parseMessage(Element messageEl) {
        MessageDefinition.MessageDefinitionBuilder message = MessageDefinition.builder()
                .name(attribute(messageEl, "name"));
        for (Element partEl : wsdlChildren(messageEl)) {
            if (!"part".equals(partEl.getLocalName())) {
                continue;
            }
            QName element = qualifiedName(partEl, attribute(partEl, "element"));
            message.part(MessagePart.builder()
                    .name(attribute(partEl, "name"))
                    .elementName(element)
                    .typeName(element == null ? qualifiedName(partEl, attribute(partEl, "type")) : null)
                    .build());
        }
        return message.build();
    }

    private PortTypeDefinition parsePortType(Element portTypeEl) {
        PortTypeDefinition.PortTypeDefinitionBuilder portType = PortTypeDefinition.builder()
                .name(attribute(portTypeEl, "name"));
        for (Element opEl : wsdlChildren(portTypeEl)) {
            if (!"operation".equals(opEl.getLocalName())) {
                continue;
            }
            OperationDefinition.OperationDefinitionBuilder operation = OperationDefinition.builder()
                    .name(attribute(opEl, "name"));
            for (Element child : wsdlChildren(opEl)) {
                switch (child.getLocalName()) {
                    case "documentation" -> operation.documentation(child.getTextContent());
                    case "input" -> operation.inputMessage(qualifiedName(child, attribute(child, "message")));
                    case "output" -> operation.outputMessage(qualifiedName(child, attribute(child, "message")));
                    default -> {
                        // faults are not mapped
                    }
                }
            }
            portType.operation(operation.build());
        }
        return portType.build();
    }

    private BindingDefinition parseBinding(Element bindingEl) {
        BindingDefinition.BindingDefinitionBuilder binding = BindingDefinition.builder()
                .name(attribute(bindingEl, "name"))
                .portType(qualifiedName(bindingEl, attribute(bindingEl, "type")));
        for (Element child : childElements(bindingEl)) {
            if ("binding".equals(child.getLocalName()) && !WSDL_NAMESPACE.equals(child.getNamespaceURI())) {
                binding.style(attribute(child, "style"));
                binding.transport(attribute(child, "transport"));
            }
        }
        return binding.build();
    }

    private ServiceDefinition parseService(Element serviceEl) {
        ServiceDefinition.ServiceDefinitionBuilder service = ServiceDefinition.builder()
                .name(attribute(serviceEl, "name"));
        for (Element portEl : wsdlChildren(serviceEl)) {
            if (!"port".equals(portEl.getLocalName())) {
                continue;
            }
            String address = childElements(portEl).stream()
                    .filter(e -> "address".equals(e.getLocalName()))
                    .map(e -> attribute(e, "location"))
                    .findFirst()
                    .orElse(null);
            service.port(ServicePort.builder()
                    .name(attribute(portEl, "name"))
                    .binding(qualifiedName(portEl, attribute(portEl, "binding")))
                    .address(address)
                    .build());
        }
        return service.build();
    }

    /**
     * Resolves a prefixed name such as {@code tns:GetList} against the in-scope namespace
     * declarations of {@code context}. An unprefixed name takes the default namespace.
     */
    static QName qualifiedName(Element context, String prefixedName) {
        if (prefixedName == null) {
            return null;
        }
        int colon = prefixedName.indexOf(':');
        String prefix = colon > 0 ? prefixedName.substring(0, colon) : null;
        String localPart = colon > 0 ? prefixedName.substring(colon + 1) : prefixedName;
        String namespace = context.lookupNamespaceURI(prefix);
        return new QName(namespace == null ? "" : namespace, localPart);
    }

    private static String attribute(Element element, String name) {
        String value = element.getAttribute(name);
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static List<Element> wsdlChildren(Element parent) {
        List<Element> result = new ArrayList<>();
        for (Element child : childElements(parent)) {
            if (WSDL_NAMESPACE.equals(child.getNamespaceURI())) {
                result.add(child);
            }
        }
        return result;
    }

    private static List<Element> childElements(Element parent) {
        List<Element> result = new ArrayList<>();
        for (Node node = parent.getFirstChild(); node != null; node = node.getNextSibling()) {
            if (node instanceof Element element) {
                result.add(element);
            }
        }
        return result;
    }
}
