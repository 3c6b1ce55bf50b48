package com.wsdlbridge.generator.parser;

import java.io.ByteArrayInputStream;
import java.io.IOException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;

import org.w3c.dom.Attr;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

import lombok.experimental.UtilityClass;

/**
 * Namespace-aware DOM loading with external entity resolution switched off.
 */
@UtilityClass
public class XmlDocuments {

    public static final String XSD_NAMESPACE = XMLConstants.W3C_XML_SCHEMA_NS_URI;

    /**
     * Parses raw document bytes; the parser picks the charset from the byte-order mark or the
     * XML declaration.
     */
    public Document parse(byte[] content, String systemId) throws IOException, SAXException {
        return newBuilder().parse(byteSource(content, systemId));
    }

    public InputSource byteSource(byte[] content, String systemId) {
        InputSource source = new InputSource(new ByteArrayInputStream(content));
        source.setSystemId(systemId);
        return source;
    }

    public Document newDocument() {
        return newBuilder().newDocument();
    }

    /**
     * Copies {@code element} into a fresh document of its own, re-declaring every namespace
     * prefix it inherited from its ancestors so it can be read stand-alone.
     */
    public Element detach(Element element) {
        Document target = newDocument();
        Element copy = (Element) target.importNode(element, true);
        target.appendChild(copy);

        for (Node node = element.getParentNode(); node instanceof Element; node = node.getParentNode()) {
            NamedNodeMap attributes = node.getAttributes();
            for (int i = 0; i < attributes.getLength(); i++) {
                Attr attr = (Attr) attributes.item(i);
                if (!XMLConstants.XMLNS_ATTRIBUTE_NS_URI.equals(attr.getNamespaceURI())) {
                    continue;
                }
                String qualifiedName = attr.getName();
                if (!copy.hasAttribute(qualifiedName)) {
                    copy.setAttributeNS(XMLConstants.XMLNS_ATTRIBUTE_NS_URI, qualifiedName, attr.getValue());
                }
            }
        }
        return copy;
    }

    public boolean isElement(Node node, String namespace, String localName) {
        return node instanceof Element
                && namespace.equals(node.getNamespaceURI())
                && localName.equals(node.getLocalName());
    }

    private DocumentBuilder newBuilder() {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            factory.setXIncludeAware(false);
            factory.setExpandEntityReferences(false);
            factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
            factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
            factory.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
            factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_DTD, "");
            factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_SCHEMA, "");
            return factory.newDocumentBuilder();
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser configuration failed", e);
        }
    }
}
