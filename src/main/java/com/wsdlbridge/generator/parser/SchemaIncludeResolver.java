package com.wsdlbridge.generator.parser;

import java.io.IOException;
import java.io.StringReader;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.apache.ws.commons.schema.XmlSchemaCollection;
import org.apache.ws.commons.schema.resolver.URIResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

import com.wsdlbridge.generator.codegen.context.ConversionContext;
import com.wsdlbridge.generator.model.SourceLocation;
import com.wsdlbridge.generator.schema.SchemaUniverse;

/**
 * Compiles the inline schemas of every loaded interface document, together with every
 * fragment they transitively include or import, into one {@link SchemaUniverse}.
 *
 * schemaLocation references are resolved against the fragment that declares them. Each
 * fragment location is fetched at most once per run. A fragment that cannot be loaded as a
 * schema, or whose targetNamespace differs from the one its reference expects, is replaced by
 * an empty schema and reported as a warning.
 */
public class SchemaIncludeResolver {
    private static final Logger log = LoggerFactory.getLogger(SchemaIncludeResolver.class);

    public SchemaUniverse resolveSchemaIncludesAndImports(Map<SourceLocation, List<Element>> schemasByBase,
                                                          ConversionContext context) {
        Objects.requireNonNull(schemasByBase, "schemasByBase");
        Objects.requireNonNull(context, "context");

        XmlSchemaCollection collection = new XmlSchemaCollection();
        collection.setSchemaResolver(new FragmentResolver(context));

        for (Map.Entry<SourceLocation, List<Element>> entry : schemasByBase.entrySet()) {
            SourceLocation base = entry.getKey();
            collection.setBaseUri(base.toString());
            List<Element> schemas = entry.getValue();
            for (int i = 0; i < schemas.size(); i++) {
                String systemId = base + "#schema" + i;
                Document document = schemas.get(i).getOwnerDocument();
                try {
                    collection.read(document, systemId);
                } catch (RuntimeException e) {
                    String message = "Skipped inline schema " + systemId + ": " + e.getMessage();
                    log.warn(message);
                    context.getDiagnostics().warn(message);
                }
            }
        }

        SchemaUniverse universe = new SchemaUniverse(collection);
        log.info("Compiled schema universe: {} schema(s), {} external fragment(s) loaded",
                universe.getSchemas().size(), context.getLoadedFragmentCount());
        return universe;
    }

    /**
     * Serves schemaLocation references from the run's fragment cache, fetching on first use.
     *
     * A fragment whose targetNamespace differs from the one the reference expects is served
     * as an empty schema. A fragment without a targetNamespace is accepted for any expected
     * namespace and takes on the including schema's namespace.
     */
    static class FragmentResolver implements URIResolver {

        private final ConversionContext context;
        private final Map<SourceLocation, String> fragmentNamespaces = new HashMap<>();

        FragmentResolver(ConversionContext context) {
            this.context = context;
        }

        @Override
        public InputSource resolveEntity(String targetNamespace, String schemaLocation, String baseUri) {
            SourceLocation location;
            try {
                location = baseUri == null || baseUri.isBlank()
                        ? SourceLocation.of(schemaLocation)
                        : SourceLocation.of(baseUri).resolve(schemaLocation);
            } catch (IllegalArgumentException e) {
                skip(schemaLocation, "invalid location");
                return emptySource(targetNamespace, schemaLocation);
            }
            log.debug("Resolved schemaLocation {} -> {}", schemaLocation, location);

            byte[] content = load(location);
            if (content == null) {
                return emptySource(targetNamespace, location.toString());
            }

            String expected = targetNamespace == null ? "" : targetNamespace;
            String actual = fragmentNamespaces.getOrDefault(location, "");
            if (!actual.isEmpty() && !actual.equals(expected)) {
                skip(location.toString(), "targetNamespace " + actual + " does not match expected "
                        + (expected.isEmpty() ? "(none)" : expected));
                return emptySource(targetNamespace, location.toString());
            }
            return XmlDocuments.byteSource(content, location.toString());
        }

        private byte[] load(SourceLocation location) {
            Map<SourceLocation, byte[]> fragments = context.getSchemaFragments();
            if (fragments.containsKey(location)) {
                log.debug("Schema fragment {} already loaded", location);
                return fragments.get(location);
            }

            byte[] content = null;
            try {
                byte[] fetched = context.getFetcher().fetch(location);
                Element root = XmlDocuments.parse(fetched, location.toString()).getDocumentElement();
                if (XmlDocuments.isElement(root, XmlDocuments.XSD_NAMESPACE, "schema")) {
                    content = fetched;
                    fragmentNamespaces.put(location, root.getAttribute("targetNamespace"));
                    log.info("Loaded schema fragment: {}", location);
                    context.getDiagnostics().info("Loaded schema fragment: " + location);
                } else {
                    skip(location.toString(), "root element is not xs:schema");
                }
            } catch (IOException | SAXException e) {
                skip(location.toString(), e.getMessage());
            }
            fragments.put(location, content);
            return content;
        }

        private void skip(String location, String reason) {
            String message = "Skipped schema fragment " + location + ": " + reason;
            log.warn(message);
            context.getDiagnostics().warn(message);
        }

        private static InputSource emptySource(String targetNamespace, String systemId) {
            InputSource source = new InputSource(new StringReader(emptySchema(targetNamespace)));
            source.setSystemId(systemId);
            return source;
        }

        private static String emptySchema(String targetNamespace) {
            String namespaceAttribute = targetNamespace == null || targetNamespace.isEmpty()
                    ? ""
                    : " targetNamespace=\"" + escape(targetNamespace) + "\"";
            return "<xs:schema xmlns:xs=\"" + XmlDocuments.XSD_NAMESPACE + "\"" + namespaceAttribute + "/>";
        }

        private static String escape(String value) {
            return value.replace("&", "&amp;").replace("\"", "&quot;").replace("<", "&lt;");
        }
    }
}
