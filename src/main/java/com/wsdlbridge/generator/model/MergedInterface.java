package com.wsdlbridge.generator.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import javax.xml.namespace.QName;

import org.w3c.dom.Element;

import lombok.Getter;

/**
 * The root interface document after merging every transitively imported document.
 *
 * Names are unique within each collection: the first occurrence of a name wins and later
 * duplicates are dropped whole. Inline schemas are kept per owning document location so
 * their includes can be resolved relative to that document.
 */
@Getter
public class MergedInterface {

    private final SourceLocation rootLocation;
    private final String name;
    private final String targetNamespace;

    private final Map<String, MessageDefinition> messages = new LinkedHashMap<>();
    private final Map<String, PortTypeDefinition> portTypes = new LinkedHashMap<>();
    private final Map<String, BindingDefinition> bindings = new LinkedHashMap<>();
    private final Map<String, ServiceDefinition> services = new LinkedHashMap<>();
    private final Map<SourceLocation, List<Element>> schemasByBase = new LinkedHashMap<>();
    private final List<SourceLocation> documentLocations = new ArrayList<>();

    public MergedInterface(InterfaceDocument root) {
        this.rootLocation = root.getLocation();
        this.name = root.getName();
        this.targetNamespace = root.getTargetNamespace();
        add(root);
    }

    /**
     * Folds a document into this one. Entries whose name is already present are ignored.
     */
    public void add(InterfaceDocument document) {
        documentLocations.add(document.getLocation());
        document.getMessages().forEach(m -> messages.putIfAbsent(m.getName(), m));
        document.getPortTypes().forEach(p -> portTypes.putIfAbsent(p.getName(), p));
        document.getBindings().forEach(b -> bindings.putIfAbsent(b.getName(), b));
        document.getServices().forEach(s -> services.putIfAbsent(s.getName(), s));
        if (!document.getSchemaElements().isEmpty()) {
            schemasByBase.computeIfAbsent(document.getLocation(), k -> new ArrayList<>())
                    .addAll(document.getSchemaElements());
        }
    }

    /**
     * Messages are matched on local name only, as operations reference them by prefix.
     */
    public Optional<MessageDefinition> findMessage(QName reference) {
        if (reference == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(messages.get(reference.getLocalPart()));
    }

    public Collection<PortTypeDefinition> getPortTypeList() {
        return portTypes.values();
    }

    public int getOperationCount() {
        return portTypes.values().stream().mapToInt(p -> p.getOperations().size()).sum();
    }
}
