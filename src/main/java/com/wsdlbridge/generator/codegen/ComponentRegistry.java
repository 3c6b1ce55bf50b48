package com.wsdlbridge.generator.codegen;

import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.Map;

import javax.xml.namespace.QName;

import org.apache.ws.commons.schema.XmlSchemaType;

import com.wsdlbridge.generator.codegen.util.NamingUtil;
import com.wsdlbridge.generator.schema.StructuralType;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.media.Schema;

/**
 * Component schemas synthesized during one conversion, keyed by the structured type they
 * were built from.
 *
 * Named types are keyed by qualified name, anonymous types by the identity of their schema
 * object. Entries are added before the type's properties are expanded and never removed.
 */
public class ComponentRegistry {

    private static final String ANONYMOUS_PREFIX = "AnonType_";

    private final Map<QName, String> namedTypes = new HashMap<>();
    private final Map<XmlSchemaType, String> anonymousTypes = new IdentityHashMap<>();
    private final Map<String, Schema<?>> schemas = new LinkedHashMap<>();

    /**
     * Component name already assigned to the type, or null.
     */
    public String lookup(StructuralType type) {
        if (type.isAnonymous()) {
            return anonymousTypes.get(type.getSource());
        }
        return namedTypes.get(type.getQualifiedName());
    }

    /**
     * Assigns a component name to the type and stores {@code schema} under it. Anonymous
     * types are named {@code AnonType_<n>} where n is one more than the number of components
     * registered so far.
     */
    public String register(StructuralType type, Schema<?> schema) {
        String baseName = type.isAnonymous()
                ? ANONYMOUS_PREFIX + (schemas.size() + 1)
                : type.getLocalName();
        String name = NamingUtil.disambiguate(baseName, schemas.keySet());

        if (type.isAnonymous()) {
            anonymousTypes.put(type.getSource(), name);
        } else {
            namedTypes.put(type.getQualifiedName(), name);
        }
        schemas.put(name, schema);
        return name;
    }

    /**
     * Raw-typed view for {@link Components#schemas(Map)}.
     */
    @SuppressWarnings({"rawtypes", "unchecked"})
    public Map<String, Schema> getSchemas() {
        return (Map) schemas;
    }

    public int size() {
        return schemas.size();
    }

    public static Schema<?> reference(String componentName) {
        return new Schema<>().$ref(Components.COMPONENTS_SCHEMAS_REF + componentName);
    }
}
