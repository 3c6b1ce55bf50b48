package com.wsdlbridge.generator.codegen.mapper;

import com.wsdlbridge.generator.schema.PrimitiveType;
import com.wsdlbridge.generator.schema.StructuralType;

import io.swagger.v3.oas.models.media.BooleanSchema;
import io.swagger.v3.oas.models.media.ByteArraySchema;
import io.swagger.v3.oas.models.media.DateSchema;
import io.swagger.v3.oas.models.media.DateTimeSchema;
import io.swagger.v3.oas.models.media.IntegerSchema;
import io.swagger.v3.oas.models.media.NumberSchema;
import io.swagger.v3.oas.models.media.Schema;
import io.swagger.v3.oas.models.media.StringSchema;
import lombok.experimental.UtilityClass;

/**
 * Maps simple types to OpenAPI scalar schemas.
 *
 * <pre>
 * string, normalizedString     string
 * boolean                      boolean
 * int, integer, short, byte    integer / int32
 * long                         integer / int64
 * decimal, double, float       number
 * dateTime                     string / date-time
 * date                         string / date
 * base64Binary                 string / byte
 * anything else                string
 * </pre>
 */
@UtilityClass
public class PrimitiveSchemaMapper {

    public Schema<?> toSchema(StructuralType type) {
        if (type instanceof PrimitiveType primitive) {
            return forBuiltIn(primitive.getLocalName());
        }
        return new StringSchema();
    }

    public Schema<?> forBuiltIn(String localName) {
        if (localName == null) {
            return new StringSchema();
        }
        return switch (localName) {
            case "boolean" -> new BooleanSchema();
            case "int", "integer", "short", "byte" -> new IntegerSchema();
            case "long" -> new IntegerSchema().format("int64");
            case "decimal", "double", "float" -> new NumberSchema();
            case "dateTime" -> new DateTimeSchema();
            case "date" -> new DateSchema();
            case "base64Binary" -> new ByteArraySchema();
            default -> new StringSchema();
        };
    }
}
