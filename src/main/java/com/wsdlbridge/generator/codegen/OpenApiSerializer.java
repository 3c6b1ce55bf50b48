package com.wsdlbridge.generator.codegen;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.swagger.v3.core.util.Json;
import io.swagger.v3.core.util.Yaml;
import io.swagger.v3.oas.models.OpenAPI;

/**
 * Renders an OpenAPI document with swagger-core's preconfigured mappers.
 */
public class OpenApiSerializer {

    public String serialize(OpenAPI openApi, OutputFormat format) throws JsonProcessingException {
        ObjectMapper mapper = format == OutputFormat.YAML ? Yaml.mapper() : Json.mapper();
        return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(openApi);
    }
}
