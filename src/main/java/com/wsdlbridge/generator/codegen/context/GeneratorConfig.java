package com.wsdlbridge.generator.codegen.context;

import java.time.Duration;

import com.wsdlbridge.generator.codegen.OutputFormat;

import lombok.Builder;
import lombok.Value;

/**
 * Settings for a conversion run.
 */
@Value
@Builder(toBuilder = true)
public class GeneratorConfig {

    /**
     * Timeout applied to each network fetch (connect and request).
     */
    @Builder.Default
    Duration fetchTimeout = Duration.ofSeconds(30);

    @Builder.Default
    OutputFormat outputFormat = OutputFormat.JSON;

    /**
     * Value of the top-level {@code openapi} field.
     */
    @Builder.Default
    String openApiVersion = "3.0.3";

    /**
     * Value of {@code info.version}.
     */
    @Builder.Default
    String documentVersion = "1.0.0";

    /**
     * Used for {@code info.title} when the WSDL declares no name.
     */
    @Builder.Default
    String defaultTitle = "wsdl-conversion";

    public static GeneratorConfig defaults() {
        return GeneratorConfig.builder().build();
    }
}
