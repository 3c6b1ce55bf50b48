package com.wsdlbridge.generator.cli.model;

import java.nio.file.Path;

import com.wsdlbridge.generator.codegen.context.GeneratorConfig;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Derived values needed by the executor. Keeps ConvertCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedConvertOptions {
    GeneratorConfig config;
    /** Null when the document goes to standard output. */
    Path outputFile;
}
