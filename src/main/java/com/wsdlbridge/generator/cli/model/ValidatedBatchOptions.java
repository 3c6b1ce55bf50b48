package com.wsdlbridge.generator.cli.model;

import java.nio.file.Path;

import com.wsdlbridge.generator.codegen.context.GeneratorConfig;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Derived values needed by the executor. Keeps BatchCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedBatchOptions {
    GeneratorConfig config;
    Path configFile;
    Path outputDirectory;
    String clientGeneratorCommand;
}
