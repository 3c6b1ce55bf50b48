package com.wsdlbridge.generator;

import com.wsdlbridge.generator.cli.WsdlOpenApiCommand;
import picocli.CommandLine;

/**
 * Main entry point for the WSDL to OpenAPI generator.
 * Converts WSDL service descriptions and the XSD schemas they reference into OpenAPI
 * documents, one at a time or as a batch that can also drive a client generator.
 */
public class GeneratorApplication {

    public static void main(String[] args) {
        System.exit(execute(args));
    }

    static int execute(String... args) {
        return new CommandLine(new WsdlOpenApiCommand())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
    }
}
