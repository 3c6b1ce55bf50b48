package com.wsdlbridge.generator.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Spec;

/**
 * Top-level command. Does nothing by itself; see the subcommands.
 */
@Command(
        name = "wsdl-openapi",
        mixinStandardHelpOptions = true,
        version = "wsdl-openapi-generator 1.0.0",
        description = "Converts WSDL service descriptions and their XSD schemas into OpenAPI documents.",
        subcommands = {ConvertCommand.class, BatchCommand.class}
)
public class WsdlOpenApiCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        throw new ParameterException(spec.commandLine(), "Missing subcommand: convert or batch");
    }
}
