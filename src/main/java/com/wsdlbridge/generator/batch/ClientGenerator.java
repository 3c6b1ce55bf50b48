package com.wsdlbridge.generator.batch;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Downstream step that turns a generated OpenAPI file into client code.
 */
@FunctionalInterface
public interface ClientGenerator {

    /**
     * @return true when generation succeeded
     */
    boolean generate(Path openApiFile, Path outputDirectory) throws IOException;
}
