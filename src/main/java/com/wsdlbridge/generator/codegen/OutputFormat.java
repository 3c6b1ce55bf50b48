package com.wsdlbridge.generator.codegen;

/**
 * Wire format of the generated OpenAPI document.
 */
public enum OutputFormat {
    JSON(".json"),
    YAML(".yaml");

    private final String fileExtension;

    OutputFormat(String fileExtension) {
        this.fileExtension = fileExtension;
    }

    public String getFileExtension() {
        return fileExtension;
    }
}
