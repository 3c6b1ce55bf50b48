package com.wsdlbridge.generator.parser;

import java.io.IOException;

import com.wsdlbridge.generator.model.SourceLocation;

/**
 * An interface document could not be fetched or parsed. Aborts the whole conversion.
 */
public class DocumentLoadException extends IOException {

    private static final long serialVersionUID = 1L;

    private final transient SourceLocation location;

    public DocumentLoadException(SourceLocation location, String message) {
        super(message + ": " + location);
        this.location = location;
    }

    public DocumentLoadException(SourceLocation location, String message, Throwable cause) {
        super(message + ": " + location + " (" + cause.getMessage() + ")", cause);
        this.location = location;
    }

    public SourceLocation getLocation() {
        return location;
    }
}
