package com.wsdlbridge.generator.codegen.context;

import java.util.ArrayList;
import java.util.List;

import lombok.Getter;

/**
 * Errors, warnings and infos accumulated during one conversion run.
 *
 * Pure structure only: no logging, no formatting, no IO.
 */
@Getter
public class ConversionDiagnostics {
    private final List<String> errors = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();
    private final List<String> infos = new ArrayList<>();

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }

    public void error(String message) {
        errors.add(message);
    }

    public void info(String message) {
        infos.add(message);
    }

    public void warn(String message) {
        if (!warnings.contains(message)) {
            warnings.add(message);
        }
    }
}
