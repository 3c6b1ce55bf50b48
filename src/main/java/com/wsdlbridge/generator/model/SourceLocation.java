package com.wsdlbridge.generator.model;

import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.Path;
import java.util.Locale;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * Absolute address of an interface document or schema fragment.
 *
 * Two locations are equal when their normalized absolute URIs are equal. This is the
 * dedup key for both interface documents and schema fragments.
 */
@Getter
@EqualsAndHashCode
public final class SourceLocation {

    private final URI uri;

    private SourceLocation(URI uri) {
        this.uri = uri.normalize();
    }

    /**
     * Accepts a URI with a scheme (file:, http:, https:) or a plain local path.
     */
    public static SourceLocation of(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Location must not be blank");
        }
        String trimmed = raw.trim();
        if (hasScheme(trimmed)) {
            try {
                return new SourceLocation(new URI(trimmed));
            } catch (URISyntaxException e) {
                throw new IllegalArgumentException("Invalid location: " + trimmed, e);
            }
        }
        return of(Path.of(trimmed));
    }

    public static SourceLocation of(Path path) {
        return new SourceLocation(path.toAbsolutePath().normalize().toUri());
    }

    public static SourceLocation of(URI uri) {
        return new SourceLocation(uri);
    }

    /**
     * Resolves a reference found inside this document against this location.
     */
    public SourceLocation resolve(String reference) {
        if (reference == null || reference.isBlank()) {
            throw new IllegalArgumentException("Reference must not be blank");
        }
        String trimmed = reference.trim();
        if (hasScheme(trimmed)) {
            return of(trimmed);
        }
        return new SourceLocation(uri.resolve(trimmed.replace(" ", "%20")));
    }

    public boolean isFile() {
        return "file".equalsIgnoreCase(uri.getScheme());
    }

    public boolean isHttp() {
        String scheme = uri.getScheme();
        return "http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme);
    }

    /**
     * Name of the first path segment without its extension, e.g. "Guide" for
     * {@code http://host/Guide/wsdl}. Used to name generated output files.
     */
    public String getDocumentStem() {
        String path = uri.getPath();
        if (path == null || path.isBlank() || "/".equals(path)) {
            return "schema";
        }
        String[] segments = isFile()
                ? new String[] {Path.of(uri).getFileName().toString()}
                : path.replaceFirst("^/+", "").split("/");
        String first = segments[0];
        int dot = first.indexOf('.');
        String stem = dot > 0 ? first.substring(0, dot) : first;
        return stem.isBlank() ? "schema" : stem;
    }

    @Override
    public String toString() {
        return uri.toString();
    }

    private static boolean hasScheme(String value) {
        int colon = value.indexOf(':');
        // single letter before the colon is a Windows drive, not a scheme
        if (colon <= 1) {
            return false;
        }
        String scheme = value.substring(0, colon).toLowerCase(Locale.ROOT);
        return scheme.chars().allMatch(c -> Character.isLetterOrDigit(c) || c == '+' || c == '-' || c == '.');
    }
}
