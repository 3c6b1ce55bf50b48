package com.wsdlbridge.generator.codegen.util;

import java.util.Set;

/**
 * Naming rules for path keys and component names.
 */
public class NamingUtil {

    private static final String UNNAMED = "unnamed";

    private NamingUtil() {
        // Utility class
    }

    /**
     * Keeps letters, digits, '-' and '_'. Blank input becomes "unnamed".
     */
    public static String sanitizePathSegment(String name) {
        if (name == null || name.isBlank()) {
            return UNNAMED;
        }
        StringBuilder sb = new StringBuilder(name.length());
        for (char c : name.toCharArray()) {
            if (Character.isLetterOrDigit(c) || c == '-' || c == '_') {
                sb.append(c);
            }
        }
        return sb.length() == 0 ? UNNAMED : sb.toString();
    }

    /**
     * Returns {@code baseName} if unused, else the first of baseName2, baseName3, ... that is.
     */
    public static String disambiguate(String baseName, Set<String> usedNames) {
        if (!usedNames.contains(baseName)) {
            return baseName;
        }
        int suffix = 2;
        String candidate;
        do {
            candidate = baseName + suffix;
            suffix++;
        } while (usedNames.contains(candidate));

        return candidate;
    }
}
