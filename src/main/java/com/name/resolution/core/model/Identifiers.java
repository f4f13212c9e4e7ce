package com.name.resolution.core.model;

/**
 * Classification helpers for identifiers submitted for name resolution.
 */
public final class Identifiers {

    private Identifiers() {
    }

    /**
     * Returns true if the identifier is non-empty and made only of ASCII digits.
     * Only numeric identifiers are looked up against the backend.
     */
    public static boolean isNumeric(String id) {
        if (id == null || id.isEmpty()) {
            return false;
        }
        for (int i = 0; i < id.length(); i++) {
            char c = id.charAt(i);
            if (c < '0' || c > '9') {
                return false;
            }
        }
        return true;
    }
}
