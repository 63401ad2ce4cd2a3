package com.geointel.reporter.model;

/**
 * Whether an issue lies inside a policy-restricted zone where no report may be filed.
 * Stored as a nullable boolean: NULL = UNKNOWN, TRUE = EXCLUDED, FALSE = NOT_EXCLUDED.
 */
public enum PolicyZone {

    UNKNOWN,
    EXCLUDED,
    NOT_EXCLUDED;

    public static PolicyZone fromStoredValue(Boolean inZone) {
        if (inZone == null) return UNKNOWN;
        return inZone ? EXCLUDED : NOT_EXCLUDED;
    }

    public Boolean toStoredValue() {
        return switch (this) {
            case UNKNOWN -> null;
            case EXCLUDED -> Boolean.TRUE;
            case NOT_EXCLUDED -> Boolean.FALSE;
        };
    }
}
