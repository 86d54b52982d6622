package com.entity.blocking.field;

import com.entity.blocking.exception.BlockingConfigurationException;

/**
 * Set-valued field types and the comparator each one uses.
 */
public enum SetFieldType {
    /** Cosine similarity over a TF-IDF weighted corpus. */
    SET("Set"),
    /** Minimum affine-gap distance between elements. */
    MIN_DISTANCE_SET("MinDistanceSet");

    private final String label;

    SetFieldType(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Looks up a type by its configuration label, e.g. {@code "Set"}.
     *
     * @throws BlockingConfigurationException for an unknown label
     */
    public static SetFieldType fromLabel(String label) {
        for (SetFieldType type : values()) {
            if (type.label.equals(label)) {
                return type;
            }
        }
        throw new BlockingConfigurationException("Unknown set field type: " + label);
    }
}
