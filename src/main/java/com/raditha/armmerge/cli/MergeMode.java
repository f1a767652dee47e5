package com.raditha.armmerge.cli;

/**
 * Enumeration of merge modes for the arm-merger CLI.
 */
public enum MergeMode {
    /**
     * Dry-run mode - Preview the change as a diff without touching the file.
     * This is the default mode.
     */
    DRY_RUN,

    /**
     * Apply mode - Write the merged source back to the file.
     */
    APPLY;

    /**
     * Convert a string value to MergeMode enum.
     *
     * @param value the string value to convert (case-insensitive)
     * @return the corresponding MergeMode
     * @throws IllegalArgumentException if the value is not a valid mode
     */
    public static MergeMode fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("MergeMode value cannot be null");
        }

        return switch (value.toLowerCase()) {
            case "dry-run" -> DRY_RUN;
            case "apply" -> APPLY;
            default -> throw new IllegalArgumentException(
                    "Invalid merge mode: " + value + ". Must be: dry-run or apply");
        };
    }

    /**
     * Get the string representation of this mode for CLI usage.
     *
     * @return lowercase string representation
     */
    public String toCliString() {
        return switch (this) {
            case DRY_RUN -> "dry-run";
            case APPLY -> "apply";
        };
    }
}
