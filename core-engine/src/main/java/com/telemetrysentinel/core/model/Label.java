package com.telemetrysentinel.core.model;

/**
 * Per-row verdict produced by a {@link com.telemetrysentinel.core.scoring.Scorer}.
 *
 * <p>
 * The numeric codes follow the isolation-forest convention used by the
 * prediction files: {@code 1} for inliers, {@code -1} for outliers.
 * </p>
 *
 * @since 1.0.0
 */
public enum Label {

    NORMAL(1),
    ANOMALY(-1);

    private final int code;

    Label(int code) {
        this.code = code;
    }

    /**
     * @return numeric code written to prediction files
     */
    public int getCode() {
        return code;
    }

    public boolean isAnomaly() {
        return this == ANOMALY;
    }

    /**
     * Resolve a label from its numeric code.
     *
     * @param code {@code 1} or {@code -1}
     * @return matching label
     * @throws IllegalArgumentException for any other code
     */
    public static Label fromCode(int code) {
        return switch (code) {
            case 1 -> NORMAL;
            case -1 -> ANOMALY;
            default -> throw new IllegalArgumentException("Unknown label code: " + code);
        };
    }
}
