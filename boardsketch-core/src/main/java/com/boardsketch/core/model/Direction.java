package com.boardsketch.core.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Layout direction of a diagram.
 */
public enum Direction {
    /** Top to bottom (Mermaid {@code TB} or {@code TD}) */
    TOP_TO_BOTTOM("TB"),

    /** Bottom to top */
    BOTTOM_TO_TOP("BT"),

    /** Left to right */
    LEFT_TO_RIGHT("LR"),

    /** Right to left */
    RIGHT_TO_LEFT("RL");

    private final String code;

    Direction(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    /**
     * Returns true when layers advance along the X axis.
     *
     * @return true for LR and RL
     */
    public boolean isHorizontal() {
        return this == LEFT_TO_RIGHT || this == RIGHT_TO_LEFT;
    }

    /**
     * Returns true when layer 0 sits at the far end of the layer axis.
     *
     * @return true for BT and RL
     */
    public boolean isReversed() {
        return this == BOTTOM_TO_TOP || this == RIGHT_TO_LEFT;
    }

    /**
     * Resolves a Mermaid direction code, case-insensitively.
     *
     * @param code direction code such as "TB", "TD" or "lr"
     * @return matching direction, or empty if the code is unknown
     */
    public static Optional<Direction> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        return switch (code.trim().toUpperCase(Locale.ROOT)) {
            case "TB", "TD" -> Optional.of(TOP_TO_BOTTOM);
            case "BT" -> Optional.of(BOTTOM_TO_TOP);
            case "LR" -> Optional.of(LEFT_TO_RIGHT);
            case "RL" -> Optional.of(RIGHT_TO_LEFT);
            default -> Optional.empty();
        };
    }
}
