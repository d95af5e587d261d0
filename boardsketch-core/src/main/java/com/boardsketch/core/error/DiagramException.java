package com.boardsketch.core.error;

import java.util.Objects;

/**
 * Thrown when diagram text cannot be turned into placements.
 *
 * <p>Carries exactly one {@link DiagramError}. A call that throws never returns a partial
 * diagram.
 */
public class DiagramException extends RuntimeException {

    private final transient DiagramError error;

    public DiagramException(DiagramError error) {
        super(Objects.requireNonNull(error, "error must not be null").describe());
        this.error = error;
    }

    public DiagramError getError() {
        return error;
    }

    public DiagramErrorCode getCode() {
        return error.code();
    }
}
