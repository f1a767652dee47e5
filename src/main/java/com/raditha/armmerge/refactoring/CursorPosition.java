package com.raditha.armmerge.refactoring;

/**
 * Where the cursor sat relative to the anchor arm.
 *
 * @param kind  whether the cursor was in the anchor's body
 * @param value for {@link Kind#IN_BODY} the distance from the cursor to the end of the
 *              anchor arm; for {@link Kind#IN_PATTERN} the absolute cursor offset
 */
public record CursorPosition(Kind kind, int value) {

    public enum Kind {
        IN_BODY,
        IN_PATTERN
    }

    public CursorPosition {
        if (value < 0) {
            throw new IllegalArgumentException("Cursor value must be >= 0, got: " + value);
        }
    }

    public static CursorPosition inBody(int distanceFromArmEnd) {
        return new CursorPosition(Kind.IN_BODY, distanceFromArmEnd);
    }

    public static CursorPosition inPattern(int offset) {
        return new CursorPosition(Kind.IN_PATTERN, offset);
    }

    public boolean isInBody() {
        return kind == Kind.IN_BODY;
    }
}
