package org.broadinstitute.genbank.utils.location;

/**
 * One lexical element of a location expression together with where it was found.
 */
final class LocationToken {

    enum Type {
        NUMBER,
        IDENTIFIER,
        OPEN_PAREN,
        CLOSE_PAREN,
        COMMA,
        RANGE_SEPARATOR,
        BETWEEN_SEPARATOR,
        REMOTE_SEPARATOR,
        BEFORE,
        AFTER,
        UNKNOWN,
        END
    }

    private final Type type;
    private final String text;
    private final int offset;

    LocationToken(final Type type, final String text, final int offset) {
        this.type = type;
        this.text = text;
        this.offset = offset;
    }

    Type getType() {
        return type;
    }

    boolean is(final Type other) {
        return type == other;
    }

    String getText() {
        return text;
    }

    /**
     * @return 0-based offset of the first character of this token in the raw location
     */
    int getOffset() {
        return offset;
    }

    @Override
    public String toString() {
        return type == Type.END ? "end of location" : "'" + text + "'";
    }
}
