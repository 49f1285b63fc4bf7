package org.broadinstitute.genbank.utils.location;

import org.broadinstitute.genbank.exceptions.LocationSyntaxException;
import org.broadinstitute.genbank.utils.Utils;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a raw location expression into {@link LocationToken}s. Whitespace between tokens is ignored, since long
 * locations are wrapped over several lines in flat files.
 *
 * The token list always ends with a single {@link LocationToken.Type#END} token.
 */
final class LocationLexer {

    private final String raw;
    private int index = 0;

    LocationLexer(final String raw) {
        this.raw = Utils.nonNull(raw, "location cannot be null");
    }

    List<LocationToken> tokenize() {
        final List<LocationToken> tokens = new ArrayList<>();
        while (true) {
            skipWhitespace();
            if (index >= raw.length()) {
                tokens.add(new LocationToken(LocationToken.Type.END, "", raw.length()));
                return tokens;
            }
            tokens.add(nextToken());
        }
    }

    private void skipWhitespace() {
        while (index < raw.length() && Character.isWhitespace(raw.charAt(index))) {
            index++;
        }
    }

    private LocationToken nextToken() {
        final int start = index;
        final char c = raw.charAt(index);
        switch (c) {
            case '(': return single(LocationToken.Type.OPEN_PAREN);
            case ')': return single(LocationToken.Type.CLOSE_PAREN);
            case ',': return single(LocationToken.Type.COMMA);
            case '^': return single(LocationToken.Type.BETWEEN_SEPARATOR);
            case ':': return single(LocationToken.Type.REMOTE_SEPARATOR);
            case '<': return single(LocationToken.Type.BEFORE);
            case '>': return single(LocationToken.Type.AFTER);
            case '?': return single(LocationToken.Type.UNKNOWN);
            case '.':
                if (index + 1 < raw.length() && raw.charAt(index + 1) == '.') {
                    index += 2;
                    return new LocationToken(LocationToken.Type.RANGE_SEPARATOR, RangeLocation.SEPARATOR, start);
                }
                throw new LocationSyntaxException(raw, start, raw.substring(start), "a single '.' is not a valid separator, expected '..'");
            default:
                if (isDigit(c)) {
                    consumeDigits();
                    return new LocationToken(LocationToken.Type.NUMBER, raw.substring(start, index), start);
                }
                if (isLetter(c)) {
                    consumeIdentifier();
                    return new LocationToken(LocationToken.Type.IDENTIFIER, raw.substring(start, index), start);
                }
                throw new LocationSyntaxException(raw, start, raw.substring(start), "unexpected character '" + c + "'");
        }
    }

    private LocationToken single(final LocationToken.Type type) {
        final int start = index++;
        return new LocationToken(type, raw.substring(start, index), start);
    }

    private void consumeDigits() {
        while (index < raw.length() && isDigit(raw.charAt(index))) {
            index++;
        }
    }

    // accession-like names: letters, digits, underscores and an optional ".version"
    private void consumeIdentifier() {
        while (index < raw.length() && (isLetter(raw.charAt(index)) || isDigit(raw.charAt(index)) || raw.charAt(index) == '_')) {
            index++;
        }
        if (index + 1 < raw.length() && raw.charAt(index) == '.' && isDigit(raw.charAt(index + 1))) {
            index++;
            consumeDigits();
        }
    }

    private static boolean isDigit(final char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isLetter(final char c) {
        return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z');
    }
}
