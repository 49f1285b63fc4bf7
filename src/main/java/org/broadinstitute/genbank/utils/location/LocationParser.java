package org.broadinstitute.genbank.utils.location;

import org.broadinstitute.genbank.exceptions.GenbankException;
import org.broadinstitute.genbank.exceptions.LocationSyntaxException;
import org.broadinstitute.genbank.utils.Utils;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive descent parser for GenBank feature location expressions.
 *
 * The accepted grammar is:
 * <pre>
 * location   := join | order | complement | remote | between | range | single
 * join       := "join(" location ("," location)* ")"
 * order      := "order(" location ("," location)* ")"
 * complement := "complement(" location ")"
 * remote     := accession ":" location
 * between    := integer "^" integer
 * range      := position ".." position
 * single     := position
 * position   := ["<" | ">"] integer | "?"
 * </pre>
 *
 * Examples: {@code 467}, {@code 340..565}, {@code <345..500}, {@code 102^103}, {@code J00194.1:100..202},
 * {@code join(complement(4918..5163),complement(2691..4571))}.
 *
 * Parsing either returns a complete tree or throws a {@link LocationSyntaxException}; there are no partial results.
 * The parser holds no state between calls and is safe to use from several threads.
 */
public final class LocationParser {

    private final String raw;
    private final List<LocationToken> tokens;
    private int current = 0;

    private LocationParser(final String raw) {
        this.raw = raw;
        this.tokens = new LocationLexer(raw).tokenize();
    }

    /**
     * Parse a location expression.
     *
     * @param raw location text as found in a feature table, never {@code null}
     * @return the location tree
     * @throws LocationSyntaxException if {@code raw} is not a valid location
     */
    public static Location parse(final String raw) {
        Utils.nonNull(raw, "location cannot be null");
        final LocationParser parser = new LocationParser(raw);
        if (parser.peek().is(LocationToken.Type.END)) {
            throw parser.error(parser.peek(), "location is empty");
        }
        final Location location = parser.parseLocation();
        if (!parser.peek().is(LocationToken.Type.END)) {
            throw parser.error(parser.peek(), "unexpected " + parser.peek() + " after a complete location");
        }
        return location;
    }

    private Location parseLocation() {
        final LocationToken token = peek();
        if (token.is(LocationToken.Type.IDENTIFIER)) {
            final LocationToken following = peekAhead(1);
            if (following.is(LocationToken.Type.OPEN_PAREN)) {
                return parseOperator();
            }
            if (following.is(LocationToken.Type.REMOTE_SEPARATOR)) {
                return parseRemote();
            }
            throw error(following, "expected '(' or ':' after " + token);
        }
        return parseBaseLocation();
    }

    private Location parseOperator() {
        final LocationToken name = next();
        if (!isOperator(name.getText())) {
            throw error(name, "unknown location operator " + name);
        }
        next(); // '('
        if (peek().is(LocationToken.Type.CLOSE_PAREN)) {
            throw error(name, "empty operand list for " + name.getText());
        }
        final List<Location> parts = new ArrayList<>();
        parts.add(parseLocation());
        while (peek().is(LocationToken.Type.COMMA)) {
            next();
            parts.add(parseLocation());
        }
        expect(LocationToken.Type.CLOSE_PAREN, "expected ',' or ')' to continue " + name.getText() + "(...)");

        switch (name.getText()) {
            case JoinLocation.OPERATOR:
                return new JoinLocation(parts);
            case OrderLocation.OPERATOR:
                return new OrderLocation(parts);
            case ComplementLocation.OPERATOR:
                if (parts.size() != 1) {
                    throw error(name, "complement takes exactly one location but was given " + parts.size());
                }
                return new ComplementLocation(parts.get(0));
            default:
                throw new GenbankException.ShouldNeverReachHereException("operator was checked before its operands: " + name);
        }
    }

    private static boolean isOperator(final String name) {
        return JoinLocation.OPERATOR.equals(name) || OrderLocation.OPERATOR.equals(name) || ComplementLocation.OPERATOR.equals(name);
    }

    private Location parseRemote() {
        final LocationToken accession = next();
        next(); // ':'
        return new RemoteLocation(accession.getText(), parseLocation());
    }

    private Location parseBaseLocation() {
        final LocationToken startToken = peek();
        final Position start = parsePosition();
        if (peek().is(LocationToken.Type.RANGE_SEPARATOR)) {
            next();
            final Position end = parsePosition();
            if (RangeLocation.isInverted(start, end)) {
                throw error(startToken, "range start " + start + " is after its end " + end);
            }
            return new RangeLocation(start, end);
        }
        if (peek().is(LocationToken.Type.BETWEEN_SEPARATOR)) {
            next();
            final LocationToken rightToken = peek();
            final Position right = parsePosition();
            if (!start.isExact() || !right.isExact()) {
                throw error(startToken, "the bases around '^' must be exact");
            }
            if (!BetweenLocation.isAdjacent(start.getCoordinate(), right.getCoordinate())) {
                throw error(rightToken, "'^' needs adjacent bases (n^n+1) or n^1 for a circular molecule");
            }
            return new BetweenLocation(start.getCoordinate(), right.getCoordinate());
        }
        return new SingleBaseLocation(start);
    }

    private Position parsePosition() {
        LocationToken token = next();
        if (token.is(LocationToken.Type.UNKNOWN)) {
            return Position.unknown();
        }
        FuzzyType fuzzy = FuzzyType.EXACT;
        if (token.is(LocationToken.Type.BEFORE)) {
            fuzzy = FuzzyType.BEFORE;
            token = next();
        } else if (token.is(LocationToken.Type.AFTER)) {
            fuzzy = FuzzyType.AFTER;
            token = next();
        }
        if (!token.is(LocationToken.Type.NUMBER)) {
            throw error(token, "expected a coordinate but found " + token);
        }
        final int coordinate;
        try {
            coordinate = Integer.parseInt(token.getText());
        } catch (final NumberFormatException e) {
            throw error(token, "coordinate is too large");
        }
        if (coordinate < 1) {
            throw error(token, "coordinates are 1-based and must be >= 1");
        }
        return Position.of(coordinate, fuzzy);
    }

    private LocationToken peek() {
        return tokens.get(current);
    }

    private LocationToken peekAhead(final int distance) {
        return tokens.get(Math.min(current + distance, tokens.size() - 1));
    }

    private LocationToken next() {
        final LocationToken token = tokens.get(current);
        if (!token.is(LocationToken.Type.END)) {
            current++;
        }
        return token;
    }

    private void expect(final LocationToken.Type type, final String message) {
        final LocationToken token = next();
        if (!token.is(type)) {
            throw error(token, message + " but found " + token);
        }
    }

    private LocationSyntaxException error(final LocationToken token, final String message) {
        final String offending = token.is(LocationToken.Type.END) ? "" : raw.substring(token.getOffset());
        return new LocationSyntaxException(raw, token.getOffset(), offending, message);
    }
}
