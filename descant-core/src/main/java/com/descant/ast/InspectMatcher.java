package com.descant.ast;

import com.descant.Token;

import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Picks the alternative of an {@code inspect} that runs.
 *
 * <p>Alternatives are tried top to bottom and the first match wins, even if
 * a later alternative would match too. Selection stops at the first
 * alternative whose outcome cannot be decided, because a later match must
 * not be chosen over an earlier one that might have matched.</p>
 */
public final class InspectMatcher {

    public enum Outcome {
        MATCH,
        NO_MATCH,
        UNKNOWN
    }

    private static final Set<String> LITERAL_TYPE_NAMES = Set.of("int", "double", "char", "bool", "std::string");

    private InspectMatcher() {
    }

    /** The first alternative for which {@code test} reports a match. */
    public static Optional<Alternative> firstMatch(InspectExpression inspect, Function<Alternative, Outcome> test) {
        for (Alternative alternative : inspect.alternatives()) {
            switch (test.apply(alternative)) {
                case MATCH:
                    return Optional.of(alternative);
                case UNKNOWN:
                    return Optional.empty();
                case NO_MATCH:
                default:
                    break;
            }
        }
        return Optional.empty();
    }

    /**
     * Resolves an inspect whose answer is known from the source alone: a
     * literal subject, or a wildcard alternative reached first.
     */
    public static Optional<Alternative> resolveStatically(InspectExpression inspect) {
        return firstMatch(inspect, alternative -> staticOutcome(inspect.subject(), alternative));
    }

    static Outcome staticOutcome(Expression subject, Alternative alternative) {
        if (alternative.type() != null && alternative.type().isWildcard()) {
            return Outcome.MATCH;
        }
        if (!(subject instanceof Literal literal) || alternative.isCast()) {
            return Outcome.UNKNOWN;
        }
        if (alternative.value() != null) {
            if (alternative.value() instanceof Literal value) {
                return sameLiteral(literal.token(), value.token()) ? Outcome.MATCH : Outcome.NO_MATCH;
            }
            return Outcome.UNKNOWN;
        }
        String typeName = TreePrinter.print(alternative.type());
        if (typeName.equals(literalTypeName(literal.token()))) {
            return Outcome.MATCH;
        }
        return LITERAL_TYPE_NAMES.contains(typeName) ? Outcome.NO_MATCH : Outcome.UNKNOWN;
    }

    private static boolean sameLiteral(Token a, Token b) {
        return a.type() == b.type() && a.text().equals(b.text());
    }

    private static String literalTypeName(Token t) {
        if (t.is("true") || t.is("false")) {
            return "bool";
        }
        return switch (t.type()) {
            case DECIMAL_LITERAL, BINARY_LITERAL, HEXADECIMAL_LITERAL -> "int";
            case FLOAT_LITERAL -> "double";
            case CHARACTER_LITERAL -> "char";
            case STRING_LITERAL -> "std::string";
            default -> "";
        };
    }
}
