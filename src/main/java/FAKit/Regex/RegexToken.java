package FAKit.Regex;

import java.util.Objects;

/**
 * Either a literal symbol or an operator; exactly one of the two components is set.
 */
public record RegexToken<I>(Operator operator, I symbol) {

    public RegexToken {
        if ((operator == null) == (symbol == null)) {
            throw new IllegalArgumentException("A token is either an operator or a literal symbol");
        }
    }

    public static <I> RegexToken<I> literal(I symbol) {
        return new RegexToken<>(null, Objects.requireNonNull(symbol));
    }

    public static <I> RegexToken<I> of(Operator operator) {
        return new RegexToken<>(Objects.requireNonNull(operator), null);
    }

    public boolean isLiteral() {
        return operator == null;
    }

    public boolean is(Operator op) {
        return operator == op;
    }

    @Override
    public String toString() {
        return isLiteral() ? String.valueOf(symbol) : String.valueOf(operator.getSymbol());
    }
}
