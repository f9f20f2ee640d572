package FAKit.Regex;

/**
 * Regex operators. Precedence: {@code * = + > . > |}; parentheses only bracket the operator stack.
 */
public enum Operator {
    LEFT_PAREN('(', 0),
    RIGHT_PAREN(')', 0),
    ALTERNATION('|', 1),
    CONCAT('.', 2),
    STAR('*', 3),
    PLUS('+', 3);

    private final char symbol;
    private final int precedence;

    Operator(char symbol, int precedence) {
        this.symbol = symbol;
        this.precedence = precedence;
    }

    public char getSymbol() {
        return symbol;
    }

    public int getPrecedence() {
        return precedence;
    }

    public boolean isUnary() {
        return this == STAR || this == PLUS;
    }

    /**
     * @return the operator written as c, or null if c is not an operator character.
     */
    public static Operator fromChar(char c) {
        for (Operator op : values()) {
            if (op.symbol == c) {
                return op;
            }
        }
        return null;
    }
}
