package FAKit.Regex;

import java.util.ArrayList;
import java.util.List;

/**
 * Character-level tokenizer: every character is one symbol, except {@code ( ) | * + .} which are operators.
 */
public class RegexTokens {

    public static List<RegexToken<Character>> ofCharacters(String pattern) {
        final List<RegexToken<Character>> tokens = new ArrayList<>(pattern.length());
        for (int i = 0; i < pattern.length(); i++) {
            final char c = pattern.charAt(i);
            final Operator op = Operator.fromChar(c);
            tokens.add(op == null ? RegexToken.literal(c) : RegexToken.of(op));
        }
        return tokens;
    }

    /**
     * Input word for a character-level automaton.
     */
    public static List<Character> word(String input) {
        final List<Character> word = new ArrayList<>(input.length());
        for (int i = 0; i < input.length(); i++) {
            word.add(input.charAt(i));
        }
        return word;
    }

    public static <I> String toString(List<RegexToken<I>> tokens) {
        final StringBuilder sb = new StringBuilder();
        for (RegexToken<I> token : tokens) {
            sb.append(token);
        }
        return sb.toString();
    }
}
