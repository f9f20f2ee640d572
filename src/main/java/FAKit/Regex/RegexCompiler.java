package FAKit.Regex;

import FAKit.Model.EpsilonNFA;
import FAKit.Model.MalformedPatternException;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.alphabet.impl.Alphabets;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Compiles a tokenized regular expression into an {@link EpsilonNFA} using Thompson's construction.
 * <p>
 * Three passes: explicit concatenation insertion, infix to postfix (shunting-yard), and postfix evaluation over a
 * stack of (start, accept) fragments. Every call allocates its own state arena, so numbering starts at q0 each time.
 */
public class RegexCompiler {

    public static <I> EpsilonNFA<I> compile(List<RegexToken<I>> pattern) {
        if (pattern.isEmpty()) {
            throw new MalformedPatternException("Regular expression cannot be empty");
        }
        final List<RegexToken<I>> postfix = toPostfix(insertConcatenation(pattern));
        return postfixToNFA(postfix);
    }

    /**
     * Insert {@link Operator#CONCAT} between juxtaposed tokens.
     */
    static <I> List<RegexToken<I>> insertConcatenation(List<RegexToken<I>> tokens) {
        final List<RegexToken<I>> out = new ArrayList<>(tokens.size() * 2);
        for (int i = 0; i < tokens.size(); i++) {
            final RegexToken<I> left = tokens.get(i);
            out.add(left);
            if (i + 1 < tokens.size() && needsConcat(left, tokens.get(i + 1))) {
                out.add(RegexToken.of(Operator.CONCAT));
            }
        }
        return out;
    }

    private static boolean needsConcat(RegexToken<?> left, RegexToken<?> right) {
        if (left.is(Operator.LEFT_PAREN) || left.is(Operator.ALTERNATION) || left.is(Operator.CONCAT)) {
            return false;
        }
        return right.isLiteral() || right.is(Operator.LEFT_PAREN);
    }

    /**
     * Shunting-yard. Equal precedence pops, so every binary operator is left-associative.
     */
    static <I> List<RegexToken<I>> toPostfix(List<RegexToken<I>> infix) {
        final List<RegexToken<I>> output = new ArrayList<>(infix.size());
        final Deque<RegexToken<I>> operators = new ArrayDeque<>();

        for (RegexToken<I> token : infix) {
            if (token.isLiteral()) {
                output.add(token);
                continue;
            }
            switch (token.operator()) {
                case LEFT_PAREN -> operators.push(token);
                case RIGHT_PAREN -> {
                    while (!operators.isEmpty() && !operators.peek().is(Operator.LEFT_PAREN)) {
                        output.add(operators.pop());
                    }
                    if (operators.isEmpty()) {
                        throw new MalformedPatternException("Unbalanced parentheses: too many closing parentheses");
                    }
                    operators.pop();
                }
                default -> {
                    final int precedence = token.operator().getPrecedence();
                    while (!operators.isEmpty()
                           && !operators.peek().is(Operator.LEFT_PAREN)
                           && operators.peek().operator().getPrecedence() >= precedence) {
                        output.add(operators.pop());
                    }
                    operators.push(token);
                }
            }
        }

        while (!operators.isEmpty()) {
            final RegexToken<I> op = operators.pop();
            if (op.is(Operator.LEFT_PAREN)) {
                throw new MalformedPatternException("Unbalanced parentheses: too many opening parentheses");
            }
            output.add(op);
        }
        return output;
    }

    private static <I> EpsilonNFA<I> postfixToNFA(List<RegexToken<I>> postfix) {
        final EpsilonNFA.Builder<I> nfa = new EpsilonNFA.Builder<>(literalAlphabet(postfix));
        final Deque<Fragment> stack = new ArrayDeque<>();

        for (RegexToken<I> token : postfix) {
            if (token.isLiteral()) {
                final int start = nfa.addState();
                final int accept = nfa.addState();
                nfa.addTransition(start, token.symbol(), accept);
                stack.push(new Fragment(start, accept));
                continue;
            }
            final Operator op = token.operator();
            switch (op) {
                case CONCAT -> {
                    final Fragment right = pop(stack, op);
                    final Fragment left = pop(stack, op);
                    nfa.addEpsilon(left.accept(), right.start());
                    stack.push(new Fragment(left.start(), right.accept()));
                }
                case ALTERNATION -> {
                    final Fragment right = pop(stack, op);
                    final Fragment left = pop(stack, op);
                    final int start = nfa.addState();
                    final int accept = nfa.addState();
                    nfa.addEpsilon(start, left.start());
                    nfa.addEpsilon(start, right.start());
                    nfa.addEpsilon(left.accept(), accept);
                    nfa.addEpsilon(right.accept(), accept);
                    stack.push(new Fragment(start, accept));
                }
                case STAR -> {
                    final Fragment inner = pop(stack, op);
                    final int start = nfa.addState();
                    final int accept = nfa.addState();
                    nfa.addEpsilon(start, inner.start());
                    nfa.addEpsilon(start, accept);
                    nfa.addEpsilon(inner.accept(), inner.start());
                    nfa.addEpsilon(inner.accept(), accept);
                    stack.push(new Fragment(start, accept));
                }
                case PLUS -> {
                    // as STAR, minus the start -> accept bypass
                    final Fragment inner = pop(stack, op);
                    final int start = nfa.addState();
                    final int accept = nfa.addState();
                    nfa.addEpsilon(start, inner.start());
                    nfa.addEpsilon(inner.accept(), inner.start());
                    nfa.addEpsilon(inner.accept(), accept);
                    stack.push(new Fragment(start, accept));
                }
                default -> throw new MalformedPatternException("Unexpected '" + op.getSymbol() + "' in postfix form");
            }
        }

        if (stack.size() != 1) {
            throw new MalformedPatternException(stack.isEmpty()
                ? "Regular expression contains no symbols"
                : "Regular expression leaves " + stack.size() + " unconnected sub-expressions");
        }
        final Fragment result = stack.pop();
        return nfa.build(result.start(), result.accept());
    }

    private static Fragment pop(Deque<Fragment> stack, Operator op) {
        if (stack.isEmpty()) {
            throw new MalformedPatternException("Operator '" + op.getSymbol() + "' is missing "
                                                + (op.isUnary() ? "its operand" : "an operand"));
        }
        return stack.pop();
    }

    private static <I> Alphabet<I> literalAlphabet(List<RegexToken<I>> tokens) {
        final Set<I> symbols = new LinkedHashSet<>();
        for (RegexToken<I> token : tokens) {
            if (token.isLiteral()) {
                symbols.add(token.symbol());
            }
        }
        return Alphabets.fromCollection(symbols);
    }

    private record Fragment(int start, int accept) { }
}
