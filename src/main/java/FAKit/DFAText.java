package FAKit;

import FAKit.Model.NamedDFA;
import FAKit.Model.ValidationException;

import java.util.ArrayList;
import java.util.List;

/**
 * One-line DFA notation used on the command line:
 * <pre>
 * states=A,B;alphabet=0,1;start=A;accept=B;A.0=A;A.1=B;B.0=A;B.1=B
 * </pre>
 * {@code X.a=Y} declares δ(X, a) = Y. The key is split at its first '.', so state names cannot contain '.' while
 * symbols can ({@code A..=B} reads '.'). Listing several targets ({@code A.0=B,C}) is rejected as nondeterministic.
 * Symbols are strings; words are read one character per symbol.
 */
public class DFAText {

    public static NamedDFA<String> parse(String text) {
        List<String> states = null;
        List<String> alphabet = null;
        String start = null;
        List<String> accepting = new ArrayList<>();
        List<String[]> transitions = new ArrayList<>();

        for (String section : text.split(";")) {
            section = section.trim();
            if (section.isEmpty()) {
                continue;
            }
            int eq = section.indexOf('=');
            if (eq < 0) {
                throw new ValidationException("Expected key=value in DFA section '" + section + "'");
            }
            String key = section.substring(0, eq).trim();
            String value = section.substring(eq + 1).trim();
            switch (key) {
                case "states" -> states = list(value);
                case "alphabet" -> alphabet = list(value);
                case "start" -> start = value;
                case "accept" -> accepting = list(value);
                default -> {
                    int dot = key.indexOf('.');
                    if (dot <= 0 || dot == key.length() - 1) {
                        throw new ValidationException("Unknown DFA section '" + key + "'");
                    }
                    for (String target : list(value)) {
                        transitions.add(new String[] {key.substring(0, dot), key.substring(dot + 1), target});
                    }
                }
            }
        }
        if (states == null || alphabet == null) {
            throw new ValidationException("DFA needs both 'states' and 'alphabet' sections");
        }

        NamedDFA.Builder<String> builder = NamedDFA.builder(alphabet);
        for (String s : states) {
            builder.addState(s);
        }
        builder.withStart(start);
        builder.addAccepting(accepting.toArray(new String[0]));
        for (String[] t : transitions) {
            builder.addTransition(t[0], t[1], t[2]);
        }
        return builder.build();
    }

    public static List<String> word(String input) {
        List<String> word = new ArrayList<>(input.length());
        for (int i = 0; i < input.length(); i++) {
            word.add(String.valueOf(input.charAt(i)));
        }
        return word;
    }

    /**
     * Human-readable listing: states, alphabet, start, final states and one δ line per defined transition.
     */
    public static <I> List<String> describe(NamedDFA<I> dfa) {
        List<String> lines = new ArrayList<>();
        lines.add("States: " + String.join(", ", dfa.getStates()));
        lines.add("Alphabet: " + join(dfa.getInputAlphabet()));
        lines.add("Start State: " + dfa.getStart());
        lines.add("Final States: " + String.join(", ", dfa.getAccepting()));
        lines.add("Transitions:");
        for (String s : dfa.getStates()) {
            for (I a : dfa.getInputAlphabet()) {
                String succ = dfa.getSuccessor(s, a);
                if (succ != null) {
                    lines.add("  δ(" + s + ", " + a + ") → " + succ);
                }
            }
        }
        return lines;
    }

    private static List<String> list(String value) {
        List<String> items = new ArrayList<>();
        for (String item : value.split(",")) {
            item = item.trim();
            if (!item.isEmpty()) {
                items.add(item);
            }
        }
        return items;
    }

    private static String join(Iterable<?> items) {
        List<String> out = new ArrayList<>();
        for (Object o : items) {
            out.add(String.valueOf(o));
        }
        return String.join(", ", out);
    }
}
