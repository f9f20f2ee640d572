package FAKit.Model;

import net.automatalib.alphabet.impl.Alphabets;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import net.automatalib.word.Word;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

public class NamedDFATest {
  private static NamedDFA.Builder<String> endsInOne() {
    return NamedDFA.<String>builder(List.of("0", "1"))
        .addStates("A", "B")
        .withStart("A")
        .addAccepting("B")
        .addTransition("A", "0", "A")
        .addTransition("A", "1", "B")
        .addTransition("B", "0", "A")
        .addTransition("B", "1", "B");
  }

  @Test
  void testAccessors() {
    NamedDFA<String> dfa = endsInOne().build();
    Assertions.assertEquals(2, dfa.size());
    Assertions.assertEquals(List.of("A", "B"), dfa.getStates());
    Assertions.assertEquals(List.of("0", "1"), List.copyOf(dfa.getInputAlphabet()));
    Assertions.assertEquals("A", dfa.getStart());
    Assertions.assertEquals(Set.of("B"), dfa.getAccepting());
    Assertions.assertTrue(dfa.isAccepting("B"));
    Assertions.assertFalse(dfa.isAccepting("A"));
    Assertions.assertEquals("B", dfa.getSuccessor("A", "1"));
    Assertions.assertNull(dfa.getSuccessor("A", "2"));
    Assertions.assertTrue(dfa.containsState("A"));
    Assertions.assertFalse(dfa.containsState("C"));
    Assertions.assertTrue(dfa.isTotal());
    Assertions.assertNull(dfa.firstMissingTransition());
  }

  @Test
  void testUnknownStateLookup() {
    NamedDFA<String> dfa = endsInOne().build();
    ValidationException e = Assertions.assertThrows(ValidationException.class, () -> dfa.isAccepting("C"));
    Assertions.assertEquals("State 'C' is not part of the state set", e.getMessage());
  }

  @Test
  void testPartial() {
    NamedDFA<String> dfa = NamedDFA.<String>builder(List.of("0", "1"))
        .addStates("A", "B")
        .withStart("A")
        .addAccepting("B")
        .addTransition("A", "1", "B")
        .build();
    Assertions.assertFalse(dfa.isTotal());
    Assertions.assertEquals("δ(A, 0)", dfa.firstMissingTransition());
    Assertions.assertNull(dfa.getSuccessor("A", "0"));
  }

  @Test
  void testBuildErrors() {
    ValidationException e;

    e = Assertions.assertThrows(ValidationException.class,
        () -> NamedDFA.<String>builder(List.of("0")).addStates("A").build());
    Assertions.assertEquals("Start state is not set", e.getMessage());

    e = Assertions.assertThrows(ValidationException.class,
        () -> NamedDFA.<String>builder(List.of("0")).addStates("A").withStart("Z").build());
    Assertions.assertEquals("Start state 'Z' is not part of the state set", e.getMessage());

    e = Assertions.assertThrows(ValidationException.class,
        () -> NamedDFA.<String>builder(List.of("0")).addStates("A").withStart("A").addAccepting("Z").build());
    Assertions.assertEquals("Accepting state 'Z' is not part of the state set", e.getMessage());

    e = Assertions.assertThrows(ValidationException.class,
        () -> NamedDFA.<String>builder(List.of("0")).addStates("A").withStart("A")
            .addTransition("A", "0", "Z").build());
    Assertions.assertEquals("Transition (A, 0) -> Z references an unknown state", e.getMessage());

    e = Assertions.assertThrows(ValidationException.class,
        () -> NamedDFA.<String>builder(List.of("0")).addStates("A").withStart("A")
            .addTransition("A", "x", "A").build());
    Assertions.assertEquals("Transition (A, x) -> A uses symbol 'x' outside the alphabet", e.getMessage());

    e = Assertions.assertThrows(ValidationException.class,
        () -> NamedDFA.<String>builder(List.of("0")).addStates("A", "A"));
    Assertions.assertEquals("Duplicate state 'A'", e.getMessage());
  }

  @Test
  void testNondeterminism() {
    NamedDFA.Builder<String> builder = endsInOne();
    // repeating an identical transition is fine
    builder.addTransition("A", "0", "A");

    NondeterministicTransitionException e = Assertions.assertThrows(NondeterministicTransitionException.class,
        () -> builder.addTransition("A", "0", "B"));
    Assertions.assertEquals("A", e.getState());
    Assertions.assertEquals("0", e.getSymbol());
    Assertions.assertEquals("A", e.getExistingTarget());
    Assertions.assertEquals("B", e.getConflictingTarget());
    Assertions.assertTrue(e.getMessage().contains("δ(A, 0) = {A, B}"));
    Assertions.assertTrue(e instanceof AutomatonException);
  }

  @Test
  void testCompactCopy() {
    NamedDFA<String> dfa = endsInOne().build();
    CompactDFA<String> copy = dfa.toCompactDFA();
    Assertions.assertEquals(2, copy.size());
    Assertions.assertTrue(copy.accepts(Word.fromSymbols("0", "1")));
    Assertions.assertFalse(copy.accepts(Word.fromSymbols("1", "0")));

    // mutating the copy must not leak into the named DFA
    copy.setAccepting(0, true);
    copy.setTransition(1, 0, 1);
    Assertions.assertFalse(dfa.isAccepting("A"));
    Assertions.assertEquals("A", dfa.getSuccessor("B", "0"));
  }

  @Test
  void testFromAutomaton() {
    CompactDFA<Integer> source = new CompactDFA<>(Alphabets.integers(0, 1));
    source.addState(false);
    source.addState(true);
    source.setInitialState(1);
    source.setTransition(0, 1, 1);
    source.setTransition(1, 0, 0);

    NamedDFA<Integer> dfa = NamedDFA.fromAutomaton(source, source.getInputAlphabet(), "p");
    Assertions.assertEquals(List.of("p0", "p1"), dfa.getStates());
    Assertions.assertEquals("p1", dfa.getStart());
    Assertions.assertEquals(Set.of("p1"), dfa.getAccepting());
    Assertions.assertEquals("p1", dfa.getSuccessor("p0", 1));
    Assertions.assertEquals("p0", dfa.getSuccessor("p1", 0));
    Assertions.assertNull(dfa.getSuccessor("p0", 0));
  }

  @Test
  void testFromAutomatonWithoutInitialState() {
    CompactDFA<Integer> source = new CompactDFA<>(Alphabets.integers(0, 1));
    source.addState(false);
    Assertions.assertThrows(ValidationException.class,
        () -> NamedDFA.fromAutomaton(source, source.getInputAlphabet(), "p"));
  }
}
