package FAKit;

import FAKit.Model.AutomatonException;
import FAKit.Model.EpsilonNFA;
import FAKit.Model.EquivalenceResult;
import FAKit.Model.MinimizationResult;
import FAKit.Model.NamedDFA;
import FAKit.Regex.RegexCompiler;
import FAKit.Regex.RegexTokens;
import FAKit.Simulation.DFARun;
import FAKit.Simulation.DFASimulator;
import FAKit.Simulation.NFASimulator;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

public class FAKitCommandLine {
  static final int USAGE = -1;

  public static void main(String[] args) {
    List<String> positional = new ArrayList<>();

    for (String arg : args) {
      if ("--debug".equalsIgnoreCase(arg)) {
        DFAMinimizer.DEBUG = true;
      } else if (arg.startsWith("--")) {
        // Unknown flag
        printUsageAndExit();
      } else {
        positional.add(arg);
      }
    }

    if (positional.isEmpty()) {
      printUsageAndExit();
    }

    int status;
    try {
      status = run(positional.get(0), positional.subList(1, positional.size()), System.out);
    } catch (AutomatonException e) {
      System.err.println("[INPUT ERROR] " + e.getMessage());
      status = 1;
    }
    if (status == USAGE) {
      printUsageAndExit();
    }
    System.exit(status);
  }

  private static void printUsageAndExit() {
    System.out.println("FAKit [--debug] <command> <arguments>");
    System.out.println("[--debug] : Print partition refinement rounds");
    System.out.println();
    System.out.println("<command> : one of the choices below:");
    System.out.println("  regex <pattern> [word...]: Compile the pattern to an NFA and test each word.");
    System.out.println("  run <dfa> [word...]: Run each word through the DFA.");
    System.out.println("  minimize <dfa>: Minimize a total DFA.");
    System.out.println("  equiv <dfa1> <dfa2>: Decide whether two DFAs accept the same language.");
    System.out.println();
    System.out.println("<pattern> : literals with ( ) | * + and optional explicit concatenation '.'");
    System.out.println("<dfa> : states=A,B;alphabet=0,1;start=A;accept=B;A.0=A;A.1=B;B.0=A;B.1=B");
    System.exit(0);
  }

  /**
   * Execute one command.
   * @param command - command name, see usage
   * @param args - command arguments
   * @param out - where results are printed
   * @return exit status, or USAGE if the invocation is invalid
   */
  static int run(String command, List<String> args, PrintStream out) {
    return switch (command.toLowerCase(Locale.ROOT)) {
      case "regex" -> args.isEmpty() ? USAGE : regex(args.get(0), args.subList(1, args.size()), out);
      case "run" -> args.isEmpty() ? USAGE : runDFA(DFAText.parse(args.get(0)), args.subList(1, args.size()), out);
      case "minimize" -> args.size() != 1 ? USAGE : minimize(DFAText.parse(args.get(0)), out);
      case "equiv" -> args.size() != 2 ? USAGE : equiv(DFAText.parse(args.get(0)), DFAText.parse(args.get(1)), out);
      default -> USAGE;
    };
  }

  private static int regex(String pattern, List<String> words, PrintStream out) {
    EpsilonNFA<Character> nfa = RegexCompiler.compile(RegexTokens.ofCharacters(pattern));
    out.println("=== NFA for " + pattern + " ===");
    out.println("Start State : " + EpsilonNFA.stateName(nfa.getStart()));
    out.println("Final State : " + EpsilonNFA.stateName(nfa.getAccept()));
    out.println("Transitions:");
    for (String line : nfa.getTransitionListing()) {
      out.println("  " + line);
    }
    for (String word : words) {
      boolean accepted = NFASimulator.accepts(nfa, RegexTokens.word(word));
      out.println((accepted ? "ACCEPTED: '" : "REJECTED: '") + word + "'");
    }
    return 0;
  }

  private static int runDFA(NamedDFA<String> dfa, List<String> words, PrintStream out) {
    for (String word : words) {
      DFARun run = DFASimulator.run(dfa, DFAText.word(word));
      out.println((run.accepted() ? "ACCEPTED: '" : "REJECTED: '") + word + "' via " + String.join(" -> ", run.trace()));
      if (run.error() != null) {
        out.println("  " + run.error());
      }
    }
    return 0;
  }

  private static int minimize(NamedDFA<String> dfa, PrintStream out) {
    MinimizationResult<String> result = DFAMinimizer.minimize(dfa);
    out.println("Original DFA size: " + dfa.size());
    out.println("Minimized DFA size: " + result.dfa().size());
    for (String line : DFAText.describe(result.dfa())) {
      out.println(line);
    }
    out.println("State mapping:");
    for (String state : result.dfa().getStates()) {
      out.println("  " + state + " represents: " + String.join(", ", result.representedBy(state)));
    }
    return 0;
  }

  private static int equiv(NamedDFA<String> first, NamedDFA<String> second, PrintStream out) {
    EquivalenceResult<String> result = DFAEquivalence.check(first, second);
    if (result.equivalent()) {
      out.println("EQUIVALENT (" + result.visitedPairs().size() + " state pairs visited)");
    } else {
      out.println("NOT EQUIVALENT: states " + result.mismatch() + " differ in acceptance");
      out.println("Counterexample: '" + String.join("", result.counterexample()) + "'");
    }
    return 0;
  }
}
