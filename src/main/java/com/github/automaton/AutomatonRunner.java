package com.github.automaton;

import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.automaton.AutomatonConfiguration.AutomatonConfigurationBuilder;

/**
 * Thin driver around the library: load a spec from a JSON file, feed it a word and report whether
 * the word is accepted.
 *
 * Usage: {@code AutomatonRunner <spec.json> <dfa|nfa> [symbol...]}<br>
 * Exit status is 0 if the word is accepted, 1 if it is rejected and 2 on bad usage or an invalid
 * spec or symbol.
 */
public final class AutomatonRunner {
  private static final Logger logger = LogManager.getLogger(AutomatonRunner.class.getSimpleName());

  static final int ACCEPTED = 0;
  static final int REJECTED = 1;
  static final int FAILED = 2;

  /**
   * Membership test: build a fresh automaton from the spec, feed it every symbol in order and
   * report whether the final configuration is accepting.
   */
  public static boolean accepts(final AutomatonConfiguration config, final AutomatonSpec spec,
      final List<String> symbols) throws AutomatonException {
    final Automaton automaton =
        Automaton.AutomatonBuilder.newBuilder().config(config).spec(spec).build();
    logger.info("[a:" + automaton.getId() + "] start " + describe(automaton));
    for (final String symbol : symbols) {
      automaton.transition(symbol);
      logger.info("[a:" + automaton.getId() + "] " + symbol + " => " + describe(automaton));
    }
    logger.info(automaton.getStatistics());
    return automaton.isAcceptingState();
  }

  static int run(final String[] args) {
    if (args.length < 2) {
      logger.error("Usage: AutomatonRunner <spec.json> <dfa|nfa> [symbol...]");
      return FAILED;
    }
    final AutomatonType type;
    try {
      type = AutomatonType.valueOf(args[1].toUpperCase());
    } catch (IllegalArgumentException badType) {
      logger.error("Unknown automaton type " + args[1] + ", expected one of "
          + Arrays.toString(AutomatonType.values()));
      return FAILED;
    }
    try {
      final AutomatonConfiguration config =
          AutomatonConfigurationBuilder.newBuilder().type(type).build();
      final AutomatonSpec spec = AutomatonSpecLoader.load(Paths.get(args[0]));
      final List<String> symbols = Arrays.asList(args).subList(2, args.length);
      final boolean accepted = accepts(config, spec, symbols);
      System.out.println(accepted ? "accepted" : "rejected");
      return accepted ? ACCEPTED : REJECTED;
    } catch (AutomatonException problem) {
      logger.error("Failed with " + problem.getCode() + ": " + problem.getMessage(), problem);
      return FAILED;
    }
  }

  public static void main(final String[] args) {
    System.exit(run(args));
  }

  private static String describe(final Automaton automaton) {
    if (automaton instanceof DeterministicAutomaton) {
      return String.valueOf(((DeterministicAutomaton) automaton).getCurrentState());
    }
    return String.valueOf(((NondeterministicAutomaton) automaton).getCurrentStates());
  }

  private AutomatonRunner() {}
}
