package com.github.automaton;

import java.util.Set;
import java.util.UUID;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.automaton.AutomatonException.Code;
import com.github.automaton.SpecValidator.ValidatedSpec;

/**
 * Common skeleton of both automaton variants: validation and table building at construction, the
 * alphabet check every transition starts with, statistics and log line tagging.
 */
abstract class AbstractAutomaton implements Automaton {
  private static final Logger logger =
      LogManager.getLogger(AbstractAutomaton.class.getSimpleName());

  private final String automatonId = UUID.randomUUID().toString();
  private final AutomatonType type;

  final Set<String> alphabet;
  final Set<String> states;
  final Set<String> finalStates;
  final String initialState;
  final TransitionTable transitionTable;
  final AutomatonStatistics statistics;

  AbstractAutomaton(final AutomatonSpec spec, final AutomatonType type)
      throws AutomatonException {
    this.type = type;
    final ValidatedSpec validated;
    final TransitionTable table;
    try {
      validated = SpecValidator.validate(spec);
      table = TransitionTable.build(validated, spec.getTransitions(), type);
    } catch (AutomatonException problem) {
      logError(automatonId, "Failed to build " + type + ": " + problem.getMessage());
      throw problem;
    }
    this.alphabet = validated.getAlphabet();
    this.states = validated.getStates();
    this.finalStates = validated.getFinalStates();
    this.initialState = validated.getInitialState();
    this.transitionTable = table;
    this.statistics = new AutomatonStatistics(automatonId);
    logInfo(automatonId, String.format(
        "Built %s with %d symbols, %d states, %d final states, %d transitions, initial state %s",
        type, alphabet.size(), states.size(), finalStates.size(), table.size(), initialState));
  }

  /**
   * Refuse symbols outside the alphabet. Runs before anything else in a transition, whatever the
   * current configuration.
   */
  final void checkSymbol(final String symbol) throws AutomatonException {
    if (!alphabet.contains(symbol)) {
      statistics.rejectedSymbols++;
      logError(automatonId, "Rejected symbol " + symbol + " that is not part of the alphabet");
      throw new AutomatonException(Code.UNKNOWN_SYMBOL,
          "symbol " + symbol + " is not a valid part of the alphabet " + alphabet);
    }
    statistics.consumedSymbols++;
  }

  /**
   * Record the step on which the automaton entered its error configuration.
   */
  final void died(final String symbol) {
    statistics.errorStep = statistics.consumedSymbols;
    logInfo(automatonId, "Entered error state on symbol " + symbol + " at step "
        + statistics.errorStep);
  }

  @Override
  public String getId() {
    return automatonId;
  }

  @Override
  public AutomatonType getType() {
    return type;
  }

  @Override
  public AutomatonStatistics getStatistics() {
    return statistics;
  }

  static void logError(final String automatonId, final String message) {
    logger.error(new StringBuilder().append("[a:").append(automatonId).append("] ")
        .append(message).toString());
  }

  static void logInfo(final String automatonId, final String message) {
    logger.info(new StringBuilder().append("[a:").append(automatonId).append("] ")
        .append(message).toString());
  }

  static void logDebug(final String automatonId, final String message) {
    if (logger.isDebugEnabled()) {
      logger.debug(new StringBuilder().append("[a:").append(automatonId).append("] ")
          .append(message).toString());
    }
  }
}
