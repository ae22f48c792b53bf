package com.github.automaton;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.github.automaton.AutomatonException.Code;
import com.github.automaton.SpecValidator.ValidatedSpec;

/**
 * Immutable transition relation K=fromState, V=(K=symbol, V=targets). This table is fully hydrated
 * during construction and never modified afterwards.
 *
 * The same build routine serves both variants; only the handling of a repeated (from, symbol)
 * pair differs. A {@link AutomatonType#DFA} table rejects it, a {@link AutomatonType#NFA} table
 * adds the new target to the pair's target set. Targets are sets, so a repeated (from, to, symbol)
 * triple in an NFA spec is absorbed.
 */
final class TransitionTable {
  private final Map<String, Map<String, Set<String>>> table;
  private final int size;

  private TransitionTable(final Map<String, Map<String, Set<String>>> table, final int size) {
    this.table = table;
    this.size = size;
  }

  /**
   * Builds the table from the raw transition list, in declaration order, so the first offending
   * tuple is the one reported.
   */
  static TransitionTable build(final ValidatedSpec validated, final List<?> transitions,
      final AutomatonType type) throws AutomatonException {
    final Set<String> states = validated.getStates();
    final Set<String> alphabet = validated.getAlphabet();
    final Map<String, Map<String, Set<String>>> table = new HashMap<>();
    int size = 0;

    for (final Object transition : transitions) {
      final List<?> tuple = asTuple(transition);
      if (tuple == null || tuple.size() != 3) {
        throw new AutomatonException(Code.TRANSITION_ARITY,
            "transition must be a 3-tuple of strings, but got " + SpecValidator.describe(
                transition instanceof Object[] ? Arrays.toString((Object[]) transition)
                    : transition));
      }
      for (int i = 0; i < 3; i++) {
        if (!(tuple.get(i) instanceof String)) {
          throw new AutomatonException(Code.TRANSITION_TYPE,
              "transition must be a 3-tuple of strings, element " + i + " is "
                  + SpecValidator.describe(tuple.get(i)));
        }
      }

      final String from = (String) tuple.get(0);
      final String to = (String) tuple.get(1);
      final String symbol = (String) tuple.get(2);
      if (!states.contains(from)) {
        throw new AutomatonException(Code.UNKNOWN_STATE,
            "first element of transition must be a declared state, but got " + from);
      }
      if (!states.contains(to)) {
        throw new AutomatonException(Code.UNKNOWN_STATE,
            "second element of transition must be a declared state, but got " + to);
      }
      if (!alphabet.contains(symbol)) {
        throw new AutomatonException(Code.UNKNOWN_SYMBOL,
            "third element of transition must be a symbol in the alphabet, but got " + symbol);
      }

      final Map<String, Set<String>> row = table.computeIfAbsent(from, k -> new HashMap<>());
      final Set<String> targets = row.get(symbol);
      if (targets == null) {
        final Set<String> fresh = new LinkedHashSet<>();
        fresh.add(to);
        row.put(symbol, fresh);
        size++;
      } else if (type == AutomatonType.DFA) {
        throw new AutomatonException(Code.NON_DETERMINISTIC_TRANSITION,
            String.format("transition %s -> %s on %s results in non-deterministic behavior, "
                + "(%s, %s) already leads to %s", from, to, symbol, from, symbol, targets));
      } else if (targets.add(to)) {
        size++;
      }
    }

    // freeze
    for (final Map<String, Set<String>> row : table.values()) {
      row.replaceAll((symbol, targets) -> Collections.unmodifiableSet(targets));
    }
    table.replaceAll((from, row) -> Collections.unmodifiableMap(row));
    return new TransitionTable(Collections.unmodifiableMap(table), size);
  }

  private static List<?> asTuple(final Object transition) {
    if (transition instanceof List) {
      return (List<?>) transition;
    }
    if (transition instanceof Object[]) {
      return Arrays.asList((Object[]) transition);
    }
    return null;
  }

  /**
   * All targets of (from, symbol), empty when the pair is undefined.
   */
  Set<String> targets(final String from, final String symbol) {
    final Map<String, Set<String>> row = table.get(from);
    if (row == null) {
      return Collections.emptySet();
    }
    final Set<String> targets = row.get(symbol);
    return targets == null ? Collections.<String>emptySet() : targets;
  }

  /**
   * The single target of (from, symbol) in a deterministic table.
   */
  Optional<String> target(final String from, final String symbol) {
    final Set<String> targets = targets(from, symbol);
    return targets.isEmpty() ? Optional.empty() : Optional.of(targets.iterator().next());
  }

  /**
   * Number of distinct (from, symbol, to) entries.
   */
  int size() {
    return size;
  }

  @Override
  public String toString() {
    return "TransitionTable [size=" + size + ", table=" + table + "]";
  }
}
