package com.github.automaton;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

import com.github.automaton.AutomatonException.Code;

/**
 * Checks a raw {@link AutomatonSpec} for well-formedness and produces the validated alphabet, state
 * set, final state set and initial state. Knows nothing about the DFA/NFA distinction; the
 * transition list is left to {@link TransitionTable}.
 *
 * Checks run in a fixed order and the first failure is reported:<br>
 * 1. presence of the spec and each of its fields<br>
 * 2. alphabet<br>
 * 3. states<br>
 * 4. initial state<br>
 * 5. final states<br>
 */
final class SpecValidator {

  static ValidatedSpec validate(final AutomatonSpec spec) throws AutomatonException {
    checkPresence(spec);

    final Set<String> alphabet = new LinkedHashSet<>();
    for (final Object symbol : spec.getAlphabet()) {
      if (!(symbol instanceof String)) {
        throw new AutomatonException(Code.INVALID_ALPHABET_SYMBOL,
            "symbol in alphabet must be a string, but got " + describe(symbol));
      }
      final String value = (String) symbol;
      if (alphabet.contains(value)) {
        throw new AutomatonException(Code.DUPLICATE_ALPHABET_SYMBOL,
            "duplicate symbol in alphabet: " + value);
      }
      if (value.trim().isEmpty()) {
        throw new AutomatonException(Code.INVALID_ALPHABET_SYMBOL,
            "symbol in alphabet must not be solely whitespace: '" + value + "'");
      }
      alphabet.add(value);
    }

    final Set<String> states = new LinkedHashSet<>();
    for (final Object state : spec.getStates()) {
      if (!(state instanceof String)) {
        throw new AutomatonException(Code.INVALID_STATE,
            "state must be a string, but got " + describe(state));
      }
      final String value = (String) state;
      if (states.contains(value)) {
        throw new AutomatonException(Code.DUPLICATE_STATE, "duplicate state: " + value);
      }
      if (value.trim().isEmpty()) {
        throw new AutomatonException(Code.INVALID_STATE,
            "state must not be solely whitespace: '" + value + "'");
      }
      states.add(value);
    }

    final Object initial = spec.getInitialState();
    if (!(initial instanceof String)) {
      throw new AutomatonException(Code.INVALID_INITIAL_STATE,
          "initialState must be a string, but got " + describe(initial));
    }
    final String initialState = (String) initial;
    if (!states.contains(initialState)) {
      throw new AutomatonException(Code.INVALID_INITIAL_STATE,
          "initialState is not a declared state: " + initialState);
    }
    // blank states are already rejected above
    if (initialState.trim().isEmpty()) {
      throw new AutomatonException(Code.INVALID_INITIAL_STATE,
          "initialState must not be solely whitespace");
    }

    final Set<String> finalStates = new LinkedHashSet<>();
    for (final Object state : spec.getFinalStates()) {
      if (!(state instanceof String)) {
        throw new AutomatonException(Code.INVALID_FINAL_STATE,
            "final state must be a string, but got " + describe(state));
      }
      final String value = (String) state;
      if (finalStates.contains(value)) {
        throw new AutomatonException(Code.DUPLICATE_FINAL_STATE,
            "duplicate final state: " + value);
      }
      if (!states.contains(value)) {
        throw new AutomatonException(Code.UNKNOWN_FINAL_STATE,
            "final state " + value + " is not a declared state");
      }
      finalStates.add(value);
    }

    return new ValidatedSpec(Collections.unmodifiableSet(alphabet),
        Collections.unmodifiableSet(states), Collections.unmodifiableSet(finalStates),
        initialState);
  }

  private static void checkPresence(final AutomatonSpec spec) throws AutomatonException {
    if (spec == null) {
      throw new AutomatonException(Code.MISSING_FIELD, "automaton spec is not defined");
    }
    missing("alphabet", spec.getAlphabet());
    missing("states", spec.getStates());
    missing("initialState", spec.getInitialState());
    missing("finalStates", spec.getFinalStates());
    missing("transitions", spec.getTransitions());
  }

  private static void missing(final String field, final Object value) throws AutomatonException {
    if (value == null || "".equals(value)) {
      throw new AutomatonException(Code.MISSING_FIELD,
          "automaton spec property " + field + " is not defined");
    }
  }

  /**
   * Renders a value with its runtime type for error messages.
   */
  static String describe(final Object value) {
    if (value == null) {
      return "null";
    }
    return value + " of type " + value.getClass().getSimpleName();
  }

  /**
   * Output of {@link SpecValidator#validate(AutomatonSpec)}. All sets are unmodifiable and keep
   * declaration order.
   */
  static final class ValidatedSpec {
    private final Set<String> alphabet;
    private final Set<String> states;
    private final Set<String> finalStates;
    private final String initialState;

    private ValidatedSpec(final Set<String> alphabet, final Set<String> states,
        final Set<String> finalStates, final String initialState) {
      this.alphabet = alphabet;
      this.states = states;
      this.finalStates = finalStates;
      this.initialState = initialState;
    }

    Set<String> getAlphabet() {
      return alphabet;
    }

    Set<String> getStates() {
      return states;
    }

    Set<String> getFinalStates() {
      return finalStates;
    }

    String getInitialState() {
      return initialState;
    }
  }

  private SpecValidator() {}
}
