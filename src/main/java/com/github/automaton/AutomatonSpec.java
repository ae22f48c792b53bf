package com.github.automaton;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * The declarative description an automaton is built from: alphabet, states, initial state, final
 * states and the (from, to, symbol) transition list.
 *
 * Fields are loosely typed: a spec usually arrives from an untyped source (a JSON document, a
 * literal in a test) and the validator reports a number where a state name was expected. A field
 * that was never set is null and is reported as missing. Use the {@code AutomatonSpecBuilder} to
 * assemble one.
 *
 * A spec is only read during construction, never retained by the automaton built from it, so one
 * spec may be used to build any number of independent automatons.
 */
public final class AutomatonSpec {
  private final List<?> alphabet;
  private final List<?> states;
  private final Object initialState;
  private final List<?> finalStates;
  private final List<?> transitions;

  public List<?> getAlphabet() {
    return alphabet;
  }

  public List<?> getStates() {
    return states;
  }

  public Object getInitialState() {
    return initialState;
  }

  public List<?> getFinalStates() {
    return finalStates;
  }

  /**
   * Each element is expected to be a 3-element {@link List} or array of (from, to, symbol).
   */
  public List<?> getTransitions() {
    return transitions;
  }

  public final static class AutomatonSpecBuilder {
    private List<?> alphabet;
    private List<?> states;
    private Object initialState;
    private List<?> finalStates;
    private List<Object> transitions;

    public static AutomatonSpecBuilder newBuilder() {
      return new AutomatonSpecBuilder();
    }

    public AutomatonSpecBuilder alphabet(final String... symbols) {
      this.alphabet = Arrays.asList(symbols);
      return this;
    }

    public AutomatonSpecBuilder alphabet(final List<?> symbols) {
      this.alphabet = symbols;
      return this;
    }

    public AutomatonSpecBuilder states(final String... states) {
      this.states = Arrays.asList(states);
      return this;
    }

    public AutomatonSpecBuilder states(final List<?> states) {
      this.states = states;
      return this;
    }

    public AutomatonSpecBuilder initialState(final Object initialState) {
      this.initialState = initialState;
      return this;
    }

    public AutomatonSpecBuilder finalStates(final String... finalStates) {
      this.finalStates = Arrays.asList(finalStates);
      return this;
    }

    public AutomatonSpecBuilder finalStates(final List<?> finalStates) {
      this.finalStates = finalStates;
      return this;
    }

    public AutomatonSpecBuilder transition(final String from, final String to,
        final String symbol) {
      if (transitions == null) {
        transitions = new ArrayList<>();
      }
      transitions.add(Arrays.asList(from, to, symbol));
      return this;
    }

    public AutomatonSpecBuilder transitions(final List<?> transitions) {
      this.transitions = transitions == null ? null : new ArrayList<>(transitions);
      return this;
    }

    public AutomatonSpec build() {
      return new AutomatonSpec(alphabet, states, initialState, finalStates, transitions);
    }

    private AutomatonSpecBuilder() {}
  }

  private static List<?> freeze(final List<?> list) {
    return list == null ? null : Collections.unmodifiableList(new ArrayList<>(list));
  }

  @Override
  public String toString() {
    return "AutomatonSpec [alphabet=" + alphabet + ", states=" + states + ", initialState="
        + initialState + ", finalStates=" + finalStates + ", transitions=" + transitions + "]";
  }

  private AutomatonSpec(final List<?> alphabet, final List<?> states, final Object initialState,
      final List<?> finalStates, final List<?> transitions) {
    this.alphabet = freeze(alphabet);
    this.states = freeze(states);
    this.initialState = initialState;
    this.finalStates = freeze(finalStates);
    this.transitions = freeze(transitions);
  }

}
