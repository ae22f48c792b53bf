package com.github.automaton;

/**
 * A finite automaton built once from an {@link AutomatonSpec} and then fed input symbols one at a
 * time. The two implementations are {@link DeterministicAutomaton} and
 * {@link NondeterministicAutomaton}; they differ in the plurality of their current configuration.
 *
 * Notes for users:<br>
 * 1. construction is atomic, either the spec is valid and a fully initialized automaton comes back
 * or an {@link AutomatonException} is thrown and nothing escapes<br>
 *
 * 2. the alphabet, state set and transition table are immutable once built; only the current
 * configuration changes, and only through {@link #transition(String)}<br>
 *
 * 3. an instance is NOT thread-safe. Callers sharing one across threads must synchronize
 * externally. Independent instances, even ones built from the same spec, share no mutable
 * state<br>
 *
 * 4. feeding a symbol outside the alphabet is a usage bug and always throws, in any
 * configuration. A valid symbol with no defined transition is a rejection, not an exception; the
 * automaton moves to its absorbing error configuration<br>
 */
public interface Automaton {

  /**
   * Consume one input symbol.
   *
   * @throws AutomatonException with {@link AutomatonException.Code#UNKNOWN_SYMBOL} if the symbol is
   *         not part of the alphabet
   */
  void transition(final String symbol) throws AutomatonException;

  /**
   * Check whether the input consumed so far is accepted.
   */
  boolean isAcceptingState();

  /**
   * Check whether the automaton is in its absorbing error configuration.
   */
  boolean isErrorState();

  /**
   * Reports the id of this automaton instance, used to tag its log lines.
   */
  String getId();

  AutomatonType getType();

  AutomatonStatistics getStatistics();

  /**
   * A simple builder to let users use fluent APIs to build automatons whose variant is picked by
   * configuration.
   */
  public final static class AutomatonBuilder {
    private AutomatonConfiguration config;
    private AutomatonSpec spec;

    public static AutomatonBuilder newBuilder() {
      return new AutomatonBuilder();
    }

    public AutomatonBuilder config(final AutomatonConfiguration config) {
      this.config = config;
      return this;
    }

    public AutomatonBuilder spec(final AutomatonSpec spec) {
      this.spec = spec;
      return this;
    }

    public Automaton build() throws AutomatonException {
      if (config == null) {
        throw new AutomatonException(AutomatonException.Code.INVALID_AUTOMATON_CONFIG,
            "AutomatonConfiguration cannot be null");
      }
      switch (config.getType()) {
        case DFA:
          return new DeterministicAutomaton(spec);
        case NFA:
          return new NondeterministicAutomaton(spec);
        default:
          throw new AutomatonException(AutomatonException.Code.INVALID_AUTOMATON_CONFIG,
              "Unsupported automaton type " + config.getType());
      }
    }

    private AutomatonBuilder() {}
  }

}
