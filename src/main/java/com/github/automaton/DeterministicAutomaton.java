package com.github.automaton;

import java.util.Optional;

/**
 * A deterministic finite automaton. Holds exactly one current {@link DfaState}: an active declared
 * state, or {@link DfaState#ERROR} once a symbol without a defined transition has been consumed.
 * The error state is absorbing.
 *
 * @see Automaton
 */
public final class DeterministicAutomaton extends AbstractAutomaton {
  private DfaState currentState;

  public DeterministicAutomaton(final AutomatonSpec spec) throws AutomatonException {
    super(spec, AutomatonType.DFA);
    this.currentState = DfaState.active(initialState);
  }

  @Override
  public void transition(final String symbol) throws AutomatonException {
    checkSymbol(symbol);
    if (currentState.isError()) {
      return;
    }
    final Optional<String> next = transitionTable.target(currentState.getName(), symbol);
    if (next.isPresent()) {
      logDebug(getId(), String.format("%s -> %s on %s", currentState.getName(), next.get(),
          symbol));
      currentState = DfaState.active(next.get());
    } else {
      logDebug(getId(), String.format("No transition from %s on %s", currentState.getName(),
          symbol));
      currentState = DfaState.ERROR;
      died(symbol);
    }
  }

  /**
   * Read the current state, {@link DfaState#ERROR} after a rejection.
   */
  public DfaState getCurrentState() {
    return currentState;
  }

  @Override
  public boolean isAcceptingState() {
    return !currentState.isError() && finalStates.contains(currentState.getName());
  }

  @Override
  public boolean isErrorState() {
    return currentState.isError();
  }

  @Override
  public String toString() {
    return "DeterministicAutomaton [id=" + getId() + ", currentState=" + currentState + "]";
  }
}
