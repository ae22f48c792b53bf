package com.github.automaton;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A nondeterministic finite automaton without epsilon moves. Its configuration is the set of
 * simultaneously active states. An empty set is the dead configuration: it is the error state and
 * is absorbing.
 *
 * The input is accepted when at least one active state is final. The dead configuration is never
 * accepting.
 *
 * @see Automaton
 */
public final class NondeterministicAutomaton extends AbstractAutomaton {
  private Set<String> currentStates;

  public NondeterministicAutomaton(final AutomatonSpec spec) throws AutomatonException {
    super(spec, AutomatonType.NFA);
    this.currentStates = Collections.singleton(initialState);
  }

  @Override
  public void transition(final String symbol) throws AutomatonException {
    checkSymbol(symbol);
    if (currentStates.isEmpty()) {
      return;
    }
    final Set<String> next = new LinkedHashSet<>();
    for (final String state : currentStates) {
      // an undefined (state, symbol) pair just contributes nothing
      next.addAll(transitionTable.targets(state, symbol));
    }
    logDebug(getId(), String.format("%s -> %s on %s", currentStates, next, symbol));
    currentStates = Collections.unmodifiableSet(next);
    if (next.isEmpty()) {
      died(symbol);
    }
  }

  /**
   * Snapshot of the active states. Empty once the automaton has died.
   */
  public Set<String> getCurrentStates() {
    return currentStates;
  }

  @Override
  public boolean isAcceptingState() {
    for (final String state : currentStates) {
      if (finalStates.contains(state)) {
        return true;
      }
    }
    return false;
  }

  @Override
  public boolean isErrorState() {
    return currentStates.isEmpty();
  }

  @Override
  public String toString() {
    return "NondeterministicAutomaton [id=" + getId() + ", currentStates=" + currentStates + "]";
  }
}
