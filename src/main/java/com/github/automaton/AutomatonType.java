package com.github.automaton;

/**
 * The automaton variant to build. Also decides what the transition table builder does when a
 * (state, symbol) pair is declared more than once.
 */
public enum AutomatonType {
  // at most one target per (state, symbol), a second definition is rejected
  DFA,
  // any number of targets per (state, symbol), later definitions accumulate
  NFA;
}
