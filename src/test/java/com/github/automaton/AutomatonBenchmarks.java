package com.github.automaton;

import org.openjdk.jmh.annotations.Benchmark;

import com.github.automaton.AutomatonSpec.AutomatonSpecBuilder;

public class AutomatonBenchmarks {
  private static final String WORD = "abababababababababababababababab";

  private static AutomatonSpec endsWithAb() {
    return AutomatonSpecBuilder.newBuilder().alphabet("a", "b").states("q0", "q1", "q2")
        .initialState("q0").finalStates("q2").transition("q0", "q0", "a")
        .transition("q0", "q0", "b").transition("q0", "q1", "a").transition("q1", "q2", "b")
        .build();
  }

  private static AutomatonSpec alternating() {
    return AutomatonSpecBuilder.newBuilder().alphabet("a", "b").states("x", "y")
        .initialState("x").finalStates("x").transition("x", "y", "a").transition("y", "x", "b")
        .build();
  }

  @Benchmark
  public boolean testDeterministicRun() throws AutomatonException {
    // 1. build
    final DeterministicAutomaton dfa = new DeterministicAutomaton(alternating());

    // 2. feed the word
    for (int i = 0; i < WORD.length(); i++) {
      dfa.transition(String.valueOf(WORD.charAt(i)));
    }

    // 3. verdict
    return dfa.isAcceptingState();
  }

  @Benchmark
  public boolean testNondeterministicRun() throws AutomatonException {
    final NondeterministicAutomaton nfa = new NondeterministicAutomaton(endsWithAb());
    for (int i = 0; i < WORD.length(); i++) {
      nfa.transition(String.valueOf(WORD.charAt(i)));
    }
    return nfa.isAcceptingState();
  }

  public static void main(String args[]) throws AutomatonException {
    AutomatonBenchmarks benchmarks = new AutomatonBenchmarks();
    System.out.println(benchmarks.testDeterministicRun());
    System.out.println(benchmarks.testNondeterministicRun());
  }
}
