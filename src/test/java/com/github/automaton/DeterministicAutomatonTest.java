package com.github.automaton;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.Test;

import com.github.automaton.AutomatonException.Code;
import com.github.automaton.AutomatonSpec.AutomatonSpecBuilder;

/**
 * Tests to maintain the sanity and correctness of the deterministic automaton.
 */
public class DeterministicAutomatonTest {
  static {
    System.setProperty("log4j.configurationFile", "log4j.properties");
  }

  private static void assertUnknownSymbol(final Automaton automaton, final String symbol) {
    try {
      automaton.transition(symbol);
      fail("Expected " + Code.UNKNOWN_SYMBOL);
    } catch (AutomatonException problem) {
      assertEquals(Code.UNKNOWN_SYMBOL, problem.getCode());
    }
  }

  @Test
  public void testAcceptingFlow() throws AutomatonException {
    final DeterministicAutomaton dfa =
        new DeterministicAutomaton(SpecValidatorTest.validSpec().build());
    assertEquals(DfaState.active("s1"), dfa.getCurrentState());
    assertFalse(dfa.isAcceptingState());
    assertFalse(dfa.isErrorState());

    // s1->s2
    dfa.transition("a");
    assertEquals(DfaState.active("s2"), dfa.getCurrentState());
    assertFalse(dfa.isAcceptingState());

    // s2->s3
    dfa.transition("b");
    assertEquals("s3", dfa.getCurrentState().getName());
    assertTrue(dfa.isAcceptingState());
    assertFalse(dfa.isErrorState());
    assertEquals(2L, dfa.getStatistics().getConsumedSymbols());
    assertEquals(-1L, dfa.getStatistics().getErrorStep());
  }

  @Test
  public void testMissingTransitionIsAbsorbingError() throws AutomatonException {
    final DeterministicAutomaton dfa =
        new DeterministicAutomaton(SpecValidatorTest.validSpec().build());

    // no (s1, b) entry
    dfa.transition("b");
    assertTrue(dfa.isErrorState());
    assertEquals(DfaState.ERROR, dfa.getCurrentState());
    assertTrue(dfa.getCurrentState().isError());
    assertFalse(dfa.isAcceptingState());
    assertEquals(1L, dfa.getStatistics().getErrorStep());

    // (s1, a) exists but the error state does not recover
    dfa.transition("a");
    dfa.transition("b");
    assertTrue(dfa.isErrorState());
    assertFalse(dfa.isAcceptingState());
    assertEquals(3L, dfa.getStatistics().getConsumedSymbols());
    assertEquals(1L, dfa.getStatistics().getErrorStep());
  }

  @Test
  public void testUnknownSymbolAlwaysThrows() throws AutomatonException {
    final DeterministicAutomaton dfa =
        new DeterministicAutomaton(SpecValidatorTest.validSpec().build());
    assertUnknownSymbol(dfa, "c");
    assertUnknownSymbol(dfa, null);
    // a refused symbol does not move the automaton
    assertEquals(DfaState.active("s1"), dfa.getCurrentState());

    dfa.transition("b");
    assertTrue(dfa.isErrorState());
    assertUnknownSymbol(dfa, "c");
    assertEquals(3L, dfa.getStatistics().getRejectedSymbols());
  }

  @Test
  public void testErrorStateIsNotADeclaredState() {
    assertNotEquals(DfaState.active("ERROR"), DfaState.ERROR);
    assertEquals(DfaState.active("s1"), DfaState.active("s1"));
    try {
      DfaState.ERROR.getName();
      fail("Expected IllegalStateException");
    } catch (IllegalStateException expected) {
      assertTrue(DfaState.ERROR.isError());
    }
  }

  @Test
  public void testSelfLoops() throws AutomatonException {
    // binary strings with an even number of zeros
    final AutomatonSpec spec = AutomatonSpecBuilder.newBuilder().alphabet("0", "1")
        .states("even", "odd").initialState("even").finalStates("even")
        .transition("even", "odd", "0").transition("odd", "even", "0")
        .transition("even", "even", "1").transition("odd", "odd", "1").build();
    final DeterministicAutomaton dfa = new DeterministicAutomaton(spec);
    assertTrue(dfa.isAcceptingState());
    for (final String symbol : "1011".split("")) {
      dfa.transition(symbol);
    }
    assertEquals(DfaState.active("odd"), dfa.getCurrentState());
    assertFalse(dfa.isAcceptingState());
    dfa.transition("0");
    assertTrue(dfa.isAcceptingState());
  }

  @Test
  public void testIndependentInstances() throws AutomatonException {
    final AutomatonSpec spec = SpecValidatorTest.validSpec().build();
    final DeterministicAutomaton first = new DeterministicAutomaton(spec);
    final DeterministicAutomaton second = new DeterministicAutomaton(spec);
    assertNotEquals(first.getId(), second.getId());

    first.transition("a");
    assertEquals(DfaState.active("s2"), first.getCurrentState());
    assertEquals(DfaState.active("s1"), second.getCurrentState());

    second.transition("b");
    assertTrue(second.isErrorState());
    assertFalse(first.isErrorState());
  }

  @Test
  public void testConstructionRejectsNonDeterminism() {
    final AutomatonSpec spec = SpecValidatorTest.validSpec().transition("s1", "s3", "a").build();
    try {
      new DeterministicAutomaton(spec);
      fail("Expected " + Code.NON_DETERMINISTIC_TRANSITION);
    } catch (AutomatonException problem) {
      assertEquals(Code.NON_DETERMINISTIC_TRANSITION, problem.getCode());
    }
  }

  @Test
  public void testConstructionSurfacesValidationErrors() {
    try {
      new DeterministicAutomaton(SpecValidatorTest.validSpec().finalStates("s4").build());
      fail("Expected " + Code.UNKNOWN_FINAL_STATE);
    } catch (AutomatonException problem) {
      assertEquals(Code.UNKNOWN_FINAL_STATE, problem.getCode());
    }
    try {
      new DeterministicAutomaton(null);
      fail("Expected " + Code.MISSING_FIELD);
    } catch (AutomatonException problem) {
      assertEquals(Code.MISSING_FIELD, problem.getCode());
    }
  }

}
