package com.github.automaton;

/**
 * Simple statistics holder for an automaton instance. Updated only by
 * {@link Automaton#transition(String)}.
 */
public final class AutomatonStatistics {
  private final String automatonId;
  private final long startMillis = System.currentTimeMillis();
  long consumedSymbols;
  long rejectedSymbols;
  // step (1-based count of consumed symbols) on which the automaton died, -1 while alive
  long errorStep = -1L;

  AutomatonStatistics(final String automatonId) {
    this.automatonId = automatonId;
  }

  public String getAutomatonId() {
    return automatonId;
  }

  public long getStartTimeMillis() {
    return startMillis;
  }

  /**
   * Symbols from the alphabet fed to the automaton, including those consumed after it died.
   */
  public long getConsumedSymbols() {
    return consumedSymbols;
  }

  /**
   * Out-of-alphabet symbols that were refused with {@link AutomatonException.Code#UNKNOWN_SYMBOL}.
   */
  public long getRejectedSymbols() {
    return rejectedSymbols;
  }

  public long getErrorStep() {
    return errorStep;
  }

  @Override
  public String toString() {
    return "AutomatonStatistics [automatonId=" + automatonId + ", startMillis=" + startMillis
        + ", consumedSymbols=" + consumedSymbols + ", rejectedSymbols=" + rejectedSymbols
        + ", errorStep=" + errorStep + "]";
  }

}
