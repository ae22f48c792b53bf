package com.github.automaton;

/**
 * Runtime state of a {@link DeterministicAutomaton}: either active in one of the declared states or
 * in the error state. The error state is not a member of the declared state set and is absorbing.
 */
public final class DfaState {
  public static final DfaState ERROR = new DfaState(null);

  // null only for ERROR
  private final String name;

  public static DfaState active(final String name) {
    if (name == null) {
      throw new IllegalArgumentException("Active state name cannot be null");
    }
    return new DfaState(name);
  }

  public boolean isError() {
    return name == null;
  }

  /**
   * The declared state name. Only defined while active.
   */
  public String getName() {
    if (name == null) {
      throw new IllegalStateException("Error state has no name");
    }
    return name;
  }

  @Override
  public int hashCode() {
    final int prime = 31;
    int result = 1;
    result = prime * result + ((name == null) ? 0 : name.hashCode());
    return result;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null) {
      return false;
    }
    if (getClass() != obj.getClass()) {
      return false;
    }
    DfaState other = (DfaState) obj;
    if (name == null) {
      if (other.name != null) {
        return false;
      }
    } else if (!name.equals(other.name)) {
      return false;
    }
    return true;
  }

  @Override
  public String toString() {
    return name == null ? "DfaState [ERROR]" : "DfaState [name=" + name + "]";
  }

  private DfaState(final String name) {
    this.name = name;
  }
}
