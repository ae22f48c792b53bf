package com.github.automaton;

/**
 * Unified single exception that's thrown by this library, both while building an automaton from
 * its spec and while feeding it symbols. The code enum classifies the failure; the message carries
 * the offending field, value and type.
 */
public final class AutomatonException extends Exception {
  private static final long serialVersionUID = 1L;
  private final Code code;

  public AutomatonException(final Code code) {
    super(code.getDescription());
    this.code = code;
  }

  public AutomatonException(final Code code, final String message) {
    super(message);
    this.code = code;
  }

  public AutomatonException(final Code code, final String message, final Throwable throwable) {
    super(message, throwable);
    this.code = code;
  }

  public Code getCode() {
    return code;
  }

  public static enum Code {
    // 1.
    MISSING_FIELD("Automaton spec or one of its required fields is not defined"),
    // 2.
    INVALID_ALPHABET_SYMBOL("Alphabet symbol must be a string that is not solely whitespace"),
    // 3.
    DUPLICATE_ALPHABET_SYMBOL("Alphabet symbol is declared more than once"),
    // 4.
    INVALID_STATE("State must be a string that is not solely whitespace"),
    // 5.
    DUPLICATE_STATE("State is declared more than once"),
    // 6.
    INVALID_INITIAL_STATE("Initial state must be a declared, non-blank state"),
    // 7.
    INVALID_FINAL_STATE("Final state must be a string"),
    // 8.
    DUPLICATE_FINAL_STATE("Final state is declared more than once"),
    // 9.
    UNKNOWN_FINAL_STATE("Final state is not a declared state"),
    // 10.
    TRANSITION_ARITY("Transition must be a 3-tuple of (from, to, symbol)"),
    // 11.
    TRANSITION_TYPE("Transition elements must all be strings"),
    // 12.
    UNKNOWN_STATE("Transition refers to a state that is not declared"),
    // 13.
    UNKNOWN_SYMBOL("Symbol is not part of the alphabet"),
    // 14.
    NON_DETERMINISTIC_TRANSITION(
        "Transition redefines an existing (state, symbol) pair of a deterministic automaton"),
    // 15.
    INVALID_AUTOMATON_CONFIG("Automaton configuration is invalid"),
    // 16.
    SPEC_LOAD_FAILURE("Failed to load automaton spec. Check exception stacktrace for details");

    private String description;

    private Code(String description) {
      this.description = description;
    }

    public String getDescription() {
      return description;
    }
  }

}
