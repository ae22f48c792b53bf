package com.github.automaton;

/**
 * This class encapsulates the configuration parameters used to build an {@link Automaton}. Use the
 * {@code AutomatonConfigurationBuilder} to build it.
 */
public final class AutomatonConfiguration {
  private final AutomatonType type;

  public AutomatonType getType() {
    return type;
  }

  public final static class AutomatonConfigurationBuilder {
    private AutomatonType type;

    public static AutomatonConfigurationBuilder newBuilder() {
      return new AutomatonConfigurationBuilder();
    }

    public AutomatonConfigurationBuilder type(final AutomatonType type) {
      this.type = type;
      return this;
    }

    public AutomatonConfiguration build() throws AutomatonException {
      final AutomatonConfiguration config = new AutomatonConfiguration(type);
      config.validate();
      return config;
    }

    private AutomatonConfigurationBuilder() {}
  }

  private void validate() throws AutomatonException {
    if (type == null) {
      throw new AutomatonException(AutomatonException.Code.INVALID_AUTOMATON_CONFIG,
          "AutomatonType cannot be null");
    }
  }

  @Override
  public String toString() {
    return "AutomatonConfiguration [type=" + type + "]";
  }

  private AutomatonConfiguration(final AutomatonType type) {
    this.type = type;
  }

}
