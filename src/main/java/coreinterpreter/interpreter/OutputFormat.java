package coreinterpreter.interpreter;

/** How a printing {@link OutputSink} renders a single written value, one value per line. */
public enum OutputFormat {
  /** Just the decimal value, e.g. {@code 10}. */
  VALUES {
    @Override
    public String format(String name, int value) {
      return Integer.toString(value);
    }
  },
  /** The variable's name and its value, e.g. {@code Y = 10}. */
  NAMED {
    @Override
    public String format(String name, int value) {
      return name + " = " + value;
    }
  };

  public abstract String format(String name, int value);
}
