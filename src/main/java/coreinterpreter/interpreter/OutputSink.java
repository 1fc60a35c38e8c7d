package coreinterpreter.interpreter;

import java.io.PrintStream;

/** Receives every value emitted by a {@code write} statement, in emission order. */
@FunctionalInterface
public interface OutputSink {

  void write(String name, int value);

  static OutputSink printingTo(PrintStream out, OutputFormat format) {
    return (name, value) -> out.println(format.format(name, value));
  }
}
