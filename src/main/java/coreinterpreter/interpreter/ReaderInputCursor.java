package coreinterpreter.interpreter;

import coreinterpreter.CoreError;
import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.io.Reader;
import org.jetbrains.annotations.Nullable;

/**
 * Reads the input data lazily from a text source holding one integer per line. Whitespace around
 * a number and a leading sign are allowed, empty lines are not.
 */
public class ReaderInputCursor implements InputCursor, Closeable {
  private final BufferedReader reader;
  private final String sourceName;
  private int lineNumber;
  @Nullable private String lookahead;
  private boolean exhausted;

  public ReaderInputCursor(Reader reader, String sourceName) {
    this.reader =
        reader instanceof BufferedReader ? (BufferedReader) reader : new BufferedReader(reader);
    this.sourceName = sourceName;
  }

  private void fill() {
    if (lookahead != null || exhausted) {
      return;
    }
    try {
      lookahead = reader.readLine();
    } catch (IOException e) {
      throw new CoreError(e);
    }
    if (lookahead == null) {
      exhausted = true;
    } else {
      lineNumber++;
    }
  }

  @Override
  public boolean hasNext() {
    fill();
    return !exhausted;
  }

  @Override
  public int next() {
    if (!hasNext()) {
      throw new RuntimeError(String.format("End of data file '%s' has been reached", sourceName));
    }
    String line = lookahead.trim();
    lookahead = null;
    if (line.isEmpty()) {
      throw new RuntimeError(
          String.format(
              "Data file '%s' contains an empty line at line %d", sourceName, lineNumber));
    }
    try {
      return Integer.parseInt(line);
    } catch (NumberFormatException e) {
      throw new RuntimeError(
          String.format(
              "Invalid line %d in data file '%s': '%s' is not an integer",
              lineNumber, sourceName, line));
    }
  }

  @Override
  public void close() throws IOException {
    reader.close();
  }
}
