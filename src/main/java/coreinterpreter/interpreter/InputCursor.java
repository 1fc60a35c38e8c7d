package coreinterpreter.interpreter;

import com.google.common.collect.ImmutableList;
import com.google.common.primitives.Ints;
import java.util.Iterator;
import java.util.List;

/** Forward-only supply of the integers consumed by {@code read} statements. */
public interface InputCursor {

  boolean hasNext();

  /**
   * Consumes the next integer. Callers check {@link #hasNext()} first.
   *
   * @throws RuntimeError if the next datum is not an integer
   */
  int next();

  static InputCursor of(int... values) {
    return of(Ints.asList(values));
  }

  static InputCursor of(List<Integer> values) {
    Iterator<Integer> it = ImmutableList.copyOf(values).iterator();
    return new InputCursor() {
      @Override
      public boolean hasNext() {
        return it.hasNext();
      }

      @Override
      public int next() {
        return it.next();
      }
    };
  }
}
