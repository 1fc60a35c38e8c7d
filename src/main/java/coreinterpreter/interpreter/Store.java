package coreinterpreter.interpreter;

import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The variables of a single program run. Every declared variable is present from the start with
 * value 0, iteration order is declaration order.
 *
 * <p>Only the {@link Interpreter} assigns variables, callers get to inspect the final values.
 */
public class Store {
  private final Map<String, Integer> values = new LinkedHashMap<>();

  Store(Iterable<String> names) {
    for (String name : names) {
      values.put(name, 0);
    }
  }

  public int get(String name) {
    Integer value = values.get(name);
    checkState(value != null, "Variable %s was not declared", name);
    return value;
  }

  void set(String name, int value) {
    checkState(values.containsKey(name), "Variable %s was not declared", name);
    values.put(name, value);
  }

  public boolean isDeclared(String name) {
    return values.containsKey(name);
  }

  /** A snapshot of all variables and their current values, in declaration order. */
  public ImmutableMap<String, Integer> asMap() {
    return ImmutableMap.copyOf(values);
  }

  @Override
  public String toString() {
    return values.toString();
  }
}
