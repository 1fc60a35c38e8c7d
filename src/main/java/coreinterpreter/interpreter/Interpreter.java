package coreinterpreter.interpreter;

import coreinterpreter.ast.*;
import coreinterpreter.semantic.NameAnalyzer;
import coreinterpreter.semantic.SemanticError;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tree-walking interpreter for name-analyzed Core programs.
 *
 * <p>Arithmetic is carried out on 32 bit integers. An overflow aborts the run with a {@link
 * RuntimeError} instead of wrapping around. Both operands of {@code &&} and {@code ||} are
 * evaluated, left to right.
 */
public class Interpreter
    implements Statement.Visitor<Void>, Expression.Visitor<Integer>, Condition.Visitor<Boolean> {
  private static final Logger LOGGER = LoggerFactory.getLogger("Interpreter");

  private final Store store;
  private final InputCursor input;
  private final OutputSink output;

  private Interpreter(Store store, InputCursor input, OutputSink output) {
    this.store = store;
    this.input = input;
    this.output = output;
  }

  /**
   * Runs {@code program} to completion against a fresh {@link Store}, which is returned. Name
   * analysis runs first, so nothing is executed for a program with a duplicate or undeclared
   * variable.
   *
   * @throws SemanticError if a variable is declared twice or used without being declared
   * @throws RuntimeError on arithmetic overflow, an integer literal out of range or insufficient or
   *     malformed input
   */
  public static Store execute(Program program, InputCursor input, OutputSink output) {
    NameAnalyzer.analyze(program);
    List<String> names = new ArrayList<>();
    for (Declaration declaration : program.declarations) {
      for (Identifier id : declaration.identifiers.identifiers) {
        names.add(id.name);
      }
    }
    Store store = new Store(names);
    LOGGER.debug("Executing program with variables {}", names);
    new Interpreter(store, input, output).executeSequence(program.body);
    LOGGER.debug("Final store {}", store);
    return store;
  }

  private void executeSequence(StatementSequence statements) {
    for (Statement statement : statements.statements) {
      LOGGER.trace("{} at {}", statement.getClass().getSimpleName(), statement.range());
      statement.acceptVisitor(this);
    }
  }

  @Override
  public Void visitAssignment(Statement.Assignment that) {
    int value = that.value.acceptVisitor(this);
    store.set(that.target.name, value);
    return null;
  }

  @Override
  public Void visitIf(Statement.If that) {
    if (that.condition.acceptVisitor(this)) {
      executeSequence(that.then);
    } else {
      that.else_.ifPresent(this::executeSequence);
    }
    return null;
  }

  @Override
  public Void visitWhile(Statement.While that) {
    while (that.condition.acceptVisitor(this)) {
      executeSequence(that.body);
    }
    return null;
  }

  @Override
  public Void visitRead(Statement.Read that) {
    for (Identifier target : that.targets.identifiers) {
      if (!input.hasNext()) {
        throw new RuntimeError(
            that.range(), "Insufficient input: no more data to read into '" + target.name + "'");
      }
      store.set(target.name, input.next());
    }
    return null;
  }

  @Override
  public Void visitWrite(Statement.Write that) {
    for (Identifier source : that.sources.identifiers) {
      output.write(source.name, store.get(source.name));
    }
    return null;
  }

  @Override
  public Integer visitBinaryOperator(Expression.BinaryOperator that) {
    int left = that.left.acceptVisitor(this);
    int right = that.right.acceptVisitor(this);
    try {
      switch (that.op) {
        case PLUS:
          return Math.addExact(left, right);
        case MINUS:
          return Math.subtractExact(left, right);
        case TIMES:
          return Math.multiplyExact(left, right);
        default:
          throw new UnsupportedOperationException("Unhandled operator " + that.op);
      }
    } catch (ArithmeticException e) {
      throw new RuntimeError(
          that.range(), String.format("Integer overflow in %d %s %d", left, that.op.string, right));
    }
  }

  @Override
  public Integer visitIntegerLiteral(Expression.IntegerLiteral that) {
    try {
      return Integer.parseInt(that.literal);
    } catch (NumberFormatException e) {
      throw new RuntimeError(
          that.range(), "Integer literal " + that.literal + " is out of the 32 bit range");
    }
  }

  @Override
  public Integer visitVariable(Expression.Variable that) {
    return store.get(that.name);
  }

  @Override
  public Integer visitParenthesized(Expression.Parenthesized that) {
    return that.expression.acceptVisitor(this);
  }

  @Override
  public Boolean visitComparison(Condition.Comparison that) {
    int left = that.left.acceptVisitor(this);
    int right = that.right.acceptVisitor(this);
    switch (that.op) {
      case NEQ:
        return left != right;
      case EQ:
        return left == right;
      case LT:
        return left < right;
      case GT:
        return left > right;
      case LEQ:
        return left <= right;
      case GEQ:
        return left >= right;
      default:
        throw new UnsupportedOperationException("Unhandled comparison " + that.op);
    }
  }

  @Override
  public Boolean visitNegation(Condition.Negation that) {
    return !that.condition.acceptVisitor(this);
  }

  @Override
  public Boolean visitConjunction(Condition.Conjunction that) {
    boolean left = that.left.acceptVisitor(this);
    boolean right = that.right.acceptVisitor(this);
    return left && right;
  }

  @Override
  public Boolean visitDisjunction(Condition.Disjunction that) {
    boolean left = that.left.acceptVisitor(this);
    boolean right = that.right.acceptVisitor(this);
    return left || right;
  }
}
