package coreinterpreter.util;

import com.google.common.base.Strings;
import coreinterpreter.ast.*;
import java.util.stream.Collectors;

/**
 * An implementation of an AST visitor that pretty-prints the AST back to source code.
 *
 * <p>The layout is canonical: every declaration and statement goes on its own line, indented by two
 * spaces per nesting level, and tokens are separated by single spaces except where the syntax
 * binds tighter ({@code !}, parentheses, brackets, {@code ,} and {@code ;}). Parsing the output
 * yields a structurally equal AST.
 *
 * <p>Instances of this class <em>are</em> stateful (e.g., current indentation level). It is very
 * cheap to create new instances of this class and therefore it is generally not advisable to reuse
 * instances.
 */
public class PrettyPrinter
    implements Program.Visitor<CharSequence>,
        Statement.Visitor<CharSequence>,
        Expression.Visitor<CharSequence>,
        Condition.Visitor<CharSequence> {

  private static final String INDENT = "  ";

  private int indentLevel = 0;

  public PrettyPrinter() {}

  public static String print(Program program) {
    return program.acceptVisitor(new PrettyPrinter()).toString();
  }

  private CharSequence indent() {
    return Strings.repeat(INDENT, indentLevel);
  }

  private static CharSequence identifiers(IdentifierList that) {
    return that.identifiers.stream().map(id -> id.name).collect(Collectors.joining(", "));
  }

  @Override
  public CharSequence visitProgram(Program that) {
    StringBuilder sb = new StringBuilder("program").append(System.lineSeparator());
    indentLevel++;
    for (Declaration declaration : that.declarations) {
      sb.append(indent())
          .append("int ")
          .append(identifiers(declaration.identifiers))
          .append(";")
          .append(System.lineSeparator());
    }
    indentLevel--;
    sb.append("begin").append(System.lineSeparator());
    sb.append(statements(that.body));
    return sb.append("end").append(System.lineSeparator());
  }

  /** Prints each statement on its own line, one level deeper than the enclosing construct. */
  private CharSequence statements(StatementSequence that) {
    StringBuilder sb = new StringBuilder();
    indentLevel++;
    for (Statement statement : that.statements) {
      sb.append(indent()).append(statement.acceptVisitor(this)).append(System.lineSeparator());
    }
    indentLevel--;
    return sb;
  }

  @Override
  public CharSequence visitAssignment(Statement.Assignment that) {
    return new StringBuilder(that.target.name)
        .append(" = ")
        .append(that.value.acceptVisitor(this))
        .append(";");
  }

  @Override
  public CharSequence visitIf(Statement.If that) {
    StringBuilder sb =
        new StringBuilder("if ")
            .append(that.condition.acceptVisitor(this))
            .append(" then")
            .append(System.lineSeparator())
            .append(statements(that.then));
    if (that.else_.isPresent()) {
      sb.append(indent())
          .append("else")
          .append(System.lineSeparator())
          .append(statements(that.else_.get()));
    }
    return sb.append(indent()).append("end;");
  }

  @Override
  public CharSequence visitWhile(Statement.While that) {
    return new StringBuilder("while ")
        .append(that.condition.acceptVisitor(this))
        .append(" loop")
        .append(System.lineSeparator())
        .append(statements(that.body))
        .append(indent())
        .append("end;");
  }

  @Override
  public CharSequence visitRead(Statement.Read that) {
    return new StringBuilder("read ").append(identifiers(that.targets)).append(";");
  }

  @Override
  public CharSequence visitWrite(Statement.Write that) {
    return new StringBuilder("write ").append(identifiers(that.sources)).append(";");
  }

  @Override
  public CharSequence visitBinaryOperator(Expression.BinaryOperator that) {
    return new StringBuilder()
        .append(that.left.acceptVisitor(this))
        .append(" ")
        .append(that.op.string)
        .append(" ")
        .append(that.right.acceptVisitor(this));
  }

  @Override
  public CharSequence visitIntegerLiteral(Expression.IntegerLiteral that) {
    return that.literal;
  }

  @Override
  public CharSequence visitVariable(Expression.Variable that) {
    return that.name;
  }

  @Override
  public CharSequence visitParenthesized(Expression.Parenthesized that) {
    return new StringBuilder("(").append(that.expression.acceptVisitor(this)).append(")");
  }

  @Override
  public CharSequence visitComparison(Condition.Comparison that) {
    return new StringBuilder("(")
        .append(that.left.acceptVisitor(this))
        .append(" ")
        .append(that.op.string)
        .append(" ")
        .append(that.right.acceptVisitor(this))
        .append(")");
  }

  @Override
  public CharSequence visitNegation(Condition.Negation that) {
    return new StringBuilder("!").append(that.condition.acceptVisitor(this));
  }

  @Override
  public CharSequence visitConjunction(Condition.Conjunction that) {
    return junction(that.left, "&&", that.right);
  }

  @Override
  public CharSequence visitDisjunction(Condition.Disjunction that) {
    return junction(that.left, "||", that.right);
  }

  private CharSequence junction(Condition left, String op, Condition right) {
    return new StringBuilder("[")
        .append(left.acceptVisitor(this))
        .append(" ")
        .append(op)
        .append(" ")
        .append(right.acceptVisitor(this))
        .append("]");
  }
}
