package coreinterpreter.util;

import static java.lang.String.format;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;

import com.google.common.collect.ImmutableList;
import coreinterpreter.ast.*;
import coreinterpreter.ast.Condition.CompOp;
import coreinterpreter.ast.Expression.BinOp;
import coreinterpreter.lexer.Lexer;
import coreinterpreter.parser.Parser;
import org.junit.Before;
import org.junit.Test;

public class PrettyPrinterTest {

  private static final SourceRange r = SourceRange.FIRST_CHAR;
  private PrettyPrinter prettyPrinter;

  @Before
  public void setup() {
    prettyPrinter = new PrettyPrinter();
  }

  private static IdentifierList ids(String... names) {
    ImmutableList.Builder<Identifier> identifiers = ImmutableList.builder();
    for (String name : names) {
      identifiers.add(new Identifier(name, r));
    }
    return new IdentifierList(identifiers.build(), r);
  }

  private static Program reparse(String source) {
    return new Parser(new Lexer(source)).parse();
  }

  @Test
  public void visitProgram_canonicalLayout() throws Exception {
    Program p =
        new Program(
            ImmutableList.of(new Declaration(ids("X", "Y"), r), new Declaration(ids("Z"), r)),
            new StatementSequence(
                ImmutableList.of(
                    new Statement.Read(ids("X"), r), new Statement.Write(ids("X", "Z"), r)),
                r),
            r);
    CharSequence actual = p.acceptVisitor(prettyPrinter);
    assertThat(
        actual.toString(),
        is(
            equalTo(
                format(
                    "program%n"
                        + "  int X, Y;%n"
                        + "  int Z;%n"
                        + "begin%n"
                        + "  read X;%n"
                        + "  write X, Z;%n"
                        + "end%n"))));
  }

  @Test
  public void visitAssignment_operatorsAreSpaced() throws Exception {
    Statement node =
        new Statement.Assignment(
            new Identifier("Y", r),
            new Expression.BinaryOperator(
                BinOp.PLUS,
                new Expression.Variable("X", r),
                new Expression.BinaryOperator(
                    BinOp.TIMES,
                    new Expression.IntegerLiteral("007", r),
                    new Expression.Parenthesized(
                        new Expression.BinaryOperator(
                            BinOp.MINUS,
                            new Expression.Variable("Z", r),
                            new Expression.IntegerLiteral("1", r),
                            r),
                        r),
                    r),
                r),
            r);
    CharSequence actual = node.acceptVisitor(prettyPrinter);
    assertThat(actual.toString(), is(equalTo("Y = X + 007 * (Z - 1);")));
  }

  @Test
  public void visitConditions_bracketsAndNegation() throws Exception {
    Condition node =
        new Condition.Disjunction(
            new Condition.Negation(
                new Condition.Comparison(
                    new Expression.Variable("X", r),
                    CompOp.GEQ,
                    new Expression.Variable("Y", r),
                    r),
                r),
            new Condition.Conjunction(
                new Condition.Comparison(
                    new Expression.Variable("X", r),
                    CompOp.NEQ,
                    new Expression.IntegerLiteral("0", r),
                    r),
                new Condition.Comparison(
                    new Expression.IntegerLiteral("1", r),
                    CompOp.LEQ,
                    new Expression.Variable("Y", r),
                    r),
                r),
            r);
    CharSequence actual = node.acceptVisitor(prettyPrinter);
    assertThat(actual.toString(), is(equalTo("[!(X >= Y) || [(X != 0) && (1 <= Y)]]")));
  }

  @Test
  public void visitNestedStatements_indentedPerLevel() throws Exception {
    String source =
        "program int X; begin while [(X < 5) && (X > 0)] loop if (X == 2) then write X;"
            + " else X = X + 1; end; X = X + 1; end; end";
    String actual = PrettyPrinter.print(reparse(source));
    assertThat(
        actual,
        is(
            equalTo(
                format(
                    "program%n"
                        + "  int X;%n"
                        + "begin%n"
                        + "  while [(X < 5) && (X > 0)] loop%n"
                        + "    if (X == 2) then%n"
                        + "      write X;%n"
                        + "    else%n"
                        + "      X = X + 1;%n"
                        + "    end;%n"
                        + "    X = X + 1;%n"
                        + "  end;%n"
                        + "end%n"))));
  }

  @Test
  public void printAndReparse_structurallyEqual() throws Exception {
    String source =
        "program int X,Y;int Z;begin read X,Y;if!!(X<Y)then Z=(X-Y)*2-1;end;"
            + "while[(X>Z)||!(Y==3)]loop X=X-1;write X;end;end";
    Program original = reparse(source);
    String printed = PrettyPrinter.print(original);
    assertThat(reparse(printed), is(equalTo(original)));
    assertThat(PrettyPrinter.print(reparse(printed)), is(equalTo(printed)));
  }
}
