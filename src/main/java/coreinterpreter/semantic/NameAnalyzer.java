package coreinterpreter.semantic;

import coreinterpreter.ast.*;
import java.util.Optional;

/**
 * Performs name analysis for a Program.
 *
 * <p>All declarations are collected first, rejecting a name that is declared twice. Then the body
 * is traversed and every identifier it mentions, be it an assignment target, an element of a
 * {@code read} or {@code write} list or a variable in an expression, is resolved against the
 * collected declarations.
 */
public class NameAnalyzer
    implements Program.Visitor<Void>,
        Statement.Visitor<Void>,
        Expression.Visitor<Void>,
        Condition.Visitor<Void> {

  private SymbolTable variables = new SymbolTable();

  public static void analyze(Program program) {
    program.acceptVisitor(new NameAnalyzer());
  }

  @Override
  public Void visitProgram(Program that) {
    variables = new SymbolTable();
    for (Declaration declaration : that.declarations) {
      for (Identifier id : declaration.identifiers.identifiers) {
        Optional<Identifier> previous = variables.lookup(id.name);
        if (previous.isPresent()) {
          throw new SemanticError(
              id.range(),
              previous.get().range(),
              "Variable '" + id.name + "' is already declared");
        }
        variables.insert(id.name, id);
      }
    }
    visitStatements(that.body);
    return null;
  }

  private void visitStatements(StatementSequence statements) {
    for (Statement statement : statements.statements) {
      statement.acceptVisitor(this);
    }
  }

  private void resolve(Identifier identifier) {
    if (!variables.lookup(identifier.name).isPresent()) {
      throw new SemanticError(
          identifier.range(), "Variable '" + identifier.name + "' is not declared");
    }
  }

  private void resolve(IdentifierList identifiers) {
    for (Identifier id : identifiers.identifiers) {
      resolve(id);
    }
  }

  @Override
  public Void visitAssignment(Statement.Assignment that) {
    resolve(that.target);
    that.value.acceptVisitor(this);
    return null;
  }

  @Override
  public Void visitIf(Statement.If that) {
    that.condition.acceptVisitor(this);
    visitStatements(that.then);
    that.else_.ifPresent(this::visitStatements);
    return null;
  }

  @Override
  public Void visitWhile(Statement.While that) {
    that.condition.acceptVisitor(this);
    visitStatements(that.body);
    return null;
  }

  @Override
  public Void visitRead(Statement.Read that) {
    resolve(that.targets);
    return null;
  }

  @Override
  public Void visitWrite(Statement.Write that) {
    resolve(that.sources);
    return null;
  }

  @Override
  public Void visitBinaryOperator(Expression.BinaryOperator that) {
    that.left.acceptVisitor(this);
    that.right.acceptVisitor(this);
    return null;
  }

  @Override
  public Void visitIntegerLiteral(Expression.IntegerLiteral that) {
    return null;
  }

  @Override
  public Void visitVariable(Expression.Variable that) {
    if (!variables.lookup(that.name).isPresent()) {
      throw new SemanticError(that.range(), "Variable '" + that.name + "' is not declared");
    }
    return null;
  }

  @Override
  public Void visitParenthesized(Expression.Parenthesized that) {
    return that.expression.acceptVisitor(this);
  }

  @Override
  public Void visitComparison(Condition.Comparison that) {
    that.left.acceptVisitor(this);
    that.right.acceptVisitor(this);
    return null;
  }

  @Override
  public Void visitNegation(Condition.Negation that) {
    return that.condition.acceptVisitor(this);
  }

  @Override
  public Void visitConjunction(Condition.Conjunction that) {
    that.left.acceptVisitor(this);
    that.right.acceptVisitor(this);
    return null;
  }

  @Override
  public Void visitDisjunction(Condition.Disjunction that) {
    that.left.acceptVisitor(this);
    that.right.acceptVisitor(this);
    return null;
  }
}
