package coreinterpreter.parser;

import static coreinterpreter.token.Terminal.*;

import coreinterpreter.ast.*;
import coreinterpreter.token.Terminal;
import coreinterpreter.token.Token;
import coreinterpreter.util.SourcePosition;
import coreinterpreter.util.SourceRange;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Predictive recursive descent parser for Core, one method per nonterminal. The current token
 * always determines the production, there is no backtracking. The first mismatch aborts the parse
 * with a {@link ParserError}.
 */
public class Parser {
  private static final Token EOF_TOKEN = new Token(EOF, SourceRange.FIRST_CHAR, null);
  private final Iterator<Token> tokens;
  private Token currentToken;

  public Parser(Iterator<Token> tokens) {
    this.tokens = tokens;
  }

  private Token consumeToken() {
    Token eaten = currentToken;
    if (tokens.hasNext()) {
      currentToken = tokens.next();
    } else if (this.currentToken == null) {
      currentToken = EOF_TOKEN;
    } else if (!currentToken.isOneOf(EOF)) {
      // Just pretend there are infinitely many single byte EOF tokens
      currentToken = new Token(EOF, new SourceRange(currentToken.range().end, 1), null);
    }
    return eaten;
  }

  private Token expectAndConsume(Terminal terminal) {
    if (currentToken.terminal != terminal) {
      throw new ParserError(
          Thread.currentThread().getStackTrace()[2].getMethodName(), terminal, currentToken);
    }
    return consumeToken();
  }

  private <T> T unexpectCurrentToken(Terminal... expectedTerminals) {
    throw new ParserError(
        Thread.currentThread().getStackTrace()[2].getMethodName(), currentToken, expectedTerminals);
  }

  private boolean isCurrentTokenTypeOf(Terminal terminal) {
    return currentToken.terminal == terminal;
  }

  private boolean isCurrentTokenStatementStart() {
    return currentToken.isOneOf(IDENT, IF, WHILE, READ, WRITE);
  }

  private static SourceRange span(SourcePosition begin, Token last) {
    return new SourceRange(begin, last.range().end);
  }

  public Program parse() {
    consumeToken();
    return parseProgram();
  }

  /** Program -> program Declaration+ begin StatementSequence end EOF */
  private Program parseProgram() {
    SourcePosition begin = expectAndConsume(PROGRAM).range().begin;
    List<Declaration> declarations = new ArrayList<>();
    do {
      declarations.add(parseDeclaration());
    } while (isCurrentTokenTypeOf(INT));
    expectAndConsume(BEGIN);
    StatementSequence body = parseStatementSequence();
    Token end = expectAndConsume(END);
    expectAndConsume(EOF);
    return new Program(declarations, body, span(begin, end));
  }

  /** Declaration -> int IdentifierList ; */
  private Declaration parseDeclaration() {
    SourcePosition begin = expectAndConsume(INT).range().begin;
    IdentifierList identifiers = parseIdentifierList();
    Token semicolon = expectAndConsume(SEMICOLON);
    return new Declaration(identifiers, span(begin, semicolon));
  }

  /** IdentifierList -> Identifier (, Identifier)* */
  private IdentifierList parseIdentifierList() {
    List<Identifier> identifiers = new ArrayList<>();
    identifiers.add(parseIdentifier());
    while (isCurrentTokenTypeOf(COMMA)) {
      expectAndConsume(COMMA);
      identifiers.add(parseIdentifier());
    }
    SourceRange range =
        identifiers.get(0).range().extendTo(identifiers.get(identifiers.size() - 1).range());
    return new IdentifierList(identifiers, range);
  }

  /** Identifier -> IDENT */
  private Identifier parseIdentifier() {
    Token identifier = expectAndConsume(IDENT);
    return new Identifier(identifier.lexval, identifier.range());
  }

  /** StatementSequence -> Statement+ */
  private StatementSequence parseStatementSequence() {
    List<Statement> statements = new ArrayList<>();
    do {
      statements.add(parseStatement());
    } while (isCurrentTokenStatementStart());
    SourceRange range =
        statements.get(0).range().extendTo(statements.get(statements.size() - 1).range());
    return new StatementSequence(statements, range);
  }

  /** Statement -> Assignment | If | While | Read | Write */
  private Statement parseStatement() {
    switch (currentToken.terminal) {
      case IDENT:
        return parseAssignment();
      case IF:
        return parseIf();
      case WHILE:
        return parseWhile();
      case READ:
        return parseRead();
      case WRITE:
        return parseWrite();
      default:
        return unexpectCurrentToken(IDENT, IF, WHILE, READ, WRITE);
    }
  }

  /** Assignment -> Identifier = Expression ; */
  private Statement parseAssignment() {
    Identifier target = parseIdentifier();
    expectAndConsume(ASSIGN);
    Expression value = parseExpression();
    Token semicolon = expectAndConsume(SEMICOLON);
    return new Statement.Assignment(target, value, span(target.range().begin, semicolon));
  }

  /** If -> if Condition then StatementSequence (else StatementSequence)? end ; */
  private Statement parseIf() {
    SourcePosition begin = expectAndConsume(IF).range().begin;
    Condition condition = parseCondition();
    expectAndConsume(THEN);
    StatementSequence then = parseStatementSequence();
    StatementSequence else_ = null;
    if (isCurrentTokenTypeOf(ELSE)) {
      expectAndConsume(ELSE);
      else_ = parseStatementSequence();
    }
    expectAndConsume(END);
    Token semicolon = expectAndConsume(SEMICOLON);
    return new Statement.If(condition, then, else_, span(begin, semicolon));
  }

  /** While -> while Condition loop StatementSequence end ; */
  private Statement parseWhile() {
    SourcePosition begin = expectAndConsume(WHILE).range().begin;
    Condition condition = parseCondition();
    expectAndConsume(LOOP);
    StatementSequence body = parseStatementSequence();
    expectAndConsume(END);
    Token semicolon = expectAndConsume(SEMICOLON);
    return new Statement.While(condition, body, span(begin, semicolon));
  }

  /** Read -> read IdentifierList ; */
  private Statement parseRead() {
    SourcePosition begin = expectAndConsume(READ).range().begin;
    IdentifierList targets = parseIdentifierList();
    Token semicolon = expectAndConsume(SEMICOLON);
    return new Statement.Read(targets, span(begin, semicolon));
  }

  /** Write -> write IdentifierList ; */
  private Statement parseWrite() {
    SourcePosition begin = expectAndConsume(WRITE).range().begin;
    IdentifierList sources = parseIdentifierList();
    Token semicolon = expectAndConsume(SEMICOLON);
    return new Statement.Write(sources, span(begin, semicolon));
  }

  /** Condition -> Comparison | ! Condition | [ Condition (&& | ||) Condition ] */
  private Condition parseCondition() {
    switch (currentToken.terminal) {
      case LPAREN:
        return parseComparison();
      case NOT:
        {
          SourcePosition begin = expectAndConsume(NOT).range().begin;
          Condition condition = parseCondition();
          return new Condition.Negation(condition, new SourceRange(begin, condition.range().end));
        }
      case LBRACK:
        return parseJunction();
      default:
        return unexpectCurrentToken(LPAREN, NOT, LBRACK);
    }
  }

  /** Junction -> [ Condition && Condition ] | [ Condition || Condition ] */
  private Condition parseJunction() {
    SourcePosition begin = expectAndConsume(LBRACK).range().begin;
    Condition left = parseCondition();
    switch (currentToken.terminal) {
      case AND:
        {
          expectAndConsume(AND);
          Condition right = parseCondition();
          Token close = expectAndConsume(RBRACK);
          return new Condition.Conjunction(left, right, span(begin, close));
        }
      case OR:
        {
          expectAndConsume(OR);
          Condition right = parseCondition();
          Token close = expectAndConsume(RBRACK);
          return new Condition.Disjunction(left, right, span(begin, close));
        }
      default:
        return unexpectCurrentToken(AND, OR);
    }
  }

  /** Comparison -> ( Operand CompOp Operand ) */
  private Condition parseComparison() {
    SourcePosition begin = expectAndConsume(LPAREN).range().begin;
    Expression left = parseOperand();
    Condition.CompOp op = parseComparisonOperator();
    Expression right = parseOperand();
    Token close = expectAndConsume(RPAREN);
    return new Condition.Comparison(left, op, right, span(begin, close));
  }

  /** CompOp -> != | == | < | > | <= | >= */
  private Condition.CompOp parseComparisonOperator() {
    Condition.CompOp op;
    switch (currentToken.terminal) {
      case NEQ:
        op = Condition.CompOp.NEQ;
        break;
      case EQL:
        op = Condition.CompOp.EQ;
        break;
      case LSS:
        op = Condition.CompOp.LT;
        break;
      case GTR:
        op = Condition.CompOp.GT;
        break;
      case LEQ:
        op = Condition.CompOp.LEQ;
        break;
      case GEQ:
        op = Condition.CompOp.GEQ;
        break;
      default:
        return unexpectCurrentToken(NEQ, EQL, LSS, GTR, LEQ, GEQ);
    }
    consumeToken();
    return op;
  }

  /** Expression -> Product ((+ | -) Product)* */
  private Expression parseExpression() {
    Expression result = parseProduct();
    while (currentToken.isOneOf(ADD, SUB)) {
      Expression.BinOp op =
          isCurrentTokenTypeOf(ADD) ? Expression.BinOp.PLUS : Expression.BinOp.MINUS;
      consumeToken();
      Expression rhs = parseProduct();
      result =
          new Expression.BinaryOperator(op, result, rhs, result.range().extendTo(rhs.range()));
    }
    return result;
  }

  /** Product -> Operand (* Operand)* */
  private Expression parseProduct() {
    Expression result = parseOperand();
    while (isCurrentTokenTypeOf(MUL)) {
      consumeToken();
      Expression rhs = parseOperand();
      result =
          new Expression.BinaryOperator(
              Expression.BinOp.TIMES, result, rhs, result.range().extendTo(rhs.range()));
    }
    return result;
  }

  /** Operand -> INTEGER_LITERAL | IDENT | ( Expression ) */
  private Expression parseOperand() {
    switch (currentToken.terminal) {
      case INTEGER_LITERAL:
        {
          Token literal = expectAndConsume(INTEGER_LITERAL);
          return new Expression.IntegerLiteral(literal.lexval, literal.range());
        }
      case IDENT:
        {
          Token identifier = expectAndConsume(IDENT);
          return new Expression.Variable(identifier.lexval, identifier.range());
        }
      case LPAREN:
        {
          SourcePosition begin = expectAndConsume(LPAREN).range().begin;
          Expression expression = parseExpression();
          Token close = expectAndConsume(RPAREN);
          return new Expression.Parenthesized(expression, span(begin, close));
        }
      default:
        return unexpectCurrentToken(INTEGER_LITERAL, IDENT, LPAREN);
    }
  }
}
