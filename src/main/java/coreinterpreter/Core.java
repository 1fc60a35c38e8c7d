package coreinterpreter;

import coreinterpreter.ast.Program;
import coreinterpreter.interpreter.InputCursor;
import coreinterpreter.interpreter.Interpreter;
import coreinterpreter.interpreter.OutputSink;
import coreinterpreter.interpreter.Store;
import coreinterpreter.lexer.Lexer;
import coreinterpreter.parser.Parser;
import coreinterpreter.semantic.NameAnalyzer;
import coreinterpreter.token.Token;
import coreinterpreter.util.PrettyPrinter;
import java.io.InputStream;
import java.util.Iterator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** The stages of the Core pipeline. Each stage fails fast with a subclass of {@link CoreError}. */
public class Core {
  private static final Logger LOGGER = LoggerFactory.getLogger("Core");

  public static Lexer lex(InputStream in) {
    return new Lexer(in);
  }

  public static Program parse(Iterator<Token> tokens) {
    Program program = new Parser(tokens).parse();
    LOGGER.debug(
        "Parsed {} declarations and {} top-level statements",
        program.declarations.size(),
        program.body.statements.size());
    return program;
  }

  public static Program lexAndParse(InputStream in) {
    return parse(lex(in));
  }

  /** Rejects duplicate declarations and references to undeclared variables. */
  public static void checkSemantics(Program ast) {
    NameAnalyzer.analyze(ast);
    LOGGER.debug("Name analysis passed");
  }

  /** Lexes, parses and checks a program, so that it is ready for {@link #execute}. */
  public static Program load(InputStream in) {
    Program ast = lexAndParse(in);
    checkSemantics(ast);
    return ast;
  }

  public static String prettyPrint(Program ast) {
    return PrettyPrinter.print(ast);
  }

  public static Store execute(Program ast, InputCursor input, OutputSink output) {
    return Interpreter.execute(ast, input, output);
  }
}
