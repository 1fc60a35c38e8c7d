package coreinterpreter;

import static org.jooq.lambda.Seq.seq;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import com.google.common.base.Joiner;
import com.google.common.io.ByteStreams;
import com.google.common.primitives.Booleans;
import coreinterpreter.ast.Program;
import coreinterpreter.interpreter.OutputFormat;
import coreinterpreter.interpreter.OutputSink;
import coreinterpreter.interpreter.ReaderInputCursor;
import coreinterpreter.lexer.Lexer;
import coreinterpreter.token.Token;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.AccessDeniedException;
import java.nio.file.FileSystem;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.event.Level;
import org.slf4j.impl.SimpleLogger;

public class Cli {

  static final String usage =
      Joiner.on(System.lineSeparator())
          .join(
              new String[] {
                "Usage: core [--echo|--lextest|--parsetest|--print-ast|--check] [--print]",
                "            [--named-output] [--verbosity] [--help] program [data]",
                "",
                "  --echo          write program's content to stdout",
                "  --lextest       run lexical analysis on program's content and print tokens",
                "  --parsetest     run syntactical analysis on program's content",
                "  --print-ast     check program and pretty-print it to stdout",
                "  --check         parse program and check that every variable is declared once",
                "  --print         pretty-print program before running it",
                "  --named-output  write values as 'NAME = value' instead of just the value",
                "  --verbosity|-v  Crank this up for more debug output",
                "  --help          display this help and exit",
                "",
                "  If no mode flag is given, program is run with its read statements consuming",
                "  the integers in data, one per line."
              });

  private final PrintStream out;
  private final PrintStream err;
  private final FileSystem fileSystem;

  Cli(OutputStream out, OutputStream err, FileSystem fileSystem) {
    this.out = new PrintStream(out);
    this.err = new PrintStream(err);
    this.fileSystem = fileSystem;
  }

  int run(String... args) {
    Parameters params = Parameters.parse(args);
    setLogLevel(params.verbosity);
    if (!params.valid()) {
      err.println("Called as: " + String.join(" ", args));
      err.println(usage);
      return 1;
    }
    if (params.help) {
      out.println(usage);
      return 0;
    }
    Path path = fileSystem.getPath(params.program);
    try (InputStream in = Files.newInputStream(path)) {
      if (params.echo) {
        echo(in);
      } else if (params.lextest) {
        lextest(in);
      } else if (params.parsetest) {
        parsetest(in);
      } else if (params.printAst) {
        printAst(in);
      } else if (params.check) {
        check(in);
      } else {
        interpret(in, fileSystem.getPath(params.data), params.print, params.outputFormat());
      }
    } catch (AccessDeniedException e) {
      err.println("error: access to file '" + e.getFile() + "' was denied");
      return 1;
    } catch (CoreError e) {
      try {
        err.println("error: " + e.getSourceReferencingMessage(Files.readAllLines(path)));
      } catch (IOException io) {
        err.println("error: " + e.getMessage());
      }
      return 1;
    } catch (NoSuchFileException e) {
      err.println("error: file '" + e.getFile() + "' doesn't exist");
      return 1;
    } catch (Throwable t) {
      // print full stacktrace for any other error
      // if a better description becomes necessary,
      // add a another more specific catch block
      t.printStackTrace(err);
      return 1;
    } finally {
      out.flush();
    }
    return 0;
  }

  private void setLogLevel(int verbosity) {
    verbosity = Math.max(0, verbosity);
    verbosity = Math.min(Level.values().length - 1, verbosity);
    // HACK ALERT
    String level = Level.values()[verbosity].toString();
    System.setProperty(SimpleLogger.DEFAULT_LOG_LEVEL_KEY, level);
  }

  private void echo(InputStream in) throws IOException {
    ByteStreams.copy(in, out);
  }

  private void lextest(InputStream in) {
    Lexer lexer = Core.lex(in);
    seq(lexer).map(Token::toString).forEach(out::println);
  }

  private void parsetest(InputStream in) {
    Core.lexAndParse(in);
  }

  private void printAst(InputStream in) {
    Program ast = Core.load(in);
    out.print(Core.prettyPrint(ast));
  }

  private void check(InputStream in) {
    Core.load(in);
  }

  private void interpret(InputStream in, Path dataPath, boolean print, OutputFormat format)
      throws IOException {
    Program ast = Core.load(in);
    if (print) {
      out.print(Core.prettyPrint(ast));
    }
    try (BufferedReader data = Files.newBufferedReader(dataPath, StandardCharsets.UTF_8);
        ReaderInputCursor input = new ReaderInputCursor(data, dataPath.toString())) {
      Core.execute(ast, input, OutputSink.printingTo(out, format));
    }
  }

  private static class Parameters {
    private Parameters() {}

    /** True if the --echo option was set */
    @Parameter(names = "--echo")
    boolean echo;

    /** True if the --lextest option was set */
    @Parameter(names = "--lextest")
    boolean lextest;

    /** True if the --parsetest option was set */
    @Parameter(names = "--parsetest")
    boolean parsetest;

    /** True if the --print-ast option was set */
    @Parameter(names = "--print-ast")
    boolean printAst;

    /** True if the --check option was set */
    @Parameter(names = "--check")
    boolean check;

    /** True if the --print option was set */
    @Parameter(names = "--print")
    boolean print;

    /** True if the --named-output option was set */
    @Parameter(names = "--named-output")
    boolean namedOutput;

    /** 0 logs errors only, 4 traces every executed statement */
    @Parameter(names = {"--verbosity", "-v"})
    Integer verbosity = 1;

    /** True if the --help option was set */
    @Parameter(names = "--help")
    boolean help;

    @SuppressWarnings("MismatchedQueryAndUpdateOfCollection")
    @Parameter
    private List<String> mainParameters = new ArrayList<>();

    /** The path of the Core program, possibly relative to the current working directory */
    String program;

    /** The path of the input data, only needed when the program is run */
    String data;

    // set to true, if parsing arguments failed
    private boolean invalid;

    private boolean isRun() {
      return Booleans.countTrue(echo, lextest, parsetest, printAst, check) == 0;
    }

    OutputFormat outputFormat() {
      return namedOutput ? OutputFormat.NAMED : OutputFormat.VALUES;
    }

    /** Returns true if the parameter values represent a valid set */
    boolean valid() {
      return !invalid
          && (help
              || ((Booleans.countTrue(echo, lextest, parsetest, printAst, check) <= 1)
                  && (program != null)
                  && (isRun() ? data != null : mainParameters.size() == 1)
                  && (isRun() || !(print || namedOutput))));
    }

    static Parameters parse(String... args) {
      Parameters params = new Parameters();
      try {
        new JCommander(params, args);
        if (params.mainParameters.size() > 2) {
          params.invalid = true;
        }
        if (!params.mainParameters.isEmpty()) {
          params.program = params.mainParameters.get(0);
        }
        if (params.mainParameters.size() == 2) {
          params.data = params.mainParameters.get(1);
        }
      } catch (ParameterException e) {
        params.invalid = true;
      }
      return params;
    }
  }
}
