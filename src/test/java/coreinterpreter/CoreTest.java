package coreinterpreter;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;

import coreinterpreter.ast.Program;
import coreinterpreter.interpreter.InputCursor;
import coreinterpreter.interpreter.OutputFormat;
import coreinterpreter.interpreter.OutputSink;
import coreinterpreter.interpreter.Store;
import coreinterpreter.semantic.SemanticError;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import org.junit.Assert;
import org.junit.Test;

public class CoreTest {

  private static InputStream source(String text) {
    return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
  }

  @Test
  public void loadAndExecute_printingSinkWritesOneLinePerValue() throws Exception {
    Program ast = Core.load(source("program int X, Y; begin read X, Y; write Y, X; end"));
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    PrintStream out = new PrintStream(bytes, true, "UTF-8");
    Store store =
        Core.execute(ast, InputCursor.of(3, 4), OutputSink.printingTo(out, OutputFormat.VALUES));
    assertThat(bytes.toString("UTF-8"), is(String.format("4%n3%n")));
    assertThat(store.get("X"), is(3));
  }

  @Test(expected = SemanticError.class)
  public void load_runsNameAnalysis() {
    Core.load(source("program int X; begin write Y; end"));
  }

  @Test
  public void executeParsedButUncheckedProgram_failsBeforeWriting() {
    Program ast = Core.lexAndParse(source("program int X; begin write X; Y = 1; end"));
    List<String> written = new ArrayList<>();
    try {
      Core.execute(ast, InputCursor.of(), (name, value) -> written.add(name));
      Assert.fail("Expected a semantic error");
    } catch (SemanticError e) {
      assertThat(e.getMessage(), containsString("'Y'"));
    }
    assertThat(written, is(empty()));
  }

  @Test
  public void lexAndParse_doesNotRunNameAnalysis() {
    Program ast = Core.lexAndParse(source("program int X; begin write Y; end"));
    assertThat(ast.declarations, hasSize(1));
  }

  @Test
  public void prettyPrint_roundTrips() {
    Program ast = Core.load(source("program int X;begin X=1+2*3;end"));
    String printed = Core.prettyPrint(ast);
    assertThat(Core.load(source(printed)), is(equalTo(ast)));
  }
}
