package coreinterpreter.interpreter;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;

import java.io.StringReader;
import org.junit.Assert;
import org.junit.Test;

public class ReaderInputCursorTest {

  private static ReaderInputCursor cursor(String data) {
    return new ReaderInputCursor(new StringReader(data), "data.txt");
  }

  private static RuntimeError nextExpectingError(ReaderInputCursor cursor) {
    try {
      cursor.next();
    } catch (RuntimeError e) {
      return e;
    }
    Assert.fail("Expected a runtime error");
    return null;
  }

  @Test
  public void oneIntegerPerLine_readInOrder() {
    ReaderInputCursor cursor = cursor("5\n-3\n+7\n");
    assertThat(cursor.next(), is(5));
    assertThat(cursor.next(), is(-3));
    assertThat(cursor.next(), is(7));
    assertThat(cursor.hasNext(), is(false));
  }

  @Test
  public void surroundingWhitespace_isIgnored() {
    ReaderInputCursor cursor = cursor("  12\t\r\n\t0042  ");
    assertThat(cursor.next(), is(12));
    assertThat(cursor.next(), is(42));
    assertThat(cursor.hasNext(), is(false));
  }

  @Test
  public void hasNext_doesNotConsume() {
    ReaderInputCursor cursor = cursor("1\n2");
    assertThat(cursor.hasNext(), is(true));
    assertThat(cursor.hasNext(), is(true));
    assertThat(cursor.next(), is(1));
    assertThat(cursor.next(), is(2));
  }

  @Test
  public void emptySource_hasNoNext() {
    assertThat(cursor("").hasNext(), is(false));
  }

  @Test
  public void nextAfterEnd_isRuntimeError() {
    RuntimeError e = nextExpectingError(cursor(""));
    assertThat(e.getMessage(), allOf(containsString("data.txt"), containsString("End of data")));
  }

  @Test
  public void emptyLine_isRuntimeErrorWithLineNumber() {
    ReaderInputCursor cursor = cursor("1\n\n3\n");
    assertThat(cursor.next(), is(1));
    RuntimeError e = nextExpectingError(cursor);
    assertThat(e.getMessage(), allOf(containsString("empty line"), containsString("line 2")));
    assertThat(e.range, is(nullValue()));
  }

  @Test
  public void nonIntegerLine_isRuntimeError() {
    RuntimeError e = nextExpectingError(cursor("12abc\n"));
    assertThat(e.getMessage(), allOf(containsString("'12abc'"), containsString("line 1")));
  }

  @Test
  public void integerOutOfRange_isRuntimeError() {
    RuntimeError e = nextExpectingError(cursor("2147483648\n"));
    assertThat(e.getMessage(), containsString("2147483648"));
  }

  @Test
  public void dataIsReadLazily_laterGarbageDoesNotMatterUntilConsumed() {
    ReaderInputCursor cursor = cursor("8\nnot a number\n");
    assertThat(cursor.next(), is(8));
  }
}
