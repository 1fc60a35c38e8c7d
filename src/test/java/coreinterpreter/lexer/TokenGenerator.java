package coreinterpreter.lexer;

import com.pholser.junit.quickcheck.generator.GenerationStatus;
import com.pholser.junit.quickcheck.generator.Generator;
import com.pholser.junit.quickcheck.random.SourceOfRandomness;
import coreinterpreter.token.Terminal;
import coreinterpreter.token.Token;
import coreinterpreter.util.SourceRange;
import java.util.stream.IntStream;
import org.jooq.lambda.Seq;

/**
 * Generates a random @Token@, with random content. Also makes sure that the content is actually
 * lexed as the corresponding @Terminal@.
 */
public class TokenGenerator extends Generator<Token> {

  public TokenGenerator() {
    super(Token.class);
  }

  @Override
  public Token generate(SourceOfRandomness random, GenerationStatus status) {
    Terminal terminal = random.choose(Terminal.values());
    if (terminal.hasLexval()) {
      String lexval = generateStringForTerminal(terminal, random);
      return new Token(terminal, SourceRange.FIRST_CHAR, lexval);
    }
    return new Token(terminal, SourceRange.FIRST_CHAR, null);
  }

  public static String generateStringForTerminal(Terminal t, SourceOfRandomness random) {
    switch (t) {
      case IDENT:
        return generateIdentifier(random);
      case INTEGER_LITERAL:
        return Integer.toString(random.nextInt(0, Integer.MAX_VALUE));
      default:
        return t.string;
    }
  }

  public static String generateIdentifier(SourceOfRandomness random) {
    StringBuilder id = new StringBuilder();
    Seq.of(random.choose(IDENT_FIRST_CHAR))
        .concat(
            Seq.generate(() -> random.choose(IDENT_FOLLOWING_CHARS)).limit(random.nextInt(0, 8)))
        .forEach(id::append);
    return id.toString();
  }

  private static final Character[] IDENT_FIRST_CHAR =
      IntStream.rangeClosed('A', 'Z').mapToObj(c -> (char) c).toArray(Character[]::new);

  private static final Character[] IDENT_FOLLOWING_CHARS =
      IntStream.concat(IntStream.rangeClosed('A', 'Z'), IntStream.rangeClosed('0', '9'))
          .mapToObj(c -> (char) c)
          .toArray(Character[]::new);
}
