package ca.gc.cra.logdrop.domain.template;

import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * Two-state tokenizer for format strings: literal text and {@code {a/b}} placeholders.
 *
 * <p>After end of input inside a placeholder the parser is broken and yields the same
 * {@link TemplateToken.Error} on every pull. Not thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class TemplateParser {
  private enum State { UNDEFINED, PARSE_PLACEHOLDER, BROKEN }

  private final String source;
  private int position;
  private State state = State.UNDEFINED;
  private TemplateToken.Error failure;

  /**
   * Creates a tokenizer over the supplied format string.
   *
   * @param source format string; must not be {@code null}
   */
  public TemplateParser(String source) {
    this.source = Objects.requireNonNull(source, "source");
  }

  /**
   * Pulls the next token.
   *
   * @return next token, or empty when the input is exhausted
   */
  public Optional<TemplateToken> next() {
    return switch (state) {
      case BROKEN -> Optional.of(failure);
      case PARSE_PLACEHOLDER -> Optional.of(parsePlaceholder());
      case UNDEFINED -> parseLiteral();
    };
  }

  private Optional<TemplateToken> parseLiteral() {
    if (position >= source.length()) {
      return Optional.empty();
    }
    int open = source.indexOf('{', position);
    if (open == position) {
      position++;
      state = State.PARSE_PLACEHOLDER;
      return Optional.of(parsePlaceholder());
    }
    int end = open < 0 ? source.length() : open;
    String text = source.substring(position, end);
    position = end;
    if (open >= 0) {
      position++;
      state = State.PARSE_PLACEHOLDER;
    }
    return Optional.of(new TemplateToken.Literal(text));
  }

  private TemplateToken parsePlaceholder() {
    int close = source.indexOf('}', position);
    if (close < 0) {
      position = source.length();
      state = State.BROKEN;
      failure = new TemplateToken.Error(TemplateSyntaxError.EOF_WHILE_PARSING_PLACEHOLDER);
      return failure;
    }
    String body = source.substring(position, close);
    position = close + 1;
    state = State.UNDEFINED;
    return new TemplateToken.Placeholder(Arrays.asList(body.split("/", -1)));
  }
}
