package ca.gc.cra.logdrop.domain.template;

import ca.gc.cra.logdrop.domain.value.LogRecord;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Pre-tokenized format string such as {@code /var/log/{app}/{host}.log}.
 * <p><strong>Why:</strong> Outputs render a path or line for every record; tokenizing once keeps the hot path to
 * field lookups and concatenation.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe to share.</p>
 *
 * @since 0.1.0
 */
public final class Template {
  private final String source;
  private final List<TemplateToken> tokens;

  private Template(String source, List<TemplateToken> tokens) {
    this.source = source;
    this.tokens = List.copyOf(tokens);
  }

  /**
   * Tokenizes the supplied format string.
   *
   * @param source format string; must not be {@code null}
   * @return compiled template
   * @throws TemplateSyntaxException if the string contains an unterminated placeholder
   */
  public static Template compile(String source) {
    Objects.requireNonNull(source, "source");
    TemplateParser parser = new TemplateParser(source);
    List<TemplateToken> tokens = new ArrayList<>();
    Optional<TemplateToken> token;
    while ((token = parser.next()).isPresent()) {
      if (token.get() instanceof TemplateToken.Error error) {
        throw new TemplateSyntaxException(source, error.error());
      }
      tokens.add(token.get());
    }
    return new Template(source, tokens);
  }

  /**
   * Renders every token against the record and concatenates the results.
   *
   * @param record record supplying field values
   * @return rendered text
   * @throws TemplateResolutionException if any token fails to resolve
   */
  public String render(LogRecord record) {
    Objects.requireNonNull(record, "record");
    StringBuilder out = new StringBuilder();
    for (TemplateToken token : tokens) {
      out.append(TemplateResolver.resolve(token, record));
    }
    return out.toString();
  }

  public List<TemplateToken> tokens() {
    return tokens;
  }

  public String source() {
    return source;
  }

  @Override
  public String toString() {
    return source;
  }
}
