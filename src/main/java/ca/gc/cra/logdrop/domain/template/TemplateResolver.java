package ca.gc.cra.logdrop.domain.template;

import ca.gc.cra.logdrop.domain.template.TemplateResolutionException.Reason;
import ca.gc.cra.logdrop.domain.value.JsonBoolean;
import ca.gc.cra.logdrop.domain.value.JsonNull;
import ca.gc.cra.logdrop.domain.value.JsonNumber;
import ca.gc.cra.logdrop.domain.value.JsonObject;
import ca.gc.cra.logdrop.domain.value.JsonString;
import ca.gc.cra.logdrop.domain.value.LogRecord;
import ca.gc.cra.logdrop.domain.value.Value;

/**
 * Renders single template tokens against a record.
 *
 * @since 0.1.0
 */
public final class TemplateResolver {
  private TemplateResolver() {}

  /**
   * Resolves a token to text.
   *
   * @param token token to render
   * @param record record supplying field values
   * @return rendered text
   * @throws TemplateResolutionException if a field is missing, a container is addressed, or the
   *     token is a tokenizer error
   */
  public static String resolve(TemplateToken token, LogRecord record) {
    if (token instanceof TemplateToken.Literal literal) {
      return literal.text();
    }
    if (token instanceof TemplateToken.Error error) {
      throw new TemplateResolutionException(
          Reason.SYNTAX_ERROR, null, "syntax error: " + error.error().description());
    }
    TemplateToken.Placeholder placeholder = (TemplateToken.Placeholder) token;
    Value current = record.body();
    for (String name : placeholder.path()) {
      if (!(current instanceof JsonObject)) {
        throw keyNotFound(name);
      }
      current = current.find(name).orElseThrow(() -> keyNotFound(name));
    }
    return render(current, placeholder);
  }

  private static String render(Value value, TemplateToken.Placeholder placeholder) {
    if (value instanceof JsonNull) {
      return "null";
    } else if (value instanceof JsonBoolean bool) {
      return Boolean.toString(bool.value());
    } else if (value instanceof JsonNumber number) {
      return number.toPlainString();
    } else if (value instanceof JsonString string) {
      return string.value();
    }
    throw new TemplateResolutionException(
        Reason.TYPE_MISMATCH,
        placeholder.path().get(placeholder.path().size() - 1),
        "type mismatch: " + placeholder + " resolves to a container");
  }

  private static TemplateResolutionException keyNotFound(String name) {
    return new TemplateResolutionException(Reason.KEY_NOT_FOUND, name, "key not found: " + name);
  }
}
