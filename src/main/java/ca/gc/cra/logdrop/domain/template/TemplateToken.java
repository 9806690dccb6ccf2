package ca.gc.cra.logdrop.domain.template;

import java.util.List;
import java.util.Objects;

/**
 * Unit of a tokenized format string.
 *
 * @since 0.1.0
 */
public sealed interface TemplateToken {

  /**
   * Verbatim text between placeholders.
   *
   * @param text literal run
   */
  record Literal(String text) implements TemplateToken {
    public Literal {
      Objects.requireNonNull(text, "text");
    }
  }

  /**
   * Field reference such as {@code {id/source}}.
   *
   * @param path field names walked from the record root, in order
   */
  record Placeholder(List<String> path) implements TemplateToken {
    public Placeholder {
      path = List.copyOf(Objects.requireNonNull(path, "path"));
      if (path.isEmpty()) {
        throw new IllegalArgumentException("placeholder path must not be empty");
      }
    }

    @Override
    public String toString() {
      return "{" + String.join("/", path) + "}";
    }
  }

  /**
   * Terminal tokenizer failure.
   *
   * @param error violated expectation
   */
  record Error(TemplateSyntaxError error) implements TemplateToken {
    public Error {
      Objects.requireNonNull(error, "error");
    }
  }
}
