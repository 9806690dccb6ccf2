package ca.gc.cra.logdrop.domain.template;

import java.util.Objects;

/**
 * Raised when a format string cannot be tokenized. Surfaces at configuration time.
 *
 * @since 0.1.0
 */
public final class TemplateSyntaxException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  private final TemplateSyntaxError error;

  /**
   * Creates an exception for the supplied template.
   *
   * @param source offending format string
   * @param error tokenizer failure
   */
  public TemplateSyntaxException(String source, TemplateSyntaxError error) {
    super("Invalid template '" + source + "': " + Objects.requireNonNull(error, "error").description());
    this.error = error;
  }

  public TemplateSyntaxError error() {
    return error;
  }
}
