package ca.gc.cra.logdrop.domain.template;

import java.util.Objects;

/**
 * Raised when a token cannot be rendered against a particular record. Per-record and non-terminal.
 *
 * @since 0.1.0
 */
public final class TemplateResolutionException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  /** Failure category. */
  public enum Reason {
    /** A field on the path is absent, or the path steps into a non-object. */
    KEY_NOT_FOUND,
    /** The path ends on an array or object. */
    TYPE_MISMATCH,
    /** The token is a tokenizer error. */
    SYNTAX_ERROR
  }

  private final Reason reason;
  private final String key;

  /**
   * Creates a resolution failure.
   *
   * @param reason failure category
   * @param key field name at which resolution failed; may be {@code null} for syntax errors
   * @param message operator-facing message
   */
  public TemplateResolutionException(Reason reason, String key, String message) {
    super(message);
    this.reason = Objects.requireNonNull(reason, "reason");
    this.key = key;
  }

  public Reason reason() {
    return reason;
  }

  /**
   * Returns the field name at which resolution failed.
   *
   * @return failing key, or {@code null} for syntax errors
   */
  public String key() {
    return key;
  }
}
