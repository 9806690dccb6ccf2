package ca.gc.cra.logdrop.domain.json;

import java.util.Objects;

/**
 * Raised by {@link ValueBuilder} when the underlying parser reports an error.
 *
 * @since 0.1.0
 */
public final class JsonParseException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final transient ParserError error;

  /**
   * Creates an exception for the supplied parser error.
   *
   * @param error parser failure; must not be {@code null}
   */
  public JsonParseException(ParserError error) {
    super(Objects.requireNonNull(error, "error").describe(),
        error instanceof ParserError.Io io ? io.cause() : null);
    this.error = error;
  }

  /**
   * Returns the parser failure.
   *
   * @return parser error
   */
  public ParserError error() {
    return error;
  }
}
