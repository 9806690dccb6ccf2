package ca.gc.cra.logdrop.domain.json;

import java.io.IOException;
import java.util.Objects;

/**
 * Failure carried by a {@link JsonEvent.Error} event.
 *
 * @since 0.1.0
 */
public sealed interface ParserError {

  /** Shared terminal error reported on every pull after the parser broke. */
  ParserError BROKEN = new BrokenParser();

  /**
   * Returns a human-readable description.
   *
   * @return description text
   */
  String describe();

  /**
   * Syntax violation in the character stream.
   *
   * @param code violated expectation
   */
  record SyntaxError(JsonSyntaxError code) implements ParserError {
    public SyntaxError {
      Objects.requireNonNull(code, "code");
    }

    @Override
    public String describe() {
      return code.description();
    }
  }

  /** Parser was already broken by an earlier error. */
  record BrokenParser() implements ParserError {
    @Override
    public String describe() {
      return "parser is broken by an earlier error";
    }
  }

  /**
   * Underlying reader failed.
   *
   * @param cause reader failure
   */
  record Io(IOException cause) implements ParserError {
    @Override
    public String describe() {
      return "read failure: " + cause.getMessage();
    }
  }
}
