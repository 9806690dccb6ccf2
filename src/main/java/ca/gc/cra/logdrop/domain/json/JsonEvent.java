package ca.gc.cra.logdrop.domain.json;

import java.util.Objects;

/**
 * Flat event emitted by {@link JsonStreamParser}, one per pull.
 *
 * @since 0.1.0
 */
public sealed interface JsonEvent {
  JsonEvent NULL = new NullValue();
  JsonEvent TRUE = new BooleanValue(true);
  JsonEvent FALSE = new BooleanValue(false);
  JsonEvent ARRAY_BEGIN = new ArrayBegin();
  JsonEvent ARRAY_END = new ArrayEnd();
  JsonEvent OBJECT_BEGIN = new ObjectBegin();
  JsonEvent OBJECT_END = new ObjectEnd();

  /** {@code null} literal. */
  record NullValue() implements JsonEvent {}

  /**
   * Boolean literal.
   *
   * @param value literal value
   */
  record BooleanValue(boolean value) implements JsonEvent {}

  /**
   * Number.
   *
   * @param value parsed value
   */
  record NumberValue(double value) implements JsonEvent {}

  /**
   * String value or object key.
   *
   * @param value unescaped contents
   */
  record StringValue(String value) implements JsonEvent {
    public StringValue {
      Objects.requireNonNull(value, "value");
    }
  }

  /** Opening {@code [}. */
  record ArrayBegin() implements JsonEvent {}

  /** Closing {@code ]}. */
  record ArrayEnd() implements JsonEvent {}

  /** Opening <code>{</code>. */
  record ObjectBegin() implements JsonEvent {}

  /** Closing <code>}</code>. */
  record ObjectEnd() implements JsonEvent {}

  /**
   * Parse failure. Once emitted the parser only ever emits {@link ParserError#BROKEN}.
   *
   * @param error failure detail
   */
  record Error(ParserError error) implements JsonEvent {
    public Error {
      Objects.requireNonNull(error, "error");
    }

    /**
     * Shorthand for a syntax error event.
     *
     * @param code violated expectation
     * @return error event
     */
    public static Error syntax(JsonSyntaxError code) {
      return new Error(new ParserError.SyntaxError(code));
    }
  }
}
