package ca.gc.cra.logdrop.domain.json;

/**
 * Syntax violations reported by {@link JsonStreamParser}.
 *
 * @since 0.1.0
 */
public enum JsonSyntaxError {
  EXPECTED_VALUE("invalid value - expected null, true, false, number, string, '[' or '{'"),
  EXPECTED_VALUE_OR_ARRAY_END("invalid array - expected value or ']'"),
  EXPECTED_COMMA_OR_ARRAY_END("invalid array - expected ',' or ']' after element"),
  EXPECTED_KEY_OR_OBJECT_END("invalid object - expected string key or '}'"),
  EXPECTED_COMMA_OR_OBJECT_END("invalid object - expected ',' or '}' after value"),
  EXPECTED_COLON("invalid object - expected ':' after object key"),
  EOF_WHILE_PARSING_STRING("unexpected end while parsing string"),
  EOF_WHILE_PARSING_ARRAY("unexpected end while parsing array"),
  EOF_WHILE_PARSING_OBJECT("unexpected end while parsing object"),
  EOF_WHILE_PARSING_OBJECT_KEY("unexpected end while parsing object key"),
  EOF_WHILE_PARSING_OBJECT_COLON("unexpected end while parsing object colon"),
  EOF_WHILE_PARSING_OBJECT_VALUE("unexpected end while parsing object value"),
  INVALID_ESCAPE("invalid escaped characters while parsing string"),
  LONE_LEADING_SURROGATE_IN_HEX_ESCAPE("lone surrogate in hex escape"),
  UNEXPECTED_END_OF_HEX_ESCAPE("unexpected end of hex escape"),
  INVALID_NUMBER("invalid number - expected digit"),
  LEADING_ZERO("invalid number - leading zero must not be followed by another digit");

  private final String description;

  JsonSyntaxError(String description) {
    this.description = description;
  }

  /**
   * Returns the operator-facing description of this error.
   *
   * @return description text
   */
  public String description() {
    return description;
  }
}
