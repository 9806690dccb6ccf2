package ca.gc.cra.logdrop.domain.json;

/**
 * Position of {@link JsonStreamParser} within the grammar between two pulls.
 */
enum ParserState {
  /** At start, or after a complete top-level document. */
  UNDEFINED,
  /** After any error; every later pull fails. */
  BROKEN,
  /** Just after {@code [}. */
  PARSE_ARRAY,
  /** Just after an array element. */
  PARSE_ARRAY_MAYBE,
  /** Just after <code>{</code>. */
  PARSE_OBJECT,
  /** Just after an object key. */
  PARSE_OBJECT_PAIR,
  /** Just after an object value. */
  PARSE_OBJECT_MAYBE
}
