package ca.gc.cra.logdrop.domain.json;

import java.io.IOException;
import java.io.Reader;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Pull-based, resumable JSON tokenizer over a character stream.
 * <p><strong>Why:</strong> Log shippers concatenate documents without framing; the parser must emit events for
 * {@code {}{}null42} one value at a time and never read past the character that completes a value.</p>
 * <p><strong>Role:</strong> Domain parser feeding {@link ValueBuilder}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Emit one {@link JsonEvent} per {@link #next()} call; return empty at end of input between documents.</li>
 *   <li>Keep container nesting on an explicit stack so arbitrarily deep input never recurses.</li>
 *   <li>Turn into a broken parser after the first error; every later pull reports
 *       {@link ParserError#BROKEN}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; confine each instance to one reader thread.</p>
 * <p><strong>Performance:</strong> Reads one character at a time; wrap sockets in a buffered reader.</p>
 *
 * @since 0.1.0
 */
public final class JsonStreamParser {
  private static final int EOF = -1;
  private static final int UNREAD = -2;

  private final Reader reader;
  private final Deque<ParserState> stack = new ArrayDeque<>();
  private ParserState state = ParserState.UNDEFINED;
  private int lookahead = UNREAD;

  /**
   * Creates a parser over the supplied reader. The parser never closes the reader.
   *
   * @param reader character source; must not be {@code null}
   */
  public JsonStreamParser(Reader reader) {
    this.reader = Objects.requireNonNull(reader, "reader");
  }

  /**
   * Pulls the next event.
   *
   * @return next event, or empty when input ended cleanly between top-level values
   */
  public Optional<JsonEvent> next() {
    if (state == ParserState.BROKEN) {
      return Optional.of(new JsonEvent.Error(ParserError.BROKEN));
    }
    try {
      return pull();
    } catch (SyntaxFailure failure) {
      state = ParserState.BROKEN;
      return Optional.of(JsonEvent.Error.syntax(failure.code));
    } catch (IOException ex) {
      state = ParserState.BROKEN;
      return Optional.of(new JsonEvent.Error(new ParserError.Io(ex)));
    }
  }

  /**
   * Reports whether an error has been emitted.
   *
   * @return {@code true} once the parser is broken
   */
  public boolean isBroken() {
    return state == ParserState.BROKEN;
  }

  /**
   * Returns the current container depth.
   *
   * @return number of open arrays and objects
   */
  public int depth() {
    return state == ParserState.UNDEFINED || state == ParserState.BROKEN ? 0 : stack.size();
  }

  private Optional<JsonEvent> pull() throws IOException, SyntaxFailure {
    return switch (state) {
      case UNDEFINED -> {
        skipWhitespace();
        yield peek() == EOF ? Optional.empty() : Optional.of(parseValue());
      }
      case PARSE_ARRAY -> Optional.of(parseArray(true));
      case PARSE_ARRAY_MAYBE -> Optional.of(parseArray(false));
      case PARSE_OBJECT -> Optional.of(parseObject(true));
      case PARSE_OBJECT_MAYBE -> Optional.of(parseObject(false));
      case PARSE_OBJECT_PAIR -> Optional.of(parseObjectValue());
      case BROKEN -> throw new IllegalStateException("broken parser must not be pulled");
    };
  }

  private JsonEvent parseValue() throws IOException, SyntaxFailure {
    int c = peek();
    switch (c) {
      case 'n':
        return literal("null", JsonEvent.NULL);
      case 't':
        return literal("true", JsonEvent.TRUE);
      case 'f':
        return literal("false", JsonEvent.FALSE);
      case '"':
        consume();
        return parseString(false);
      case '[':
        consume();
        stack.push(state);
        state = ParserState.PARSE_ARRAY;
        return JsonEvent.ARRAY_BEGIN;
      case '{':
        consume();
        stack.push(state);
        state = ParserState.PARSE_OBJECT;
        return JsonEvent.OBJECT_BEGIN;
      default:
        if (c == '-' || isDigit(c)) {
          return parseNumber();
        }
        throw new SyntaxFailure(JsonSyntaxError.EXPECTED_VALUE);
    }
  }

  private JsonEvent parseArray(boolean first) throws IOException, SyntaxFailure {
    skipWhitespace();
    int c = peek();
    if (c == EOF) {
      throw new SyntaxFailure(JsonSyntaxError.EOF_WHILE_PARSING_ARRAY);
    }
    if (c == ']') {
      consume();
      state = stack.pop();
      return JsonEvent.ARRAY_END;
    }
    if (first) {
      if (c == ',') {
        throw new SyntaxFailure(JsonSyntaxError.EXPECTED_VALUE_OR_ARRAY_END);
      }
    } else {
      if (c != ',') {
        throw new SyntaxFailure(JsonSyntaxError.EXPECTED_COMMA_OR_ARRAY_END);
      }
      consume();
      skipWhitespace();
      c = peek();
      if (c == EOF) {
        throw new SyntaxFailure(JsonSyntaxError.EOF_WHILE_PARSING_ARRAY);
      }
      if (c == ']' || c == ',') {
        throw new SyntaxFailure(JsonSyntaxError.EXPECTED_VALUE);
      }
    }
    state = ParserState.PARSE_ARRAY_MAYBE;
    return parseValue();
  }

  private JsonEvent parseObject(boolean first) throws IOException, SyntaxFailure {
    skipWhitespace();
    int c = peek();
    if (c == EOF) {
      throw new SyntaxFailure(JsonSyntaxError.EOF_WHILE_PARSING_OBJECT);
    }
    if (c == '}') {
      consume();
      state = stack.pop();
      return JsonEvent.OBJECT_END;
    }
    if (!first) {
      if (c != ',') {
        throw new SyntaxFailure(JsonSyntaxError.EXPECTED_COMMA_OR_OBJECT_END);
      }
      consume();
      skipWhitespace();
      c = peek();
      if (c == EOF) {
        throw new SyntaxFailure(JsonSyntaxError.EOF_WHILE_PARSING_OBJECT);
      }
    }
    if (c != '"') {
      throw new SyntaxFailure(JsonSyntaxError.EXPECTED_KEY_OR_OBJECT_END);
    }
    consume();
    state = ParserState.PARSE_OBJECT_PAIR;
    return parseString(true);
  }

  private JsonEvent parseObjectValue() throws IOException, SyntaxFailure {
    skipWhitespace();
    int c = peek();
    if (c == EOF) {
      throw new SyntaxFailure(JsonSyntaxError.EOF_WHILE_PARSING_OBJECT_COLON);
    }
    if (c != ':') {
      throw new SyntaxFailure(JsonSyntaxError.EXPECTED_COLON);
    }
    consume();
    skipWhitespace();
    if (peek() == EOF) {
      throw new SyntaxFailure(JsonSyntaxError.EOF_WHILE_PARSING_OBJECT_VALUE);
    }
    state = ParserState.PARSE_OBJECT_MAYBE;
    return parseValue();
  }

  private JsonEvent literal(String word, JsonEvent event) throws IOException, SyntaxFailure {
    for (int i = 0; i < word.length(); i++) {
      if (peek() != word.charAt(i)) {
        throw new SyntaxFailure(JsonSyntaxError.EXPECTED_VALUE);
      }
      consume();
    }
    return event;
  }

  private JsonEvent parseString(boolean key) throws IOException, SyntaxFailure {
    JsonSyntaxError eof = key
        ? JsonSyntaxError.EOF_WHILE_PARSING_OBJECT_KEY
        : JsonSyntaxError.EOF_WHILE_PARSING_STRING;
    StringBuilder out = new StringBuilder();
    while (true) {
      int c = peek();
      if (c == EOF) {
        throw new SyntaxFailure(eof);
      }
      consume();
      if (c == '"') {
        return new JsonEvent.StringValue(out.toString());
      }
      if (c != '\\') {
        out.append((char) c);
        continue;
      }
      int escaped = peek();
      if (escaped == EOF) {
        throw new SyntaxFailure(eof);
      }
      consume();
      switch (escaped) {
        case '"' -> out.append('"');
        case '\\' -> out.append('\\');
        case '/' -> out.append('/');
        case 'b' -> out.append('\b');
        case 'f' -> out.append('\f');
        case 'n' -> out.append('\n');
        case 'r' -> out.append('\r');
        case 't' -> out.append('\t');
        case 'u' -> appendUnicodeEscape(out);
        default -> throw new SyntaxFailure(JsonSyntaxError.INVALID_ESCAPE);
      }
    }
  }

  private void appendUnicodeEscape(StringBuilder out) throws IOException, SyntaxFailure {
    char first = readHexQuad();
    if (Character.isLowSurrogate(first)) {
      throw new SyntaxFailure(JsonSyntaxError.LONE_LEADING_SURROGATE_IN_HEX_ESCAPE);
    }
    if (!Character.isHighSurrogate(first)) {
      out.append(first);
      return;
    }
    if (peek() != '\\') {
      throw new SyntaxFailure(JsonSyntaxError.UNEXPECTED_END_OF_HEX_ESCAPE);
    }
    consume();
    if (peek() != 'u') {
      throw new SyntaxFailure(JsonSyntaxError.UNEXPECTED_END_OF_HEX_ESCAPE);
    }
    consume();
    char second = readHexQuad();
    if (!Character.isLowSurrogate(second)) {
      throw new SyntaxFailure(JsonSyntaxError.LONE_LEADING_SURROGATE_IN_HEX_ESCAPE);
    }
    out.append(first).append(second);
  }

  private char readHexQuad() throws IOException, SyntaxFailure {
    int code = 0;
    for (int i = 0; i < 4; i++) {
      int digit = Character.digit(peek(), 16);
      if (peek() == EOF || digit < 0) {
        throw new SyntaxFailure(JsonSyntaxError.INVALID_ESCAPE);
      }
      consume();
      code = (code << 4) | digit;
    }
    return (char) code;
  }

  private JsonEvent parseNumber() throws IOException, SyntaxFailure {
    boolean negative = false;
    if (peek() == '-') {
      negative = true;
      consume();
    }

    int c = peek();
    if (c == EOF) {
      throw new SyntaxFailure(eofInNumber());
    }
    if (!isDigit(c)) {
      throw new SyntaxFailure(JsonSyntaxError.INVALID_NUMBER);
    }

    double mantissa;
    if (c == '0') {
      consume();
      if (isDigit(peek())) {
        throw new SyntaxFailure(JsonSyntaxError.LEADING_ZERO);
      }
      mantissa = 0;
    } else {
      mantissa = readInteger();
    }

    if (peek() == '.') {
      consume();
      if (!isDigit(peek())) {
        throw new SyntaxFailure(peek() == EOF ? eofInNumber() : JsonSyntaxError.INVALID_NUMBER);
      }
      double scale = 1.0;
      double fraction = 0;
      while (isDigit(peek())) {
        scale /= 10;
        fraction += (peek() - '0') * scale;
        consume();
      }
      mantissa += fraction;
    }

    c = peek();
    if (c == 'e' || c == 'E') {
      consume();
      boolean negativeExponent = false;
      if (peek() == '+' || peek() == '-') {
        negativeExponent = peek() == '-';
        consume();
      }
      if (!isDigit(peek())) {
        throw new SyntaxFailure(peek() == EOF ? eofInNumber() : JsonSyntaxError.INVALID_NUMBER);
      }
      int exponent = 0;
      while (isDigit(peek())) {
        if (exponent < 100_000) {
          exponent = exponent * 10 + (peek() - '0');
        }
        consume();
      }
      double power = Math.pow(10, exponent);
      mantissa = negativeExponent ? mantissa / power : mantissa * power;
    }

    if (peek() == EOF) {
      if (state == ParserState.PARSE_ARRAY_MAYBE) {
        throw new SyntaxFailure(JsonSyntaxError.EOF_WHILE_PARSING_ARRAY);
      }
      if (state == ParserState.PARSE_OBJECT_MAYBE) {
        throw new SyntaxFailure(JsonSyntaxError.EOF_WHILE_PARSING_OBJECT_VALUE);
      }
    }
    return new JsonEvent.NumberValue(negative ? -mantissa : mantissa);
  }

  /** Accumulates decimal digits as an unsigned 64-bit integer, widening to double on overflow. */
  private double readInteger() throws IOException {
    long acc = 0;
    double overflow = -1;
    while (isDigit(peek())) {
      int digit = peek() - '0';
      if (overflow >= 0) {
        overflow = overflow * 10 + digit;
      } else if (Long.compareUnsigned(acc, Long.divideUnsigned(-1L - digit, 10)) > 0) {
        overflow = unsignedToDouble(acc) * 10 + digit;
      } else {
        acc = acc * 10 + digit;
      }
      consume();
    }
    return overflow >= 0 ? overflow : unsignedToDouble(acc);
  }

  private JsonSyntaxError eofInNumber() {
    return switch (state) {
      case PARSE_ARRAY_MAYBE -> JsonSyntaxError.EOF_WHILE_PARSING_ARRAY;
      case PARSE_OBJECT_MAYBE -> JsonSyntaxError.EOF_WHILE_PARSING_OBJECT_VALUE;
      default -> JsonSyntaxError.INVALID_NUMBER;
    };
  }

  private void skipWhitespace() throws IOException {
    int c = peek();
    while (c == ' ' || c == '\n' || c == '\t' || c == '\r') {
      consume();
      c = peek();
    }
  }

  /** Returns the current character without consuming it, reading lazily so a completed value never blocks. */
  private int peek() throws IOException {
    if (lookahead == UNREAD) {
      lookahead = reader.read();
    }
    return lookahead;
  }

  private void consume() {
    lookahead = UNREAD;
  }

  private static boolean isDigit(int c) {
    return c >= '0' && c <= '9';
  }

  private static double unsignedToDouble(long value) {
    if (value >= 0) {
      return value;
    }
    return (double) (value >>> 1) * 2.0 + (value & 1);
  }

  /** Internal control-flow signal; carries no stack trace. */
  private static final class SyntaxFailure extends Exception {
    private static final long serialVersionUID = 1L;
    private final transient JsonSyntaxError code;

    SyntaxFailure(JsonSyntaxError code) {
      super(code.description(), null, false, false);
      this.code = code;
    }
  }
}
