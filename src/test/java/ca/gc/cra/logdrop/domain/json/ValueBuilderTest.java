package ca.gc.cra.logdrop.domain.json;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.logdrop.domain.value.JsonArray;
import ca.gc.cra.logdrop.domain.value.JsonObject;
import ca.gc.cra.logdrop.domain.value.Value;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import org.junit.jupiter.api.Test;

class ValueBuilderTest {

  @Test
  void buildsOneValuePerDocument() {
    ValueBuilder builder = ValueBuilder.over(new StringReader("{}{}null true false 42 \"string\" 42.5 [true] {}"));

    List<Value> values = new ArrayList<>();
    builder.forEachRemaining(values::add);

    assertEquals(List.of(
        Value.object(Map.of()),
        Value.object(Map.of()),
        Value.nullValue(),
        Value.of(true),
        Value.of(false),
        Value.of(42),
        Value.of("string"),
        Value.of(42.5),
        Value.array(List.of(Value.of(true))),
        Value.object(Map.of())), values);
  }

  @Test
  void buildsNestedTrees() {
    ValueBuilder builder = ValueBuilder.over(new StringReader(
        "{\"message\":\"hi\",\"id\":{\"source\":\"app\",\"tags\":[1,[2,{}],null]}}"));

    JsonObject root = assertInstanceOf(JsonObject.class, builder.next());

    assertEquals(Value.of("hi"), root.find("message").orElseThrow());
    JsonObject id = assertInstanceOf(JsonObject.class, root.find("id").orElseThrow());
    assertEquals(Value.of("app"), id.find("source").orElseThrow());
    JsonArray tags = assertInstanceOf(JsonArray.class, id.find("tags").orElseThrow());
    assertEquals(List.of(
        Value.of(1),
        Value.array(List.of(Value.of(2), Value.object(Map.of()))),
        Value.nullValue()), tags.elements());
    assertFalse(builder.hasNext());
  }

  @Test
  void deepNestingDoesNotOverflowStack() {
    int depth = 50_000;
    String json = "[".repeat(depth) + "]".repeat(depth);

    Value value = ValueBuilder.over(new StringReader(json)).next();

    assertTrue(value.isContainer());
  }

  @Test
  void parseErrorRaisesAndFinishes() {
    ValueBuilder builder = ValueBuilder.over(new StringReader("{\"a\":1} [1,] {\"b\":2}"));

    assertEquals(Value.object(Map.of("a", Value.of(1))), builder.next());
    JsonParseException error = assertThrows(JsonParseException.class, builder::hasNext);
    assertEquals(new ParserError.SyntaxError(JsonSyntaxError.EXPECTED_VALUE), error.error());
    assertFalse(builder.hasNext());
    assertThrows(NoSuchElementException.class, builder::next);
  }
}
