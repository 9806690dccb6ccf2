package ca.gc.cra.logdrop.domain.template;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.logdrop.domain.value.LogRecord;
import ca.gc.cra.logdrop.domain.value.Value;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class TemplateTest {
  private final LogRecord record = LogRecord.of(Map.of(
      "message", Value.of("disk full"),
      "id", Value.object(Map.of("source", Value.of("db-1"))),
      "count", Value.of(42),
      "negative", Value.of(-42),
      "ratio", Value.of(3.1415),
      "ok", Value.of(true),
      "missing", Value.nullValue(),
      "tags", Value.array(List.of(Value.of("a")))));

  @Test
  void rendersLiteralsAndNestedPlaceholders() {
    Template template = Template.compile("/var/log/{id/source}.log");

    assertEquals("/var/log/db-1.log", template.render(record));
  }

  @Test
  void rendersScalars() {
    assertEquals("42 -42 3.1415 true null", Template.compile("{count} {negative} {ratio} {ok} {missing}")
        .render(record));
  }

  @Test
  void missingKeyFailsWithKeyNotFound() {
    TemplateResolutionException ex = assertThrows(TemplateResolutionException.class,
        () -> Template.compile("{id/host}").render(record));

    assertEquals(TemplateResolutionException.Reason.KEY_NOT_FOUND, ex.reason());
    assertEquals("host", ex.key());
  }

  @Test
  void steppingIntoScalarFailsWithKeyNotFound() {
    TemplateResolutionException ex = assertThrows(TemplateResolutionException.class,
        () -> Template.compile("{message/text}").render(record));

    assertEquals(TemplateResolutionException.Reason.KEY_NOT_FOUND, ex.reason());
    assertEquals("text", ex.key());
  }

  @Test
  void containerLeafFailsWithTypeMismatch() {
    TemplateResolutionException ex = assertThrows(TemplateResolutionException.class,
        () -> Template.compile("{tags}").render(record));

    assertEquals(TemplateResolutionException.Reason.TYPE_MISMATCH, ex.reason());
    assertEquals(TemplateResolutionException.Reason.TYPE_MISMATCH, assertThrows(TemplateResolutionException.class,
        () -> Template.compile("{id}").render(record)).reason());
  }

  @Test
  void errorTokenFailsWithSyntaxError() {
    TemplateResolutionException ex = assertThrows(TemplateResolutionException.class, () -> TemplateResolver.resolve(
        new TemplateToken.Error(TemplateSyntaxError.EOF_WHILE_PARSING_PLACEHOLDER), record));

    assertEquals(TemplateResolutionException.Reason.SYNTAX_ERROR, ex.reason());
    assertNull(ex.key());
  }

  @Test
  void compileRejectsUnterminatedPlaceholder() {
    TemplateSyntaxException ex = assertThrows(TemplateSyntaxException.class, () -> Template.compile("{message"));

    assertEquals(TemplateSyntaxError.EOF_WHILE_PARSING_PLACEHOLDER, ex.error());
  }
}
