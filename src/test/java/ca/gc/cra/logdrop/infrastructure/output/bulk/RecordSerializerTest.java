package ca.gc.cra.logdrop.infrastructure.output.bulk;

import static org.junit.jupiter.api.Assertions.assertEquals;

import ca.gc.cra.logdrop.domain.json.ValueBuilder;
import ca.gc.cra.logdrop.domain.value.LogRecord;
import java.io.IOException;
import java.io.StringReader;
import org.junit.jupiter.api.Test;

class RecordSerializerTest {
  private final RecordSerializer serializer = new RecordSerializer();

  @Test
  void writesCompactSingleLineJsonInFieldOrder() throws IOException {
    LogRecord record = parse("{\n  \"message\": \"disk\\nfull\",\n  \"level\": 3,\n  \"ratio\": 0.25,\n"
        + "  \"ok\": false,\n  \"none\": null,\n  \"tags\": [\"a\", {\"b\": []}]\n}");

    String json = serializer.serialize(record);

    assertEquals("{\"message\":\"disk\\nfull\",\"level\":3,\"ratio\":0.25,\"ok\":false,\"none\":null,"
        + "\"tags\":[\"a\",{\"b\":[]}]}", json);
  }

  @Test
  void keepsLargeIntegersIntegral() throws IOException {
    assertEquals("{\"n\":-9007199254740992}", serializer.serialize(parse("{\"n\":-9007199254740992}")));
    assertEquals("{\"n\":1.0E17}", serializer.serialize(parse("{\"n\":1e17}")));
  }

  @Test
  void serializedRecordParsesBackToSameRecord() throws IOException {
    LogRecord record = parse("{\"message\":\"\\u00e9\\ud83d\\ude00\",\"id\":{\"source\":\"app\"}}");

    assertEquals(record, parse(serializer.serialize(record)));
  }

  private static LogRecord parse(String json) {
    return LogRecord.of(ValueBuilder.over(new StringReader(json)).next());
  }
}
