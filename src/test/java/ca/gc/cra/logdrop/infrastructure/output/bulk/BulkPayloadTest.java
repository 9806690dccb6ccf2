package ca.gc.cra.logdrop.infrastructure.output.bulk;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.List;
import org.junit.jupiter.api.Test;

class BulkPayloadTest {

  @Test
  void prefixesEveryDocumentWithIndexAction() {
    String payload = BulkPayload.of(List.of("{\"a\":1}", "{\"b\":2}"));

    assertEquals("{\"index\":{}}\n{\"a\":1}\n{\"index\":{}}\n{\"b\":2}\n", payload);
  }

  @Test
  void emptyBatchIsEmptyPayload() {
    assertEquals("", BulkPayload.of(List.of()));
  }
}
