package ca.gc.cra.logdrop.infrastructure.output.bulk;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.logdrop.application.port.BulkTransport;
import ca.gc.cra.logdrop.domain.value.LogRecord;
import ca.gc.cra.logdrop.domain.value.Value;
import ca.gc.cra.logdrop.testutil.Eventually;
import ca.gc.cra.logdrop.testutil.RecordingMetrics;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class BulkIndexOutputAdapterTest {
  private static final Duration WAIT = Duration.ofSeconds(5);
  private static final Duration NEVER = Duration.ofHours(1);

  private RecordingTransport transport;
  private RecordingMetrics metrics;
  private BulkIndexOutputAdapter adapter;

  @BeforeEach
  void setUp() {
    transport = new RecordingTransport();
    metrics = new RecordingMetrics();
  }

  @AfterEach
  void tearDown() throws Exception {
    if (adapter != null) {
      adapter.close();
    }
  }

  @Test
  void flushesWhenBatchReachesLimit() throws Exception {
    adapter = new BulkIndexOutputAdapter("es", transport, 3, NEVER, new RecordSerializer(), metrics);

    adapter.feed(record(1));
    adapter.feed(record(2));
    adapter.feed(record(3));

    Eventually.await("one bulk payload", WAIT, () -> transport.payloads.size() == 1);
    assertEquals(
        "{\"index\":{}}\n{\"message\":1}\n"
            + "{\"index\":{}}\n{\"message\":2}\n"
            + "{\"index\":{}}\n{\"message\":3}\n",
        transport.payloads.get(0));
    assertEquals(1, metrics.counter("output.es.bulk.flushed"));
    assertEquals(List.of(3L), metrics.observations("output.es.bulk.batchSize"));
  }

  @Test
  void belowLimitWaitsForTimer() throws Exception {
    adapter = new BulkIndexOutputAdapter("es", transport, 100, Duration.ofMillis(100), new RecordSerializer(), metrics);

    adapter.feed(record(1));
    adapter.feed(record(2));

    Eventually.await("timer flush of both records", WAIT, () -> transport.documentCount() == 2);
    assertEquals(
        List.of("{\"index\":{}}\n{\"message\":1}\n{\"index\":{}}\n{\"message\":2}\n"),
        transport.payloads,
        "both records go out in the single timer flush");

    Thread.sleep(350);
    assertEquals(1, transport.payloads.size(), "empty timer flushes must not send");
    assertEquals(1, metrics.counter("output.es.bulk.flushed"));
  }

  @Test
  void sizeFlushRestartsTheInterval() throws Exception {
    adapter = new BulkIndexOutputAdapter("es", transport, 2, Duration.ofMillis(400), new RecordSerializer(), metrics);

    Thread.sleep(300);
    adapter.feed(record(1));
    adapter.feed(record(2));
    Eventually.await("size flush", WAIT, () -> transport.payloads.size() == 1);
    adapter.feed(record(3));

    Thread.sleep(200);
    assertEquals(1, transport.payloads.size(), "the tick scheduled before the size flush must not fire");

    Eventually.await("interval flush of the remainder", WAIT, () -> transport.payloads.size() == 2);
    assertEquals("{\"index\":{}}\n{\"message\":3}\n", transport.payloads.get(1));
  }

  @Test
  void sizeFlushesRepeatWithoutTimer() throws Exception {
    adapter = new BulkIndexOutputAdapter("es", transport, 2, NEVER, new RecordSerializer(), metrics);

    for (int i = 0; i < 5; i++) {
      adapter.feed(record(i));
    }

    Eventually.await("two full batches", WAIT, () -> transport.payloads.size() == 2);
    Thread.sleep(100);
    assertEquals(2, transport.payloads.size());
  }

  @Test
  void transportFailureDropsBatchAndKeepsRunning() throws Exception {
    transport.failNext.set(true);
    adapter = new BulkIndexOutputAdapter("es", transport, 1, NEVER, new RecordSerializer(), metrics);

    adapter.feed(record(1));
    adapter.feed(record(2));

    Eventually.await("second batch", WAIT, () -> transport.payloads.size() == 1);
    assertTrue(transport.payloads.get(0).contains("{\"message\":2}"));
  }

  @Test
  void closeStopsFeedingAndClosesTransport() throws Exception {
    adapter = new BulkIndexOutputAdapter("es", transport);

    adapter.close();

    assertTrue(transport.closed);
    assertThrows(IllegalStateException.class, () -> adapter.feed(record(1)));
  }

  @Test
  void rejectsNonPositiveLimit() {
    assertThrows(IllegalArgumentException.class,
        () -> new BulkIndexOutputAdapter("es", transport, 0, NEVER, new RecordSerializer(), metrics));
  }

  private static LogRecord record(int n) {
    return LogRecord.of(Map.of("message", Value.of(n)));
  }

  private static final class RecordingTransport implements BulkTransport {
    private final List<String> payloads = new CopyOnWriteArrayList<>();
    private final AtomicBoolean failNext = new AtomicBoolean();
    private volatile boolean closed;

    int documentCount() {
      int count = 0;
      for (String payload : payloads) {
        count += payload.split("\n").length / 2;
      }
      return count;
    }

    @Override
    public void send(String payload) {
      if (failNext.getAndSet(false)) {
        throw new IllegalStateException("connection refused");
      }
      payloads.add(payload);
    }

    @Override
    public void close() {
      closed = true;
    }
  }
}
