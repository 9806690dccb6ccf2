package ca.gc.cra.logdrop.testutil;

import ca.gc.cra.logdrop.application.port.MetricsPort;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.LongAdder;

/** Thread-safe {@link MetricsPort} that remembers every counter and observation. */
public final class RecordingMetrics implements MetricsPort {
  private final Map<String, LongAdder> counters = new ConcurrentHashMap<>();
  private final Map<String, List<Long>> observations = new ConcurrentHashMap<>();

  @Override
  public void increment(String key) {
    counters.computeIfAbsent(key, k -> new LongAdder()).increment();
  }

  @Override
  public void observe(String key, long value) {
    observations.computeIfAbsent(key, k -> new CopyOnWriteArrayList<>()).add(value);
  }

  public long counter(String key) {
    LongAdder adder = counters.get(key);
    return adder == null ? 0L : adder.sum();
  }

  public List<Long> observations(String key) {
    return List.copyOf(observations.getOrDefault(key, List.of()));
  }
}
