package chatlog.micrometer;

import chatlog.spi.MetricsExporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code chatlog.append.created}: appends that inserted a new message</li>
 *   <li>{@code chatlog.append.merged}: appends merged into the previous message</li>
 *   <li>{@code chatlog.compaction.relocated}: messages moved to the archive</li>
 *   <li>{@code chatlog.compaction.failures}: failed relocation batches</li>
 *   <li>{@code chatlog.delete.count}: explicitly deleted messages</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code chatlog.live.size}: live messages seen by the last full read</li>
 * </ul>
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final Counter appended;
  private final Counter merged;
  private final Counter relocated;
  private final Counter compactionFailures;
  private final Counter deleted;
  private final Gauge liveSizeGauge;

  private final AtomicInteger liveSize = new AtomicInteger();
  private volatile boolean closed;

  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "chatlog");
  }

  /**
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "support.chatlog"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty() || namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must be non-empty and not end with '.'");
    }

    this.registry = registry;
    this.appended = Counter.builder(namePrefix + ".append.created")
        .description("Appends stored as a new message")
        .register(registry);
    this.merged = Counter.builder(namePrefix + ".append.merged")
        .description("Appends merged into the previous message")
        .register(registry);
    this.relocated = Counter.builder(namePrefix + ".compaction.relocated")
        .description("Messages relocated from live to archive")
        .register(registry);
    this.compactionFailures = Counter.builder(namePrefix + ".compaction.failures")
        .description("Relocation batches that failed")
        .register(registry);
    this.deleted = Counter.builder(namePrefix + ".delete.count")
        .description("Messages deleted explicitly")
        .register(registry);
    this.liveSizeGauge = Gauge.builder(namePrefix + ".live.size", liveSize, AtomicInteger::get)
        .description("Live messages at the last full read")
        .register(registry);
  }

  @Override
  public void incrementAppended() {
    if (closed) return;
    appended.increment();
  }

  @Override
  public void incrementMerged() {
    if (closed) return;
    merged.increment();
  }

  @Override
  public void incrementRelocated(int count) {
    if (closed || count <= 0) return;
    relocated.increment(count);
  }

  @Override
  public void incrementCompactionFailure() {
    if (closed) return;
    compactionFailures.increment();
  }

  @Override
  public void incrementDeleted(int count) {
    if (closed || count <= 0) return;
    deleted.increment(count);
  }

  @Override
  public void recordLiveSize(int size) {
    if (closed) return;
    liveSize.set(size);
  }

  /**
   * Removes this exporter's meters from the registry.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : List.of(appended, merged, relocated, compactionFailures, deleted, liveSizeGauge)) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
