/*
 * Where: Notification engine service layer
 * What: Records event processing outcomes, created notifications and backlog size
 * Why: Make poison events and a growing queue visible from Prometheus
 */
package com.example.docnotify.engine.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry is a shared Spring managed component")
public class NotificationMetrics {

  static final String METRIC_EVENTS_PROCESSED_TOTAL = "notification.events.processed.total";
  static final String METRIC_CREATED_TOTAL = "notification.created.total";
  static final String METRIC_BACKLOG_CURRENT = "notification.events.backlog.current";

  public static final String RESULT_SUCCEEDED = "succeeded";
  public static final String RESULT_FAILED = "failed";
  public static final String RESULT_EXHAUSTED = "exhausted";
  public static final String RESULT_CANCELLED = "cancelled";
  public static final String RESULT_SKIPPED = "skipped";

  private final MeterRegistry meterRegistry;
  private final AtomicInteger backlogCurrent = new AtomicInteger(0);
  private final ConcurrentMap<String, Counter> resultCounters = new ConcurrentHashMap<>();
  private final Counter createdCounter;

  public NotificationMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    Gauge.builder(METRIC_BACKLOG_CURRENT, backlogCurrent, AtomicInteger::get)
        .description("Current number of unprocessed events")
        .register(meterRegistry);
    this.createdCounter =
        Counter.builder(METRIC_CREATED_TOTAL)
            .description("Total number of notifications created")
            .register(meterRegistry);
  }

  public void recordEventResult(String result) {
    resultCounters
        .computeIfAbsent(
            result,
            ignored ->
                Counter.builder(METRIC_EVENTS_PROCESSED_TOTAL)
                    .description("Event processing attempt outcomes")
                    .tags(Tags.of("result", result))
                    .register(meterRegistry))
        .increment();
  }

  public void recordNotificationsCreated(int count) {
    if (count > 0) {
      createdCounter.increment(count);
    }
  }

  public void updateBacklogCurrent(int backlogCount) {
    backlogCurrent.set(Math.max(backlogCount, 0));
  }
}
