/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.telemetry.query.sink;

import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import lombok.extern.log4j.Log4j2;
import org.telemetry.query.component.ExitReason;
import org.telemetry.query.component.LivenessTracker;
import org.telemetry.query.component.Sink;
import org.telemetry.query.component.Subscription;
import org.telemetry.query.data.Batch;

/** Sink that discards everything it receives, keeping only counters. */
@Log4j2
public class NullSink implements Sink, AutoCloseable {

  private final LivenessTracker liveness = new LivenessTracker();
  private final AtomicLong batches = new AtomicLong();
  private final AtomicLong rows = new AtomicLong();

  @Override
  public void ship(Batch batch) {
    batches.incrementAndGet();
    rows.addAndGet(batch.getPositionCount());
  }

  @Override
  public Subscription watch(Consumer<ExitReason> listener) {
    return liveness.watch(listener);
  }

  public long getBatchCount() {
    return batches.get();
  }

  public long getRowCount() {
    return rows.get();
  }

  /** Disconnects normally; watching exporters terminate. */
  @Override
  public void close() {
    log.debug("null sink closes after discarding {} rows", rows.get());
    liveness.disconnect(ExitReason.NORMAL);
  }

  @Override
  public String toString() {
    return "null-sink";
  }
}
