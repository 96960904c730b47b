/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.telemetry.query.exporter;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import org.telemetry.query.component.ExitReason;
import org.telemetry.query.component.LivenessTracker;
import org.telemetry.query.component.Sink;
import org.telemetry.query.component.Subscription;
import org.telemetry.query.data.Batch;
import org.telemetry.query.data.Batches;

/** Sink collecting every shipped batch. */
class CollectingSink implements Sink {

  final List<Batch> batches = new ArrayList<>();
  final LivenessTracker liveness = new LivenessTracker();

  @Override
  public void ship(Batch batch) {
    batches.add(batch);
  }

  @Override
  public Subscription watch(Consumer<ExitReason> watcher) {
    return liveness.watch(watcher);
  }

  long rows() {
    return Batches.rows(batches);
  }

  @Override
  public String toString() {
    return "collecting-sink";
  }
}
