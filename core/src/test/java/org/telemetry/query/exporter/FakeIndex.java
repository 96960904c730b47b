/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.telemetry.query.exporter;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.function.Consumer;
import org.telemetry.query.common.response.ResponseListener;
import org.telemetry.query.component.ExitReason;
import org.telemetry.query.component.Index;
import org.telemetry.query.component.IndexClient;
import org.telemetry.query.component.LivenessTracker;
import org.telemetry.query.component.LookupHandle;
import org.telemetry.query.component.Subscription;
import org.telemetry.query.data.Selection;
import org.telemetry.query.expression.Expression;

/** Index whose replies are driven step by step by the test. */
class FakeIndex implements Index {

  final UUID lookupId = UUID.randomUUID();
  final List<Integer> partitionRequests = new ArrayList<>();
  final LivenessTracker liveness = new LivenessTracker();
  Expression expression;
  IndexClient client;
  ResponseListener<LookupHandle> listener;

  @Override
  public void lookup(
      Expression expression, IndexClient client, ResponseListener<LookupHandle> listener) {
    this.expression = expression;
    this.client = client;
    this.listener = listener;
  }

  @Override
  public void requestPartitions(UUID lookupId, int partitions) {
    partitionRequests.add(partitions);
  }

  @Override
  public Subscription watch(Consumer<ExitReason> watcher) {
    return liveness.watch(watcher);
  }

  void reply(int partitions, int scheduled) {
    listener.onResponse(new LookupHandle(lookupId, partitions, scheduled));
  }

  void fail(Exception e) {
    listener.onFailure(e);
  }

  void hits(Selection hits) {
    client.onHits(hits);
  }

  void done() {
    client.onDone();
  }

  @Override
  public String toString() {
    return "fake-index";
  }
}
