/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.telemetry.query.exporter;

import com.google.common.base.Preconditions;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import org.telemetry.query.data.Batch;
import org.telemetry.query.data.Batches;

/**
 * FIFO queue of filtered batches waiting to be shipped. Keeps a row counter in sync with its
 * content. The buffer has no capacity limit; demand gating happens in the {@link Exporter}.
 */
public class ResultBuffer {

  private final Deque<Batch> batches = new ArrayDeque<>();
  private long rows;

  /** Appends a batch. Empty batches are ignored. */
  public void add(Batch batch) {
    if (batch.getPositionCount() == 0) {
      return;
    }
    batches.addLast(batch);
    rows += batch.getPositionCount();
  }

  public void addAll(List<Batch> batchList) {
    batchList.forEach(this::add);
  }

  /**
   * Removes at most {@code maxRows} rows from the head of the buffer. Returns the head batch if it
   * fits; otherwise splits the head, returns its first {@code maxRows} rows and keeps the remainder
   * as the new head.
   *
   * @param maxRows upper bound on the returned rows, positive
   * @return the rows taken, never empty
   */
  public Batch take(long maxRows) {
    Preconditions.checkArgument(maxRows > 0, "must take at least one row");
    Preconditions.checkState(!batches.isEmpty(), "take from an empty result buffer");
    Batch head = batches.peekFirst();
    Batch taken;
    if (head.getPositionCount() <= maxRows) {
      taken = batches.pollFirst();
    } else {
      List<Batch> parts = Batches.split(head, (int) maxRows);
      batches.pollFirst();
      batches.addFirst(parts.get(1));
      taken = parts.get(0);
    }
    rows -= taken.getPositionCount();
    return taken;
  }

  public boolean isEmpty() {
    return batches.isEmpty();
  }

  /** Returns the number of buffered rows. */
  public long getRows() {
    return rows;
  }

  /** Returns the number of buffered batches. */
  public int size() {
    return batches.size();
  }
}
