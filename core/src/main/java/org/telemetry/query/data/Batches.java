/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.telemetry.query.data;

import com.google.common.base.Preconditions;
import java.util.ArrayList;
import java.util.List;
import lombok.experimental.UtilityClass;

/** Operations producing new batches from existing ones. */
@UtilityClass
public class Batches {

  /**
   * Splits a batch at row {@code k}. The first part holds rows {@code [0, k)}, the second part rows
   * {@code [k, rows)}; both keep the global ids of their rows.
   *
   * @param batch the batch to split
   * @param k the split point, {@code 0 < k < batch.getPositionCount()}
   * @return exactly two batches whose row counts sum to the original
   */
  public List<Batch> split(Batch batch, int k) {
    int rows = batch.getPositionCount();
    Preconditions.checkArgument(0 < k && k < rows, "split point %s out of (0, %s)", k, rows);
    return List.of(batch.getRegion(0, k), batch.getRegion(k, rows - k));
  }

  /**
   * Selects the rows of a batch whose global ids are in the selection. Every maximal run of
   * consecutive selected rows yields one sub-batch, in row order.
   *
   * @param batch the batch to filter
   * @param selection global row ids to keep; ids outside the batch are ignored
   * @return the selected sub-batches, empty if nothing is selected
   */
  public List<Batch> select(Batch batch, Selection selection) {
    List<Batch> result = new ArrayList<>();
    long begin = batch.getOffset();
    long end = begin + batch.getPositionCount();
    for (long[] run : selection.runs()) {
      long from = Math.max(run[0], begin);
      long to = Math.min(run[1], end);
      if (from < to) {
        result.add(batch.getRegion((int) (from - begin), (int) (to - from)));
      }
    }
    return result;
  }

  /** Returns the sum of the row counts of the given batches. */
  public long rows(Iterable<? extends Batch> batches) {
    long total = 0;
    for (Batch batch : batches) {
      total += batch.getPositionCount();
    }
    return total;
  }
}
