/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.telemetry.query.data;

/**
 * An immutable batch of rows sharing one {@link Schema}. Batches flow from the archive (or the
 * continuous ingestion stream) through the exporter to the sinks.
 *
 * <p>Every row carries a global row id: the id of the row at position {@code p} is {@code
 * getOffset() + p}. Hits delivered by the index and selections produced by checkers are expressed
 * in these ids.
 */
public interface Batch {

  /** Returns the schema shared by all rows of this batch. */
  Schema getSchema();

  /** Returns the global row id of the first row. */
  long getOffset();

  /** Returns the number of rows in this batch. */
  int getPositionCount();

  /** Returns the number of columns in this batch. */
  default int getChannelCount() {
    return getSchema().getFields().size();
  }

  /**
   * Returns the value at the given row and column position.
   *
   * @param position the row index (0-based)
   * @param channel the column index (0-based)
   * @return the value, or null if the cell is null
   */
  Object getValue(int position, int channel);

  /**
   * Returns a sub-region of this batch. The region keeps the global ids of its rows, so its offset
   * is {@code getOffset() + positionOffset}.
   *
   * @param positionOffset the starting row index
   * @param length the number of rows in the region
   * @return a new Batch representing the sub-region
   */
  Batch getRegion(int positionOffset, int length);

  /**
   * Returns a copy of this batch whose first row has the given global id.
   *
   * @param offset the new offset
   * @return a batch with the same rows
   */
  Batch withOffset(long offset);

  /** Returns an empty batch with zero rows and the given schema. */
  static Batch empty(Schema schema) {
    return new RowBatch(schema, 0L, new Object[0][]);
  }
}
