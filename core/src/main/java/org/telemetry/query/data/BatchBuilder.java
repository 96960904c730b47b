/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.telemetry.query.data;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds a {@link Batch} row by row. Call {@link #beginRow()}, set values via {@link #setValue(int,
 * Object)}, then {@link #endRow()} to commit. Call {@link #build()} to produce the final Batch.
 */
public class BatchBuilder {

  private final Schema schema;
  private final int channelCount;
  private final List<Object[]> rows;
  private long offset;
  private Object[] currentRow;

  public BatchBuilder(Schema schema) {
    this.schema = schema;
    this.channelCount = schema.getFields().size();
    this.rows = new ArrayList<>();
  }

  /** Sets the global id of the first row of the next built batch. Defaults to 0. */
  public BatchBuilder offset(long offset) {
    this.offset = offset;
    return this;
  }

  /** Starts a new row. Values default to null. */
  public void beginRow() {
    currentRow = new Object[channelCount];
  }

  /**
   * Sets a value in the current row.
   *
   * @param channel the column index (0-based)
   * @param value the value to set
   */
  public void setValue(int channel, Object value) {
    if (currentRow == null) {
      throw new IllegalStateException("beginRow() must be called before setValue()");
    }
    if (channel < 0 || channel >= channelCount) {
      throw new IndexOutOfBoundsException(
          "Channel " + channel + " out of range [0, " + channelCount + ")");
    }
    currentRow[channel] = value;
  }

  /** Commits the current row to the batch. */
  public void endRow() {
    if (currentRow == null) {
      throw new IllegalStateException("beginRow() must be called before endRow()");
    }
    rows.add(currentRow);
    currentRow = null;
  }

  /** Adds a complete row. */
  public BatchBuilder addRow(Object... values) {
    if (values.length != channelCount) {
      throw new IllegalArgumentException(
          "Expected " + channelCount + " values but got " + values.length);
    }
    beginRow();
    for (int channel = 0; channel < values.length; channel++) {
      setValue(channel, values[channel]);
    }
    endRow();
    return this;
  }

  /** Returns the number of rows added so far. */
  public int getRowCount() {
    return rows.size();
  }

  /** Returns true if no rows have been added. */
  public boolean isEmpty() {
    return rows.isEmpty();
  }

  /** Builds the final Batch from all committed rows and resets the builder. */
  public Batch build() {
    if (currentRow != null) {
      throw new IllegalStateException("endRow() must be called before build()");
    }
    Object[][] data = rows.toArray(new Object[0][]);
    rows.clear();
    Batch batch = new RowBatch(schema, offset, data);
    offset += data.length;
    return batch;
  }
}
