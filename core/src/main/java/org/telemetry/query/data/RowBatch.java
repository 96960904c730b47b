/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.telemetry.query.data;

import java.util.Arrays;
import java.util.Objects;

/**
 * Row-based {@link Batch} implementation. Each row is an Object array where the index corresponds
 * to the column (channel) position of the schema.
 */
public class RowBatch implements Batch {

  private final Schema schema;
  private final long offset;
  private final Object[][] rows;

  /**
   * Creates a RowBatch from pre-built row data. The array is owned by the batch afterwards and must
   * not be modified by the caller.
   *
   * @param schema the schema of all rows
   * @param offset the global id of the first row
   * @param rows 2D array where rows[i][j] is the value at row i, column j
   */
  public RowBatch(Schema schema, long offset, Object[][] rows) {
    if (offset < 0) {
      throw new IllegalArgumentException("offset must be non-negative: " + offset);
    }
    this.schema = Objects.requireNonNull(schema, "schema");
    this.offset = offset;
    this.rows = rows;
  }

  @Override
  public Schema getSchema() {
    return schema;
  }

  @Override
  public long getOffset() {
    return offset;
  }

  @Override
  public int getPositionCount() {
    return rows.length;
  }

  @Override
  public Object getValue(int position, int channel) {
    if (position < 0 || position >= rows.length) {
      throw new IndexOutOfBoundsException(
          "Position " + position + " out of range [0, " + rows.length + ")");
    }
    int channelCount = getChannelCount();
    if (channel < 0 || channel >= channelCount) {
      throw new IndexOutOfBoundsException(
          "Channel " + channel + " out of range [0, " + channelCount + ")");
    }
    return rows[position][channel];
  }

  @Override
  public Batch getRegion(int positionOffset, int length) {
    if (positionOffset < 0 || length < 0 || positionOffset + length > rows.length) {
      throw new IndexOutOfBoundsException(
          "Region ["
              + positionOffset
              + ", "
              + (positionOffset + length)
              + ") out of range [0, "
              + rows.length
              + ")");
    }
    Object[][] region = Arrays.copyOfRange(rows, positionOffset, positionOffset + length);
    return new RowBatch(schema, offset + positionOffset, region);
  }

  @Override
  public Batch withOffset(long newOffset) {
    return new RowBatch(schema, newOffset, rows);
  }

  @Override
  public String toString() {
    return "RowBatch{schema="
        + schema.getName()
        + ", offset="
        + offset
        + ", rows="
        + rows.length
        + "}";
  }
}
