/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.telemetry.query.data;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class RowBatchTest {

  private static final Schema SCHEMA =
      Schema.of("zeek.conn", Field.of("host", FieldType.STRING), Field.of("port", FieldType.COUNT));

  @Test
  void should_create_batch_with_rows_and_columns() {
    Object[][] data = {
      {"10.0.0.1", 80L},
      {"10.0.0.2", 443L}
    };
    RowBatch batch = new RowBatch(SCHEMA, 100, data);

    assertEquals(2, batch.getPositionCount());
    assertEquals(2, batch.getChannelCount());
    assertEquals(100, batch.getOffset());
    assertEquals("10.0.0.2", batch.getValue(1, 0));
    assertEquals(443L, batch.getValue(1, 1));
  }

  @Test
  void should_handle_null_values() {
    RowBatch batch = new RowBatch(SCHEMA, 0, new Object[][] {{null, 22L}});

    assertNull(batch.getValue(0, 0));
    assertEquals(22L, batch.getValue(0, 1));
  }

  @Test
  void should_keep_global_ids_in_sub_region() {
    Object[][] data = {{"a", 1L}, {"b", 2L}, {"c", 3L}, {"d", 4L}};
    RowBatch batch = new RowBatch(SCHEMA, 10, data);

    Batch region = batch.getRegion(1, 2);

    assertEquals(2, region.getPositionCount());
    assertEquals(11, region.getOffset());
    assertEquals("b", region.getValue(0, 0));
    assertEquals("c", region.getValue(1, 0));
  }

  @Test
  void should_rebase_offset() {
    RowBatch batch = new RowBatch(SCHEMA, 0, new Object[][] {{"a", 1L}});

    Batch rebased = batch.withOffset(42);

    assertEquals(42, rebased.getOffset());
    assertEquals("a", rebased.getValue(0, 0));
  }

  @Test
  void should_create_empty_batch() {
    Batch empty = Batch.empty(SCHEMA);

    assertEquals(0, empty.getPositionCount());
    assertEquals(2, empty.getChannelCount());
  }

  @Test
  void should_throw_on_invalid_position_or_channel() {
    RowBatch batch = new RowBatch(SCHEMA, 0, new Object[][] {{"a", 1L}});

    assertThrows(IndexOutOfBoundsException.class, () -> batch.getValue(1, 0));
    assertThrows(IndexOutOfBoundsException.class, () -> batch.getValue(0, 2));
    assertThrows(IndexOutOfBoundsException.class, () -> batch.getRegion(0, 2));
  }

  @Test
  void should_reject_negative_offset() {
    assertThrows(IllegalArgumentException.class, () -> new RowBatch(SCHEMA, -1, new Object[0][]));
  }
}
