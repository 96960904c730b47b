/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.telemetry.query.exporter;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.telemetry.query.data.Batch;
import org.telemetry.query.data.BatchBuilder;
import org.telemetry.query.data.Field;
import org.telemetry.query.data.FieldType;
import org.telemetry.query.data.Schema;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class ResultBufferTest {

  private static final Schema SCHEMA = Schema.of("test", Field.of("x", FieldType.COUNT));

  @Test
  void should_return_whole_head_batch_when_it_fits() {
    ResultBuffer buffer = new ResultBuffer();
    buffer.addAll(List.of(batch(0, 3), batch(10, 2)));

    Batch taken = buffer.take(5);

    assertEquals(3, taken.getPositionCount());
    assertEquals(2, buffer.getRows());
    assertEquals(1, buffer.size());
  }

  @Test
  void should_split_head_batch_when_it_exceeds_max_rows() {
    ResultBuffer buffer = new ResultBuffer();
    buffer.add(batch(100, 10));

    Batch taken = buffer.take(4);

    assertEquals(4, taken.getPositionCount());
    assertEquals(100, taken.getOffset());
    assertEquals(6, buffer.getRows());
    Batch rest = buffer.take(Demand.UNBOUNDED);
    assertEquals(104, rest.getOffset());
    assertEquals(6, rest.getPositionCount());
    assertTrue(buffer.isEmpty());
    assertEquals(0, buffer.getRows());
  }

  @Test
  void should_ignore_empty_batches() {
    ResultBuffer buffer = new ResultBuffer();
    buffer.add(Batch.empty(SCHEMA));

    assertTrue(buffer.isEmpty());
  }

  @Test
  void should_reject_take_from_empty_buffer() {
    ResultBuffer buffer = new ResultBuffer();

    assertThrows(IllegalStateException.class, () -> buffer.take(1));
    assertThrows(IllegalArgumentException.class, () -> buffer.take(0));
  }

  private static Batch batch(long offset, int rows) {
    BatchBuilder builder = new BatchBuilder(SCHEMA).offset(offset);
    for (int i = 0; i < rows; i++) {
      builder.addRow(offset + i);
    }
    return builder.build();
  }
}
