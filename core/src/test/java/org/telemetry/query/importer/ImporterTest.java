/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.telemetry.query.importer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.telemetry.query.component.Subscription;
import org.telemetry.query.config.DefaultSettings;
import org.telemetry.query.data.Batch;
import org.telemetry.query.data.BatchBuilder;
import org.telemetry.query.data.Field;
import org.telemetry.query.data.FieldType;
import org.telemetry.query.data.Schema;
import org.telemetry.query.exporter.StatusVerbosity;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class ImporterTest {

  private static final Schema SCHEMA = Schema.of("test", Field.of("x", FieldType.COUNT));

  private final Importer importer =
      new Importer(new DefaultSettings(Map.of("importer.id_block.size", "16")));

  @Test
  void should_reserve_first_block_on_start() {
    assertEquals(new IdBlock(0, 16), importer.getIdBlock());
    assertEquals(16, importer.availableIds());
  }

  @Test
  void should_assign_contiguous_ids_across_blocks() {
    Batch first = importer.ingest(batch(10));
    Batch second = importer.ingest(batch(10));

    assertEquals(0, first.getOffset());
    assertEquals(10, second.getOffset());
    assertEquals(new IdBlock(20, 32), importer.getIdBlock());
  }

  @Test
  void should_extend_block_until_more_than_required_ids_are_available() {
    importer.getNextBlock(40);

    assertEquals(48, importer.getIdBlock().getEnd());
    assertTrue(importer.availableIds() > 40);
  }

  @Test
  void should_hand_out_ids_within_block() {
    assertEquals(0, importer.nextId(5));
    assertEquals(5, importer.nextId(0));
    assertThrows(IllegalStateException.class, () -> importer.nextId(12));
  }

  @Test
  void should_relay_batches_to_subscribers_until_cancelled() {
    List<Batch> received = new ArrayList<>();
    Subscription subscription = importer.subscribe(received::add);

    importer.ingest(batch(2));
    subscription.cancel();
    importer.ingest(batch(3));

    assertEquals(1, received.size());
    assertEquals(0, importer.getSubscriberCount());
  }

  @Test
  void should_report_id_block_in_detailed_status() {
    importer.subscribe(batch -> {});
    importer.ingest(batch(4));

    Map<String, Object> status = importer.status(StatusVerbosity.DETAILED);

    assertEquals(12L, status.get("ids.available"));
    assertEquals(4L, status.get("ids.block.next"));
    assertEquals(16L, status.get("ids.block.end"));
    assertEquals(1, status.get("subscribers"));
    assertTrue(importer.status(StatusVerbosity.INFO).isEmpty());
  }

  private static Batch batch(int rows) {
    BatchBuilder builder = new BatchBuilder(SCHEMA);
    for (int i = 0; i < rows; i++) {
      builder.addRow((long) i);
    }
    return builder.build();
  }
}
