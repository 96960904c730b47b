/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.telemetry.query.exporter;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.telemetry.query.exporter.Demand.UNBOUNDED;

import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class DemandTest {

  @Test
  void should_add_small_requests() {
    assertEquals(10, Demand.add(0, 10));
    assertEquals(15, Demand.add(10, 5));
  }

  @Test
  void should_treat_request_for_unbounded_rows_as_no_op() {
    assertEquals(0, Demand.increment(UNBOUNDED));
    assertEquals(7, Demand.add(7, UNBOUNDED));
  }

  @Test
  void should_cap_increment_near_the_sentinel() {
    assertEquals(1, Demand.increment(UNBOUNDED - 1));
    assertEquals(UNBOUNDED / 2, Demand.increment(UNBOUNDED / 2));
  }

  @Test
  void should_saturate_at_unbounded() {
    assertEquals(UNBOUNDED, Demand.add(UNBOUNDED - 3, 10));
    assertEquals(UNBOUNDED, Demand.add(UNBOUNDED, 10));
  }

  @Test
  void should_keep_unbounded_demand_when_consuming() {
    assertEquals(UNBOUNDED, Demand.consume(UNBOUNDED, 1_000_000));
    assertEquals(3, Demand.consume(10, 7));
  }

  @Test
  void should_reject_shipping_more_than_requested() {
    assertThrows(IllegalArgumentException.class, () -> Demand.consume(5, 6));
    assertThrows(IllegalArgumentException.class, () -> Demand.increment(-1));
  }
}
