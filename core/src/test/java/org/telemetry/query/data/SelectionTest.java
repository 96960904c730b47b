/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.telemetry.query.data;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class SelectionTest {

  @Test
  void should_count_set_ids() {
    Selection selection = Selection.of(3, 5, 7);

    assertEquals(3, selection.rank());
    assertEquals(2, selection.rank(5));
    assertEquals(3, selection.first());
    assertEquals(7, selection.last());
    assertTrue(selection.contains(5));
    assertFalse(selection.contains(4));
  }

  @Test
  void should_combine_selections() {
    Selection a = Selection.range(0, 10);
    Selection b = Selection.range(5, 15);

    assertEquals(Selection.range(0, 15), a.union(b));
    assertEquals(Selection.range(5, 10), a.intersect(b));
    assertEquals(Selection.range(0, 5), a.subtract(b));
    assertTrue(Selection.range(0, 5).intersect(Selection.range(5, 10)).isEmpty());
  }

  @Test
  void should_detect_overlap_without_building_the_intersection() {
    Selection large = Selection.range(0, 100_000);

    assertTrue(large.intersects(Selection.of(99_999)));
    assertTrue(Selection.of(5).intersects(large));
    assertFalse(large.intersects(Selection.range(100_000, 100_010)));
    assertFalse(Selection.empty().intersects(large));
    assertEquals(100_000, large.rank());
    assertTrue(Selection.range(7, 7).isEmpty());
  }

  @Test
  void should_accumulate_selections_in_place() {
    Selection.Builder accumulator = Selection.builder();
    accumulator.addAll(Selection.range(0, 4));
    Selection before = accumulator.snapshot();

    accumulator.addAll(Selection.range(10, 12));

    assertTrue(accumulator.intersects(Selection.of(11)));
    assertFalse(accumulator.intersects(Selection.range(4, 10)));
    assertEquals(6, accumulator.rank());
    assertEquals(Selection.range(0, 4), before);
    assertEquals(Selection.of(0, 1, 2, 3, 10, 11), accumulator.snapshot());
    assertFalse(accumulator.isEmpty());
  }

  @Test
  void should_split_after_kth_set_bit() {
    Selection selection = Selection.of(1, 2, 8, 9, 20);

    Selection.Split split = selection.split(3);

    assertEquals(Selection.of(1, 2, 8), split.getHead());
    assertEquals(Selection.of(9, 20), split.getTail());
    assertTrue(selection.split(0).getHead().isEmpty());
    assertTrue(selection.split(5).getTail().isEmpty());
    assertThrows(IllegalArgumentException.class, () -> selection.split(6));
  }

  @Test
  void should_report_runs_as_half_open_ranges() {
    List<long[]> runs = Selection.of(1, 2, 3, 7, 9, 10).runs();

    assertEquals(3, runs.size());
    assertArrayEquals(new long[] {1, 4}, runs.get(0));
    assertArrayEquals(new long[] {7, 8}, runs.get(1));
    assertArrayEquals(new long[] {9, 11}, runs.get(2));
    assertEquals("{[1, 4), [7, 8), [9, 11)}", Selection.of(1, 2, 3, 7, 9, 10).toString());
  }

  @Test
  void should_build_from_unordered_ids() {
    Selection selection = Selection.builder().add(9).add(2).add(4).build();

    assertEquals(Selection.of(2, 4, 9), selection);
  }

  @Test
  void should_reject_first_of_empty_selection() {
    assertThrows(IllegalStateException.class, () -> Selection.empty().first());
    assertThrows(IllegalArgumentException.class, () -> Selection.of(-1));
  }
}
