/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.telemetry.query.data;

import com.google.common.base.Preconditions;
import java.util.ArrayList;
import java.util.List;
import org.roaringbitmap.longlong.LongIterator;
import org.roaringbitmap.longlong.Roaring64NavigableMap;

/**
 * An immutable compressed bitmap over global row ids. Used both for index hits (the ids of rows
 * that a partition reports as candidates) and for the output of a checker over one batch.
 *
 * <p>All operations return new selections; the backing bitmap is never exposed.
 */
public final class Selection {

  private static final Selection EMPTY = new Selection(new Roaring64NavigableMap());

  private final Roaring64NavigableMap bitmap;

  private Selection(Roaring64NavigableMap bitmap) {
    this.bitmap = bitmap;
  }

  public static Selection empty() {
    return EMPTY;
  }

  /** Returns a selection containing exactly the given ids. */
  public static Selection of(long... ids) {
    Roaring64NavigableMap bitmap = new Roaring64NavigableMap();
    for (long id : ids) {
      Preconditions.checkArgument(id >= 0, "row ids must be non-negative: %s", id);
      bitmap.addLong(id);
    }
    return new Selection(bitmap);
  }

  /** Returns a selection containing the ids in {@code [from, to)}. */
  public static Selection range(long from, long to) {
    Preconditions.checkArgument(0 <= from && from <= to, "invalid range [%s, %s)", from, to);
    Roaring64NavigableMap bitmap = new Roaring64NavigableMap();
    if (from < to) {
      bitmap.addRange(from, to);
    }
    return new Selection(bitmap);
  }

  /** Returns a builder that accumulates ids in ascending order or any order. */
  public static Builder builder() {
    return new Builder();
  }

  /** Returns the number of set bits. */
  public long rank() {
    return bitmap.getLongCardinality();
  }

  /** Returns the number of set bits with an id lower than or equal to {@code id}. */
  public long rank(long id) {
    return bitmap.rankLong(id);
  }

  public boolean isEmpty() {
    return bitmap.isEmpty();
  }

  public boolean contains(long id) {
    return bitmap.contains(id);
  }

  /** Returns the smallest set id. */
  public long first() {
    Preconditions.checkState(!isEmpty(), "empty selection has no first id");
    return bitmap.select(0);
  }

  /** Returns the largest set id. */
  public long last() {
    Preconditions.checkState(!isEmpty(), "empty selection has no last id");
    return bitmap.select(rank() - 1);
  }

  public Selection union(Selection other) {
    Roaring64NavigableMap result = new Roaring64NavigableMap();
    result.or(bitmap);
    result.or(other.bitmap);
    return new Selection(result);
  }

  public Selection intersect(Selection other) {
    Roaring64NavigableMap result = new Roaring64NavigableMap();
    result.or(bitmap);
    result.and(other.bitmap);
    return new Selection(result);
  }

  /** Returns whether this selection shares at least one id with {@code other}. */
  public boolean intersects(Selection other) {
    return overlap(bitmap, other.bitmap);
  }

  /** Returns the ids of this selection that are not in {@code other}. */
  public Selection subtract(Selection other) {
    Roaring64NavigableMap result = new Roaring64NavigableMap();
    result.or(bitmap);
    result.andNot(other.bitmap);
    return new Selection(result);
  }

  /**
   * Splits this selection after its {@code k}-th set bit.
   *
   * @param k number of set bits that go to the head, {@code 0 <= k <= rank()}
   * @return the head holding the {@code k} smallest ids and the tail holding the rest
   */
  public Split split(long k) {
    long rank = rank();
    Preconditions.checkArgument(0 <= k && k <= rank, "split point %s out of [0, %s]", k, rank);
    Roaring64NavigableMap head = new Roaring64NavigableMap();
    Roaring64NavigableMap tail = new Roaring64NavigableMap();
    LongIterator it = bitmap.getLongIterator();
    long seen = 0;
    while (it.hasNext()) {
      long id = it.next();
      if (seen++ < k) {
        head.addLong(id);
      } else {
        tail.addLong(id);
      }
    }
    return new Split(new Selection(head), new Selection(tail));
  }

  /** Returns the maximal runs of consecutive set ids as half-open {@code [from, to)} pairs. */
  public List<long[]> runs() {
    List<long[]> runs = new ArrayList<>();
    LongIterator it = bitmap.getLongIterator();
    long from = -1;
    long to = -1;
    while (it.hasNext()) {
      long id = it.next();
      if (id == to) {
        to++;
      } else {
        if (from >= 0) {
          runs.add(new long[] {from, to});
        }
        from = id;
        to = id + 1;
      }
    }
    if (from >= 0) {
      runs.add(new long[] {from, to});
    }
    return runs;
  }

  private static boolean overlap(Roaring64NavigableMap a, Roaring64NavigableMap b) {
    if (a.isEmpty() || b.isEmpty()) {
      return false;
    }
    Roaring64NavigableMap smaller = a.getLongCardinality() <= b.getLongCardinality() ? a : b;
    Roaring64NavigableMap larger = smaller == a ? b : a;
    Roaring64NavigableMap shared = new Roaring64NavigableMap();
    shared.or(smaller);
    shared.and(larger);
    return !shared.isEmpty();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Selection)) {
      return false;
    }
    return bitmap.equals(((Selection) o).bitmap);
  }

  @Override
  public int hashCode() {
    return bitmap.hashCode();
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("{");
    List<long[]> runs = runs();
    for (int i = 0; i < runs.size(); i++) {
      if (i > 0) {
        sb.append(", ");
      }
      sb.append('[').append(runs.get(i)[0]).append(", ").append(runs.get(i)[1]).append(')');
    }
    return sb.append('}').toString();
  }

  /** The two halves of {@link #split(long)}. */
  public static final class Split {
    private final Selection head;
    private final Selection tail;

    private Split(Selection head, Selection tail) {
      this.head = head;
      this.tail = tail;
    }

    public Selection getHead() {
      return head;
    }

    public Selection getTail() {
      return tail;
    }
  }

  /**
   * Accumulates ids into a new selection. The accumulated ids can be inspected before building, so
   * a builder also serves as a growing set that is updated in place.
   */
  public static final class Builder {
    private Roaring64NavigableMap bitmap = new Roaring64NavigableMap();

    private Builder() {}

    public Builder add(long id) {
      bitmap.addLong(id);
      return this;
    }

    public Builder addAll(Selection selection) {
      bitmap.or(selection.bitmap);
      return this;
    }

    public boolean intersects(Selection selection) {
      return overlap(bitmap, selection.bitmap);
    }

    public long rank() {
      return bitmap.getLongCardinality();
    }

    public boolean isEmpty() {
      return bitmap.isEmpty();
    }

    /** Returns a selection of the ids accumulated so far without resetting the builder. */
    public Selection snapshot() {
      Roaring64NavigableMap copy = new Roaring64NavigableMap();
      copy.or(bitmap);
      return new Selection(copy);
    }

    public Selection build() {
      Selection selection = new Selection(bitmap);
      bitmap = new Roaring64NavigableMap();
      return selection;
    }
  }
}
