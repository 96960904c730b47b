/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.telemetry.query.exporter;

import com.google.common.base.Preconditions;
import com.google.common.math.LongMath;

/**
 * Saturating arithmetic on the number of rows a consumer requested.
 *
 * <p>{@link #UNBOUNDED} is a sentinel for "everything". Adding demand never exceeds the sentinel,
 * and shipping rows out of unbounded demand leaves it unbounded.
 */
public final class Demand {

  public static final long UNBOUNDED = Long.MAX_VALUE;

  private Demand() {}

  /**
   * Returns how much a request for {@code n} more rows adds to the pending demand: {@code
   * min(UNBOUNDED - n, n)}. A request for {@code UNBOUNDED} rows therefore adds nothing; use an
   * explicit extract-all instead.
   */
  public static long increment(long n) {
    Preconditions.checkArgument(n >= 0, "negative demand: %s", n);
    return Math.min(UNBOUNDED - n, n);
  }

  /** Adds a request for {@code n} more rows to {@code requested}, saturating at UNBOUNDED. */
  public static long add(long requested, long n) {
    return LongMath.saturatedAdd(requested, increment(n));
  }

  /** Removes {@code rows} shipped rows from {@code requested}. */
  public static long consume(long requested, long rows) {
    if (requested == UNBOUNDED) {
      return UNBOUNDED;
    }
    Preconditions.checkArgument(
        rows <= requested, "shipping %s rows exceeds demand of %s", rows, requested);
    return requested - rows;
  }
}
