/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.telemetry.query.expression.checker;

import org.telemetry.query.data.Batch;

/** A compiled test of one row of a batch. */
@FunctionalInterface
interface RowPredicate {

  RowPredicate TRUE = (batch, position) -> true;

  RowPredicate FALSE = (batch, position) -> false;

  boolean test(Batch batch, int position);
}
