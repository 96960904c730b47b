/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.telemetry.query.component;

import java.util.UUID;
import org.telemetry.query.common.response.ResponseListener;
import org.telemetry.query.expression.Expression;

/**
 * The partition index. Decides which partitions qualify for an expression and evaluates them in
 * batches on request, delivering hits to the {@link IndexClient} of the lookup.
 */
public interface Index extends Monitorable {

  /**
   * Starts a lookup.
   *
   * @param expression the query expression
   * @param client receives hits and completion signals of this lookup
   * @param listener receives the lookup handle, or the failure of the round-trip
   */
  void lookup(Expression expression, IndexClient client, ResponseListener<LookupHandle> listener);

  /**
   * Asks the index to evaluate more partitions of a lookup. Requesting zero partitions tells the
   * index to stop delivering results for the lookup.
   *
   * @param lookupId the lookup id of a {@link LookupHandle}
   * @param partitions number of partitions to evaluate next
   */
  void requestPartitions(UUID lookupId, int partitions);
}
