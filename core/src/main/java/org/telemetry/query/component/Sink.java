/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.telemetry.query.component;

import org.telemetry.query.data.Batch;

/** A downstream consumer of query results. */
public interface Sink extends Monitorable {

  void ship(Batch batch);
}
