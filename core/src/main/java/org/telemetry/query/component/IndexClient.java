/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.telemetry.query.component;

import org.telemetry.query.data.Selection;

/**
 * Receives the results of an index lookup: a series of hit-sets, one per evaluated partition,
 * followed by {@link #onDone()} after each scheduled batch of partitions.
 */
public interface IndexClient {

  void onHits(Selection hits);

  void onDone();
}
