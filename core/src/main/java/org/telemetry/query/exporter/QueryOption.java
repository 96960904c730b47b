/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.telemetry.query.exporter;

/** Query options. A query has at least one of them and may have both. */
public enum QueryOption {
  /** Evaluate the query over data that was already ingested. */
  HISTORICAL,

  /** Evaluate the query over newly ingested data until the query is stopped. */
  CONTINUOUS
}
