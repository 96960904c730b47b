/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.telemetry.query.exception;

import org.telemetry.query.common.exception.QueryEngineException;

/** Wraps a failure reported by the index or the archive on behalf of a query. */
public class UpstreamFailureException extends QueryEngineException {

  public UpstreamFailureException(String message, Throwable cause) {
    super(message, cause);
  }
}
