/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.telemetry.query.common.exception;

/** Base exception for all query engine failures that terminate a query. */
public class QueryEngineException extends RuntimeException {

  public QueryEngineException(String message) {
    super(message);
  }

  public QueryEngineException(String message, Throwable cause) {
    super(message, cause);
  }
}
