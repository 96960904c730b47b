/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.telemetry.query.exception;

import org.telemetry.query.common.exception.QueryEngineException;

/** Thrown when a query expression cannot be specialised to the schema of an observed batch. */
public class ExpressionTailorException extends QueryEngineException {

  public ExpressionTailorException(String message) {
    super(message);
  }
}
