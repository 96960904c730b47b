/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.telemetry.query.exception;

import org.telemetry.query.common.exception.QueryEngineException;

/** Thrown when a collaborator required to start a query is not available. */
public class MissingComponentException extends QueryEngineException {

  public MissingComponentException(String component) {
    super("missing component: " + component);
  }
}
