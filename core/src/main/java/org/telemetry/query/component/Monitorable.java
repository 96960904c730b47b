/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.telemetry.query.component;

import java.util.function.Consumer;

/** A collaborator whose liveness can be watched. */
public interface Monitorable {

  /**
   * Registers a listener that is notified once when this component goes away.
   *
   * @param listener receives the reason the component terminated
   * @return a subscription cancelling the watch
   */
  Subscription watch(Consumer<ExitReason> listener);
}
