/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.telemetry.query.component;

/** Handle of a registration that can be cancelled, e.g. a liveness watch. */
@FunctionalInterface
public interface Subscription {

  Subscription NONE = () -> {};

  /** Cancels the registration. Cancelling twice has no effect. */
  void cancel();
}
