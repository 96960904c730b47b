/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.telemetry.query.component;

import com.google.common.base.Preconditions;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/** Why a component terminated: normally, by a forceful kill, or because of an error. */
@Getter
@EqualsAndHashCode
public final class ExitReason {

  /** Exit kinds. */
  public enum Kind {
    NORMAL,
    KILL,
    ERROR
  }

  public static final ExitReason NORMAL = new ExitReason(Kind.NORMAL, null);

  public static final ExitReason KILL = new ExitReason(Kind.KILL, null);

  private final Kind kind;
  private final Throwable cause;

  private ExitReason(Kind kind, Throwable cause) {
    this.kind = kind;
    this.cause = cause;
  }

  public static ExitReason error(Throwable cause) {
    Preconditions.checkNotNull(cause, "an error exit needs a cause");
    return new ExitReason(Kind.ERROR, cause);
  }

  public boolean isNormal() {
    return kind == Kind.NORMAL;
  }

  public boolean isKill() {
    return kind == Kind.KILL;
  }

  @Override
  public String toString() {
    return cause == null ? kind.name().toLowerCase() : "error: " + cause.getMessage();
  }
}
