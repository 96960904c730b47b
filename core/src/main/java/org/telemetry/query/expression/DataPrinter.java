/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.telemetry.query.expression;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Iterator;
import lombok.experimental.UtilityClass;

/**
 * Renders literal values. Integers carry a forced sign, strings are double-quoted with quotes and
 * backslashes escaped, booleans print as {@code T}/{@code F} and null as {@code nil}.
 */
@UtilityClass
public class DataPrinter {

  public String print(Object value) {
    StringBuilder out = new StringBuilder();
    print(out, value);
    return out.toString();
  }

  public void print(StringBuilder out, Object value) {
    if (value == null) {
      out.append("nil");
    } else if (value instanceof Boolean) {
      out.append((Boolean) value ? 'T' : 'F');
    } else if (value instanceof Long || value instanceof Integer) {
      long x = ((Number) value).longValue();
      if (x >= 0) {
        out.append('+');
      }
      out.append(x);
    } else if (value instanceof Number) {
      out.append(value);
    } else if (value instanceof String) {
      printString(out, (String) value);
    } else if (value instanceof Instant) {
      out.append(value);
    } else if (value instanceof Duration) {
      out.append(((Duration) value).toMillis()).append("ms");
    } else if (value instanceof Collection) {
      out.append('[');
      Iterator<?> it = ((Collection<?>) value).iterator();
      while (it.hasNext()) {
        print(out, it.next());
        if (it.hasNext()) {
          out.append(", ");
        }
      }
      out.append(']');
    } else {
      out.append(value);
    }
  }

  private void printString(StringBuilder out, String s) {
    out.append('"');
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      switch (c) {
        case '"':
          out.append("\\\"");
          break;
        case '\\':
          out.append("\\\\");
          break;
        case '\n':
          out.append("\\n");
          break;
        case '\t':
          out.append("\\t");
          break;
        default:
          out.append(c);
      }
    }
    out.append('"');
  }
}
