/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.telemetry.query.exporter;

import java.util.Map;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;
import org.telemetry.query.common.response.ResponseListener;
import org.telemetry.query.component.Archive;
import org.telemetry.query.component.ExitReason;
import org.telemetry.query.component.Index;
import org.telemetry.query.component.LookupHandle;
import org.telemetry.query.component.Sink;
import org.telemetry.query.data.Batch;
import org.telemetry.query.data.Selection;
import org.telemetry.query.telemetry.Accountant;

/**
 * An event in the mailbox of an {@link Exporter}. Each message knows which handler of the
 * exporter it is routed to; the handler decides whether the message is consumed or deferred.
 */
public interface ExporterMessage {

  /** Outcome of handling a message. */
  enum Disposition {
    /** The message was processed. */
    CONSUMED,

    /** The message arrived too early; it is retried after the next consumed message. */
    SKIPPED
  }

  Disposition applyTo(Exporter exporter);

  // -- consumer demand ------------------------------------------------------------------------

  /** Ask for all remaining results. */
  @ToString
  final class ExtractAll implements ExporterMessage {
    @Override
    public Disposition applyTo(Exporter exporter) {
      return exporter.onExtractAll();
    }
  }

  /** Ask for {@code count} more results. */
  @Getter
  @ToString
  @RequiredArgsConstructor
  final class Extract implements ExporterMessage {
    private final long count;

    @Override
    public Disposition applyTo(Exporter exporter) {
      return exporter.onExtract(count);
    }
  }

  // -- registration ---------------------------------------------------------------------------

  /** Register the telemetry endpoint. */
  @Getter
  @ToString
  @RequiredArgsConstructor
  final class RegisterAccountant implements ExporterMessage {
    private final Accountant accountant;

    @Override
    public Disposition applyTo(Exporter exporter) {
      return exporter.onRegister(accountant);
    }
  }

  /** Register the archive. */
  @Getter
  @ToString
  @RequiredArgsConstructor
  final class RegisterArchive implements ExporterMessage {
    private final Archive archive;

    @Override
    public Disposition applyTo(Exporter exporter) {
      return exporter.onRegister(archive);
    }
  }

  /** Register the index. */
  @Getter
  @ToString
  @RequiredArgsConstructor
  final class RegisterIndex implements ExporterMessage {
    private final Index index;

    @Override
    public Disposition applyTo(Exporter exporter) {
      return exporter.onRegister(index);
    }
  }

  /** Register a sink. */
  @Getter
  @ToString
  @RequiredArgsConstructor
  final class RegisterSink implements ExporterMessage {
    private final Sink sink;

    @Override
    public Disposition applyTo(Exporter exporter) {
      return exporter.onRegister(sink);
    }
  }

  /** Register the receiver of the final statistics. */
  @Getter
  @ToString
  @RequiredArgsConstructor
  final class RegisterStatisticsSubscriber implements ExporterMessage {
    private final StatisticsSubscriber subscriber;

    @Override
    public Disposition applyTo(Exporter exporter) {
      return exporter.onRegister(subscriber);
    }
  }

  // -- lifecycle ------------------------------------------------------------------------------

  /** Start the query. */
  @ToString
  final class Run implements ExporterMessage {
    @Override
    public Disposition applyTo(Exporter exporter) {
      return exporter.onRun();
    }
  }

  /** The index accepted the query. */
  @Getter
  @ToString
  @RequiredArgsConstructor
  final class LookupStarted implements ExporterMessage {
    private final LookupHandle handle;

    @Override
    public Disposition applyTo(Exporter exporter) {
      return exporter.onLookupStarted(handle);
    }
  }

  /** The initial index round-trip failed. */
  @Getter
  @ToString
  @RequiredArgsConstructor
  final class LookupFailed implements ExporterMessage {
    private final Exception error;

    @Override
    public Disposition applyTo(Exporter exporter) {
      return exporter.onLookupFailed(error);
    }
  }

  /** A watched collaborator went away. */
  @Getter
  @ToString
  @RequiredArgsConstructor
  final class Disconnected implements ExporterMessage {
    private final Object source;
    private final ExitReason reason;

    @Override
    public Disposition applyTo(Exporter exporter) {
      return exporter.onDisconnected(source, reason);
    }
  }

  /** Terminate the exporter. */
  @Getter
  @ToString
  @RequiredArgsConstructor
  final class Exit implements ExporterMessage {
    private final ExitReason reason;

    @Override
    public Disposition applyTo(Exporter exporter) {
      return exporter.onExit(reason);
    }
  }

  /** Report diagnostics. */
  @Getter
  @ToString
  @RequiredArgsConstructor
  final class StatusRequest implements ExporterMessage {
    private final StatusVerbosity verbosity;
    private final ResponseListener<Map<String, Object>> listener;

    @Override
    public Disposition applyTo(Exporter exporter) {
      return exporter.onStatus(verbosity, listener);
    }
  }

  // -- data -----------------------------------------------------------------------------------

  /** A batch from the archive or from the continuous ingestion stream. */
  @Getter
  @ToString
  @RequiredArgsConstructor
  final class BatchArrived implements ExporterMessage {
    private final Batch batch;

    @Override
    public Disposition applyTo(Exporter exporter) {
      return exporter.onBatch(batch);
    }
  }

  /** Hits of one partition from the index. */
  @Getter
  @ToString
  @RequiredArgsConstructor
  final class Hits implements ExporterMessage {
    private final Selection hits;

    @Override
    public Disposition applyTo(Exporter exporter) {
      return exporter.onHits(hits);
    }
  }

  /** The index finished the most recently scheduled partitions. */
  @ToString
  final class IndexDone implements ExporterMessage {
    @Override
    public Disposition applyTo(Exporter exporter) {
      return exporter.onIndexDone();
    }
  }

  /** The archive finished one round-trip. */
  @Getter
  @ToString
  @RequiredArgsConstructor
  final class ArchiveDone implements ExporterMessage {
    private final Throwable error;

    @Override
    public Disposition applyTo(Exporter exporter) {
      return exporter.onArchiveDone(error);
    }
  }
}
