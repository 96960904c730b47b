/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.telemetry.query.exporter;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import lombok.Getter;
import lombok.extern.log4j.Log4j2;
import org.telemetry.query.common.response.ResponseListener;
import org.telemetry.query.common.setting.Settings;
import org.telemetry.query.component.Archive;
import org.telemetry.query.component.ArchiveClient;
import org.telemetry.query.component.ExitReason;
import org.telemetry.query.component.Index;
import org.telemetry.query.component.IndexClient;
import org.telemetry.query.component.LookupHandle;
import org.telemetry.query.component.Monitorable;
import org.telemetry.query.component.Sink;
import org.telemetry.query.component.Subscription;
import org.telemetry.query.data.Batch;
import org.telemetry.query.data.Batches;
import org.telemetry.query.data.Selection;
import org.telemetry.query.exception.ExpressionTailorException;
import org.telemetry.query.exception.MissingComponentException;
import org.telemetry.query.exception.UpstreamFailureException;
import org.telemetry.query.exporter.ExporterMessage.Disposition;
import org.telemetry.query.expression.Expression;
import org.telemetry.query.expression.checker.Checker;
import org.telemetry.query.telemetry.Accountant;
import org.telemetry.query.telemetry.Report;

/**
 * Coordinates the execution of one query.
 *
 * <ol>
 *   <li>Asks the index which partitions qualify and receives hit-sets partition by partition
 *   <li>Forwards each hit-set to the archive, which materializes the rows as batches
 *   <li>Filters every batch with a checker compiled for the batch's schema
 *   <li>Buffers qualifying rows and ships them to the sinks as far as the consumers asked for them
 *   <li>Requests more partitions from the index only when demand is left and nothing is in flight
 * </ol>
 *
 * <p>All state is owned by a single logical thread: public methods only enqueue an {@link
 * ExporterMessage}, and the mailbox is drained on the supplied executor by at most one thread at a
 * time. Messages that arrive before their prerequisites are deferred and retried after the next
 * consumed message.
 */
@Log4j2
public class Exporter {

  /** Exporter lifecycle states. */
  public enum State {
    CREATED,
    RUNNING,
    TERMINATED
  }

  @Getter private final String name;
  @Getter private final Expression expression;
  @Getter private final Set<QueryOption> options;
  private final Executor executor;
  private final Clock clock;
  private final int partitionsPerRequest;
  private final boolean statusIncludesBuffer;

  private final Queue<ExporterMessage> mailbox = new ConcurrentLinkedQueue<>();
  private final List<ExporterMessage> stash = new ArrayList<>();
  private final AtomicBoolean draining = new AtomicBoolean(false);
  private final CompletableFuture<ExitReason> termination = new CompletableFuture<>();

  private final QueryStatus query = new QueryStatus();
  private final ResultBuffer results = new ResultBuffer();
  private final CheckerCache checkers;
  private final StatisticsReporter statistics;
  private final List<Subscription> subscriptions = new ArrayList<>();
  private final List<Sink> sinks = new ArrayList<>();
  private final IndexClient indexClient = new ExporterIndexClient();
  private final ArchiveClient archiveClient = new ExporterArchiveClient();
  private final Selection.Builder hits = Selection.builder();

  private volatile State state = State.CREATED;
  private Instant start;
  private UUID lookupId;
  private boolean finished;
  private Index index;
  private Archive archive;
  private Accountant accountant;
  private StatisticsSubscriber statisticsSubscriber;

  public Exporter(
      String name,
      Expression expression,
      Set<QueryOption> options,
      Settings settings,
      Executor executor) {
    this(name, expression, options, settings, executor, Clock.systemUTC());
  }

  public Exporter(
      String name,
      Expression expression,
      Set<QueryOption> options,
      Settings settings,
      Executor executor,
      Clock clock) {
    Preconditions.checkArgument(!options.isEmpty(), "a query needs at least one query option");
    this.name = name;
    this.expression = expression;
    this.options = ImmutableSet.copyOf(options);
    this.executor = executor;
    this.clock = clock;
    Integer perRequest = settings.getSettingValue(Settings.Key.EXPORTER_PARTITIONS_PER_REQUEST);
    Preconditions.checkArgument(perRequest > 0, "partitions per request must be positive");
    this.partitionsPerRequest = perRequest;
    Boolean includeBuffer = settings.getSettingValue(Settings.Key.EXPORTER_STATUS_INCLUDE_BUFFER);
    this.statusIncludesBuffer = includeBuffer;
    this.checkers = new CheckerCache(expression);
    this.statistics = new StatisticsReporter(name);
    if (isContinuous()) {
      log.debug("{} has continuous query option", name);
    }
  }

  // -- public interface -----------------------------------------------------------------------

  /** Enqueues a message. Never blocks; messages sent after termination are dropped. */
  public void tell(ExporterMessage message) {
    mailbox.add(message);
    scheduleDrain();
  }

  public void extractAll() {
    tell(new ExporterMessage.ExtractAll());
  }

  public void extract(long count) {
    Preconditions.checkArgument(count >= 0, "cannot extract a negative number of rows");
    tell(new ExporterMessage.Extract(count));
  }

  public void register(Accountant newAccountant) {
    tell(new ExporterMessage.RegisterAccountant(newAccountant));
  }

  public void register(Archive newArchive) {
    tell(new ExporterMessage.RegisterArchive(newArchive));
  }

  public void register(Index newIndex) {
    tell(new ExporterMessage.RegisterIndex(newIndex));
  }

  public void register(Sink sink) {
    tell(new ExporterMessage.RegisterSink(sink));
  }

  public void register(StatisticsSubscriber subscriber) {
    tell(new ExporterMessage.RegisterStatisticsSubscriber(subscriber));
  }

  public void run() {
    tell(new ExporterMessage.Run());
  }

  public void status(StatusVerbosity verbosity, ResponseListener<Map<String, Object>> listener) {
    tell(new ExporterMessage.StatusRequest(verbosity, listener));
  }

  public void exit(ExitReason reason) {
    tell(new ExporterMessage.Exit(reason));
  }

  /** Terminates without sending final statistics. */
  public void kill() {
    exit(ExitReason.KILL);
  }

  /** Returns the endpoint the index delivers hits and completion signals to. */
  public IndexClient getIndexClient() {
    return indexClient;
  }

  /** Returns the endpoint the archive delivers batches and completion signals to. */
  public ArchiveClient getArchiveClient() {
    return archiveClient;
  }

  /** Returns a consumer feeding batches of the continuous ingestion stream into this exporter. */
  public Consumer<Batch> getBatchConsumer() {
    return batch -> tell(new ExporterMessage.BatchArrived(batch));
  }

  /**
   * Returns a future completed on termination: normally with the exit reason for normal exits and
   * kills, exceptionally with the cause for errors.
   */
  public CompletableFuture<ExitReason> getTermination() {
    return termination;
  }

  public State getState() {
    return state;
  }

  public boolean isHistorical() {
    return options.contains(QueryOption.HISTORICAL);
  }

  public boolean isContinuous() {
    return options.contains(QueryOption.CONTINUOUS);
  }

  @VisibleForTesting
  QueryStatus getQueryStatus() {
    return query.snapshot();
  }

  @VisibleForTesting
  ResultBuffer getResults() {
    return results;
  }

  @VisibleForTesting
  CheckerCache getCheckers() {
    return checkers;
  }

  @VisibleForTesting
  Selection getHits() {
    return hits.snapshot();
  }

  // -- mailbox --------------------------------------------------------------------------------

  private void scheduleDrain() {
    if (draining.compareAndSet(false, true)) {
      executor.execute(this::drain);
    }
  }

  private void drain() {
    try {
      ExporterMessage message;
      while ((message = mailbox.poll()) != null) {
        dispatch(message);
      }
    } finally {
      draining.set(false);
    }
    if (!mailbox.isEmpty()) {
      scheduleDrain();
    }
  }

  private void dispatch(ExporterMessage message) {
    if (state == State.TERMINATED) {
      log.debug("{} drops {} after termination", name, message);
      return;
    }
    if (handle(message) == Disposition.SKIPPED) {
      log.debug("{} defers {}", name, message);
      stash.add(message);
      return;
    }
    retryStash();
  }

  /** Retries deferred messages in arrival order until none of them can be consumed. */
  private void retryStash() {
    boolean progress = true;
    while (progress && !stash.isEmpty() && state != State.TERMINATED) {
      progress = false;
      Iterator<ExporterMessage> it = stash.iterator();
      while (it.hasNext()) {
        ExporterMessage deferred = it.next();
        if (handle(deferred) == Disposition.CONSUMED) {
          // Termination clears the stash and invalidates the iterator.
          if (state == State.TERMINATED) {
            return;
          }
          it.remove();
          progress = true;
          break;
        }
      }
    }
  }

  private Disposition handle(ExporterMessage message) {
    try {
      return message.applyTo(this);
    } catch (RuntimeException e) {
      log.error("{} failed to handle {}", name, message, e);
      terminate(ExitReason.error(e));
      return Disposition.CONSUMED;
    }
  }

  // -- consumer demand ------------------------------------------------------------------------

  Disposition onExtractAll() {
    log.debug("{} got request to extract all events", name);
    if (query.requested == Demand.UNBOUNDED) {
      log.warn("{} ignores extract request, already getting all", name);
      return Disposition.CONSUMED;
    }
    query.requested = Demand.UNBOUNDED;
    shipResults();
    requestMoreHits();
    return Disposition.CONSUMED;
  }

  Disposition onExtract(long count) {
    if (count == 0) {
      log.warn("{} ignores extract request for 0 results", name);
      return Disposition.CONSUMED;
    }
    if (query.requested == Demand.UNBOUNDED) {
      log.warn("{} ignores extract request, already getting all", name);
      return Disposition.CONSUMED;
    }
    log.debug(
        "{} got a request to extract {} more results in addition to {} pending results",
        name,
        Demand.increment(count),
        query.requested);
    query.requested = Demand.add(query.requested, count);
    shipResults();
    requestMoreHits();
    return Disposition.CONSUMED;
  }

  // -- registration ---------------------------------------------------------------------------

  Disposition onRegister(Accountant newAccountant) {
    accountant = newAccountant;
    accountant.announce(name);
    return Disposition.CONSUMED;
  }

  Disposition onRegister(Archive newArchive) {
    log.debug("{} registers archive {}", name, newArchive);
    archive = newArchive;
    if (isContinuous()) {
      monitor(archive);
    }
    if (isHistorical()) {
      archive.register(archiveClient);
    }
    return Disposition.CONSUMED;
  }

  Disposition onRegister(Index newIndex) {
    log.debug("{} registers index {}", name, newIndex);
    index = newIndex;
    if (isContinuous()) {
      monitor(index);
    }
    return Disposition.CONSUMED;
  }

  Disposition onRegister(Sink sink) {
    log.debug("{} registers sink {}", name, sink);
    sinks.add(sink);
    monitor(sink);
    shipResults();
    return Disposition.CONSUMED;
  }

  Disposition onRegister(StatisticsSubscriber subscriber) {
    log.debug("{} registers statistics subscriber {}", name, subscriber);
    statisticsSubscriber = subscriber;
    return Disposition.CONSUMED;
  }

  private void monitor(Monitorable collaborator) {
    subscriptions.add(
        collaborator.watch(reason -> tell(new ExporterMessage.Disconnected(collaborator, reason))));
  }

  // -- lifecycle ------------------------------------------------------------------------------

  Disposition onRun() {
    log.info("{} executes query: {}", name, expression);
    state = State.RUNNING;
    start = clock.instant();
    if (!isHistorical()) {
      return Disposition.CONSUMED;
    }
    if (index == null) {
      terminate(ExitReason.error(new MissingComponentException("index")));
      return Disposition.CONSUMED;
    }
    if (archive == null) {
      terminate(ExitReason.error(new MissingComponentException("archive")));
      return Disposition.CONSUMED;
    }
    index.lookup(
        expression,
        indexClient,
        new ResponseListener<>() {
          @Override
          public void onResponse(LookupHandle handle) {
            tell(new ExporterMessage.LookupStarted(handle));
          }

          @Override
          public void onFailure(Exception e) {
            tell(new ExporterMessage.LookupFailed(e));
          }
        });
    return Disposition.CONSUMED;
  }

  Disposition onLookupStarted(LookupHandle handle) {
    log.info(
        "{} got lookup handle {}, scheduled {}/{} partitions",
        name,
        handle.getId(),
        handle.getScheduled(),
        handle.getPartitions());
    lookupId = handle.getId();
    if (handle.getPartitions() > 0) {
      query.expected = handle.getPartitions();
      query.scheduled = handle.getScheduled();
    } else {
      shutdown();
    }
    return Disposition.CONSUMED;
  }

  Disposition onLookupFailed(Exception error) {
    log.error("{} failed to start the index lookup", name, error);
    shutdown(new UpstreamFailureException("index lookup failed: " + error.getMessage(), error));
    return Disposition.CONSUMED;
  }

  Disposition onDisconnected(Object source, ExitReason reason) {
    log.debug("{} received DOWN from {} with reason {}", name, source, reason);
    terminate(reason);
    return Disposition.CONSUMED;
  }

  Disposition onExit(ExitReason reason) {
    log.debug("{} received exit with reason {}", name, reason);
    terminate(reason);
    return Disposition.CONSUMED;
  }

  Disposition onStatus(StatusVerbosity verbosity, ResponseListener<Map<String, Object>> listener) {
    Map<String, Object> result = new LinkedHashMap<>();
    Map<String, Object> exporterStatus = new LinkedHashMap<>();
    result.put("exporter", exporterStatus);
    if (verbosity.isAtLeast(StatusVerbosity.INFO)) {
      Map<String, Object> queryStatus = new LinkedHashMap<>();
      queryStatus.put("expression", expression.toString());
      if (verbosity.isAtLeast(StatusVerbosity.DETAILED)) {
        queryStatus.put("hits", hits.rank());
        queryStatus.put("start", start == null ? "" : start.toString());
      }
      result.put("queries", List.of(queryStatus));
    }
    if (verbosity.isAtLeast(StatusVerbosity.DETAILED)) {
      exporterStatus.put("name", name);
      exporterStatus.put("state", state.name());
      exporterStatus.put("mailbox-size", mailbox.size());
      exporterStatus.put("stashed", stash.size());
      if (statusIncludesBuffer) {
        exporterStatus.put("buffered-batches", results.size());
        exporterStatus.put("cached", query.cached);
      }
    }
    if (verbosity.isAtLeast(StatusVerbosity.DEBUG)) {
      exporterStatus.put("query", query.toMap());
    }
    listener.onResponse(result);
    return Disposition.CONSUMED;
  }

  // -- data -----------------------------------------------------------------------------------

  Disposition onBatch(Batch batch) {
    log.debug("{} got batch of {} events", name, batch.getPositionCount());
    Checker checker;
    try {
      checker = checkers.get(batch.getSchema());
    } catch (ExpressionTailorException e) {
      log.error("{} failed to tailor expression: {}", name, e.getMessage());
      shipResults();
      shutdown(e);
      return Disposition.CONSUMED;
    }
    query.processed += batch.getPositionCount();
    Selection selection = checker.evaluate(batch);
    long selected = selection.rank();
    if (selected == 0) {
      return Disposition.CONSUMED;
    }
    query.cached += selected;
    results.addAll(Batches.select(batch, selection));
    shipResults();
    return Disposition.CONSUMED;
  }

  Disposition onHits(Selection newHits) {
    // Skip results that arrive before we got our lookup handle from the index.
    if (query.expected == 0) {
      return Disposition.SKIPPED;
    }
    if (finished) {
      log.warn("{} drops {} hits that arrived after the query finished", name, newHits.rank());
      return Disposition.CONSUMED;
    }
    Duration runtime = updateRuntime();
    long count = newHits.rank();
    if (accountant != null) {
      Report.Builder report = Report.builder();
      if (hits.isEmpty()) {
        report.put("exporter.hits.first", runtime);
      }
      report.put("exporter.hits.arrived", runtime).put("exporter.hits.count", count);
      accountant.report(report.build());
    }
    if (count == 0) {
      log.warn("{} got empty hits", name);
      return Disposition.CONSUMED;
    }
    Preconditions.checkState(
        !hits.intersects(newHits), "%s got hits overlapping earlier hits", name);
    log.debug(
        "{} got {} index hits in [{}, {})", name, count, newHits.first(), newHits.last() + 1);
    hits.addAll(newHits);
    log.debug("{} forwards hits to archive", name);
    query.lookupsIssued++;
    archive.lookup(newHits, archiveClient);
    return Disposition.CONSUMED;
  }

  Disposition onIndexDone() {
    if (query.expected == 0) {
      return Disposition.SKIPPED;
    }
    // Ignore this message until we got all lookup results from the archive. Otherwise, we can end
    // up in weirdly interleaved state.
    if (query.lookupsIssued != query.lookupsComplete) {
      return Disposition.SKIPPED;
    }
    Duration runtime = updateRuntime();
    query.received += query.scheduled;
    Preconditions.checkState(
        query.received <= query.expected,
        "%s received %s of %s partitions",
        name,
        query.received,
        query.expected);
    if (query.received < query.expected) {
      log.debug("{} received hits from {}/{} partitions", name, query.received, query.expected);
      requestMoreHits();
    } else {
      log.debug(
          "{} received all hits from {} partition(s) in {}", name, query.expected, runtime);
      if (accountant != null) {
        accountant.report(Report.of("exporter.hits.runtime", runtime));
      }
      if (query.isFinished()) {
        Preconditions.checkState(!finished, "%s finished twice", name);
        finished = true;
        shutdown();
      }
    }
    return Disposition.CONSUMED;
  }

  Disposition onArchiveDone(Throwable error) {
    if (error != null) {
      log.error("{} received failed lookup from archive", name, error);
    }
    query.lookupsComplete++;
    log.debug("{} received done from archive: {}", name, query);
    Preconditions.checkState(
        query.lookupsComplete <= query.lookupsIssued,
        "%s completed more archive lookups than it issued",
        name);
    // The index 'done' is deferred until all lookups completed, so we can never be finished here.
    Preconditions.checkState(
        query.expected == 0 || !query.isFinished(),
        "%s finished before the index was done",
        name);
    return Disposition.CONSUMED;
  }

  // -- internals ------------------------------------------------------------------------------

  private Duration updateRuntime() {
    Duration runtime = start == null ? Duration.ZERO : Duration.between(start, clock.instant());
    query.runtime = runtime;
    return runtime;
  }

  private void shipResults() {
    if (sinks.isEmpty()) {
      log.debug("{} holds {} events until a sink registers", name, query.cached);
      return;
    }
    log.debug("{} relays {} events", name, query.cached);
    while (query.requested > 0 && query.cached > 0) {
      // Either we grab the entire first batch or we split it up.
      Batch batch = results.take(query.requested);
      long rows = batch.getPositionCount();
      Preconditions.checkState(rows <= query.cached);
      query.cached -= rows;
      query.requested = Demand.consume(query.requested, rows);
      query.shipped += rows;
      for (Sink sink : sinks) {
        sink.ship(batch);
      }
    }
    Preconditions.checkState(
        query.cached == results.getRows(),
        "%s caches %s rows but buffers %s",
        name,
        query.cached,
        results.getRows());
  }

  private void requestMoreHits() {
    if (!isHistorical()) {
      log.warn("{} requested more hits for continuous query", name);
      return;
    }
    // Do nothing if we already shipped everything the client asked for.
    if (query.requested == 0) {
      log.debug(
          "{} shipped {} results and waits for client to request more", name, query.shipped);
      return;
    }
    // Do nothing if we are still waiting for results from the archive.
    if (query.lookupsIssued > query.lookupsComplete) {
      log.debug(
          "{} currently awaits {} more lookup results from the archive",
          name,
          query.lookupsIssued - query.lookupsComplete);
      return;
    }
    // Do nothing if we received everything.
    if (query.received == query.expected) {
      log.debug("{} received hits for all {} partitions", name, query.expected);
      return;
    }
    long remaining = query.expected - query.received;
    int n = (int) Math.min(remaining, partitionsPerRequest);
    // Store how many partitions we schedule with our request. When receiving 'done', we add this
    // number to 'received'.
    query.scheduled = n;
    log.debug("{} asks index to process {} more partitions", name, n);
    index.requestPartitions(lookupId, n);
  }

  /** Terminates a historical query normally. Continuous queries keep running. */
  private void shutdown() {
    if (isContinuous()) {
      return;
    }
    log.debug("{} initiates shutdown", name);
    terminate(ExitReason.NORMAL);
  }

  private void shutdown(Throwable error) {
    log.debug("{} initiates shutdown with error {}", name, error.getMessage());
    terminate(ExitReason.error(error));
  }

  private void terminate(ExitReason reason) {
    if (state == State.TERMINATED) {
      return;
    }
    state = State.TERMINATED;
    if (!reason.isKill()) {
      try {
        statistics.report(query, hits.snapshot(), accountant, statisticsSubscriber);
      } catch (RuntimeException e) {
        log.warn("{} failed to report statistics", name, e);
      }
    }
    if (index != null && lookupId != null) {
      // Requesting 0 partitions tells the index to drop further results.
      try {
        index.requestPartitions(lookupId, 0);
      } catch (RuntimeException e) {
        log.warn("{} failed to stop index lookup {}", name, lookupId, e);
      }
    }
    subscriptions.forEach(Subscription::cancel);
    subscriptions.clear();
    stash.clear();
    log.debug("{} terminated with reason {}", name, reason);
    if (reason.getKind() == ExitReason.Kind.ERROR) {
      termination.completeExceptionally(reason.getCause());
    } else {
      termination.complete(reason);
    }
  }

  private class ExporterIndexClient implements IndexClient {
    @Override
    public void onHits(Selection newHits) {
      tell(new ExporterMessage.Hits(newHits));
    }

    @Override
    public void onDone() {
      tell(new ExporterMessage.IndexDone());
    }

    @Override
    public String toString() {
      return name + "/index-client";
    }
  }

  private class ExporterArchiveClient implements ArchiveClient {
    @Override
    public void onBatch(Batch batch) {
      tell(new ExporterMessage.BatchArrived(batch));
    }

    @Override
    public void onDone(Throwable error) {
      tell(new ExporterMessage.ArchiveDone(error));
    }

    @Override
    public String toString() {
      return name + "/archive-client";
    }
  }
}
