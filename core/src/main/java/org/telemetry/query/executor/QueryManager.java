/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.telemetry.query.executor;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicLong;
import lombok.Builder;
import lombok.extern.log4j.Log4j2;
import org.telemetry.query.common.response.ResponseListener;
import org.telemetry.query.common.setting.Settings;
import org.telemetry.query.component.Archive;
import org.telemetry.query.component.Index;
import org.telemetry.query.component.Sink;
import org.telemetry.query.component.Subscription;
import org.telemetry.query.exception.MissingComponentException;
import org.telemetry.query.exporter.Exporter;
import org.telemetry.query.exporter.QueryOption;
import org.telemetry.query.exporter.StatisticsSubscriber;
import org.telemetry.query.exporter.StatusVerbosity;
import org.telemetry.query.expression.Expression;
import org.telemetry.query.expression.taxonomy.Taxonomies;
import org.telemetry.query.expression.taxonomy.TaxonomyResolver;
import org.telemetry.query.importer.Importer;
import org.telemetry.query.telemetry.Accountant;

/**
 * Spawns and tracks one {@link Exporter} per submitted query.
 *
 * <ol>
 *   <li>Resolves concepts of the query expression through the taxonomies
 *   <li>Validates the query options against the available collaborators
 *   <li>Registers accountant, archive, index and sink with a new exporter
 *   <li>Subscribes continuous queries to the importer
 *   <li>Runs the exporter and forgets it once it terminates
 * </ol>
 */
@Log4j2
public class QueryManager {

  private final Settings settings;
  private final Executor executor;
  private final Taxonomies taxonomies;
  private final Index index;
  private final Archive archive;
  private final Importer importer;
  private final Accountant accountant;
  private final StatisticsSubscriber statisticsSubscriber;

  private final Map<String, Exporter> active = new ConcurrentHashMap<>();
  private final AtomicLong counter = new AtomicLong();

  @Builder
  public QueryManager(
      Settings settings,
      Executor executor,
      Taxonomies taxonomies,
      Index index,
      Archive archive,
      Importer importer,
      Accountant accountant,
      StatisticsSubscriber statisticsSubscriber) {
    this.settings = Preconditions.checkNotNull(settings, "settings");
    this.executor = Preconditions.checkNotNull(executor, "executor");
    this.taxonomies = taxonomies == null ? Taxonomies.empty() : taxonomies;
    this.index = index;
    this.archive = archive;
    this.importer = importer;
    this.accountant = accountant;
    this.statisticsSubscriber = statisticsSubscriber;
  }

  /**
   * Starts a query. The returned exporter ships nothing until its consumer asks for results through
   * {@link Exporter#extract} or {@link Exporter#extractAll}.
   *
   * @throws MissingComponentException if a collaborator the options need is not available
   */
  public Exporter submit(Expression expression, Set<QueryOption> options, Sink sink) {
    Preconditions.checkArgument(!options.isEmpty(), "a query needs at least one query option");
    boolean historical = options.contains(QueryOption.HISTORICAL);
    boolean continuous = options.contains(QueryOption.CONTINUOUS);
    if (historical && index == null) {
      throw new MissingComponentException("index");
    }
    if (historical && archive == null) {
      throw new MissingComponentException("archive");
    }
    if (continuous && importer == null) {
      throw new MissingComponentException("importer");
    }
    Expression resolved = TaxonomyResolver.resolve(taxonomies, expression);
    String name = "exporter-" + counter.incrementAndGet();
    Exporter exporter = new Exporter(name, resolved, options, settings, executor);
    if (accountant != null) {
      exporter.register(accountant);
    }
    if (statisticsSubscriber != null) {
      exporter.register(statisticsSubscriber);
    }
    if (archive != null) {
      exporter.register(archive);
    }
    if (index != null) {
      exporter.register(index);
    }
    exporter.register(sink);
    Subscription subscription =
        continuous ? importer.subscribe(exporter.getBatchConsumer()) : Subscription.NONE;
    active.put(name, exporter);
    exporter
        .getTermination()
        .whenComplete(
            (reason, error) -> {
              subscription.cancel();
              active.remove(name);
              if (error != null) {
                log.warn("{} terminated with error: {}", name, error.getMessage());
              } else {
                log.debug("{} terminated: {}", name, reason);
              }
            });
    log.info("{} spawned for query {} with options {}", name, resolved, options);
    exporter.run();
    return exporter;
  }

  public List<Exporter> getActiveQueries() {
    return ImmutableList.copyOf(active.values());
  }

  /** Kills every running query. */
  public void shutdown() {
    log.info("shutting down {} running queries", active.size());
    new ArrayList<>(active.values()).forEach(Exporter::kill);
  }

  /**
   * Collects the status of the importer and of every running exporter. Exporters that terminate
   * before answering are reported with their name only.
   */
  public void status(StatusVerbosity verbosity, ResponseListener<Map<String, Object>> listener) {
    List<CompletableFuture<Map<String, Object>>> futures = new ArrayList<>();
    for (Exporter exporter : active.values()) {
      CompletableFuture<Map<String, Object>> future = new CompletableFuture<>();
      Map<String, Object> nameOnly = Map.of("name", exporter.getName());
      exporter.getTermination().whenComplete((reason, error) -> future.complete(nameOnly));
      exporter.status(
          verbosity,
          new ResponseListener<>() {
            @Override
            public void onResponse(Map<String, Object> response) {
              future.complete(response);
            }

            @Override
            public void onFailure(Exception e) {
              future.completeExceptionally(e);
            }
          });
      futures.add(future);
    }
    CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0]))
        .whenComplete(
            (ignored, error) -> {
              if (error != null) {
                listener.onFailure(
                    error instanceof Exception ? (Exception) error : new RuntimeException(error));
                return;
              }
              Map<String, Object> result = new LinkedHashMap<>();
              List<Map<String, Object>> exporters = new ArrayList<>();
              futures.forEach(f -> exporters.add(f.join()));
              result.put("exporters", exporters);
              if (importer != null) {
                result.put("importer", importer.status(verbosity));
              }
              listener.onResponse(result);
            });
  }
}
