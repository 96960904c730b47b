/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.telemetry.query.importer;

import com.google.common.base.Preconditions;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import lombok.extern.log4j.Log4j2;
import org.telemetry.query.common.setting.Settings;
import org.telemetry.query.component.Subscription;
import org.telemetry.query.data.Batch;
import org.telemetry.query.exporter.StatusVerbosity;

/**
 * Entry point of the ingestion path. Stamps every incoming batch with a contiguous range of ids
 * and relays it to the subscribed continuous queries.
 */
@Log4j2
public class Importer {

  private final long blockSize;
  private final List<Consumer<Batch>> subscribers = new CopyOnWriteArrayList<>();
  private IdBlock block = new IdBlock(0, 0);

  public Importer(Settings settings) {
    Long size = settings.getSettingValue(Settings.Key.IMPORTER_ID_BLOCK_SIZE);
    Preconditions.checkArgument(size > 0, "id block size must be positive");
    this.blockSize = size;
    getNextBlock(0);
  }

  /**
   * Assigns ids to {@code batch} and relays it to all subscribers.
   *
   * @return the batch with its offset set to the first assigned id
   */
  public Batch ingest(Batch batch) {
    Batch stamped;
    synchronized (this) {
      int rows = batch.getPositionCount();
      if (rows > availableIds()) {
        getNextBlock(rows);
      }
      stamped = batch.withOffset(nextId(rows));
    }
    log.debug(
        "imported {} events starting at id {}", stamped.getPositionCount(), stamped.getOffset());
    for (Consumer<Batch> subscriber : subscribers) {
      subscriber.accept(stamped);
    }
    return stamped;
  }

  /** Returns the next free id and advances past {@code advance} ids. */
  public synchronized long nextId(long advance) {
    Preconditions.checkArgument(advance >= 0, "cannot advance by a negative count");
    Preconditions.checkState(
        advance <= block.available(), "advancing by %s exceeds the id block %s", advance, block);
    long id = block.getNext();
    block = block.advance(advance);
    return id;
  }

  /** Extends the current block until more than {@code required} ids are available. */
  public synchronized void getNextBlock(long required) {
    Preconditions.checkArgument(required >= 0, "cannot require a negative count");
    while (block.getNext() + required >= block.getEnd()) {
      block = block.extend(blockSize);
    }
    log.debug("reserved id block {}", block);
  }

  public synchronized long availableIds() {
    return block.available();
  }

  public synchronized IdBlock getIdBlock() {
    return block;
  }

  public Subscription subscribe(Consumer<Batch> subscriber) {
    subscribers.add(subscriber);
    return () -> subscribers.remove(subscriber);
  }

  public int getSubscriberCount() {
    return subscribers.size();
  }

  public Map<String, Object> status(StatusVerbosity verbosity) {
    Map<String, Object> result = new LinkedHashMap<>();
    if (verbosity.isAtLeast(StatusVerbosity.DETAILED)) {
      IdBlock current = getIdBlock();
      result.put("ids.available", current.available());
      result.put("ids.block.next", current.getNext());
      result.put("ids.block.end", current.getEnd());
      result.put("subscribers", subscribers.size());
    }
    return result;
  }
}
