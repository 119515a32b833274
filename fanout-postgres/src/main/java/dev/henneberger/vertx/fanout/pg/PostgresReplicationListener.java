/*
 * Copyright (C) 2026 Daniel Henneberger
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.henneberger.vertx.fanout.pg;

import dev.henneberger.vertx.fanout.core.CommitHandler;
import dev.henneberger.vertx.fanout.core.ListenerState;
import dev.henneberger.vertx.fanout.core.ListenerStateChange;
import dev.henneberger.vertx.fanout.core.ReplicationMetricsListener;
import dev.henneberger.vertx.fanout.core.Subscription;
import io.vertx.core.Context;
import io.vertx.core.Future;
import io.vertx.core.Handler;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import java.sql.SQLException;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import org.postgresql.replication.LogSequenceNumber;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Streams committed transactions of one source database to a {@link CommitHandler}.
 *
 * <p>A dedicated worker thread reads WAL messages one at a time and feeds them to a
 * {@link TransactionStateMachine}. A completed transaction is handed to the commit handler on the listener's
 * Vert.x context and the worker waits for its result before reading further. The commit position is acknowledged
 * only when the handler reports {@code true}; any other result stops the listener without acknowledging, so the
 * transaction is delivered again when a listener is next started on the slot.
 */
public final class PostgresReplicationListener implements AutoCloseable {

  private static final Logger LOG = LoggerFactory.getLogger(PostgresReplicationListener.class);

  private final Vertx vertx;
  private final Context context;
  private final PostgresListenerOptions options;
  private final String streamName;
  private final ReplicationTransportFactory transportFactory;
  private final CommitHandler<TransactionBuffer> commitHandler;
  private final List<Handler<ListenerStateChange>> stateHandlers = new CopyOnWriteArrayList<>();
  private final List<ReplicationMetricsListener> metricsListeners = new CopyOnWriteArrayList<>();
  private final AtomicBoolean shouldRun = new AtomicBoolean(false);

  private volatile Thread worker;
  private volatile boolean commitInFlight;
  private volatile Promise<Void> startPromise;
  private volatile Promise<ListenerOutcome> terminationPromise;
  private volatile ListenerState state = ListenerState.IDLE;
  private volatile LogSequenceNumber lastAcknowledged;

  public PostgresReplicationListener(Vertx vertx,
                                     PostgresListenerOptions options,
                                     String streamName,
                                     ReplicationTransportFactory transportFactory,
                                     CommitHandler<TransactionBuffer> commitHandler) {
    this.vertx = Objects.requireNonNull(vertx, "vertx");
    this.context = vertx.getOrCreateContext();
    this.options = new PostgresListenerOptions(Objects.requireNonNull(options, "options"));
    this.options.validate();
    this.streamName = Objects.requireNonNull(streamName, "streamName");
    this.transportFactory = Objects.requireNonNull(transportFactory, "transportFactory");
    this.commitHandler = Objects.requireNonNull(commitHandler, "commitHandler");
  }

  /**
   * Starts streaming from {@code resumeLsn}, normally the slot's confirmed flush position. Transactions ending at
   * or before it are skipped. The returned future completes once the stream is subscribed.
   */
  public Future<Void> start(LogSequenceNumber resumeLsn) {
    Promise<Void> promiseToReturn;
    synchronized (this) {
      if ((state == ListenerState.STARTING || state == ListenerState.SUBSCRIBED) && startPromise != null) {
        return startPromise.future();
      }

      shouldRun.set(true);
      startPromise = Promise.promise();
      terminationPromise = Promise.promise();
      lastAcknowledged = resumeLsn;
      promiseToReturn = startPromise;
      transition(ListenerState.STARTING, null);

      Thread thread = new Thread(() -> runLoop(resumeLsn), "pg-fanout-" + streamName);
      thread.setDaemon(true);
      worker = thread;
      thread.start();
    }
    return promiseToReturn.future();
  }

  /**
   * Runs for at most {@code millis} and then stops cleanly.
   *
   * @return {@link ListenerOutcome#STOPPED} when the time ran out or {@link #stop()} was called,
   *   {@link ListenerOutcome#TERMINATED} when the listener failed first
   */
  public Future<ListenerOutcome> runFor(LogSequenceNumber resumeLsn, long millis) {
    if (millis < 1) {
      return Future.failedFuture(new IllegalArgumentException("millis must be >= 1"));
    }
    start(resumeLsn);
    long timerId = vertx.setTimer(millis, id -> {
      LOG.info("stream={} listen window of {} ms elapsed, stopping", streamName, millis);
      stop();
    });
    return termination().onComplete(ar -> vertx.cancelTimer(timerId));
  }

  /**
   * Completes when the current run ends.
   */
  public Future<ListenerOutcome> termination() {
    Promise<ListenerOutcome> promise = terminationPromise;
    if (promise == null) {
      return Future.failedFuture("listener has not been started");
    }
    return promise.future();
  }

  public ListenerState state() {
    return state;
  }

  public boolean isRunning() {
    ListenerState current = state;
    return current == ListenerState.STARTING || current == ListenerState.SUBSCRIBED;
  }

  public String streamName() {
    return streamName;
  }

  public Subscription onStateChange(Handler<ListenerStateChange> handler) {
    Handler<ListenerStateChange> resolved = Objects.requireNonNull(handler, "handler");
    stateHandlers.add(resolved);
    return () -> stateHandlers.remove(resolved);
  }

  public Subscription addMetricsListener(ReplicationMetricsListener listener) {
    ReplicationMetricsListener resolved = Objects.requireNonNull(listener, "listener");
    metricsListeners.add(resolved);
    return () -> metricsListeners.remove(resolved);
  }

  /**
   * Requests the listener to stop. A transaction already handed to the commit handler is processed to completion
   * first; its position is not acknowledged.
   */
  public synchronized void stop() {
    shouldRun.set(false);
    Thread thread = worker;
    if (thread != null && thread != Thread.currentThread() && !commitInFlight) {
      thread.interrupt();
    }
  }

  @Override
  public void close() {
    stop();
  }

  private void runLoop(LogSequenceNumber resumeLsn) {
    Throwable failure = null;
    try {
      runSession(resumeLsn);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      if (shouldRun.get()) {
        failure = e;
      }
    } catch (SQLException e) {
      if (shouldRun.get()) {
        failure = e;
      } else {
        LOG.debug("stream={} transport error during shutdown: {}", streamName, e.getMessage());
      }
    } catch (Exception e) {
      failure = e;
    } finally {
      synchronized (this) {
        worker = null;
      }
    }

    if (failure != null) {
      LOG.error("Replication listener for {} terminated", streamName, failure);
      finish(ListenerState.FAILED, ListenerOutcome.TERMINATED, failure);
    } else {
      finish(ListenerState.STOPPED, ListenerOutcome.STOPPED, null);
    }
  }

  private void runSession(LogSequenceNumber resumeLsn) throws Exception {
    LogSequenceNumber startLsn = resumeLsn == null ? LogSequenceNumber.INVALID_LSN : resumeLsn;
    try (ReplicationTransport transport = transportFactory.open(startLsn)) {
      TransactionStateMachine machine = new TransactionStateMachine(resumeLsn);
      transition(ListenerState.SUBSCRIBED, null);
      completeStart();

      while (shouldRun.get()) {
        WalEvent event = transport.poll();
        if (event == null) {
          sleepInterruptibly(options.getIdlePollIntervalMs());
          continue;
        }

        StepResult result = machine.step(event.streamLsn(), event.message());
        switch (result.kind()) {
          case CONTINUE:
            break;
          case ACKNOWLEDGE:
            acknowledge(transport, result.lsn());
            break;
          case REPLAYED:
            LOG.debug("stream={} skipped already acknowledged transaction ending at {}",
              streamName, result.lsn().asString());
            break;
          case COMMIT:
            handleCommit(transport, machine, result.buffer());
            break;
          case FATAL:
            throw new IllegalStateException(result.reason());
          default:
            throw new IllegalStateException("Unhandled step result " + result.kind());
        }
      }
    }
  }

  private void handleCommit(ReplicationTransport transport,
                            TransactionStateMachine machine,
                            TransactionBuffer buffer) throws Exception {
    LOG.debug("stream={} commit xid={} lsn={} operations={}",
      streamName, buffer.xid(), buffer.commitLsn().asString(), buffer.operations().size());

    boolean applied;
    synchronized (this) {
      commitInFlight = true;
    }
    try {
      applied = dispatchAndAwait(buffer);
    } finally {
      synchronized (this) {
        commitInFlight = false;
      }
    }
    emitCommitProcessed(buffer, applied);
    if (!applied) {
      throw new IllegalStateException("Transaction " + buffer.xid() + " at " + buffer.commitLsn().asString()
        + " was not applied");
    }
    if (!shouldRun.get()) {
      return;
    }
    acknowledge(transport, machine.completeCommit());
  }

  private boolean dispatchAndAwait(TransactionBuffer buffer) throws Exception {
    CountDownLatch latch = new CountDownLatch(1);
    AtomicReference<Boolean> applied = new AtomicReference<>(false);
    AtomicReference<Throwable> failure = new AtomicReference<>();

    context.runOnContext(v -> invokeHandler(buffer, latch, applied, failure));

    awaitUninterruptibly(latch);
    Throwable err = failure.get();
    if (err != null) {
      if (err instanceof Exception) {
        throw (Exception) err;
      }
      throw new RuntimeException(err);
    }
    return applied.get();
  }

  private static void awaitUninterruptibly(CountDownLatch latch) {
    boolean interrupted = false;
    while (true) {
      try {
        latch.await();
        break;
      } catch (InterruptedException e) {
        interrupted = true;
      }
    }
    if (interrupted) {
      Thread.currentThread().interrupt();
    }
  }

  private void invokeHandler(TransactionBuffer buffer,
                             CountDownLatch latch,
                             AtomicReference<Boolean> applied,
                             AtomicReference<Throwable> failure) {
    try {
      Future<Boolean> result = commitHandler.handle(buffer);
      if (result == null) {
        failure.set(new IllegalStateException("commit handler returned no result"));
        latch.countDown();
        return;
      }
      result.onComplete(ar -> {
        if (ar.failed()) {
          failure.set(ar.cause());
        } else {
          applied.set(Boolean.TRUE.equals(ar.result()));
        }
        latch.countDown();
      });
    } catch (Throwable err) {
      failure.set(err);
      latch.countDown();
    }
  }

  private void acknowledge(ReplicationTransport transport, LogSequenceNumber lsn) throws Exception {
    LogSequenceNumber previous = lastAcknowledged;
    if (previous != null && lsn.compareTo(previous) <= 0) {
      return;
    }
    transport.acknowledge(lsn);
    lastAcknowledged = lsn;
    LOG.debug("stream={} acknowledged {}", streamName, lsn.asString());
    for (ReplicationMetricsListener listener : metricsListeners) {
      listener.onLsnAcknowledged(streamName, lsn.asString());
    }
  }

  private void emitCommitProcessed(TransactionBuffer buffer, boolean applied) {
    for (ReplicationMetricsListener listener : metricsListeners) {
      listener.onCommitProcessed(streamName, buffer.commitLsn().asString(), buffer.operations().size(), applied);
    }
  }

  private void finish(ListenerState finalState, ListenerOutcome outcome, Throwable cause) {
    shouldRun.set(false);
    transition(finalState, cause);
    Promise<Void> start = startPromise;
    if (start != null && !start.future().isComplete()) {
      if (cause != null) {
        start.fail(cause);
      } else {
        start.fail("listener stopped before subscribing");
      }
    }
    Promise<ListenerOutcome> termination = terminationPromise;
    if (termination != null) {
      termination.tryComplete(outcome);
    }
  }

  private void completeStart() {
    Promise<Void> promise = startPromise;
    if (promise != null && !promise.future().isComplete()) {
      promise.complete();
    }
  }

  private void transition(ListenerState nextState, Throwable cause) {
    ListenerState previous = state;
    if (previous == nextState && cause == null) {
      return;
    }
    state = nextState;
    ListenerStateChange change = new ListenerStateChange(previous, nextState, cause);
    for (ReplicationMetricsListener listener : metricsListeners) {
      listener.onStateChange(change);
    }
    for (Handler<ListenerStateChange> handler : stateHandlers) {
      context.runOnContext(v -> handler.handle(change));
    }
  }

  private void sleepInterruptibly(long millis) {
    try {
      Thread.sleep(millis);
    } catch (InterruptedException ignore) {
      Thread.currentThread().interrupt();
    }
  }
}
