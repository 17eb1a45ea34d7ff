package com.relationsim.relationship.coordinator;

import com.relationsim.common.model.PersonalityState;
import com.relationsim.common.model.PlayerAction;
import com.relationsim.common.model.RelationshipSnapshot;
import com.relationsim.common.model.ResponseModifiers;
import com.relationsim.common.state.PersonalityStateManager;
import com.relationsim.common.trace.SessionContextUtil;
import com.relationsim.relationship.logger.RelationshipFlowLogger;
import com.relationsim.relationship.persistence.PersistenceLayer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Owns the one {@link PersonalityStateManager} of a relationship and serializes access to it.
 *
 * <h3>Writes</h3>
 * Actions are offered to a bounded queue. A single consumer thread drains it, sorts each batch
 * by timestamp and applies it under the write lock. Draining and applying happen under one
 * drain lock, so batches can never overtake each other. A full queue is reported as
 * {@code CONCURRENCY_OVERFLOW}; the submitter then waits up to the overflow wait before giving up.
 *
 * <h3>Reads</h3>
 * State, modifiers and snapshots are read under the read lock and may run concurrently.
 *
 * <h3>Saves</h3>
 * {@link #saveAsync()} captures the snapshot synchronously, then writes it on a single-thread
 * scheduler. Saves therefore complete in the order they were requested and never block
 * action processing.
 */
public class RelationshipCoordinator implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RelationshipCoordinator.class);

    private static final long POLL_INTERVAL_MS = 100;
    private static final long SHUTDOWN_WAIT_MS = 2_000;

    private final PersonalityStateManager manager;
    private final PersistenceLayer        persistence;
    private final RelationshipFlowLogger  flowLogger;
    private final Scheduler               persistenceScheduler;
    private final Clock                   clock;
    private final String                  sessionId;
    private final int                     queueDepth;
    private final Duration                overflowWait;

    private final BlockingQueue<PlayerAction>  queue;
    private final ReentrantReadWriteLock       stateLock = new ReentrantReadWriteLock();
    private final ReentrantLock                drainLock = new ReentrantLock(true);
    private final AtomicLong                   overflowCount = new AtomicLong();
    private final AtomicLong                   droppedCount  = new AtomicLong();

    private volatile boolean running;
    private Thread consumer;

    public RelationshipCoordinator(PersonalityStateManager manager,
                                   PersistenceLayer persistence,
                                   RelationshipFlowLogger flowLogger,
                                   Scheduler persistenceScheduler,
                                   Clock clock,
                                   String sessionId,
                                   int queueDepth,
                                   Duration overflowWait) {
        this.manager              = manager;
        this.persistence          = persistence;
        this.flowLogger           = flowLogger;
        this.persistenceScheduler = persistenceScheduler;
        this.clock                = clock;
        this.sessionId            = sessionId;
        this.queueDepth           = queueDepth;
        this.overflowWait         = overflowWait;
        this.queue                = new ArrayBlockingQueue<>(queueDepth);
    }

    // ── lifecycle ───────────────────────────────────────────────────────────

    public synchronized void start() {
        if (running) return;
        running  = true;
        consumer = new Thread(this::consumeLoop, "relationship-consumer-" + sessionId);
        consumer.setDaemon(true);
        consumer.start();
        log.info("Coordinator started. sessionId={} queueDepth={} overflowWaitMs={}",
            sessionId, queueDepth, overflowWait.toMillis());
    }

    /** Stops the consumer, applies whatever is still queued and writes a final save. */
    @Override
    public synchronized void close() {
        running = false;
        if (consumer != null) {
            consumer.interrupt();
            try {
                consumer.join(SHUTDOWN_WAIT_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            consumer = null;
        }
        drainPending();
        boolean saved = persistence.save(snapshot());
        log.info("Coordinator stopped. sessionId={} finalSave={} overflowCount={} droppedCount={}",
            sessionId, saved, overflowCount.get(), droppedCount.get());
    }

    public boolean isRunning() {
        return running;
    }

    // ── writes ──────────────────────────────────────────────────────────────

    /**
     * Queues {@code action} for ordered processing.
     *
     * @return {@code false} if the queue stayed full for the whole overflow wait
     */
    public boolean submit(PlayerAction action) {
        if (queue.offer(action)) {
            return true;
        }
        long overflows = overflowCount.incrementAndGet();
        flowLogger.logOverflow(queueDepth, overflows, sessionId);
        try {
            if (queue.offer(action, overflowWait.toMillis(), TimeUnit.MILLISECONDS)) {
                return true;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        droppedCount.incrementAndGet();
        log.warn("Action not queued after overflow wait. type={} at={} sessionId={}",
            action.actionType(), action.timestamp(), sessionId);
        return false;
    }

    /**
     * Applies everything currently queued on the calling thread.
     *
     * @return number of actions accepted by the state manager
     */
    public int drainPending() {
        drainLock.lock();
        try {
            List<PlayerAction> batch = new ArrayList<>();
            queue.drainTo(batch);
            return batch.isEmpty() ? 0 : apply(batch);
        } finally {
            drainLock.unlock();
        }
    }

    private void consumeLoop() {
        while (running) {
            try {
                drainLock.lockInterruptibly();
                try {
                    PlayerAction first = queue.poll(POLL_INTERVAL_MS, TimeUnit.MILLISECONDS);
                    if (first == null) continue;
                    List<PlayerAction> batch = new ArrayList<>();
                    batch.add(first);
                    queue.drainTo(batch);
                    apply(batch);
                } finally {
                    drainLock.unlock();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (RuntimeException e) {
                log.error("Batch processing failed, consumer continues. sessionId={}", sessionId, e);
            }
        }
    }

    private int apply(List<PlayerAction> batch) {
        int accepted;
        PersonalityState  state;
        ResponseModifiers modifiers;
        stateLock.writeLock().lock();
        try {
            accepted  = manager.processActions(batch);
            state     = manager.getCurrentState();
            modifiers = manager.getResponseModifiers();
        } finally {
            stateLock.writeLock().unlock();
        }
        flowLogger.logBatch(batch.size(), accepted, state, modifiers, sessionId);
        return accepted;
    }

    // ── reads ───────────────────────────────────────────────────────────────

    public PersonalityState getCurrentState() {
        stateLock.readLock().lock();
        try {
            return manager.getCurrentState();
        } finally {
            stateLock.readLock().unlock();
        }
    }

    public ResponseModifiers getResponseModifiers() {
        stateLock.readLock().lock();
        try {
            return manager.getResponseModifiers();
        } finally {
            stateLock.readLock().unlock();
        }
    }

    public RelationshipSnapshot snapshot() {
        stateLock.readLock().lock();
        try {
            return manager.snapshot(clock.instant());
        } finally {
            stateLock.readLock().unlock();
        }
    }

    // ── persistence ─────────────────────────────────────────────────────────

    /**
     * Snapshots now and schedules the write immediately. The returned {@code Mono} replays
     * the save outcome to any subscriber.
     */
    public Mono<Boolean> saveAsync() {
        return saveAsync(persistence.getDefaultSlot());
    }

    public Mono<Boolean> saveAsync(String slot) {
        RelationshipSnapshot snapshot = snapshot();
        Mono<Boolean> save = SessionContextUtil.withSessionId(
            Mono.fromCallable(() -> persistence.save(slot, snapshot))
                .subscribeOn(persistenceScheduler)
                .doOnEach(flowLogger.stage(RelationshipFlowLogger.STATE_SAVED)),
            sessionId)
            .cache();
        save.subscribe(
            ok -> log.debug("Save finished. slot={} saved={} sessionId={}", slot, ok, sessionId),
            e -> log.error("Asynchronous save failed. slot={} sessionId={}", slot, sessionId, e));
        return save;
    }

    // ── counters ────────────────────────────────────────────────────────────

    public long getOverflowCount() {
        return overflowCount.get();
    }

    public long getDroppedCount() {
        return droppedCount.get();
    }

    public int getQueuedCount() {
        return queue.size();
    }

    public String getSessionId() {
        return sessionId;
    }
}
