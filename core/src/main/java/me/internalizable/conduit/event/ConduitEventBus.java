package me.internalizable.conduit.event;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import me.internalizable.conduit.api.event.Event;
import me.internalizable.conduit.api.event.EventBus;
import me.internalizable.conduit.api.event.EventHandler;
import me.internalizable.conduit.api.event.EventMiddleware;
import me.internalizable.conduit.api.event.HandlerResult;
import me.internalizable.conduit.config.ConduitConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.Clock;
import java.time.Duration;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Event bus implementation.
 *
 * Features:
 * - Priority-sorted handler lists per event type
 * - Middleware chain with per-middleware failure isolation
 * - Concurrent handler dispatch with per-handler failure isolation and optional timeout
 * - Fire-and-forget dispatch tracked for graceful shutdown
 * - Bounded event history with periodic age-based cleanup
 */
public class ConduitEventBus implements EventBus {

    private static final Logger LOGGER = LoggerFactory.getLogger(ConduitEventBus.class);

    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    // Map: EventType -> Sorted list of handlers
    private final Map<String, List<HandlerRegistration>> handlersByType = new ConcurrentHashMap<>();

    private final List<EventMiddleware> middleware = new CopyOnWriteArrayList<>();
    private final EventHistory history;

    // Fire-and-forget batches that have not completed yet
    private final Set<CompletableFuture<List<HandlerResult>>> backgroundDispatches = ConcurrentHashMap.newKeySet();

    private final ExecutorService dispatchExecutor;
    private final Clock clock;
    private final Duration handlerTimeout;
    private final Duration historyTtl;
    private final Duration shutdownTimeout;

    private final Object cleanupLock = new Object();
    private ScheduledExecutorService cleanupScheduler;

    private final AtomicBoolean shutdown = new AtomicBoolean(false);

    // True while one of this bus's handlers runs on the current thread
    private final ThreadLocal<Boolean> handlerThread = ThreadLocal.withInitial(() -> Boolean.FALSE);

    public ConduitEventBus() {
        this(new ConduitConfig());
    }

    public ConduitEventBus(@Nonnull ConduitConfig config) {
        this(config, newDispatchExecutor(config), Clock.systemUTC());
    }

    public ConduitEventBus(@Nonnull ConduitConfig config, @Nonnull ExecutorService executor, @Nonnull Clock clock) {
        Objects.requireNonNull(config, "config");
        config.validate();
        this.history = new EventHistory(config.getHistoryCapacity());
        this.dispatchExecutor = Objects.requireNonNull(executor, "executor");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.handlerTimeout = config.handlerTimeout();
        this.historyTtl = config.historyTtl();
        this.shutdownTimeout = config.shutdownTimeout();
    }

    private static ExecutorService newDispatchExecutor(ConduitConfig config) {
        config.validate();
        return Executors.newFixedThreadPool(config.resolveDispatchThreads(),
            new ThreadFactoryBuilder()
                .setNameFormat("Conduit-Event-Executor-%d")
                .setDaemon(true)
                .build());
    }

    // ==================== Handlers ====================

    @Override
    public void registerHandler(@Nonnull EventHandler handler) {
        Objects.requireNonNull(handler, "handler");

        Set<String> eventTypes = handler.getEventTypes();
        if (eventTypes.isEmpty()) {
            LOGGER.warn("Event handler {} declares no event types", handler.getClass().getSimpleName());
            return;
        }

        lock.writeLock().lock();
        try {
            for (String eventType : eventTypes) {
                List<HandlerRegistration> handlers = handlersByType.computeIfAbsent(
                    eventType, k -> new CopyOnWriteArrayList<>()
                );
                handlers.add(new HandlerRegistration(handler, eventType, handler.getPriority()));
                // Re-sort by priority; the sort is stable so equal priorities keep registration order
                handlers.sort(Comparator.naturalOrder());
            }
        } finally {
            lock.writeLock().unlock();
        }

        LOGGER.info("Registered event handler {} for {} with priority {}",
            handler.getClass().getSimpleName(), eventTypes, handler.getPriority());
    }

    @Override
    public void unregisterHandler(@Nonnull EventHandler handler) {
        Objects.requireNonNull(handler, "handler");

        List<String> removedFrom = new ArrayList<>();
        lock.writeLock().lock();
        try {
            Iterator<Map.Entry<String, List<HandlerRegistration>>> it = handlersByType.entrySet().iterator();
            while (it.hasNext()) {
                Map.Entry<String, List<HandlerRegistration>> entry = it.next();
                if (entry.getValue().removeIf(registration -> registration.getHandler() == handler)) {
                    removedFrom.add(entry.getKey());
                }
                if (entry.getValue().isEmpty()) {
                    it.remove();
                }
            }
        } finally {
            lock.writeLock().unlock();
        }

        if (!removedFrom.isEmpty()) {
            LOGGER.info("Unregistered event handler {} from {}", handler.getClass().getSimpleName(), removedFrom);
        }
    }

    @Override
    public void addMiddleware(@Nonnull EventMiddleware middleware) {
        Objects.requireNonNull(middleware, "middleware");
        this.middleware.add(middleware);
        LOGGER.info("Added event middleware {}", middleware.getClass().getName());
    }

    // ==================== Publishing ====================

    @Override
    public void publish(@Nonnull Event event) {
        Objects.requireNonNull(event, "event");

        CompletableFuture<List<HandlerResult>> batch = dispatch(event, dispatchExecutor);
        if (batch.isDone()) {
            return;
        }
        backgroundDispatches.add(batch);
        batch.whenComplete((results, error) -> backgroundDispatches.remove(batch));
    }

    @Override
    @Nonnull
    public List<HandlerResult> publishAndWait(@Nonnull Event event) {
        Objects.requireNonNull(event, "event");
        if (handlerThread.get()) {
            // A handler waiting on the pool it runs on can starve it, so nested batches run inline
            return dispatch(event, Runnable::run).join();
        }
        return dispatch(event, dispatchExecutor).join();
    }

    private CompletableFuture<List<HandlerResult>> dispatch(Event event, Executor executor) {
        if (shutdown.get()) {
            LOGGER.warn("Event bus is shut down, dropping event {}", event.getType());
            return CompletableFuture.completedFuture(List.of());
        }

        history.record(event);

        Event processed = applyMiddleware(event);
        if (processed == null) {
            LOGGER.debug("Event {} cancelled by middleware", event.getType());
            return CompletableFuture.completedFuture(List.of());
        }

        List<HandlerRegistration> handlers = snapshot(processed.getType());
        if (handlers.isEmpty()) {
            LOGGER.debug("No handlers for event {}", processed.getType());
            return CompletableFuture.completedFuture(List.of());
        }

        LOGGER.debug("Publishing event {} to {} handler(s), priority {}",
            processed.getType(), handlers.size(), processed.getPriority());

        List<CompletableFuture<HandlerResult>> calls = new ArrayList<>(handlers.size());
        for (HandlerRegistration registration : handlers) {
            calls.add(invoke(registration.getHandler(), processed, executor));
        }

        return CompletableFuture.allOf(calls.toArray(new CompletableFuture<?>[0]))
            .thenApply(ignored -> {
                List<HandlerResult> results = new ArrayList<>(calls.size());
                for (CompletableFuture<HandlerResult> call : calls) {
                    results.add(call.join());
                }
                return Collections.unmodifiableList(results);
            });
    }

    @Nullable
    private Event applyMiddleware(Event event) {
        Event current = event;
        for (EventMiddleware step : middleware) {
            try {
                Event next = step.apply(current);
                if (next == null) {
                    return null;
                }
                current = next;
            } catch (Exception e) {
                LOGGER.error("Event middleware {} failed for event {}",
                    step.getClass().getName(), current.getType(), e);
            }
        }
        return current;
    }

    private List<HandlerRegistration> snapshot(String eventType) {
        lock.readLock().lock();
        try {
            List<HandlerRegistration> handlers = handlersByType.get(eventType);
            return handlers != null ? List.copyOf(handlers) : List.of();
        } finally {
            lock.readLock().unlock();
        }
    }

    private CompletableFuture<HandlerResult> invoke(EventHandler handler, Event event, Executor executor) {
        CompletableFuture<Object> call;
        try {
            call = CompletableFuture.supplyAsync(() -> {
                boolean nested = handlerThread.get();
                handlerThread.set(Boolean.TRUE);
                try {
                    return handler.handle(event);
                } catch (RuntimeException e) {
                    throw e;
                } catch (Exception e) {
                    throw new CompletionException(e);
                } finally {
                    handlerThread.set(nested);
                }
            }, executor);
        } catch (RejectedExecutionException e) {
            call = CompletableFuture.failedFuture(e);
        }

        if (!handlerTimeout.isZero()) {
            call = call.orTimeout(handlerTimeout.toMillis(), TimeUnit.MILLISECONDS);
        }

        return call.handle((value, error) -> {
            if (error == null) {
                LOGGER.debug("Handler {} executed for event {}", handler.getClass().getSimpleName(), event.getType());
                return HandlerResult.success(handler, value);
            }

            Throwable cause = unwrap(error);
            LOGGER.error("Handler {} failed for event {}", handler.getClass().getSimpleName(), event.getType(), cause);
            notifyError(handler, event, cause);
            return HandlerResult.failure(handler, cause);
        });
    }

    private void notifyError(EventHandler handler, Event event, Throwable cause) {
        try {
            handler.onError(event, cause);
        } catch (Exception e) {
            LOGGER.error("Error callback of handler {} failed for event {}",
                handler.getClass().getSimpleName(), event.getType(), e);
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
            && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /**
     * Wait for fire-and-forget batches that are still running.
     *
     * @param timeout how long to wait
     * @return true if every batch completed in time
     */
    public boolean awaitBackgroundDispatches(@Nonnull Duration timeout) {
        List<CompletableFuture<List<HandlerResult>>> pending = List.copyOf(backgroundDispatches);
        if (pending.isEmpty()) {
            return true;
        }

        LOGGER.info("Waiting for {} background dispatch(es)...", pending.size());
        try {
            CompletableFuture.allOf(pending.toArray(new CompletableFuture<?>[0]))
                .get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (TimeoutException e) {
            LOGGER.warn("Background dispatches did not finish within {}", timeout);
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (ExecutionException e) {
            LOGGER.error("Background dispatch failed", e.getCause());
            return false;
        }
    }

    public int getPendingDispatchCount() {
        return backgroundDispatches.size();
    }

    // ==================== History ====================

    @Override
    @Nonnull
    public List<Event> getEventHistory(@Nullable String type, int limit) {
        return history.recent(type, limit);
    }

    @Override
    public void clearHistory() {
        history.clear();
        LOGGER.info("Event history cleared");
    }

    /**
     * Drop history entries older than the configured time to live.
     *
     * @return the number of events dropped
     */
    public int evictExpiredHistory() {
        int removed = history.evictOlderThan(clock.instant().minus(historyTtl));
        if (removed > 0) {
            LOGGER.debug("Cleaned up {} old event(s) (TTL {})", removed, historyTtl);
        }
        return removed;
    }

    /**
     * Start evicting expired history entries periodically. Does nothing if already running.
     *
     * @param interval the time between two cleanups
     */
    public void startHistoryCleanup(@Nonnull Duration interval) {
        Objects.requireNonNull(interval, "interval");
        synchronized (cleanupLock) {
            if (cleanupScheduler != null) {
                return;
            }
            cleanupScheduler = Executors.newSingleThreadScheduledExecutor(new ThreadFactoryBuilder()
                .setNameFormat("Conduit-History-Cleanup")
                .setDaemon(true)
                .build());
            cleanupScheduler.scheduleAtFixedRate(() -> {
                try {
                    evictExpiredHistory();
                } catch (Exception e) {
                    LOGGER.error("Event history cleanup failed", e);
                }
            }, interval.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
        }
        LOGGER.info("Event history cleanup started (interval {})", interval);
    }

    public void stopHistoryCleanup() {
        synchronized (cleanupLock) {
            if (cleanupScheduler == null) {
                return;
            }
            cleanupScheduler.shutdownNow();
            cleanupScheduler = null;
        }
        LOGGER.info("Event history cleanup stopped");
    }

    public boolean isHistoryCleanupRunning() {
        synchronized (cleanupLock) {
            return cleanupScheduler != null;
        }
    }

    // ==================== Introspection ====================

    @Override
    @Nonnull
    public List<EventHandler> getHandlers(@Nonnull String type) {
        Objects.requireNonNull(type, "type");
        ImmutableList.Builder<EventHandler> handlers = ImmutableList.builder();
        for (HandlerRegistration registration : snapshot(type)) {
            handlers.add(registration.getHandler());
        }
        return handlers.build();
    }

    @Override
    @Nonnull
    public Set<String> getRegisteredEventTypes() {
        lock.readLock().lock();
        try {
            return ImmutableSet.copyOf(handlersByType.keySet());
        } finally {
            lock.readLock().unlock();
        }
    }

    // ==================== Shutdown ====================

    /**
     * Shutdown the event bus: stop history cleanup, give background dispatches the
     * configured time to finish, then stop the dispatch executor.
     */
    public void shutdown() {
        if (!shutdown.compareAndSet(false, true)) {
            return;
        }

        stopHistoryCleanup();
        awaitBackgroundDispatches(shutdownTimeout);

        dispatchExecutor.shutdown();
        try {
            if (!dispatchExecutor.awaitTermination(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                dispatchExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            dispatchExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        LOGGER.info("Event bus shut down");
    }

    /**
     * Check if the event bus has been shut down.
     */
    public boolean isShutdown() {
        return shutdown.get();
    }
}
