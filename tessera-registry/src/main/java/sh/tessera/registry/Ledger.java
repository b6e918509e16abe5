// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.registry;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.tessera.core.DebugLogger;
import sh.tessera.core.error.InvalidStateException;
import sh.tessera.core.error.RegistryError;
import sh.tessera.core.types.Address;
import sh.tessera.registry.event.EventListener;
import sh.tessera.registry.event.LedgerEvent;
import sh.tessera.registry.identity.AgentReceiver;

/**
 * Serialized execution environment shared by the four registries.
 *
 * <p>Every mutating registry operation runs inside {@link #transact} (or
 * {@link #execute}). A transaction:
 * <ul>
 * <li>holds a single re-entrant lock, so one mutation commits before the next begins</li>
 * <li>reads the clock once; {@link #timestamp()} returns the same value for the whole operation</li>
 * <li>buffers emitted events and publishes them only if the body returns normally</li>
 * </ul>
 *
 * <p>A body that throws leaves nothing observable: registries validate before their
 * first write, and the event buffer is discarded. Nested calls join the outer
 * transaction, except from code run through {@link #callOut}, which may only read.
 *
 * <p>Listeners run after commit on the committing thread, outside the committed
 * transaction. A listener that mutates opens its own transaction. A listener that
 * throws is logged and skipped.
 *
 * @since 0.1.0
 */
public final class Ledger {

    private static final Logger log = LoggerFactory.getLogger(Ledger.class);

    private final LedgerConfig config;
    private final ReentrantLock lock = new ReentrantLock();
    private final EventLog eventLog = new EventLog();
    private final List<EventListener> listeners = new CopyOnWriteArrayList<>();
    private final Map<Address, AgentReceiver> receivers = new ConcurrentHashMap<>();

    // guarded by lock; non-null while a transaction is open
    private List<LedgerEvent> pending;
    private long timestamp;
    private int callOutDepth;

    public Ledger(final LedgerConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    public LedgerConfig config() {
        return config;
    }

    /**
     * Returns the execution environment identifier folded into derived ids and
     * signing domains.
     *
     * @return the chain id
     */
    public long chainId() {
        return config.chainId();
    }

    public RegistryLimits limits() {
        return config.limits();
    }

    /**
     * Runs one mutating operation atomically.
     *
     * @param operation name used for tracing
     * @param body      the operation
     * @param <T>       result type
     * @return the body's result
     */
    public <T> T transact(final String operation, final Supplier<T> body) {
        Objects.requireNonNull(body, "body");
        lock.lock();
        try {
            if (pending != null) {
                if (callOutDepth > 0) {
                    throw new InvalidStateException(RegistryError.REENTRANT_CALL,
                            operation + " cannot run from an external callback");
                }
                return body.get();
            }
            pending = new ArrayList<>();
            timestamp = config.clock().instant().getEpochSecond();
            final T result;
            final List<LedgerEvent> committed;
            try {
                result = body.get();
                committed = List.copyOf(pending);
                eventLog.appendAll(committed);
                log.debug("{} committed at {} with {} event(s)", operation, timestamp, committed.size());
                DebugLogger.logOperation("[COMMIT] op=%s time=%d events=%d", operation, timestamp, committed.size());
            } catch (RuntimeException e) {
                log.debug("{} rejected: {}", operation, e.getMessage());
                DebugLogger.logOperation("[REJECT] op=%s reason=%s", operation, e.getMessage());
                throw e;
            } finally {
                pending = null;
                callOutDepth = 0;
            }
            publish(committed);
            return result;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Runs one mutating operation that returns nothing.
     *
     * @param operation name used for tracing
     * @param body      the operation
     */
    public void execute(final String operation, final Runnable body) {
        Objects.requireNonNull(body, "body");
        transact(operation, () -> {
            body.run();
            return null;
        });
    }

    /**
     * Runs third-party code from inside the open transaction. The code may read any
     * registry, but a mutating call from it fails with
     * {@link RegistryError#REENTRANT_CALL}, which aborts the enclosing operation.
     *
     * @param callback the external code
     * @param <T>      result type
     * @return the callback's result
     * @throws IllegalStateException if no transaction is open
     */
    public <T> T callOut(final Supplier<T> callback) {
        Objects.requireNonNull(callback, "callback");
        requireTransaction();
        callOutDepth++;
        try {
            return callback.get();
        } finally {
            callOutDepth--;
        }
    }

    /**
     * Runs a query against a consistent snapshot.
     *
     * @param query the query
     * @param <T>   result type
     * @return the query's result
     */
    public <T> T read(final Supplier<T> query) {
        Objects.requireNonNull(query, "query");
        lock.lock();
        try {
            return query.get();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Queues an event for publication when the current transaction commits.
     *
     * @param event the event
     * @throws IllegalStateException if no transaction is open
     */
    public void emit(final LedgerEvent event) {
        Objects.requireNonNull(event, "event");
        requireTransaction();
        pending.add(event);
    }

    /**
     * Returns the current operation's timestamp in unix seconds.
     *
     * @return the timestamp
     * @throws IllegalStateException if no transaction is open
     */
    public long timestamp() {
        requireTransaction();
        return timestamp;
    }

    public EventLog eventLog() {
        return eventLog;
    }

    public void addListener(final EventListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeListener(final EventListener listener) {
        listeners.remove(listener);
    }

    /**
     * Installs recipient-acknowledgment code at an address. Safe transfers to that
     * address must be acknowledged by the receiver.
     *
     * @param address  the address
     * @param receiver the hook
     */
    public void installReceiver(final Address address, final AgentReceiver receiver) {
        Objects.requireNonNull(address, "address");
        Objects.requireNonNull(receiver, "receiver");
        receivers.put(address, receiver);
    }

    public void removeReceiver(final Address address) {
        receivers.remove(address);
    }

    public Optional<AgentReceiver> receiverAt(final Address address) {
        return Optional.ofNullable(receivers.get(address));
    }

    private void requireTransaction() {
        if (!lock.isHeldByCurrentThread() || pending == null) {
            throw new IllegalStateException("No open transaction");
        }
    }

    private void publish(final List<LedgerEvent> events) {
        for (LedgerEvent event : events) {
            DebugLogger.logEvent("[EVENT] %s %s", event.name(), event);
            for (EventListener listener : listeners) {
                try {
                    listener.onEvent(event);
                } catch (RuntimeException e) {
                    log.warn("Listener {} failed on {}", listener, event.name(), e);
                }
            }
        }
    }
}
