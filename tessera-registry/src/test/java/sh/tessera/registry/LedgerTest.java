// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.registry;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import sh.tessera.core.agent.AgentId;
import sh.tessera.core.error.InvalidInputException;
import sh.tessera.core.error.InvalidStateException;
import sh.tessera.core.error.RegistryError;
import sh.tessera.registry.event.AgentDeactivated;
import sh.tessera.registry.event.AgentReactivated;
import sh.tessera.registry.event.LedgerEvent;

class LedgerTest {

    private final Logger ledgerLogger = (Logger) LoggerFactory.getLogger(Ledger.class);
    private ListAppender<ILoggingEvent> appender;
    private Ledger ledger;

    @BeforeEach
    void setUp() {
        ledger = TestLedgers.ledger();
        appender = new ListAppender<>();
        appender.start();
        ledgerLogger.addAppender(appender);
    }

    @AfterEach
    void tearDown() {
        ledgerLogger.detachAppender(appender);
    }

    @Test
    void committedEventsReachLogAndListeners() {
        List<LedgerEvent> seen = new ArrayList<>();
        ledger.addListener(seen::add);

        String result = ledger.transact("test", () -> {
            ledger.emit(new AgentDeactivated(AgentId.of(1), ledger.timestamp()));
            ledger.emit(new AgentReactivated(AgentId.of(1), ledger.timestamp()));
            return "done";
        });

        assertEquals("done", result);
        assertEquals(2, ledger.eventLog().size());
        assertEquals(ledger.eventLog().events(), seen);
        assertEquals(List.of(new AgentDeactivated(AgentId.of(1), TestLedgers.NOW)),
                ledger.eventLog().eventsOfType(AgentDeactivated.class));
    }

    @Test
    void failedBodyPublishesNothing() {
        List<LedgerEvent> seen = new ArrayList<>();
        ledger.addListener(seen::add);

        assertThrows(InvalidInputException.class, () -> ledger.execute("test", () -> {
            ledger.emit(new AgentDeactivated(AgentId.of(1), ledger.timestamp()));
            throw InvalidInputException.empty("category");
        }));

        assertEquals(0, ledger.eventLog().size());
        assertTrue(seen.isEmpty());
    }

    @Test
    void ledgerIsUsableAfterFailure() {
        assertThrows(IllegalStateException.class, () -> ledger.execute("boom", () -> {
            throw new IllegalStateException("boom");
        }));

        ledger.execute("ok", () -> ledger.emit(new AgentReactivated(AgentId.of(2), ledger.timestamp())));

        assertEquals(1, ledger.eventLog().size());
    }

    @Test
    void nestedTransactionsJoinTheOuterOne() {
        List<LedgerEvent> seen = new ArrayList<>();
        ledger.addListener(seen::add);

        assertThrows(IllegalStateException.class, () -> ledger.execute("outer", () -> {
            ledger.execute("inner", () -> ledger.emit(new AgentDeactivated(AgentId.of(1), ledger.timestamp())));
            assertTrue(seen.isEmpty(), "inner commit must not publish early");
            throw new IllegalStateException("outer fails");
        }));

        assertEquals(0, ledger.eventLog().size());
        assertTrue(seen.isEmpty());
    }

    @Test
    void timestampComesFromTheClock() {
        long timestamp = ledger.transact("time", ledger::timestamp);
        assertEquals(TestLedgers.NOW, timestamp);
    }

    @Test
    void emitOutsideTransactionFails() {
        assertThrows(IllegalStateException.class,
                () -> ledger.emit(new AgentDeactivated(AgentId.of(1), 0)));
        assertThrows(IllegalStateException.class, ledger::timestamp);
    }

    @Test
    void throwingListenerIsLoggedAndSkipped() {
        List<LedgerEvent> seen = new ArrayList<>();
        ledger.addListener(event -> {
            throw new IllegalStateException("listener down");
        });
        ledger.addListener(seen::add);

        ledger.execute("test", () -> ledger.emit(new AgentReactivated(AgentId.of(3), ledger.timestamp())));

        assertEquals(1, seen.size());
        assertEquals(1, ledger.eventLog().size());
        assertTrue(appender.list.stream().anyMatch(e -> e.getLevel() == Level.WARN
                && e.getFormattedMessage().contains("AgentReactivated")));
    }

    @Test
    void removedListenerStopsReceiving() {
        List<LedgerEvent> seen = new ArrayList<>();
        sh.tessera.registry.event.EventListener listener = seen::add;
        ledger.addListener(listener);
        ledger.removeListener(listener);

        ledger.execute("test", () -> ledger.emit(new AgentReactivated(AgentId.of(3), ledger.timestamp())));

        assertTrue(seen.isEmpty());
    }

    @Test
    void listenerMutationCommitsInItsOwnTransaction() {
        List<LedgerEvent> seen = new ArrayList<>();
        AtomicBoolean reacted = new AtomicBoolean();
        ledger.addListener(event -> {
            if (event instanceof AgentDeactivated && reacted.compareAndSet(false, true)) {
                ledger.execute("follow-up", () -> ledger.emit(new AgentReactivated(AgentId.of(1), ledger.timestamp())));
            }
        });
        ledger.addListener(seen::add);

        ledger.execute("test", () -> ledger.emit(new AgentDeactivated(AgentId.of(1), ledger.timestamp())));

        assertEquals(List.of(
                new AgentDeactivated(AgentId.of(1), TestLedgers.NOW),
                new AgentReactivated(AgentId.of(1), TestLedgers.NOW)), ledger.eventLog().events());
        assertEquals(2, seen.size());
        assertTrue(seen.containsAll(ledger.eventLog().events()));
    }

    @Test
    void mutationFromExternalCallbackIsRefused() {
        InvalidStateException e = assertThrows(InvalidStateException.class, () -> ledger.execute("outer", () -> {
            ledger.emit(new AgentDeactivated(AgentId.of(1), ledger.timestamp()));
            ledger.callOut(() -> {
                ledger.execute("inner", () -> ledger.emit(new AgentReactivated(AgentId.of(1), ledger.timestamp())));
                return true;
            });
        }));

        assertEquals(RegistryError.REENTRANT_CALL, e.error());
        assertEquals(0, ledger.eventLog().size());
    }

    @Test
    void externalCallbackMayRead() {
        long chainId = ledger.transact("outer", () -> ledger.callOut(() -> ledger.read(ledger::chainId)));
        assertEquals(31337L, chainId);
    }

    @Test
    void callOutRequiresTransaction() {
        assertThrows(IllegalStateException.class, () -> ledger.callOut(() -> true));
    }

    @Test
    void readRunsQuery() {
        assertEquals(31337L, ledger.read(ledger::chainId));
    }
}
