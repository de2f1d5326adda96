package credman.core.service;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;

import credman.core.model.DeviceCodeSession;
import credman.core.model.DeviceCodeStatus;
import credman.core.model.TokenRecord;

/**
 * Mutable in-memory state of one slot.
 *
 * <p>Every field is guarded by the instance's monitor. The monitor is never
 * held across storage or provider calls.
 */
final class SlotState {

    /** Pending sign-in, or null. */
    DeviceCodeSession session;

    /** Time of the last poll of {@link #session}, or null before the first poll. */
    Instant lastPollAt;

    /** A device authorization request is in flight. */
    boolean starting;

    /** Message of a failed sign-in; the slot reports ERROR until the next sign-in or sign-out. */
    String errorMessage;

    /** The last refresh failed; the slot reports EXPIRED until the next sign-in or sign-out. */
    boolean refreshFailed;

    /** Handle and final status of the last finished session, returned on re-poll. */
    String terminalSessionId;

    DeviceCodeStatus terminalStatus;

    /** Incremented on sign-out so sign-ins and refreshes started earlier can detect it. */
    long generation;

    /** Refresh shared by concurrent callers, or null. */
    CompletableFuture<TokenRecord> inFlightRefresh;

    boolean hasActiveSession(Instant now) {
        return starting || (session != null && !session.isExpired(now));
    }

    boolean isCurrent(DeviceCodeSession candidate) {
        return session != null && session.id().equals(candidate.id());
    }

    void finish(DeviceCodeSession finished, DeviceCodeStatus status) {
        session = null;
        lastPollAt = null;
        terminalSessionId = finished.id();
        terminalStatus = status;
    }

    void reset() {
        starting = false;
        session = null;
        lastPollAt = null;
        errorMessage = null;
        refreshFailed = false;
        terminalSessionId = null;
        terminalStatus = null;
        inFlightRefresh = null;
        generation++;
    }
}
