package credman.core.service;

import java.time.Clock;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.regex.Pattern;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import credman.core.config.RefreshConfig;
import credman.core.config.SlotConfig;
import credman.core.model.AuthState;
import credman.core.model.CredentialErrorKind;
import credman.core.model.CredentialException;
import credman.core.model.DeviceCodeSession;
import credman.core.model.DeviceCodeStatus;
import credman.core.model.IssuedTokens;
import credman.core.model.PollOutcome;
import credman.core.model.SlotStatus;
import credman.core.model.TenantSlot;
import credman.core.model.TokenRecord;
import credman.core.model.TokenValidationResult;
import credman.core.port.in.CredentialManagement;
import credman.core.port.out.DeviceCodeClient;
import credman.core.port.out.SecurityEventPublisher;
import credman.core.port.out.TokenRecordRepository;
import credman.spi.SecurityEvent;

/**
 * Owns the authentication lifecycle of the source and target slots.
 *
 * <p>Each slot has its own {@link SlotState}. State transitions for a slot are
 * serialized on that state's monitor, which is released before any storage or
 * provider call. Slots never share state, so work on one slot never waits for
 * the other.
 *
 * <p>Refreshes are single-flight per slot: concurrent callers join the refresh
 * already in progress and observe the same result, so one provider call and
 * one storage write happen per refresh.
 */
@ApplicationScoped
public class CredentialManager implements CredentialManagement {

    private static final Logger LOG = Logger.getLogger(CredentialManager.class);

    private static final Pattern TENANT_ID = Pattern.compile("^[A-Za-z0-9][A-Za-z0-9.-]{0,254}$");

    static final int SLOW_DOWN_INCREMENT_SECONDS = 5;

    private final DeviceCodeClient client;
    private final TokenValidator validator;
    private final TokenRecordRepository repository;
    private final SecurityEventPublisher events;
    private final SlotConfig slotConfig;
    private final RefreshConfig refreshConfig;
    private final Clock clock;

    private final Map<TenantSlot, SlotState> states = new EnumMap<>(TenantSlot.class);

    @Inject
    public CredentialManager(
            DeviceCodeClient client,
            TokenValidator validator,
            TokenRecordRepository repository,
            SecurityEventPublisher events,
            SlotConfig slotConfig,
            RefreshConfig refreshConfig,
            Clock clock) {
        this.client = client;
        this.validator = validator;
        this.repository = repository;
        this.events = events;
        this.slotConfig = slotConfig;
        this.refreshConfig = refreshConfig;
        this.clock = clock;
        for (var slot : TenantSlot.values()) {
            states.put(slot, new SlotState());
        }
    }

    @Override
    public Uni<DeviceCodeSession> signIn(TenantSlot slot, Optional<String> tenantId) {
        return Uni.createFrom().deferred(() -> {
            final var expectedTenant = resolveTenant(slot, tenantId);
            final var state = states.get(slot);
            final long generation;
            synchronized (state) {
                if (state.hasActiveSession(clock.instant())) {
                    throw CredentialException.alreadyAuthenticating(slot);
                }
                state.starting = true;
                state.session = null;
                state.lastPollAt = null;
                generation = state.generation;
            }

            return client.start(slot, expectedTenant)
                    .onItem()
                    .invoke(session -> {
                        synchronized (state) {
                            if (state.generation != generation) {
                                LOG.infof("Sign-out during sign-in start for slot %s, session discarded", slot);
                                return;
                            }
                            state.starting = false;
                            state.session = session;
                            state.lastPollAt = null;
                            state.errorMessage = null;
                            state.refreshFailed = false;
                            state.terminalSessionId = null;
                            state.terminalStatus = null;
                        }
                        LOG.infof("Sign-in started for slot %s, session %s", slot, session.id());
                    })
                    .onFailure()
                    .invoke(error -> {
                        endStart(state, generation);
                        LOG.warnf("Sign-in start failed for slot %s: %s", slot, kindOf(error));
                    })
                    .onCancellation()
                    .invoke(() -> {
                        endStart(state, generation);
                        LOG.debugf("Sign-in start for slot %s was cancelled", slot);
                    });
        });
    }

    @Override
    public Uni<DeviceCodeStatus> checkStatus(TenantSlot slot, String sessionId) {
        return Uni.createFrom().deferred(() -> {
            final var state = states.get(slot);
            final var now = clock.instant();
            final DeviceCodeSession session;
            final long generation;
            synchronized (state) {
                if (state.session == null || !state.session.id().equals(sessionId)) {
                    if (sessionId.equals(state.terminalSessionId)) {
                        return Uni.createFrom().item(state.terminalStatus);
                    }
                    throw CredentialException.unknownSession(slot);
                }
                session = state.session;
                if (session.isExpired(now)) {
                    final var expired = DeviceCodeStatus.expired();
                    state.finish(session, expired);
                    LOG.infof("Device code for slot %s expired before sign-in completed", slot);
                    return Uni.createFrom().item(expired);
                }
                if (state.lastPollAt != null) {
                    final var nextPollAt = state.lastPollAt.plusSeconds(session.pollIntervalSeconds());
                    if (now.isBefore(nextPollAt)) {
                        throw CredentialException.rateLimited(slot, session.pollIntervalSeconds());
                    }
                }
                state.lastPollAt = now;
                generation = state.generation;
            }

            return client.poll(session)
                    .onItem()
                    .transformToUni(outcome -> onPollOutcome(state, session, generation, outcome))
                    .onFailure(CredentialException.class)
                    .recoverWithUni(error -> onPollFailure(state, session, (CredentialException) error));
        });
    }

    @Override
    public Uni<TokenRecord> getToken(TenantSlot slot) {
        return Uni.createFrom().deferred(() -> {
            final var state = states.get(slot);
            final long generation;
            synchronized (state) {
                if (state.refreshFailed) {
                    throw CredentialException.expired(slot);
                }
                generation = state.generation;
            }
            return readRecord(slot).onItem().transformToUni(found -> {
                if (found.isEmpty()) {
                    return Uni.createFrom().failure(CredentialException.notAuthenticated(slot));
                }
                final var record = found.get();
                final var now = clock.instant();
                if (!record.expiresWithin(refreshConfig.lookahead(), now)) {
                    return Uni.createFrom().item(record);
                }
                if (!record.hasRefreshToken()) {
                    if (record.isExpired(now)) {
                        markRefreshFailed(state, generation);
                        return Uni.createFrom().failure(CredentialException.expired(slot));
                    }
                    return Uni.createFrom().item(record);
                }
                return refresh(slot, record).onFailure(CredentialException.class).recoverWithUni(error -> {
                    final var failure = (CredentialException) error;
                    if (failure.kind() == CredentialErrorKind.PROVIDER_UNREACHABLE
                            && !record.isExpired(clock.instant())) {
                        LOG.warnf("Provider unreachable during refresh for slot %s, returning stored token", slot);
                        return Uni.createFrom().item(record);
                    }
                    if (failure.kind() == CredentialErrorKind.REFRESH_FAILED
                            || failure.kind() == CredentialErrorKind.PROVIDER_REJECTED) {
                        return Uni.createFrom().failure(CredentialException.refreshFailed(slot));
                    }
                    return Uni.createFrom().failure(failure);
                });
            });
        });
    }

    @Override
    public Uni<TokenRecord> refresh(TenantSlot slot) {
        return refresh(slot, null);
    }

    /**
     * Refresh the slot's token, joining a refresh already in progress.
     *
     * @param observed record the caller found near expiry; when the stored record
     *                 no longer matches it, another caller already refreshed and the
     *                 stored record is returned without a provider call. Null forces
     *                 a provider call.
     */
    private Uni<TokenRecord> refresh(TenantSlot slot, TokenRecord observed) {
        return Uni.createFrom().deferred(() -> {
            final var state = states.get(slot);
            final CompletableFuture<TokenRecord> future;
            final boolean leader;
            final long generation;
            synchronized (state) {
                generation = state.generation;
                if (state.inFlightRefresh != null) {
                    future = state.inFlightRefresh;
                    leader = false;
                } else {
                    future = new CompletableFuture<>();
                    state.inFlightRefresh = future;
                    leader = true;
                }
            }

            if (leader) {
                LOG.debugf("Refreshing token for slot %s", slot);
                performRefresh(slot, state, generation, observed)
                        .subscribe()
                        .with(
                                record -> releaseRefresh(state, future, record, null),
                                failure -> releaseRefresh(state, future, null, failure));
            } else {
                LOG.debugf("Joining refresh already in progress for slot %s", slot);
            }

            return Uni.createFrom()
                    .completionStage(future.copy())
                    .onFailure(CompletionException.class)
                    .transform(Throwable::getCause);
        });
    }

    @Override
    public Uni<Void> signOut(TenantSlot slot) {
        return Uni.createFrom().deferred(() -> {
            final var state = states.get(slot);
            synchronized (state) {
                state.reset();
            }
            return repository
                    .clear(slot)
                    .onFailure()
                    .invoke(error -> publishStorageFailure(slot, "clear", error))
                    .onItem()
                    .invoke(() -> {
                        LOG.infof("Signed out of slot %s", slot);
                        events.publish(new SecurityEvent.SignedOut(clock.instant(), slot.id()));
                    });
        });
    }

    @Override
    public Uni<Void> signOutAll() {
        return signOut(TenantSlot.SOURCE)
                .onItemOrFailure()
                .transformToUni((ignored, sourceFailure) -> signOut(TenantSlot.TARGET)
                        .onItem()
                        .transformToUni(done -> sourceFailure == null
                                ? Uni.createFrom().voidItem()
                                : Uni.createFrom().<Void>failure(sourceFailure)));
    }

    @Override
    public Uni<SlotStatus> status(TenantSlot slot) {
        return Uni.createFrom().deferred(() -> {
            final var state = states.get(slot);
            final var now = clock.instant();
            final boolean refreshFailed;
            synchronized (state) {
                if (state.hasActiveSession(now)) {
                    return Uni.createFrom().item(SlotStatus.of(slot, AuthState.AUTHENTICATING));
                }
                if (state.errorMessage != null) {
                    return Uni.createFrom().item(SlotStatus.failed(slot, AuthState.ERROR, state.errorMessage));
                }
                refreshFailed = state.refreshFailed;
            }

            return repository
                    .get(slot)
                    .map(found -> {
                        if (found.isEmpty()) {
                            return refreshFailed
                                    ? SlotStatus.failed(slot, AuthState.EXPIRED, "Credentials have expired")
                                    : SlotStatus.of(slot, AuthState.NOT_AUTHENTICATED);
                        }
                        final var record = found.get();
                        if (!matchesConfiguredTenant(slot, record)) {
                            return SlotStatus.failed(
                                    slot, AuthState.ERROR, "Stored credentials belong to a different tenant");
                        }
                        if (refreshFailed) {
                            return withError(SlotStatus.withRecord(slot, AuthState.EXPIRED, record),
                                    "Token refresh failed, sign in again");
                        }
                        if (record.isExpired(clock.instant())) {
                            return SlotStatus.withRecord(slot, AuthState.EXPIRED, record);
                        }
                        return SlotStatus.withRecord(slot, AuthState.AUTHENTICATED, record);
                    })
                    .onFailure()
                    .recoverWithItem(error -> {
                        LOG.warnf("Could not read credentials for slot %s: %s", slot, kindOf(error));
                        return SlotStatus.failed(slot, AuthState.ERROR, "Credential storage is unavailable");
                    });
        });
    }

    @Override
    public Uni<Map<TenantSlot, SlotStatus>> statuses() {
        return Uni.combine()
                .all()
                .unis(status(TenantSlot.SOURCE), status(TenantSlot.TARGET))
                .asTuple()
                .map(tuple -> {
                    final var result = new EnumMap<TenantSlot, SlotStatus>(TenantSlot.class);
                    result.put(TenantSlot.SOURCE, tuple.getItem1());
                    result.put(TenantSlot.TARGET, tuple.getItem2());
                    return Collections.unmodifiableMap(result);
                });
    }

    /**
     * Finish sign-in sessions whose device code has expired without being polled.
     *
     * @return number of sessions finished
     */
    public int expireAbandonedSessions() {
        final var now = clock.instant();
        int expired = 0;
        for (var entry : states.entrySet()) {
            final var state = entry.getValue();
            synchronized (state) {
                if (state.session != null && state.session.isExpired(now)) {
                    state.finish(state.session, DeviceCodeStatus.expired());
                    expired++;
                    LOG.infof("Abandoned sign-in for slot %s expired", entry.getKey());
                }
            }
        }
        return expired;
    }

    /**
     * Check a caller-supplied tenant identifier (GUID or domain name).
     */
    public static boolean isValidTenantId(String tenantId) {
        return tenantId != null && TENANT_ID.matcher(tenantId).matches();
    }

    private Optional<String> resolveTenant(TenantSlot slot, Optional<String> requested) {
        final var configured = slotConfig.expectedTenant(slot);
        final var supplied = requested.map(String::trim).filter(t -> !t.isEmpty());
        if (supplied.isEmpty()) {
            return configured;
        }
        if (!isValidTenantId(supplied.get())) {
            throw CredentialException.invalidRequest("Invalid tenant ID");
        }
        if (configured.isPresent() && !configured.get().equals(supplied.get())) {
            throw CredentialException.invalidRequest("Tenant ID does not match the tenant configured for " + slot);
        }
        return supplied;
    }

    private Uni<DeviceCodeStatus> onPollFailure(
            SlotState state, DeviceCodeSession session, CredentialException error) {
        if (error.kind() != CredentialErrorKind.PROVIDER_REJECTED) {
            return Uni.createFrom().failure(error);
        }
        LOG.warnf("Device code poll for slot %s failed: %s", session.slot(), error.kind());
        return Uni.createFrom().item(failSession(state, session, "Identity provider rejected the sign-in"));
    }

    private Uni<DeviceCodeStatus> onPollOutcome(
            SlotState state, DeviceCodeSession session, long generation, PollOutcome outcome) {
        final var slot = session.slot();
        if (outcome instanceof PollOutcome.Pending) {
            return Uni.createFrom().item(DeviceCodeStatus.pending(session.pollIntervalSeconds()));
        }
        if (outcome instanceof PollOutcome.SlowDown) {
            final int interval = session.pollIntervalSeconds() + SLOW_DOWN_INCREMENT_SECONDS;
            synchronized (state) {
                if (state.isCurrent(session)) {
                    state.session = state.session.withPollInterval(interval);
                }
            }
            LOG.debugf("Provider asked to slow down for slot %s, interval now %ds", slot, interval);
            return Uni.createFrom().item(DeviceCodeStatus.pending(interval));
        }
        if (outcome instanceof PollOutcome.Expired) {
            final var expired = DeviceCodeStatus.expired();
            synchronized (state) {
                if (state.isCurrent(session)) {
                    state.finish(session, expired);
                }
            }
            LOG.infof("Device code for slot %s expired at the provider", slot);
            return Uni.createFrom().item(expired);
        }
        if (outcome instanceof PollOutcome.Denied) {
            events.publish(new SecurityEvent.SignInDenied(clock.instant(), slot.id()));
            return Uni.createFrom().item(failSession(state, session, "Sign-in was declined"));
        }
        if (outcome instanceof PollOutcome.TokenIssued issued) {
            return complete(state, session, generation, issued.tokens());
        }
        throw new IllegalStateException("Unhandled poll outcome: " + outcome.getClass().getSimpleName());
    }

    private Uni<DeviceCodeStatus> complete(
            SlotState state, DeviceCodeSession session, long generation, IssuedTokens tokens) {
        final var slot = session.slot();
        final var result = validator.validate(tokens, session.expectedTenantId());

        if (result instanceof TokenValidationResult.TenantMismatch mismatch) {
            LOG.warnf("Rejected token for slot %s: %s", slot, CredentialErrorKind.TENANT_MISMATCH);
            events.publish(new SecurityEvent.TenantMismatch(
                    clock.instant(), slot.id(), mismatch.expectedTenantId(), mismatch.actualTenantId()));
            return Uni.createFrom()
                    .item(failSession(state, session, "Signed-in account belongs to a different tenant"));
        }
        if (!(result instanceof TokenValidationResult.Valid valid)) {
            LOG.warnf("Rejected token for slot %s: %s", slot, result.getClass().getSimpleName());
            return Uni.createFrom().item(failSession(state, session, rejectionMessage(result)));
        }

        synchronized (state) {
            if (!state.isCurrent(session)) {
                LOG.infof("Sign-in for slot %s was superseded, discarding issued tokens", slot);
                return Uni.createFrom().item(DeviceCodeStatus.error("Sign-in was cancelled"));
            }
        }

        final var record = valid.record();
        return repository
                .put(slot, record)
                .onFailure()
                .invoke(error -> {
                    publishStorageFailure(slot, "write", error);
                    failSession(state, session, "Credential storage is unavailable");
                })
                .onItem()
                .transformToUni(ignored -> {
                    final boolean signedOut;
                    final var completed = DeviceCodeStatus.completed(record);
                    synchronized (state) {
                        signedOut = state.generation != generation;
                        if (!signedOut && state.isCurrent(session)) {
                            state.finish(session, completed);
                            state.errorMessage = null;
                            state.refreshFailed = false;
                        }
                    }
                    if (signedOut) {
                        LOG.infof("Sign-out during sign-in completion for slot %s, removing credentials", slot);
                        return repository.clear(slot).replaceWith(DeviceCodeStatus.error("Sign-in was cancelled"));
                    }
                    LOG.infof("Sign-in completed for slot %s", slot);
                    return Uni.createFrom().item(completed);
                });
    }

    private Uni<TokenRecord> performRefresh(
            TenantSlot slot, SlotState state, long generation, TokenRecord observed) {
        return readRecord(slot).onItem().transformToUni(found -> {
            if (found.isEmpty()) {
                return Uni.createFrom().failure(CredentialException.notAuthenticated(slot));
            }
            final var current = found.get();
            if (observed != null && !current.accessToken().equals(observed.accessToken())) {
                LOG.debugf("Token for slot %s was already refreshed", slot);
                return Uni.createFrom().item(current);
            }
            if (!current.hasRefreshToken()) {
                return Uni.createFrom()
                        .failure(refreshFailure(slot, state, generation, CredentialErrorKind.REFRESH_FAILED));
            }
            return client.refresh(current.refreshToken(), slot, current.tenantId())
                    .onFailure(CredentialException.class)
                    .transform(error -> {
                        final var kind = ((CredentialException) error).kind();
                        if (kind == CredentialErrorKind.PROVIDER_UNREACHABLE) {
                            LOG.warnf("Refresh for slot %s failed: %s", slot, kind);
                            return error;
                        }
                        return refreshFailure(slot, state, generation, kind);
                    })
                    .onItem()
                    .transformToUni(tokens -> storeRefreshed(slot, state, generation, current, tokens));
        });
    }

    private Uni<TokenRecord> storeRefreshed(
            TenantSlot slot, SlotState state, long generation, TokenRecord current, IssuedTokens tokens) {
        final var rotated = tokens.withFallbackRefreshToken(current.refreshToken());
        final var result = validator.validate(rotated, Optional.of(current.tenantId()));
        if (result instanceof TokenValidationResult.TenantMismatch mismatch) {
            events.publish(new SecurityEvent.TenantMismatch(
                    clock.instant(), slot.id(), mismatch.expectedTenantId(), mismatch.actualTenantId()));
            markRefreshFailed(state, generation);
            LOG.warnf("Refresh for slot %s failed: %s", slot, CredentialErrorKind.TENANT_MISMATCH);
            return Uni.createFrom().failure(CredentialException.tenantMismatch(slot));
        }
        if (!(result instanceof TokenValidationResult.Valid valid)) {
            return Uni.createFrom()
                    .failure(refreshFailure(slot, state, generation, CredentialErrorKind.REFRESH_FAILED));
        }
        final var record = valid.record();
        return repository
                .put(slot, record)
                .onFailure()
                .invoke(error -> publishStorageFailure(slot, "write", error))
                .onItem()
                .transformToUni(ignored -> {
                    final boolean signedOut;
                    synchronized (state) {
                        signedOut = state.generation != generation;
                        if (!signedOut) {
                            state.refreshFailed = false;
                        }
                    }
                    if (signedOut) {
                        LOG.infof("Sign-out during refresh for slot %s, removing credentials", slot);
                        return repository
                                .clear(slot)
                                .onItem()
                                .transformToUni(cleared ->
                                        Uni.createFrom().<TokenRecord>failure(CredentialException.notAuthenticated(slot)));
                    }
                    LOG.infof("Refreshed token for slot %s", slot);
                    return Uni.createFrom().item(record);
                });
    }

    private CredentialException refreshFailure(
            TenantSlot slot, SlotState state, long generation, CredentialErrorKind kind) {
        markRefreshFailed(state, generation);
        LOG.warnf("Refresh for slot %s failed: %s", slot, kind);
        events.publish(new SecurityEvent.RefreshFailed(clock.instant(), slot.id(), kind.name()));
        return CredentialException.refreshFailed(slot);
    }

    private static void markRefreshFailed(SlotState state, long generation) {
        synchronized (state) {
            if (state.generation == generation) {
                state.refreshFailed = true;
            }
        }
    }

    private static void endStart(SlotState state, long generation) {
        synchronized (state) {
            if (state.generation == generation) {
                state.starting = false;
            }
        }
    }

    private void releaseRefresh(
            SlotState state, CompletableFuture<TokenRecord> future, TokenRecord record, Throwable failure) {
        synchronized (state) {
            if (state.inFlightRefresh == future) {
                state.inFlightRefresh = null;
            }
        }
        if (failure != null) {
            future.completeExceptionally(failure);
        } else {
            future.complete(record);
        }
    }

    private Uni<Optional<TokenRecord>> readRecord(TenantSlot slot) {
        return repository
                .get(slot)
                .onFailure()
                .invoke(error -> publishStorageFailure(slot, "read", error))
                .onItem()
                .transform(found -> {
                    if (found.isPresent() && !matchesConfiguredTenant(slot, found.get())) {
                        final var expected = slotConfig.expectedTenant(slot).orElse("");
                        LOG.warnf("Stored credentials rejected for slot %s: %s", slot, CredentialErrorKind.TENANT_MISMATCH);
                        events.publish(new SecurityEvent.TenantMismatch(
                                clock.instant(), slot.id(), expected, found.get().tenantId()));
                        throw CredentialException.tenantMismatch(slot);
                    }
                    return found;
                });
    }

    private boolean matchesConfiguredTenant(TenantSlot slot, TokenRecord record) {
        return slotConfig
                .expectedTenant(slot)
                .map(expected -> expected.equals(record.tenantId()))
                .orElse(true);
    }

    private DeviceCodeStatus failSession(SlotState state, DeviceCodeSession session, String message) {
        final var status = DeviceCodeStatus.error(message);
        synchronized (state) {
            if (state.isCurrent(session)) {
                state.finish(session, status);
                state.errorMessage = message;
            }
        }
        return status;
    }

    private void publishStorageFailure(TenantSlot slot, String operation, Throwable error) {
        if (error instanceof CredentialException ce && ce.kind() == CredentialErrorKind.STORAGE_ERROR) {
            LOG.warnf("Credential storage %s failed for slot %s: %s", operation, slot, ce.kind());
            events.publish(new SecurityEvent.StorageFailure(clock.instant(), slot.id(), operation));
        }
    }

    private static String rejectionMessage(TokenValidationResult result) {
        if (result instanceof TokenValidationResult.Expired) {
            return "Identity provider issued an expired token";
        }
        if (result instanceof TokenValidationResult.InsufficientScope) {
            return "Signed-in account was not granted the required scopes";
        }
        return "Identity provider issued an unusable token";
    }

    private static SlotStatus withError(SlotStatus status, String error) {
        return new SlotStatus(
                status.slot(), status.state(), status.user(), status.tenantId(), status.expiresAt(), Optional.of(error));
    }

    private static Object kindOf(Throwable error) {
        return error instanceof CredentialException ce ? ce.kind() : error.getClass().getSimpleName();
    }
}
