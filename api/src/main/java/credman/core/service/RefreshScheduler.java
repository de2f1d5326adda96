package credman.core.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.quarkus.scheduler.Scheduled;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import credman.core.config.RefreshConfig;
import credman.core.model.CredentialException;
import credman.core.model.TenantSlot;

/**
 * Keeps stored tokens fresh without request traffic.
 *
 * <p>Each sweep visits both slots. An authenticated slot is read through
 * {@link CredentialManager#getToken(TenantSlot)}, which refreshes the token when
 * it expires within the lookahead window. The sweep interval must stay shorter
 * than the lookahead. Abandoned sign-in sessions are expired on the same pass.
 *
 * <p>A failure on one slot never prevents the other slot from being visited.
 */
@ApplicationScoped
public class RefreshScheduler {

    private static final Logger LOG = Logger.getLogger(RefreshScheduler.class);

    private final CredentialManager manager;
    private final RefreshConfig config;

    @Inject
    public RefreshScheduler(CredentialManager manager, RefreshConfig config) {
        this.manager = manager;
        this.config = config;
    }

    @Scheduled(
            every = "${credman.refresh.sweep-interval:3m}",
            delayed = "30s",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    public Uni<Void> sweep() {
        if (!config.enabled()) {
            return Uni.createFrom().voidItem();
        }

        final int expiredSessions = manager.expireAbandonedSessions();
        if (expiredSessions > 0) {
            LOG.debugf("Expired %d abandoned sign-in session(s)", expiredSessions);
        }

        return Uni.combine()
                .all()
                .unis(refreshSlot(TenantSlot.SOURCE), refreshSlot(TenantSlot.TARGET))
                .discardItems();
    }

    /**
     * Refresh one slot if it is authenticated. Never fails.
     */
    Uni<Void> refreshSlot(TenantSlot slot) {
        return manager.status(slot)
                .flatMap(status -> {
                    if (!status.isAuthenticated()) {
                        return Uni.createFrom().voidItem();
                    }
                    return manager.getToken(slot).replaceWithVoid();
                })
                .onFailure()
                .recoverWithUni(error -> {
                    if (error instanceof CredentialException ce) {
                        LOG.warnf("Scheduled refresh failed for slot %s: %s", slot, ce.kind());
                    } else {
                        LOG.warnf("Scheduled refresh failed for slot %s: %s", slot, error.getClass().getSimpleName());
                    }
                    return Uni.createFrom().voidItem();
                });
    }
}
