package credman.core.config;

import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithName;

import credman.core.model.TenantSlot;

/**
 * Expected tenant per slot.
 *
 * <p>When a slot has an expected tenant, tokens issued for any other tenant are
 * rejected and a stored record belonging to another tenant is never returned.
 * A tenant supplied at sign-in applies only when none is configured here.
 *
 * <pre>{@code
 * credman.slots.source.tenant-id=11111111-1111-1111-1111-111111111111
 * credman.slots.target.tenant-id=contoso.onmicrosoft.com
 * }</pre>
 */
@ConfigMapping(prefix = "credman.slots")
public interface SlotConfig {

    SlotSettings source();

    SlotSettings target();

    default Optional<String> expectedTenant(TenantSlot slot) {
        final var settings = slot == TenantSlot.SOURCE ? source() : target();
        return settings.tenantId().filter(t -> !t.isBlank());
    }

    /**
     * Settings for a single slot.
     */
    interface SlotSettings {

        @WithName("tenant-id")
        Optional<String> tenantId();
    }
}
