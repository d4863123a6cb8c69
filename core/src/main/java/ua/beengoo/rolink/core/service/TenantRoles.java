package ua.beengoo.rolink.core.service;

import ua.beengoo.rolink.api.model.TenantRoleConfig;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Per-guild role configuration. Guild {@code 0} only carries defaults and is never synced itself.
 */
public class TenantRoles {
    public static final long DEFAULTS_TENANT = 0L;

    private final Map<Long, TenantRoleConfig> byTenant;
    private final TenantRoleConfig defaults;

    public TenantRoles(Map<Long, TenantRoleConfig> byTenant) {
        this.byTenant = new TreeMap<>(byTenant);
        this.defaults = this.byTenant.getOrDefault(DEFAULTS_TENANT, TenantRoleConfig.EMPTY);
    }

    /** Configured guild ids, ascending, without the defaults entry. */
    public List<Long> tenantIds() {
        return byTenant.keySet().stream().filter(id -> id != DEFAULTS_TENANT).toList();
    }

    /** Effective config of a guild, unknown guilds fall back to the defaults entry. */
    public TenantRoleConfig resolve(long tenantId) {
        TenantRoleConfig own = byTenant.get(tenantId);
        if (own == null) return defaults;
        return own.withDefaults(defaults);
    }

    public TenantRoleConfig defaults() {
        return defaults;
    }
}
