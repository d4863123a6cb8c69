package ua.beengoo.rolink.api.model;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Result of one role reconciliation pass across all configured guilds.
 *
 * @param applied roles granted per guild; guilds with nothing to add are absent
 * @param skipped guilds that were not processed (bot not in guild, user not a member)
 * @param errors  non-fatal per-guild failures
 */
public record SyncReport(Map<Long, Set<Long>> applied, Set<Long> skipped, List<TenantSyncError> errors) {
    public static final SyncReport EMPTY = new SyncReport(Map.of(), Set.of(), List.of());

    public SyncReport {
        applied = Map.copyOf(applied);
        skipped = Set.copyOf(skipped);
        errors = List.copyOf(errors);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public record TenantSyncError(long tenantId, Type type, String message) {
        public enum Type {
            /** Treated as "not a member"; the verified role is still granted. */
            GROUP_MEMBERSHIP_CHECK_FAILURE,
            MEMBER_FETCH_FAILURE,
            ROLE_APPLICATION_FAILURE
        }
    }
}
