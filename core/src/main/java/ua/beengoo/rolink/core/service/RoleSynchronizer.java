package ua.beengoo.rolink.core.service;

import lombok.extern.slf4j.Slf4j;
import ua.beengoo.rolink.api.model.SyncReport;
import ua.beengoo.rolink.api.model.SyncReport.TenantSyncError;
import ua.beengoo.rolink.api.model.TenantRoleConfig;
import ua.beengoo.rolink.api.ports.GuildRolesPort;
import ua.beengoo.rolink.api.ports.OAuthPort;

import java.util.*;

/**
 * Grants verification roles in every configured guild the user is a member of.
 * <p>
 * Strictly additive: roles the member already holds are never touched, and nothing is ever
 * revoked. One guild failing does not stop the others.
 */
@Slf4j
public class RoleSynchronizer {
    public static final String GRANT_REASON = "Roblox Verification";

    private final OAuthPort oauth;
    private final GuildRolesPort guilds;
    private final TenantRoles tenants;

    public RoleSynchronizer(OAuthPort oauth, GuildRolesPort guilds, TenantRoles tenants) {
        this.oauth = oauth;
        this.guilds = guilds;
        this.tenants = tenants;
    }

    public SyncReport apply(long requesterId, long externalId, String accessToken) {
        // group id -> is member, lives for this run only
        Map<Long, Boolean> groupCache = new HashMap<>();
        Map<Long, Set<Long>> applied = new LinkedHashMap<>();
        Set<Long> skipped = new LinkedHashSet<>();
        List<TenantSyncError> errors = new ArrayList<>();

        for (long tenantId : tenants.tenantIds()) {
            try {
                syncTenant(tenantId, requesterId, externalId, accessToken, groupCache, applied, skipped, errors);
            } catch (Exception e) {
                log.warn("Error processing roles for guild {}: {}", tenantId, e.getMessage());
                errors.add(new TenantSyncError(tenantId, TenantSyncError.Type.ROLE_APPLICATION_FAILURE, messageOf(e)));
            }
        }
        return new SyncReport(applied, skipped, errors);
    }

    private void syncTenant(long tenantId, long requesterId, long externalId, String accessToken,
                            Map<Long, Boolean> groupCache,
                            Map<Long, Set<Long>> applied, Set<Long> skipped, List<TenantSyncError> errors) {
        if (!guilds.hasTenant(tenantId)) {
            skipped.add(tenantId);
            return;
        }

        Optional<GuildRolesPort.GuildMember> found;
        try {
            found = guilds.findMember(tenantId, requesterId);
        } catch (Exception e) {
            log.warn("Failed to fetch member {} in guild {}: {}", requesterId, tenantId, e.getMessage());
            errors.add(new TenantSyncError(tenantId, TenantSyncError.Type.MEMBER_FETCH_FAILURE, messageOf(e)));
            return;
        }
        if (found.isEmpty()) {
            skipped.add(tenantId);
            return;
        }
        GuildRolesPort.GuildMember member = found.get();

        TenantRoleConfig cfg = tenants.resolve(tenantId);
        boolean groupMember = isGroupMember(tenantId, cfg.externalGroupId(), externalId, accessToken, groupCache, errors);

        Set<Long> candidates = new LinkedHashSet<>();
        if (cfg.verifiedRoleId() != 0 && guilds.roleExists(tenantId, cfg.verifiedRoleId())) {
            candidates.add(cfg.verifiedRoleId());
        }
        if (groupMember && cfg.groupMemberRoleId() != 0 && guilds.roleExists(tenantId, cfg.groupMemberRoleId())) {
            candidates.add(cfg.groupMemberRoleId());
        }

        Set<Long> toAdd = additions(member, candidates);
        if (toAdd.isEmpty()) return;

        try {
            guilds.grantRoles(tenantId, requesterId, toAdd, GRANT_REASON);
            applied.put(tenantId, toAdd);
            log.info("Added roles {} to {} in guild {}", toAdd, requesterId, tenantId);
        } catch (Exception e) {
            log.warn("Failed to add roles {} to {} in guild {}: {}", toAdd, requesterId, tenantId, e.getMessage());
            errors.add(new TenantSyncError(tenantId, TenantSyncError.Type.ROLE_APPLICATION_FAILURE, messageOf(e)));
        }
    }

    /** Candidates the member does not hold yet, in candidate order. */
    static Set<Long> additions(GuildRolesPort.GuildMember member, Set<Long> candidates) {
        Set<Long> out = new LinkedHashSet<>();
        for (Long roleId : candidates) {
            if (!member.hasRole(roleId)) out.add(roleId);
        }
        return out;
    }

    private boolean isGroupMember(long tenantId, long groupId, long externalId, String accessToken,
                                  Map<Long, Boolean> groupCache, List<TenantSyncError> errors) {
        if (groupId == 0) return false;
        Boolean cached = groupCache.get(groupId);
        if (cached != null) return cached;

        boolean member = false;
        try {
            member = oauth.checkGroupMembership(groupId, externalId, accessToken) == OAuthPort.Membership.MEMBER;
            if (!member) log.debug("Roblox user {} is not in group {}", externalId, groupId);
        } catch (Exception e) {
            log.warn("Failed to check group membership for {}: {}", groupId, e.getMessage());
            errors.add(new TenantSyncError(tenantId, TenantSyncError.Type.GROUP_MEMBERSHIP_CHECK_FAILURE, messageOf(e)));
        }
        groupCache.put(groupId, member);
        return member;
    }

    private static String messageOf(Exception e) {
        return e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
    }
}
