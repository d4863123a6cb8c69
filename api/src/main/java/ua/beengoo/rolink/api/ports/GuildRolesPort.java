package ua.beengoo.rolink.api.ports;

import java.util.Optional;
import java.util.Set;

/**
 * Chat platform side of role reconciliation. Tenants are Discord guilds.
 */
public interface GuildRolesPort {

    /** Whether the bot can see this guild at all. */
    boolean hasTenant(long tenantId);

    /**
     * @return the member, or empty if the user is not in the guild
     * @throws RuntimeException if the lookup itself failed
     */
    Optional<GuildMember> findMember(long tenantId, long userId);

    boolean roleExists(long tenantId, long roleId);

    /** Adds all {@code roleIds} to the member in a single request. */
    void grantRoles(long tenantId, long userId, Set<Long> roleIds, String reason);

    /** Discord user name for display, if the user is resolvable. */
    Optional<String> userName(long userId);

    record GuildMember(long tenantId, long userId, Set<Long> roleIds) {
        public GuildMember {
            roleIds = Set.copyOf(roleIds);
        }

        public boolean hasRole(long roleId) {
            return roleIds.contains(roleId);
        }
    }
}
