package ua.beengoo.rolink.bot.adapters.discord;

import lombok.extern.slf4j.Slf4j;
import net.dv8tion.jda.api.JDA;
import net.dv8tion.jda.api.entities.Guild;
import net.dv8tion.jda.api.entities.Member;
import net.dv8tion.jda.api.entities.Role;
import net.dv8tion.jda.api.entities.User;
import net.dv8tion.jda.api.exceptions.ErrorResponseException;
import net.dv8tion.jda.api.requests.ErrorResponse;
import ua.beengoo.rolink.api.ports.GuildRolesPort;

import java.time.Duration;
import java.util.*;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/** Guild access through JDA. Every REST call blocks for at most the configured timeout. */
@Slf4j
public class JdaGuildRolesAdapter implements GuildRolesPort {
    private final JDA jda;
    private final long timeoutMillis;

    public JdaGuildRolesAdapter(JDA jda, Duration timeout) {
        this.jda = jda;
        this.timeoutMillis = timeout.toMillis();
    }

    @Override
    public boolean hasTenant(long tenantId) {
        return jda.getGuildById(tenantId) != null;
    }

    @Override
    public Optional<GuildMember> findMember(long tenantId, long userId) {
        return retrieveMember(guild(tenantId), userId)
                .map(m -> new GuildMember(tenantId, userId,
                        m.getRoles().stream().map(Role::getIdLong).collect(Collectors.toSet())));
    }

    @Override
    public boolean roleExists(long tenantId, long roleId) {
        return guild(tenantId).getRoleById(roleId) != null;
    }

    @Override
    public void grantRoles(long tenantId, long userId, Set<Long> roleIds, String reason) {
        Guild guild = guild(tenantId);
        List<Role> roles = new ArrayList<>();
        for (Long id : roleIds) {
            Role role = guild.getRoleById(id);
            if (role == null) throw new IllegalStateException("Role not found: " + id + " in guild " + tenantId);
            roles.add(role);
        }
        Member member = retrieveMember(guild, userId)
                .orElseThrow(() -> new IllegalStateException("Member " + userId + " left guild " + tenantId));
        guild.modifyMemberRoles(member, roles, Collections.emptyList())
                .reason(reason)
                .timeout(timeoutMillis, TimeUnit.MILLISECONDS)
                .complete();
    }

    @Override
    public Optional<String> userName(long userId) {
        User cached = jda.getUserById(userId);
        if (cached != null) return Optional.of(cached.getName());
        try {
            User user = jda.retrieveUserById(userId).timeout(timeoutMillis, TimeUnit.MILLISECONDS).complete();
            return Optional.ofNullable(user).map(User::getName);
        } catch (ErrorResponseException e) {
            if (e.getErrorResponse() != ErrorResponse.UNKNOWN_USER) throw e;
            log.debug("Discord user {} not found", userId);
            return Optional.empty();
        }
    }

    private Optional<Member> retrieveMember(Guild guild, long userId) {
        try {
            return Optional.ofNullable(guild.retrieveMemberById(userId)
                    .timeout(timeoutMillis, TimeUnit.MILLISECONDS)
                    .complete());
        } catch (ErrorResponseException e) {
            if (e.getErrorResponse() == ErrorResponse.UNKNOWN_MEMBER
                    || e.getErrorResponse() == ErrorResponse.UNKNOWN_USER) {
                return Optional.empty();
            }
            throw e;
        }
    }

    private Guild guild(long tenantId) {
        Guild guild = jda.getGuildById(tenantId);
        if (guild == null) throw new IllegalStateException("Guild not found: " + tenantId);
        return guild;
    }
}
