package ua.beengoo.rolink.bot.adapters.discord;

import net.dv8tion.jda.api.JDA;
import net.dv8tion.jda.api.entities.Guild;
import net.dv8tion.jda.api.entities.Member;
import net.dv8tion.jda.api.entities.Role;
import net.dv8tion.jda.api.entities.User;
import net.dv8tion.jda.api.exceptions.ErrorResponseException;
import net.dv8tion.jda.api.requests.ErrorResponse;
import net.dv8tion.jda.api.requests.restaction.AuditableRestAction;
import net.dv8tion.jda.api.requests.restaction.CacheRestAction;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import ua.beengoo.rolink.api.ports.GuildRolesPort;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class JdaGuildRolesAdapterTest {
    @Mock JDA jda;
    @Mock Guild guild;
    @Mock Member member;
    @Mock Role verified;
    @Mock Role groupRole;
    @Mock CacheRestAction<Member> memberAction;
    @Mock AuditableRestAction<Void> modifyAction;

    private JdaGuildRolesAdapter adapter;

    @BeforeEach
    void setUp() {
        adapter = new JdaGuildRolesAdapter(jda, Duration.ofSeconds(5));
        when(jda.getGuildById(7L)).thenReturn(guild);
        when(guild.getRoleById(701L)).thenReturn(verified);
        when(guild.getRoleById(702L)).thenReturn(groupRole);
        when(verified.getIdLong()).thenReturn(701L);
        when(groupRole.getIdLong()).thenReturn(702L);
        when(guild.retrieveMemberById(42L)).thenReturn(memberAction);
        when(memberAction.timeout(anyLong(), any(TimeUnit.class))).thenReturn(memberAction);
    }

    @Test
    void unknownGuildIsNotATenant() {
        assertTrue(adapter.hasTenant(7L));
        assertFalse(adapter.hasTenant(8L));
    }

    @Test
    void memberRolesAreReported() {
        when(memberAction.complete()).thenReturn(member);
        when(member.getRoles()).thenReturn(List.of(verified));

        GuildRolesPort.GuildMember found = adapter.findMember(7L, 42L).orElseThrow();

        assertEquals(Set.of(701L), found.roleIds());
        verify(memberAction).timeout(5000L, TimeUnit.MILLISECONDS);
    }

    @Test
    void unknownMemberIsEmpty() {
        ErrorResponseException notFound = mock(ErrorResponseException.class);
        when(notFound.getErrorResponse()).thenReturn(ErrorResponse.UNKNOWN_MEMBER);
        when(memberAction.complete()).thenThrow(notFound);

        assertTrue(adapter.findMember(7L, 42L).isEmpty());
    }

    @Test
    void otherDiscordErrorsPropagate() {
        ErrorResponseException missingAccess = mock(ErrorResponseException.class);
        when(missingAccess.getErrorResponse()).thenReturn(ErrorResponse.MISSING_ACCESS);
        when(memberAction.complete()).thenThrow(missingAccess);

        assertThrows(ErrorResponseException.class, () -> adapter.findMember(7L, 42L));
    }

    @Test
    void roleExistence() {
        assertTrue(adapter.roleExists(7L, 701L));
        assertFalse(adapter.roleExists(7L, 799L));
    }

    @Test
    @SuppressWarnings("unchecked")
    void grantIsOneBatchedCallWithReason() {
        when(memberAction.complete()).thenReturn(member);
        when(guild.modifyMemberRoles(eq(member), any(Collection.class), any(Collection.class))).thenReturn(modifyAction);
        when(modifyAction.reason(anyString())).thenReturn(modifyAction);
        when(modifyAction.timeout(anyLong(), any(TimeUnit.class))).thenReturn(modifyAction);

        adapter.grantRoles(7L, 42L, Set.of(701L, 702L), "Roblox Verification");

        verify(guild, times(1)).modifyMemberRoles(eq(member),
                argThat((Collection<Role> add) -> add.size() == 2 && add.contains(verified) && add.contains(groupRole)),
                argThat((Collection<Role> remove) -> remove.isEmpty()));
        verify(modifyAction).reason("Roblox Verification");
        verify(modifyAction).complete();
    }

    @Test
    void grantFailsForMissingRole() {
        assertThrows(IllegalStateException.class,
                () -> adapter.grantRoles(7L, 42L, Set.of(799L), "Roblox Verification"));
        verify(guild, never()).modifyMemberRoles(any(Member.class), anyCollection(), anyCollection());
    }

    @Test
    void cachedUserNameIsUsed() {
        User user = mock(User.class);
        when(user.getName()).thenReturn("dcuser");
        when(jda.getUserById(42L)).thenReturn(user);

        assertEquals("dcuser", adapter.userName(42L).orElseThrow());
        verify(jda, never()).retrieveUserById(anyLong());
    }
}
