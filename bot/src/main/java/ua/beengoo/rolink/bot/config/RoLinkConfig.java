package ua.beengoo.rolink.bot.config;

import lombok.Getter;
import lombok.Setter;
import ua.beengoo.rolink.api.model.TenantRoleConfig;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Typed view of {@code config.yml}. Field defaults are overridden by the bundled defaults file,
 * which in turn is overridden by the user's file.
 */
@Getter
@Setter
public class RoLinkConfig {
    private OAuth oauth = new OAuth();
    private Web web = new Web();
    private Discord discord = new Discord();
    private Sessions sessions = new Sessions();
    private Http http = new Http();
    private Database database = new Database();
    private Audit audit = new Audit();
    /** Guild id to role mapping; guild {@code 0} holds defaults. */
    private Map<Long, Tenant> tenants = new LinkedHashMap<>();

    public void validate() {
        require(oauth.clientId, "oauth.clientId");
        require(oauth.clientSecret, "oauth.clientSecret");
        require(oauth.redirectUri, "oauth.redirectUri");
        require(discord.botToken, "discord.botToken");
        require(web.successUrl, "web.successUrl");
        if (sessions.ttlSeconds <= 0) throw new IllegalStateException("sessions.ttlSeconds must be positive");
    }

    public Map<Long, TenantRoleConfig> tenantRoles() {
        Map<Long, TenantRoleConfig> out = new LinkedHashMap<>();
        tenants.forEach((id, t) -> out.put(id, t == null
                ? TenantRoleConfig.EMPTY
                : new TenantRoleConfig(t.verifiedRoleId, t.groupMemberRoleId, t.externalGroupId)));
        return out;
    }

    private static void require(String value, String key) {
        if (value == null || value.isBlank()) throw new IllegalStateException(key + " is missing in config.yml");
    }

    @Getter
    @Setter
    public static class OAuth {
        private String clientId = "";
        private String clientSecret = "";
        private String redirectUri = "http://localhost:5000/callback";
        private String scopes = "openid profile group:read";
        private String authorizeUrl = "https://apis.roblox.com/oauth/v1/authorize";
        private String tokenUrl = "https://apis.roblox.com/oauth/v1/token";
        private String userInfoUrl = "https://apis.roblox.com/oauth/v1/userinfo";
        private String groupMembershipUrl = "https://apis.roblox.com/cloud/v2/groups/{groupId}/memberships/users%2F{userId}";
    }

    @Getter
    @Setter
    public static class Web {
        private int port = 5000;
        private String successUrl = "https://spst.dev/verify";
    }

    @Getter
    @Setter
    public static class Discord {
        private String botToken = "";
        private long requestTimeoutSeconds = 10;
    }

    @Getter
    @Setter
    public static class Sessions {
        /** {@code memory} or {@code redis}. */
        private String backend = "memory";
        private long ttlSeconds = 600;
        private long sweepSeconds = 60;
        private String redisUri = "redis://localhost:6379";
    }

    @Getter
    @Setter
    public static class Http {
        private long connectTimeoutSeconds = 5;
        private long readTimeoutSeconds = 10;
        private long callTimeoutSeconds = 15;
    }

    @Getter
    @Setter
    public static class Database {
        private String url = "jdbc:sqlite:rolink.db";
        private String driver = "";
        private String username = "";
        private String password = "";
        private Pool pool = new Pool();

        @Getter
        @Setter
        public static class Pool {
            private int maxPoolSize = 8;
        }
    }

    @Getter
    @Setter
    public static class Audit {
        private boolean enabled = true;
        private String file = "rolink-actions.log";
    }

    @Getter
    @Setter
    public static class Tenant {
        private long verifiedRoleId;
        private long groupMemberRoleId;
        private long externalGroupId;
    }
}
