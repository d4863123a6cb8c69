package ua.beengoo.rolink.bot;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.lettuce.core.RedisClient;
import io.lettuce.core.api.StatefulRedisConnection;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import net.dv8tion.jda.api.JDA;
import net.dv8tion.jda.api.JDABuilder;
import okhttp3.OkHttpClient;
import ua.beengoo.rolink.api.ports.GuildRolesPort;
import ua.beengoo.rolink.api.ports.LinkageRepo;
import ua.beengoo.rolink.api.ports.OAuthPort;
import ua.beengoo.rolink.api.ports.SessionStore;
import ua.beengoo.rolink.bot.adapters.discord.JdaGuildRolesAdapter;
import ua.beengoo.rolink.bot.adapters.jdbc.JdbcLinkageRepo;
import ua.beengoo.rolink.bot.adapters.oauth.RobloxOAuthAdapter;
import ua.beengoo.rolink.bot.adapters.redis.RedisSessionStore;
import ua.beengoo.rolink.bot.config.ConfigLoader;
import ua.beengoo.rolink.bot.config.RoLinkConfig;
import ua.beengoo.rolink.bot.db.DatabaseManager;
import ua.beengoo.rolink.bot.runtime.SessionSweeper;
import ua.beengoo.rolink.bot.util.AuditLogger;
import ua.beengoo.rolink.bot.web.CallbackEndpoint;
import ua.beengoo.rolink.core.oauth.AuthorizationUrlBuilder;
import ua.beengoo.rolink.core.oauth.ChallengeGenerator;
import ua.beengoo.rolink.core.service.InMemorySessionStore;
import ua.beengoo.rolink.core.service.LinkService;
import ua.beengoo.rolink.core.service.RoleSynchronizer;
import ua.beengoo.rolink.core.service.TenantRoles;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Locale;

/**
 * Wires adapters to the core services and runs the callback server. The first argument, if
 * present, is the path of {@code config.yml}.
 */
@Slf4j
public final class RoLink {
    private final RoLinkConfig config;

    private DatabaseManager db;
    private JDA jda;
    private OkHttpClient http;
    private RedisClient redisClient;
    private StatefulRedisConnection<String, String> redisConnection;
    private SessionSweeper sweeper;
    private CallbackEndpoint endpoint;
    private AuditLogger audit;

    /** Entry point for an external command layer. */
    @Getter
    private LinkService linkService;

    public RoLink(RoLinkConfig config) {
        this.config = config;
    }

    public static void main(String[] args) throws InterruptedException {
        Path configPath = Path.of(args.length > 0 ? args[0] : "config.yml");
        RoLinkConfig config = ConfigLoader.load(configPath);
        try {
            config.validate();
        } catch (IllegalStateException e) {
            log.error("Invalid configuration in {}: {}", configPath.toAbsolutePath(), e.getMessage());
            System.exit(1);
            return;
        }

        RoLink app = new RoLink(config);
        Runtime.getRuntime().addShutdownHook(new Thread(app::stop, "rolink-shutdown"));
        app.start();
    }

    public void start() throws InterruptedException {
        Clock clock = Clock.systemUTC();
        Duration sessionTtl = Duration.ofSeconds(config.getSessions().getTtlSeconds());

        // DB -> migrations
        this.db = new DatabaseManager(config.getDatabase());
        this.db.start();
        LinkageRepo linkages = new JdbcLinkageRepo(db.dataSource(), db.dialect(), clock);

        // OAuth
        RoLinkConfig.Http httpCfg = config.getHttp();
        this.http = RobloxOAuthAdapter.httpClient(
                Duration.ofSeconds(httpCfg.getConnectTimeoutSeconds()),
                Duration.ofSeconds(httpCfg.getReadTimeoutSeconds()),
                Duration.ofSeconds(httpCfg.getCallTimeoutSeconds()));
        ObjectMapper json = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        RoLinkConfig.OAuth oauthCfg = config.getOauth();
        OAuthPort oauth = new RobloxOAuthAdapter(http, json,
                oauthCfg.getClientId(), oauthCfg.getClientSecret(),
                oauthCfg.getTokenUrl(), oauthCfg.getUserInfoUrl(), oauthCfg.getGroupMembershipUrl());

        // Sessions: backend is chosen once and never mixed
        SessionStore sessions = sessionStore(sessionTtl, json, clock);

        // Discord
        this.jda = JDABuilder.createLight(config.getDiscord().getBotToken()).build();
        this.jda.awaitReady();
        GuildRolesPort guilds = new JdaGuildRolesAdapter(jda,
                Duration.ofSeconds(config.getDiscord().getRequestTimeoutSeconds()));

        // Core
        RoleSynchronizer roles = new RoleSynchronizer(oauth, guilds, new TenantRoles(config.tenantRoles()));
        this.linkService = new LinkService(oauth, sessions, linkages, roles, guilds,
                new ChallengeGenerator(),
                new AuthorizationUrlBuilder(oauthCfg.getAuthorizeUrl()),
                oauthCfg.getClientId(), oauthCfg.getRedirectUri(), oauthCfg.getScopes(),
                sessionTtl, clock);

        // Audit
        RoLinkConfig.Audit auditCfg = config.getAudit();
        if (auditCfg.isEnabled()) {
            try {
                this.audit = new AuditLogger(Path.of(auditCfg.getFile()));
            } catch (Exception e) {
                log.warn("Failed to open audit log", e);
            }
        }

        // Web
        this.endpoint = new CallbackEndpoint(linkService, config.getWeb().getSuccessUrl(), audit);
        this.endpoint.start(config.getWeb().getPort());

        log.info("Using SQL dialect: {}", db.dialect());
        log.info("RoLink is ready!");
    }

    private SessionStore sessionStore(Duration ttl, ObjectMapper json, Clock clock) {
        String backend = config.getSessions().getBackend();
        backend = backend == null ? "memory" : backend.trim().toLowerCase(Locale.ROOT);
        switch (backend) {
            case "redis" -> {
                this.redisClient = RedisClient.create(config.getSessions().getRedisUri());
                this.redisConnection = redisClient.connect();
                log.info("Link sessions are stored in Redis");
                return new RedisSessionStore(redisConnection.sync(), json, ttl, clock);
            }
            case "memory" -> {
                InMemorySessionStore store = new InMemorySessionStore(ttl, clock);
                this.sweeper = new SessionSweeper(store, Duration.ofSeconds(config.getSessions().getSweepSeconds()));
                this.sweeper.start();
                log.info("Link sessions are stored in memory");
                return store;
            }
            default -> throw new IllegalStateException("Unknown sessions.backend: " + backend);
        }
    }

    public void stop() {
        if (endpoint != null) endpoint.stop();
        if (sweeper != null) sweeper.stop();
        if (jda != null) jda.shutdownNow();
        if (redisConnection != null) redisConnection.close();
        if (redisClient != null) redisClient.shutdown();
        if (http != null) {
            http.dispatcher().executorService().shutdown();
            http.connectionPool().evictAll();
        }
        if (db != null) db.stop();
        if (audit != null) {
            try {
                audit.close();
            } catch (Exception e) {
                log.warn("Failed to close audit log: {}", e.getMessage());
            }
        }
        log.info("RoLink stopped, bye-bye!");
    }
}
