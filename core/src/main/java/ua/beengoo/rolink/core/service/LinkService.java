package ua.beengoo.rolink.core.service;

import lombok.extern.slf4j.Slf4j;
import ua.beengoo.rolink.api.model.LinkFailure;
import ua.beengoo.rolink.api.model.LinkSession;
import ua.beengoo.rolink.api.model.Linkage;
import ua.beengoo.rolink.api.model.SyncReport;
import ua.beengoo.rolink.api.ports.GuildRolesPort;
import ua.beengoo.rolink.api.ports.LinkageRepo;
import ua.beengoo.rolink.api.ports.OAuthPort;
import ua.beengoo.rolink.api.ports.SessionStore;
import ua.beengoo.rolink.core.oauth.AuthorizationUrlBuilder;
import ua.beengoo.rolink.core.oauth.ChallengeGenerator;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

/**
 * Discord to Roblox linking: starts PKCE sessions, finishes them on the OAuth callback,
 * persists the linkage and hands over to {@link RoleSynchronizer}.
 * <p>
 * Stateless apart from the injected stores, so callbacks for different states may run concurrently.
 */
@Slf4j
public class LinkService {
    private final OAuthPort oauth;
    private final SessionStore sessions;
    private final LinkageRepo linkages;
    private final RoleSynchronizer roles;
    private final GuildRolesPort guilds;
    private final ChallengeGenerator challenges;
    private final AuthorizationUrlBuilder authUrls;
    private final String clientId;
    private final String redirectUri;
    private final String scopes;
    private final Duration sessionTtl;
    private final Clock clock;

    public LinkService(OAuthPort oauth,
                       SessionStore sessions,
                       LinkageRepo linkages,
                       RoleSynchronizer roles,
                       GuildRolesPort guilds,
                       ChallengeGenerator challenges,
                       AuthorizationUrlBuilder authUrls,
                       String clientId,
                       String redirectUri,
                       String scopes,
                       Duration sessionTtl,
                       Clock clock) {
        this.oauth = oauth;
        this.sessions = sessions;
        this.linkages = linkages;
        this.roles = roles;
        this.guilds = guilds;
        this.challenges = challenges;
        this.authUrls = authUrls;
        this.clientId = clientId;
        this.redirectUri = redirectUri;
        this.scopes = scopes;
        this.sessionTtl = sessionTtl;
        this.clock = clock;
    }

    // === Link start ===
    public LinkStart beginLink(long requesterId, long tenantId) {
        Optional<Linkage> existing = linkages.getByRequester(requesterId);
        if (existing.isPresent()) return new LinkStart.AlreadyLinked(existing.get());

        String state = challenges.newState();
        ChallengeGenerator.PkcePair pkce = challenges.generate();
        sessions.create(state, requesterId, tenantId, pkce.verifier());

        String url = authUrls.build(clientId, redirectUri, pkce.challenge(), state, scopes);
        log.debug("Link session created for {} (guild {})", requesterId, tenantId);
        return new LinkStart.AuthorizationRequired(url, state, clock.instant().plus(sessionTtl));
    }

    public Optional<Linkage> findLinkage(long requesterId) {
        return linkages.getByRequester(requesterId);
    }

    public boolean unlink(long requesterId) {
        boolean removed = linkages.delete(requesterId);
        if (removed) log.info("Unlinked Discord user {}", requesterId);
        return removed;
    }

    // === OAuth callback ===
    public LinkOutcome handleCallback(String code, String state) {
        if (isBlank(code) || isBlank(state))
            throw new LinkFlowException(LinkFailure.MISSING_PARAMETERS, "missing code or state");

        // consumed here whatever happens next; a failed attempt means a fresh /verify
        LinkSession session = sessions.consume(state)
                .orElseThrow(() -> new LinkFlowException(LinkFailure.SESSION_INVALID_OR_EXPIRED, "session expired or invalid"));

        String accessToken = exchange(code, session);
        OAuthPort.ExternalProfile profile = profile(accessToken);

        Linkage linkage = linkages.upsert(session.requesterId(), profile.id(), profile.displayName());
        log.info("Verified Discord user {} as Roblox user {} ({})",
                session.requesterId(), linkage.externalDisplayName(), linkage.externalId());

        SyncReport report;
        try {
            report = roles.apply(session.requesterId(), profile.id(), accessToken);
        } catch (RuntimeException e) {
            log.warn("Role sync failed for {}: {}", session.requesterId(), e.getMessage());
            report = SyncReport.EMPTY;
        }

        Optional<String> name;
        try {
            name = guilds.userName(session.requesterId());
        } catch (RuntimeException e) {
            log.debug("Could not resolve Discord user {}: {}", session.requesterId(), e.getMessage());
            name = Optional.empty();
        }
        return new LinkOutcome(linkage, report, name);
    }

    private String exchange(String code, LinkSession session) {
        String token;
        try {
            token = oauth.exchangeCode(code, session.codeVerifier());
        } catch (RuntimeException e) {
            log.error("Failed to obtain Roblox access token: {}", e.getMessage());
            throw new LinkFlowException(LinkFailure.TOKEN_EXCHANGE_FAILURE, "token exchange failed: " + e.getMessage(), e);
        }
        if (isBlank(token)) {
            log.error("Failed to obtain Roblox access token: empty access_token");
            throw new LinkFlowException(LinkFailure.TOKEN_EXCHANGE_FAILURE, "token exchange failed: no access_token");
        }
        return token;
    }

    private OAuthPort.ExternalProfile profile(String accessToken) {
        try {
            OAuthPort.ExternalProfile p = oauth.fetchProfile(accessToken);
            if (p == null) throw new IllegalStateException("empty profile");
            return p;
        } catch (RuntimeException e) {
            log.error("Failed to fetch Roblox profile: {}", e.getMessage());
            throw new LinkFlowException(LinkFailure.PROFILE_FETCH_FAILURE, "profile fetch failed: " + e.getMessage(), e);
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
