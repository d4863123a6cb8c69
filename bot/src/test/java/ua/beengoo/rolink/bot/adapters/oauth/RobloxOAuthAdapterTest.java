package ua.beengoo.rolink.bot.adapters.oauth;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.tomakehurst.wiremock.WireMockServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import ua.beengoo.rolink.api.ports.OAuthPort;

import java.time.Duration;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.options;
import static org.junit.jupiter.api.Assertions.*;

class RobloxOAuthAdapterTest {
    private WireMockServer server;
    private RobloxOAuthAdapter adapter;

    @BeforeEach
    void setUp() {
        server = new WireMockServer(options().dynamicPort());
        server.start();
        String base = server.baseUrl();
        adapter = new RobloxOAuthAdapter(
                RobloxOAuthAdapter.httpClient(Duration.ofSeconds(2), Duration.ofSeconds(2), Duration.ofSeconds(5)),
                new ObjectMapper(),
                "client", "secret",
                base + "/oauth/v1/token",
                base + "/oauth/v1/userinfo",
                base + "/cloud/v2/groups/{groupId}/memberships/users/{userId}");
    }

    @AfterEach
    void tearDown() {
        server.stop();
    }

    @Test
    void exchangeSendsVerifierAndReturnsAccessToken() {
        server.stubFor(post(urlEqualTo("/oauth/v1/token"))
                .willReturn(okJson("{\"access_token\":\"tok1\",\"token_type\":\"Bearer\",\"expires_in\":900}")));

        assertEquals("tok1", adapter.exchangeCode("xyz", "verifier-abc"));

        server.verify(postRequestedFor(urlEqualTo("/oauth/v1/token"))
                .withHeader("Content-Type", containing("application/x-www-form-urlencoded"))
                .withRequestBody(containing("grant_type=authorization_code"))
                .withRequestBody(containing("code=xyz"))
                .withRequestBody(containing("code_verifier=verifier-abc"))
                .withRequestBody(containing("client_secret=secret"))
                .withRequestBody(notContaining("redirect_uri")));
    }

    @Test
    void exchangeFailsOnErrorStatus() {
        server.stubFor(post(urlEqualTo("/oauth/v1/token"))
                .willReturn(aResponse().withStatus(400).withBody("{\"error\":\"invalid_grant\"}")));

        assertThrows(RuntimeException.class, () -> adapter.exchangeCode("xyz", "v"));
    }

    @Test
    void exchangeFailsWithoutAccessToken() {
        server.stubFor(post(urlEqualTo("/oauth/v1/token")).willReturn(okJson("{\"token_type\":\"Bearer\"}")));

        assertThrows(RuntimeException.class, () -> adapter.exchangeCode("xyz", "v"));
    }

    @Test
    void exchangeFailsOnGarbage() {
        server.stubFor(post(urlEqualTo("/oauth/v1/token")).willReturn(ok("<html>oops</html>")));

        assertThrows(RuntimeException.class, () -> adapter.exchangeCode("xyz", "v"));
    }

    @Test
    void profileReadsSubAndNames() {
        server.stubFor(get(urlEqualTo("/oauth/v1/userinfo"))
                .withHeader("Authorization", equalTo("Bearer tok1"))
                .willReturn(okJson("{\"sub\":\"900\",\"preferred_username\":\"nova\",\"nickname\":\"Nova\"}")));

        OAuthPort.ExternalProfile p = adapter.fetchProfile("tok1");

        assertEquals(900L, p.id());
        assertEquals("nova", p.displayName());
    }

    @Test
    void profileFallsBackToNickname() {
        server.stubFor(get(urlEqualTo("/oauth/v1/userinfo"))
                .willReturn(okJson("{\"sub\":\"900\",\"nickname\":\"Nova\"}")));

        assertEquals("Nova", adapter.fetchProfile("tok1").displayName());
    }

    @Test
    void profileFailsOnUnauthorized() {
        server.stubFor(get(urlEqualTo("/oauth/v1/userinfo")).willReturn(aResponse().withStatus(401)));

        assertThrows(RuntimeException.class, () -> adapter.fetchProfile("tok1"));
    }

    @Test
    void groupMembershipMapsStatusCodes() {
        server.stubFor(get(urlEqualTo("/cloud/v2/groups/55/memberships/users/900"))
                .withHeader("Authorization", equalTo("Bearer tok1"))
                .willReturn(okJson("{\"path\":\"groups/55/memberships/900\"}")));
        server.stubFor(get(urlEqualTo("/cloud/v2/groups/56/memberships/users/900"))
                .willReturn(aResponse().withStatus(404)));
        server.stubFor(get(urlEqualTo("/cloud/v2/groups/57/memberships/users/900"))
                .willReturn(aResponse().withStatus(503)));

        assertEquals(OAuthPort.Membership.MEMBER, adapter.checkGroupMembership(55L, 900L, "tok1"));
        assertEquals(OAuthPort.Membership.NOT_MEMBER, adapter.checkGroupMembership(56L, 900L, "tok1"));
        assertThrows(RuntimeException.class, () -> adapter.checkGroupMembership(57L, 900L, "tok1"));
    }
}
