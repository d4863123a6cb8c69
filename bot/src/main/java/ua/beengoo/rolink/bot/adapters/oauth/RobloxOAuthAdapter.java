package ua.beengoo.rolink.bot.adapters.oauth;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import okhttp3.*;
import ua.beengoo.rolink.api.ports.OAuthPort;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Talks to the Roblox OAuth2 and Open Cloud endpoints.
 * <p>
 * The group membership URL is a template with {@code {groupId}} and {@code {userId}} placeholders.
 */
@Slf4j
public class RobloxOAuthAdapter implements OAuthPort {
    private static final MediaType FORM = MediaType.parse("application/x-www-form-urlencoded");

    private final OkHttpClient http;
    private final ObjectMapper om;
    private final String clientId;
    private final String clientSecret;
    private final String tokenUrl;
    private final String userInfoUrl;
    private final String groupMembershipUrl;

    public RobloxOAuthAdapter(OkHttpClient http, ObjectMapper om,
                              String clientId, String clientSecret,
                              String tokenUrl, String userInfoUrl, String groupMembershipUrl) {
        this.http = http;
        this.om = om;
        this.clientId = clientId;
        this.clientSecret = clientSecret;
        this.tokenUrl = tokenUrl;
        this.userInfoUrl = userInfoUrl;
        this.groupMembershipUrl = groupMembershipUrl;
    }

    public static OkHttpClient httpClient(Duration connectTimeout, Duration readTimeout, Duration callTimeout) {
        return new OkHttpClient.Builder()
                .connectTimeout(connectTimeout)
                .readTimeout(readTimeout)
                .callTimeout(callTimeout)
                .build();
    }

    @Override
    public String exchangeCode(String code, String codeVerifier) {
        String body = "client_id=" + enc(clientId)
                + "&client_secret=" + enc(clientSecret)
                + "&grant_type=authorization_code"
                + "&code=" + enc(code)
                + "&code_verifier=" + enc(codeVerifier);

        Request req = new Request.Builder()
                .url(tokenUrl)
                .post(RequestBody.create(body, FORM))
                .build();

        try (Response res = http.newCall(req).execute()) {
            if (!res.isSuccessful()) throw new IOException("token exchange failed: " + res.code());
            JsonNode json = om.readTree(res.body().byteStream());
            if (json == null || !json.hasNonNull("access_token")) {
                throw new IOException("token exchange failed: no access_token in response");
            }
            return json.get("access_token").asText();
        } catch (IOException e) {
            log.warn("OAuth exchange error: {}", e.getMessage());
            throw new UncheckedIOException(e);
        }
    }

    @Override
    public ExternalProfile fetchProfile(String accessToken) {
        Request req = new Request.Builder()
                .url(userInfoUrl)
                .header("Authorization", "Bearer " + accessToken)
                .get()
                .build();

        try (Response res = http.newCall(req).execute()) {
            if (!res.isSuccessful()) throw new IOException("fetch user failed: " + res.code());
            JsonNode j = om.readTree(res.body().byteStream());
            if (j == null || !j.hasNonNull("sub")) throw new IOException("fetch user failed: no sub claim");
            long id = Long.parseLong(j.get("sub").asText());
            String preferred = j.hasNonNull("preferred_username") ? j.get("preferred_username").asText() : null;
            String nickname  = j.hasNonNull("nickname") ? j.get("nickname").asText() : null;
            return new ExternalProfile(id, preferred, nickname);
        } catch (IOException e) {
            log.warn("OAuth fetchProfile error: {}", e.getMessage());
            throw new UncheckedIOException(e);
        } catch (NumberFormatException e) {
            throw new IllegalStateException("fetch user failed: sub is not numeric", e);
        }
    }

    @Override
    public Membership checkGroupMembership(long groupId, long externalId, String accessToken) {
        String url = groupMembershipUrl
                .replace("{groupId}", Long.toString(groupId))
                .replace("{userId}", Long.toString(externalId));
        Request req = new Request.Builder()
                .url(url)
                .header("Authorization", "Bearer " + accessToken)
                .get()
                .build();

        try (Response res = http.newCall(req).execute()) {
            if (res.code() == 200) return Membership.MEMBER;
            if (res.code() == 404) return Membership.NOT_MEMBER;
            throw new IOException("group membership check failed: " + res.code());
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static String enc(String v) {
        return URLEncoder.encode(v, StandardCharsets.UTF_8);
    }
}
