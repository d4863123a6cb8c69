package ua.beengoo.rolink.core.oauth;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/**
 * Builds the provider's authorize URL for an authorization code + PKCE request.
 */
public class AuthorizationUrlBuilder {
    private final String authorizeEndpoint;

    public AuthorizationUrlBuilder(String authorizeEndpoint) {
        if (authorizeEndpoint == null || authorizeEndpoint.isBlank())
            throw new IllegalArgumentException("authorize endpoint is required");
        this.authorizeEndpoint = authorizeEndpoint;
    }

    public String build(String clientId, String redirectUri, String challenge, String state, String scopes) {
        String sep = authorizeEndpoint.contains("?") ? "&" : "?";
        return authorizeEndpoint + sep
                + "client_id=" + enc(clientId)
                + "&code_challenge=" + enc(challenge)
                + "&code_challenge_method=" + ChallengeGenerator.METHOD
                + "&redirect_uri=" + enc(redirectUri)
                + "&scope=" + enc(scopes)
                + "&response_type=code"
                + "&state=" + enc(state);
    }

    // URLEncoder is form encoding; spaces must be %20 in a query string we hand to browsers
    private static String enc(String v) {
        return URLEncoder.encode(v == null ? "" : v, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
