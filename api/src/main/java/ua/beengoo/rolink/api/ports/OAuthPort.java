package ua.beengoo.rolink.api.ports;

/**
 * Outbound calls to the identity provider. Every call is blocking and bounded by the
 * adapter's HTTP timeouts; failures surface as unchecked exceptions.
 */
public interface OAuthPort {

    /** Exchanges an authorization code plus PKCE verifier for a bearer access token. */
    String exchangeCode(String code, String codeVerifier);

    ExternalProfile fetchProfile(String accessToken);

    /**
     * @return {@code MEMBER} on HTTP 200, {@code NOT_MEMBER} on HTTP 404
     * @throws RuntimeException for any other status or transport error
     */
    Membership checkGroupMembership(long groupId, long externalId, String accessToken);

    record ExternalProfile(long id, String preferredUsername, String nickname) {
        /** preferred_username, then nickname, then the numeric id. */
        public String displayName() {
            if (preferredUsername != null && !preferredUsername.isBlank()) return preferredUsername;
            if (nickname != null && !nickname.isBlank()) return nickname;
            return String.valueOf(id);
        }
    }

    enum Membership { MEMBER, NOT_MEMBER }
}
