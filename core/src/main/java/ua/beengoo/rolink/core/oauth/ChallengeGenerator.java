package ua.beengoo.rolink.core.oauth;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Base64;

/**
 * PKCE (RFC 7636) verifier/challenge pairs and OAuth state tokens. Only the S256 method is used.
 */
public class ChallengeGenerator {
    public static final String METHOD = "S256";

    // 64 bytes -> 86 base64url chars, inside the 43..128 window
    private static final int VERIFIER_BYTES = 64;
    private static final int STATE_BYTES = 16;
    private static final Base64.Encoder B64URL = Base64.getUrlEncoder().withoutPadding();

    private final SecureRandom rnd;

    public ChallengeGenerator() {
        this(new SecureRandom());
    }

    public ChallengeGenerator(SecureRandom rnd) {
        this.rnd = rnd;
    }

    public PkcePair generate() {
        String verifier = randomToken(VERIFIER_BYTES);
        return new PkcePair(verifier, challengeOf(verifier));
    }

    public String newState() {
        return randomToken(STATE_BYTES);
    }

    public static String challengeOf(String verifier) {
        try {
            MessageDigest sha = MessageDigest.getInstance("SHA-256");
            byte[] digest = sha.digest(verifier.getBytes(StandardCharsets.US_ASCII));
            return B64URL.encodeToString(digest);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private String randomToken(int bytes) {
        byte[] b = new byte[bytes];
        rnd.nextBytes(b);
        return B64URL.encodeToString(b);
    }

    public record PkcePair(String verifier, String challenge) {}
}
