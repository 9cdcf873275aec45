package com.qubular.spotify;

import org.apache.commons.lang3.RandomStringUtils;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Base64;

import static java.nio.charset.StandardCharsets.US_ASCII;

/**
 * Proof Key for Code Exchange verifier and its S256 challenge.
 */
public final class PkceChallenge {
    public static final int VERIFIER_LENGTH = 43;
    public static final int MIN_VERIFIER_LENGTH = 43;
    public static final int MAX_VERIFIER_LENGTH = 128;
    public static final String METHOD = "S256";
    private static final char[] VERIFIER_CHARS =
            "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789-._~".toCharArray();
    private static final SecureRandom random = new SecureRandom();

    private final String verifier;
    private final String challenge;

    private PkceChallenge(String verifier) {
        if (verifier.length() < MIN_VERIFIER_LENGTH || verifier.length() > MAX_VERIFIER_LENGTH) {
            throw new IllegalArgumentException("PKCE verifier must be between 43 and 128 characters, got " + verifier.length());
        }
        this.verifier = verifier;
        this.challenge = challengeFor(verifier);
    }

    public static PkceChallenge generate() {
        return new PkceChallenge(RandomStringUtils.random(VERIFIER_LENGTH, 0, VERIFIER_CHARS.length, false, false,
                VERIFIER_CHARS, random));
    }

    public static PkceChallenge of(String verifier) {
        return new PkceChallenge(verifier);
    }

    public String getVerifier() {
        return verifier;
    }

    public String getChallenge() {
        return challenge;
    }

    static String challengeFor(String verifier) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(verifier.getBytes(US_ASCII));
            return Base64.getUrlEncoder().withoutPadding().encodeToString(digest);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    @Override
    public String toString() {
        return "PkceChallenge{verifier='" + Token.mask(verifier) + "', challenge='" + challenge + "'}";
    }
}
