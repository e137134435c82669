package io.paramfetch.retrieval;

import io.paramfetch.core.HashService;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import java.util.Base64;

/** First 128 bits of SHA-256 over the trimmed signature, base64url without padding. */
public class Sha256HashService implements HashService {
    @Override
    public String shortHash(String canonicalSignature) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256")
                    .digest(canonicalSignature.trim().getBytes(StandardCharsets.UTF_8));
            return Base64.getUrlEncoder().withoutPadding().encodeToString(Arrays.copyOf(digest, 16));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }
}
