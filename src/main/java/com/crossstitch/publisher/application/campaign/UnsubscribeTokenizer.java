package com.crossstitch.publisher.application.campaign;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.util.Base64;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

/**
 * <strong>What:</strong> Derives and verifies unsubscribe tokens.
 * <p><strong>Why:</strong> Tokens are never stored; the unsubscribe endpoint re-derives
 * {@code HMAC-SHA256(secret, email)} and compares.</p>
 * <p><strong>Encoding:</strong> URL-safe base64 without padding.</p>
 * <p><strong>Thread-safety:</strong> Stateless; {@link SecureRandom} is thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class UnsubscribeTokenizer {
  private static final String ALGORITHM = "HmacSHA256";
  private static final SecureRandom RANDOM = new SecureRandom();
  private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();

  private UnsubscribeTokenizer() {
    // Utility
  }

  /**
   * Derives the deterministic token for an address.
   *
   * @param email recipient address, used exactly as given
   * @param secret shared HMAC secret
   * @return base64url token without padding
   * @throws IllegalArgumentException if the secret is empty
   */
  public static String generateToken(String email, String secret) {
    if (email == null) {
      throw new IllegalArgumentException("email must not be null");
    }
    if (secret == null || secret.isEmpty()) {
      throw new IllegalArgumentException("secret must not be empty");
    }
    try {
      Mac mac = Mac.getInstance(ALGORITHM);
      mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), ALGORITHM));
      return ENCODER.encodeToString(mac.doFinal(email.getBytes(StandardCharsets.UTF_8)));
    } catch (GeneralSecurityException ex) {
      throw new IllegalStateException("HmacSHA256 unavailable", ex);
    }
  }

  /**
   * Checks a token against an address in constant time.
   *
   * @param token candidate token
   * @param email recipient address
   * @param secret shared HMAC secret
   * @return {@code true} when the token was derived from this address and secret
   */
  public static boolean verify(String token, String email, String secret) {
    if (token == null || email == null || secret == null || secret.isEmpty()) {
      return false;
    }
    byte[] expected = generateToken(email, secret).getBytes(StandardCharsets.US_ASCII);
    return MessageDigest.isEqual(expected, token.getBytes(StandardCharsets.US_ASCII));
  }

  /**
   * Generates an opaque random token.
   *
   * @param size number of random bytes; must be positive
   * @return base64url token without padding
   */
  public static String generateRandomToken(int size) {
    if (size <= 0) {
      throw new IllegalArgumentException("size must be positive");
    }
    byte[] bytes = new byte[size];
    RANDOM.nextBytes(bytes);
    return ENCODER.encodeToString(bytes);
  }

  /**
   * Generates a random 32-character lowercase hex id.
   *
   * @return hex id with 128 random bits
   */
  public static String generateHexId() {
    byte[] bytes = new byte[16];
    RANDOM.nextBytes(bytes);
    StringBuilder sb = new StringBuilder(32);
    for (byte b : bytes) {
      sb.append(Character.forDigit((b >> 4) & 0xF, 16)).append(Character.forDigit(b & 0xF, 16));
    }
    return sb.toString();
  }
}
