package com.crossstitch.publisher.domain.campaign;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> A notification recipient read from the users table.
 * <p><strong>Role:</strong> Carries the opaque store key so the campaign can stamp {@code LastEmailDate}
 * without knowing the table's key schema.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param email email address; unique case-insensitively across recipients
 * @param firstName optional first name used for personalization
 * @param recordKey store key of the user item; empty when the item had no usable key
 * @param cid optional tracking id appended to campaign links
 * @param verified whether the address has been verified
 * @param unsubscribed whether the user opted out
 * @since 0.1.0
 */
public record Recipient(
    String email,
    Optional<String> firstName,
    Map<String, Object> recordKey,
    Optional<String> cid,
    boolean verified,
    boolean unsubscribed) {

  public Recipient {
    if (email == null || email.isBlank()) {
      throw new IllegalArgumentException("email must not be blank");
    }
    email = email.trim();
    firstName = Objects.requireNonNull(firstName, "firstName").filter(v -> !v.isBlank());
    recordKey = Map.copyOf(Objects.requireNonNull(recordKey, "recordKey"));
    cid = Objects.requireNonNull(cid, "cid").filter(v -> !v.isBlank());
  }

  /**
   * Creates a recipient outside the users table, such as the admin address.
   *
   * @param email email address
   * @param cid tracking id
   * @return verified, subscribed recipient with no store key
   */
  public static Recipient adHoc(String email, String cid) {
    return new Recipient(email, Optional.empty(), Map.of(), Optional.ofNullable(cid), true, false);
  }

  public boolean sameAddress(String other) {
    return other != null && email.equalsIgnoreCase(other.trim());
  }
}
