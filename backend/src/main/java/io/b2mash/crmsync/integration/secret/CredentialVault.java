package io.b2mash.crmsync.integration.secret;

import io.b2mash.crmsync.integration.provider.CrmCredentials;
import jakarta.annotation.PostConstruct;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.Map;
import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import tools.jackson.core.JacksonException;
import tools.jackson.core.type.TypeReference;
import tools.jackson.databind.ObjectMapper;

/**
 * Seals CRM credential maps with AES-256-GCM before they are persisted. The key comes from {@code
 * crmsync.encryption-key} as Base64 and must decode to exactly 32 bytes; the application refuses
 * to start otherwise. Plaintext credentials only exist in memory for the duration of a call.
 */
@Component
public class CredentialVault {

  private static final String ALGORITHM = "AES/GCM/NoPadding";
  private static final int GCM_TAG_LENGTH = 128; // bits
  private static final int IV_LENGTH = 12; // bytes (96 bits)
  private static final int KEY_LENGTH = 32;
  static final int KEY_VERSION = 1;

  private static final TypeReference<Map<String, Object>> CREDENTIALS_TYPE =
      new TypeReference<>() {};

  private final ObjectMapper objectMapper;
  private final SecretKeySpec encryptionKey;
  private final SecureRandom secureRandom = new SecureRandom();

  public CredentialVault(
      ObjectMapper objectMapper, @Value("${crmsync.encryption-key:}") String encodedKey) {
    this.objectMapper = objectMapper;
    if (encodedKey == null || encodedKey.isBlank()) {
      this.encryptionKey = null; // Will fail at @PostConstruct
    } else {
      try {
        this.encryptionKey = new SecretKeySpec(Base64.getDecoder().decode(encodedKey), "AES");
      } catch (IllegalArgumentException e) {
        throw new IllegalStateException("CRMSYNC_ENCRYPTION_KEY is not valid Base64", e);
      }
    }
  }

  @PostConstruct
  void validateKey() {
    if (encryptionKey == null) {
      throw new IllegalStateException(
          "CRMSYNC_ENCRYPTION_KEY environment variable is not set. "
              + "Cannot start without an encryption key for CRM credentials.");
    }
    if (encryptionKey.getEncoded().length != KEY_LENGTH) {
      throw new IllegalStateException(
          "CRMSYNC_ENCRYPTION_KEY must be a Base64-encoded 256-bit (32-byte) key. Got "
              + encryptionKey.getEncoded().length
              + " bytes.");
    }
  }

  public EncryptedCredentials encrypt(CrmCredentials credentials) {
    byte[] plaintext = objectMapper.writeValueAsBytes(credentials.values());
    byte[] iv = generateIv();
    byte[] ciphertext = encrypt(plaintext, iv);
    return new EncryptedCredentials(
        Base64.getEncoder().encodeToString(ciphertext),
        Base64.getEncoder().encodeToString(iv),
        KEY_VERSION);
  }

  /**
   * @throws IllegalStateException if the ciphertext was tampered with, sealed under another key or
   *     does not hold a credential map
   */
  public CrmCredentials decrypt(EncryptedCredentials sealed) {
    if (sealed.keyVersion() != KEY_VERSION) {
      throw new IllegalStateException("Unknown credential key version " + sealed.keyVersion());
    }
    byte[] ciphertext = Base64.getDecoder().decode(sealed.ciphertext());
    byte[] iv = Base64.getDecoder().decode(sealed.iv());
    byte[] plaintext = decrypt(ciphertext, iv);
    try {
      return new CrmCredentials(objectMapper.readValue(plaintext, CREDENTIALS_TYPE));
    } catch (JacksonException e) {
      throw new IllegalStateException("Decrypted credentials are not a JSON object", e);
    }
  }

  private byte[] generateIv() {
    byte[] iv = new byte[IV_LENGTH];
    secureRandom.nextBytes(iv);
    return iv;
  }

  private byte[] encrypt(byte[] plaintext, byte[] iv) {
    try {
      Cipher cipher = Cipher.getInstance(ALGORITHM);
      cipher.init(Cipher.ENCRYPT_MODE, encryptionKey, new GCMParameterSpec(GCM_TAG_LENGTH, iv));
      return cipher.doFinal(plaintext);
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException("Encryption failed", e);
    }
  }

  private byte[] decrypt(byte[] ciphertext, byte[] iv) {
    try {
      Cipher cipher = Cipher.getInstance(ALGORITHM);
      cipher.init(Cipher.DECRYPT_MODE, encryptionKey, new GCMParameterSpec(GCM_TAG_LENGTH, iv));
      return cipher.doFinal(ciphertext);
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException("Decryption failed", e);
    }
  }
}
