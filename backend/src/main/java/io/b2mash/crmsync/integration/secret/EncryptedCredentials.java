package io.b2mash.crmsync.integration.secret;

/**
 * Base64 AES-GCM ciphertext of a credential map, with the IV it was sealed under.
 *
 * @param ciphertext Base64 ciphertext including the GCM tag
 * @param iv Base64 96-bit IV, unique per encryption
 * @param keyVersion version of the key that sealed it
 */
public record EncryptedCredentials(String ciphertext, String iv, int keyVersion) {}
