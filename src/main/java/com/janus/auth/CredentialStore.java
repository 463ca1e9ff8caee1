package com.janus.auth;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.janus.exception.ConfigurationException;
import com.janus.exception.CredentialStoreException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.DecoderException;
import org.apache.commons.codec.binary.Hex;

import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.PBEKeySpec;
import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFilePermissions;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Encrypted on-disk storage of one {@link TokenRecord} per provider.
 *
 * <p>Files hold {@code <iv-hex>:<auth-tag-hex>:<ciphertext-hex>} produced by AES-256-GCM with a
 * key derived from the configured secret and salt (PBKDF2-HMAC-SHA256). A modified or truncated
 * file fails tag verification and is reported, never decoded into garbage.</p>
 */
@Slf4j
public class CredentialStore {

    private static final String CIPHER_ALGORITHM = "AES/GCM/NoPadding";
    private static final String KDF_ALGORITHM = "PBKDF2WithHmacSHA256";
    private static final int KDF_ITERATIONS = 120_000;
    private static final int KEY_SIZE = 256;
    private static final int GCM_IV_LENGTH = 12;
    private static final int GCM_TAG_LENGTH = 16;
    private static final int MIN_SECRET_LENGTH = 16;

    private static final Set<String> PLACEHOLDERS = Set.of(
            "change-me", "changeme", "change_me", "default", "secret", "password",
            "placeholder", "your-encryption-key", "your-salt", "salt", "example");

    private static final Pattern KEY_PATTERN = Pattern.compile("[a-z0-9][a-z0-9-]*");

    private final Path directory;
    private final SecretKey encryptionKey;
    private final ObjectMapper objectMapper;
    private final SecureRandom random = new SecureRandom();

    public CredentialStore(Path directory, String secret, String salt, ObjectMapper objectMapper) {
        requireSecure("encryption key (JANUS_ENCRYPTION_KEY)", secret, MIN_SECRET_LENGTH);
        requireSecure("salt (JANUS_SALT)", salt, 1);

        this.directory = directory;
        this.objectMapper = objectMapper;
        this.encryptionKey = deriveKey(secret, salt);
    }

    private static void requireSecure(String name, String value, int minLength) {
        if (value == null || value.isBlank()) {
            throw new ConfigurationException("Required " + name + " is not set");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        if (PLACEHOLDERS.contains(normalized) || normalized.startsWith("change-me")) {
            throw new ConfigurationException("The " + name + " is still set to a placeholder value");
        }
        if (value.length() < minLength) {
            throw new ConfigurationException("The " + name + " must be at least " + minLength + " characters");
        }
    }

    private static SecretKey deriveKey(String secret, String salt) {
        PBEKeySpec spec = new PBEKeySpec(secret.toCharArray(), salt.getBytes(StandardCharsets.UTF_8),
                KDF_ITERATIONS, KEY_SIZE);
        try {
            byte[] keyBytes = SecretKeyFactory.getInstance(KDF_ALGORITHM).generateSecret(spec).getEncoded();
            return new SecretKeySpec(keyBytes, "AES");
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Key derivation unavailable", e);
        } finally {
            spec.clearPassword();
        }
    }

    /**
     * Encrypt and write the record, replacing any previous one atomically.
     */
    public void save(String key, TokenRecord record) throws IOException {
        Path target = pathFor(key);
        ensureDirectory();

        String encrypted = encrypt(objectMapper.writeValueAsBytes(record));

        Path temp = Files.createTempFile(directory, key + "-", ".tmp");
        try {
            restrictFile(temp);
            Files.writeString(temp, encrypted, StandardCharsets.UTF_8);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } finally {
            Files.deleteIfExists(temp);
        }
        log.info("Token saved to {}", target);
    }

    /**
     * @return the stored record, or empty when no file exists
     * @throws CredentialStoreException when the file is malformed or was tampered with
     */
    public Optional<TokenRecord> load(String key) throws IOException {
        Path path = pathFor(key);
        String encrypted;
        try {
            encrypted = Files.readString(path, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            log.debug("No token file found at {}", path);
            return Optional.empty();
        }

        byte[] plaintext = decrypt(encrypted.trim(), path);
        log.debug("Token loaded from {}", path);
        return Optional.of(objectMapper.readValue(plaintext, TokenRecord.class));
    }

    public void delete(String key) throws IOException {
        Path path = pathFor(key);
        if (Files.deleteIfExists(path)) {
            log.info("Token deleted from {}", path);
        }
    }

    public Path pathFor(String key) {
        if (key == null || !KEY_PATTERN.matcher(key).matches()) {
            throw new IllegalArgumentException("Invalid credential key: " + key);
        }
        return directory.resolve(key + "-token.enc");
    }

    private String encrypt(byte[] plaintext) {
        byte[] iv = new byte[GCM_IV_LENGTH];
        random.nextBytes(iv);
        try {
            Cipher cipher = Cipher.getInstance(CIPHER_ALGORITHM);
            cipher.init(Cipher.ENCRYPT_MODE, encryptionKey, new GCMParameterSpec(GCM_TAG_LENGTH * 8, iv));
            byte[] sealed = cipher.doFinal(plaintext);

            // JCE appends the tag to the ciphertext
            byte[] ciphertext = Arrays.copyOfRange(sealed, 0, sealed.length - GCM_TAG_LENGTH);
            byte[] tag = Arrays.copyOfRange(sealed, sealed.length - GCM_TAG_LENGTH, sealed.length);

            return Hex.encodeHexString(iv) + ":" + Hex.encodeHexString(tag) + ":" + Hex.encodeHexString(ciphertext);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Token encryption failed", e);
        }
    }

    private byte[] decrypt(String encrypted, Path path) {
        String[] parts = encrypted.split(":", -1);
        if (parts.length != 3) {
            throw new CredentialStoreException("Invalid encrypted data format in " + path);
        }

        try {
            byte[] iv = Hex.decodeHex(parts[0]);
            byte[] tag = Hex.decodeHex(parts[1]);
            byte[] ciphertext = Hex.decodeHex(parts[2]);
            if (iv.length != GCM_IV_LENGTH || tag.length != GCM_TAG_LENGTH) {
                throw new CredentialStoreException("Invalid IV or authentication tag length in " + path);
            }

            byte[] sealed = new byte[ciphertext.length + tag.length];
            System.arraycopy(ciphertext, 0, sealed, 0, ciphertext.length);
            System.arraycopy(tag, 0, sealed, ciphertext.length, tag.length);

            Cipher cipher = Cipher.getInstance(CIPHER_ALGORITHM);
            cipher.init(Cipher.DECRYPT_MODE, encryptionKey, new GCMParameterSpec(GCM_TAG_LENGTH * 8, iv));
            return cipher.doFinal(sealed);
        } catch (DecoderException e) {
            throw new CredentialStoreException("Credential file " + path + " is not valid hex", e);
        } catch (GeneralSecurityException e) {
            throw new CredentialStoreException("Credential file " + path + " failed integrity check", e);
        }
    }

    private void ensureDirectory() throws IOException {
        if (Files.isDirectory(directory)) {
            return;
        }
        if (supportsPosix()) {
            Files.createDirectories(directory,
                    PosixFilePermissions.asFileAttribute(PosixFilePermissions.fromString("rwx------")));
        } else {
            Files.createDirectories(directory);
        }
        log.debug("Created credentials directory {}", directory);
    }

    private void restrictFile(Path file) throws IOException {
        if (supportsPosix()) {
            Files.setPosixFilePermissions(file, PosixFilePermissions.fromString("rw-------"));
        }
    }

    private static boolean supportsPosix() {
        return FileSystems.getDefault().supportedFileAttributeViews().contains("posix");
    }
}
