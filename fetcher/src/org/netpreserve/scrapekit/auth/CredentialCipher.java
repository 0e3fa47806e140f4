package org.netpreserve.scrapekit.auth;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.PBEKeySpec;
import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Base64;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Encrypts credentials for storage. The AES key is derived with PBKDF2 from the credential key label as the
 * password and this machine's host name as the salt, so a stored blob only opens on the machine that wrote it
 * and under the key it was saved as.
 * <p>
 * Blobs are base64 of a 12 byte IV followed by the AES-GCM ciphertext of {@code {"username":..,"password":..}}.
 */
public class CredentialCipher {
    private static final Logger log = LoggerFactory.getLogger(CredentialCipher.class);
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final int ITERATIONS = 100_000;
    private static final int KEY_BITS = 256;
    private static final int SALT_BYTES = 16;
    private static final int IV_BYTES = 12;
    private static final int TAG_BITS = 128;

    private final byte[] salt;
    private final SecureRandom random = new SecureRandom();
    private final Map<String, SecretKey> keys = new ConcurrentHashMap<>();

    public CredentialCipher() {
        this(machineIdentifier());
    }

    public CredentialCipher(String machineIdentifier) {
        this.salt = salt(machineIdentifier);
    }

    /**
     * The first 16 bytes of the identifier, padded with '0' characters when shorter.
     */
    static byte[] salt(String machineIdentifier) {
        byte[] bytes = machineIdentifier.getBytes(StandardCharsets.UTF_8);
        byte[] salt = Arrays.copyOf(bytes, SALT_BYTES);
        if (bytes.length < SALT_BYTES) Arrays.fill(salt, bytes.length, SALT_BYTES, (byte) '0');
        return salt;
    }

    static String machineIdentifier() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            String env = System.getenv("HOSTNAME");
            if (env == null) env = System.getenv("COMPUTERNAME");
            log.debug("Unable to resolve local host name, using {}", env);
            return env != null ? env : "localhost";
        }
    }

    public String seal(String label, Credentials credentials) {
        ObjectNode json = JSON.createObjectNode()
                .put("username", credentials.username())
                .put("password", credentials.secret());
        try {
            byte[] iv = new byte[IV_BYTES];
            random.nextBytes(iv);
            Cipher cipher = Cipher.getInstance("AES/GCM/NoPadding");
            cipher.init(Cipher.ENCRYPT_MODE, key(label), new GCMParameterSpec(TAG_BITS, iv));
            byte[] ciphertext = cipher.doFinal(JSON.writeValueAsBytes(json));
            return Base64.getEncoder().encodeToString(ByteBuffer.allocate(iv.length + ciphertext.length)
                    .put(iv).put(ciphertext).array());
        } catch (GeneralSecurityException | JsonProcessingException e) {
            throw new IllegalStateException("Unable to encrypt credentials", e);
        }
    }

    /**
     * @throws GeneralSecurityException if the blob is malformed, was sealed under another label or on another
     *                                  machine
     */
    public Credentials open(String label, String blob) throws GeneralSecurityException {
        byte[] bytes;
        try {
            bytes = Base64.getDecoder().decode(blob.trim());
        } catch (IllegalArgumentException e) {
            throw new GeneralSecurityException("Credential blob is not valid base64", e);
        }
        if (bytes.length <= IV_BYTES) throw new GeneralSecurityException("Credential blob too short");
        Cipher cipher = Cipher.getInstance("AES/GCM/NoPadding");
        cipher.init(Cipher.DECRYPT_MODE, key(label), new GCMParameterSpec(TAG_BITS, bytes, 0, IV_BYTES));
        byte[] plaintext = cipher.doFinal(bytes, IV_BYTES, bytes.length - IV_BYTES);
        try {
            JsonNode json = JSON.readTree(plaintext);
            if (!json.hasNonNull("username") || !json.hasNonNull("password")) {
                throw new GeneralSecurityException("Decrypted credentials are incomplete");
            }
            return new Credentials(json.get("username").asText(), json.get("password").asText());
        } catch (IOException e) {
            throw new GeneralSecurityException("Decrypted credentials are not JSON", e);
        }
    }

    private SecretKey key(String label) throws GeneralSecurityException {
        SecretKey key = keys.get(label);
        if (key != null) return key;
        var keySpec = new PBEKeySpec(label.toCharArray(), salt, ITERATIONS, KEY_BITS);
        try {
            byte[] encoded = SecretKeyFactory.getInstance("PBKDF2WithHmacSHA256").generateSecret(keySpec).getEncoded();
            key = new SecretKeySpec(encoded, "AES");
        } finally {
            keySpec.clearPassword();
        }
        keys.put(label, key);
        return key;
    }
}
