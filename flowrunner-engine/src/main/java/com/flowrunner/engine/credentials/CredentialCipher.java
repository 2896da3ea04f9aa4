package com.flowrunner.engine.credentials;

import com.flowrunner.core.exception.WorkflowConfigurationException;

import javax.crypto.Cipher;
import javax.crypto.spec.IvParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Base64;

/**
 * Passphrase-based AES-256-CBC in the OpenSSL "Salted__" envelope.
 * 
 * Layout (Base64): "Salted__" | 8-byte salt | ciphertext.
 * Key and IV are derived with EVP_BytesToKey (MD5, one iteration).
 */
public class CredentialCipher {

    private static final byte[] SALTED_MAGIC = "Salted__".getBytes(StandardCharsets.US_ASCII);
    private static final int SALT_LENGTH = 8;
    private static final int KEY_LENGTH = 32;
    private static final int IV_LENGTH = 16;

    private final String passphrase;
    private final SecureRandom random = new SecureRandom();

    public CredentialCipher(String passphrase) {
        this.passphrase = passphrase;
    }

    public boolean isConfigured() {
        return passphrase != null && !passphrase.isEmpty();
    }

    public String decrypt(String encrypted) {
        requireConfigured();
        byte[] data = Base64.getDecoder().decode(encrypted.trim());
        if (data.length < SALTED_MAGIC.length + SALT_LENGTH
                || !Arrays.equals(Arrays.copyOf(data, SALTED_MAGIC.length), SALTED_MAGIC)) {
            throw new IllegalArgumentException("Encrypted credentials are not in salted format");
        }
        byte[] salt = Arrays.copyOfRange(data, SALTED_MAGIC.length, SALTED_MAGIC.length + SALT_LENGTH);
        byte[] cipherText = Arrays.copyOfRange(data, SALTED_MAGIC.length + SALT_LENGTH, data.length);
        try {
            Cipher cipher = cipher(Cipher.DECRYPT_MODE, salt);
            return new String(cipher.doFinal(cipherText), StandardCharsets.UTF_8);
        } catch (GeneralSecurityException e) {
            throw new IllegalArgumentException("Unable to decrypt credentials", e);
        }
    }

    public String encrypt(String plainText) {
        requireConfigured();
        byte[] salt = new byte[SALT_LENGTH];
        random.nextBytes(salt);
        try {
            Cipher cipher = cipher(Cipher.ENCRYPT_MODE, salt);
            byte[] cipherText = cipher.doFinal(plainText.getBytes(StandardCharsets.UTF_8));
            byte[] out = new byte[SALTED_MAGIC.length + SALT_LENGTH + cipherText.length];
            System.arraycopy(SALTED_MAGIC, 0, out, 0, SALTED_MAGIC.length);
            System.arraycopy(salt, 0, out, SALTED_MAGIC.length, SALT_LENGTH);
            System.arraycopy(cipherText, 0, out, SALTED_MAGIC.length + SALT_LENGTH, cipherText.length);
            return Base64.getEncoder().encodeToString(out);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Unable to encrypt credentials", e);
        }
    }

    private Cipher cipher(int mode, byte[] salt) throws GeneralSecurityException {
        byte[] keyAndIv = deriveKeyAndIv(passphrase.getBytes(StandardCharsets.UTF_8), salt);
        Cipher cipher = Cipher.getInstance("AES/CBC/PKCS5Padding");
        cipher.init(mode,
            new SecretKeySpec(keyAndIv, 0, KEY_LENGTH, "AES"),
            new IvParameterSpec(keyAndIv, KEY_LENGTH, IV_LENGTH));
        return cipher;
    }

    private static byte[] deriveKeyAndIv(byte[] password, byte[] salt) throws GeneralSecurityException {
        MessageDigest md5 = MessageDigest.getInstance("MD5");
        byte[] result = new byte[KEY_LENGTH + IV_LENGTH];
        byte[] block = new byte[0];
        int filled = 0;
        while (filled < result.length) {
            md5.reset();
            md5.update(block);
            md5.update(password);
            md5.update(salt);
            block = md5.digest();
            int length = Math.min(block.length, result.length - filled);
            System.arraycopy(block, 0, result, filled, length);
            filled += length;
        }
        return result;
    }

    private void requireConfigured() {
        if (!isConfigured()) {
            throw new WorkflowConfigurationException("Credentials key not set");
        }
    }
}
