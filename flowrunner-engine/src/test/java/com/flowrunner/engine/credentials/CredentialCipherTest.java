package com.flowrunner.engine.credentials;

import com.flowrunner.core.exception.WorkflowConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Base64;

import static org.assertj.core.api.Assertions.*;

@DisplayName("CredentialCipher")
class CredentialCipherTest {

    // echo -n '{"token":"abc"}' | openssl enc -aes-256-cbc -md md5 -a -A -salt -pass pass:secret-key
    private static final String OPENSSL_SAMPLE = "U2FsdGVkX1/kx7vv0sjs0jxeK1erUqzMLsn3DrcEx2I=";

    private final CredentialCipher cipher = new CredentialCipher("secret-key");

    @Test
    @DisplayName("Encrypted text uses the salted envelope")
    void usesSaltedEnvelope() {
        byte[] raw = Base64.getDecoder().decode(cipher.encrypt("{\"token\":\"abc\"}"));

        assertThat(new String(Arrays.copyOf(raw, 8), StandardCharsets.US_ASCII)).isEqualTo("Salted__");
        assertThat((raw.length - 16) % 16).isZero();
    }

    @Test
    @DisplayName("Decrypts text produced by openssl enc")
    void decryptsOpensslOutput() {
        assertThat(cipher.decrypt(OPENSSL_SAMPLE)).isEqualTo("{\"token\":\"abc\"}");
    }

    @Test
    @DisplayName("Encrypt then decrypt restores the plain text")
    void decryptRestoresPlainText() {
        String encrypted = cipher.encrypt("{\"token\":\"abc\"}");

        assertThat(cipher.decrypt(encrypted)).isEqualTo("{\"token\":\"abc\"}");
    }

    @Test
    @DisplayName("Each encryption uses a fresh salt")
    void freshSalt() {
        assertThat(cipher.encrypt("same")).isNotEqualTo(cipher.encrypt("same"));
    }

    @Test
    @DisplayName("Wrong passphrase cannot decrypt")
    void wrongPassphrase() {
        assertThatThrownBy(() -> new CredentialCipher("other-key").decrypt(OPENSSL_SAMPLE))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Text without the salted header is rejected")
    void rejectsUnsaltedText() {
        String plain = Base64.getEncoder().encodeToString("not salted at all".getBytes(StandardCharsets.UTF_8));

        assertThatThrownBy(() -> cipher.decrypt(plain))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("salted");
    }

    @Test
    @DisplayName("Missing passphrase is a configuration error")
    void missingPassphrase() {
        CredentialCipher unconfigured = new CredentialCipher("");

        assertThat(unconfigured.isConfigured()).isFalse();
        assertThatThrownBy(() -> unconfigured.encrypt("x"))
            .isInstanceOf(WorkflowConfigurationException.class)
            .hasMessage("Credentials key not set");
    }
}
