package com.camsentinel.service.onvif;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Base64;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link WsSecurity}.
 */
class WsSecurityTest {

    @Test
    @DisplayName("Should compute the password digest of the ONVIF core example")
    void shouldMatchReferenceDigest() {
        byte[] nonce = Base64.getDecoder().decode("LKqI6G/AikKCQrN0zqZFlg==");

        String digest = WsSecurity.passwordDigest(nonce, "2010-09-16T07:50:45Z", "userpassword");

        assertThat(digest).isEqualTo("tuOSpGlFlIXsozq4HFNeeGeFLEI=");
    }

    @Test
    @DisplayName("Should render a UsernameToken with a fresh nonce per request")
    void shouldRenderUsernameToken() {
        Instant now = Instant.parse("2024-05-01T10:00:00.789Z");

        String first = WsSecurity.securityHeader("admin", "secret", now);
        String second = WsSecurity.securityHeader("admin", "secret", now);

        assertThat(first).contains("<wsse:Username>admin</wsse:Username>")
                .contains("#PasswordDigest")
                .contains("<wsu:Created>2024-05-01T10:00:00Z</wsu:Created>")
                .doesNotContain("secret");
        assertThat(first).isNotEqualTo(second);
    }

    @Test
    @DisplayName("Should escape markup in the user name")
    void shouldEscapeUserName() {
        String header = WsSecurity.securityHeader("a<b&c", "pw", Instant.EPOCH);

        assertThat(header).contains("<wsse:Username>a&lt;b&amp;c</wsse:Username>");
    }
}
