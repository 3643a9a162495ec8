package com.chartgate.gateway.api;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.chartgate.gateway.config.AdminProperties;
import com.chartgate.security.UnauthorizedException;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("AdminAuthenticator")
class AdminAuthenticatorTest {

    private final AdminAuthenticator authenticator =
            new AdminAuthenticator(new AdminProperties("operator", "s3cret"));

    private static String basic(String user, String password) {
        String pair = user + ":" + password;
        return "Basic " + Base64.getEncoder().encodeToString(pair.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("accepts basic credentials")
    void basicAuth() {
        assertThatCode(() -> authenticator.authenticate(basic("operator", "s3cret"))).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("accepts the password or user:password as a bearer token")
    void bearerAuth() {
        assertThatCode(() -> authenticator.authenticate("Bearer s3cret")).doesNotThrowAnyException();
        assertThatCode(() -> authenticator.authenticate("bearer operator:s3cret")).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("rejects wrong or missing credentials")
    void rejects() {
        assertThatThrownBy(() -> authenticator.authenticate(basic("operator", "wrong")))
                .isInstanceOf(UnauthorizedException.class);
        assertThatThrownBy(() -> authenticator.authenticate("Bearer wrong"))
                .isInstanceOf(UnauthorizedException.class);
        assertThatThrownBy(() -> authenticator.authenticate("Basic not-base64!"))
                .isInstanceOf(UnauthorizedException.class);
        assertThatThrownBy(() -> authenticator.authenticate(null))
                .isInstanceOf(UnauthorizedException.class);
    }

    @Test
    @DisplayName("refuses every request when no admin credentials are configured")
    void notConfigured() {
        AdminAuthenticator unconfigured = new AdminAuthenticator(new AdminProperties(null, null));

        assertThatThrownBy(() -> unconfigured.authenticate(basic("operator", "s3cret")))
                .isInstanceOf(AdminUnavailableException.class);
    }
}
