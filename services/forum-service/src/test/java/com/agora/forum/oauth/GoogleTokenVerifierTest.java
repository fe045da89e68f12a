package com.agora.forum.oauth;

import com.agora.forum.config.OAuthProperties;
import com.agora.forum.entity.AuthProvider;
import com.agora.forum.exception.ProviderException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class GoogleTokenVerifierTest {

    private static final String TOKEN_INFO = "https://oauth2.googleapis.com/tokeninfo?id_token=tok";

    private RestTemplate restTemplate;
    private MockRestServiceServer server;
    private OAuthProperties properties;

    @BeforeEach
    void setUp() {
        restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        properties = new OAuthProperties();
    }

    private GoogleTokenVerifier verifier() {
        return new GoogleTokenVerifier(restTemplate, properties);
    }

    private void respond(String json) {
        server.expect(requestTo(TOKEN_INFO))
                .andExpect(method(HttpMethod.GET))
                .andRespond(withSuccess(json, MediaType.APPLICATION_JSON));
    }

    @Test
    void verifiedToken_yieldsIdentity() {
        respond("{\"sub\":\"g-1\",\"aud\":\"web-client\",\"email\":\"a@x.com\","
                + "\"email_verified\":\"true\",\"picture\":\"https://img.example/a.png\",\"exp\":\"1700000000\"}");

        ProviderIdentity identity = verifier().verify("tok");

        assertThat(identity.getSubjectId()).isEqualTo("g-1");
        assertThat(identity.getEmail()).isEqualTo("a@x.com");
        assertThat(identity.isEmailVerified()).isTrue();
        assertThat(identity.getPictureUrl()).isEqualTo("https://img.example/a.png");
        assertThat(verifier().provider()).isEqualTo(AuthProvider.GOOGLE);
        server.verify();
    }

    @Test
    void booleanEmailVerifiedFlag_isAccepted() {
        respond("{\"sub\":\"g-1\",\"email\":\"a@x.com\",\"email_verified\":true}");

        assertThat(verifier().verify("tok").getPictureUrl()).isNull();
    }

    @Test
    void unverifiedEmail_isRejected() {
        respond("{\"sub\":\"g-1\",\"email\":\"a@x.com\",\"email_verified\":\"false\"}");

        assertThatThrownBy(() -> verifier().verify("tok"))
                .isInstanceOf(ProviderException.class)
                .hasMessage("email not verified");
    }

    @Test
    void missingEmail_isRejected() {
        respond("{\"sub\":\"g-1\",\"email_verified\":\"true\"}");

        assertThatThrownBy(() -> verifier().verify("tok")).isInstanceOf(ProviderException.class);
    }

    @Test
    void errorStatus_isRejected() {
        server.expect(requestTo(TOKEN_INFO))
                .andRespond(withStatus(HttpStatus.BAD_REQUEST)
                        .contentType(MediaType.APPLICATION_JSON)
                        .body("{\"error\":\"invalid_token\"}"));

        assertThatThrownBy(() -> verifier().verify("tok"))
                .isInstanceOf(ProviderException.class)
                .hasMessageContaining("400");
    }

    @Test
    void configuredAudience_mustMatch() {
        properties.getGoogle().setClientIds(List.of("web-client"));
        respond("{\"sub\":\"g-1\",\"aud\":\"someone-else\",\"email\":\"a@x.com\",\"email_verified\":\"true\"}");

        assertThatThrownBy(() -> verifier().verify("tok"))
                .isInstanceOf(ProviderException.class)
                .hasMessageContaining("audience");
    }

    @Test
    void blankToken_isRejectedWithoutCallingGoogle() {
        assertThatThrownBy(() -> verifier().verify(" ")).isInstanceOf(ProviderException.class);
        server.verify();
    }
}
