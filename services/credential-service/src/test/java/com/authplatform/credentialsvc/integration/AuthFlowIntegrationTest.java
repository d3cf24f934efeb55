package com.authplatform.credentialsvc.integration;

import com.authplatform.credentialsvc.api.support.SessionCookieFactory;
import com.authplatform.credentialsvc.infra.persistence.SessionTokenRepository;
import com.authplatform.credentialsvc.infra.persistence.UserRepository;
import jakarta.servlet.http.Cookie;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpHeaders;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.web.servlet.MvcResult;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

class AuthFlowIntegrationTest extends BaseIntegrationTest {

    @Autowired
    private SessionTokenRepository sessionTokenRepository;

    @Autowired
    private UserRepository userRepository;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private static String sessionCookie(MvcResult result) {
        Cookie cookie = result.getResponse().getCookie(SessionCookieFactory.COOKIE_NAME);
        assertThat(cookie).as("session cookie").isNotNull();
        return cookie.getValue();
    }

    @Test
    void registerVerifyLoginRefreshLogout() throws Exception {
        String email = uniqueEmail("flow");
        UUID userId = register(email);

        MvcResult beforeVerify = login(email, PASSWORD);
        assertThat(beforeVerify.getResponse().getStatus()).isEqualTo(403);
        assertThat(json(beforeVerify).get("errorCode").asText()).isEqualTo("EMAIL_NOT_VERIFIED");

        mockMvc.perform(post("/api/v1/auth/verify-email")
                        .contentType("application/json")
                        .content("{\"email\":\"" + email + "\",\"code\":\"" + latestVerificationCode(userId) + "\"}"))
                .andExpect(status().isOk());

        MvcResult loggedIn = login(email, PASSWORD);
        assertThat(loggedIn.getResponse().getStatus()).isEqualTo(200);
        assertThat(loggedIn.getResponse().getHeader(HttpHeaders.SET_COOKIE))
                .contains("HttpOnly").contains("SameSite=Strict").contains("Path=/api/v1/auth");
        String accessToken = json(loggedIn).get("accessToken").asText();
        String firstSession = sessionCookie(loggedIn);

        mockMvc.perform(get("/api/v1/me").header(HttpHeaders.AUTHORIZATION, "Bearer " + accessToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.userId").value(userId.toString()))
                .andExpect(jsonPath("$.email").value(email))
                .andExpect(jsonPath("$.emailVerified").value(true));

        MvcResult refreshed = mockMvc.perform(post("/api/v1/auth/refresh")
                        .cookie(new Cookie(SessionCookieFactory.COOKIE_NAME, firstSession)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.accessToken").isNotEmpty())
                .andReturn();
        String secondSession = sessionCookie(refreshed);
        assertThat(secondSession).isNotEqualTo(firstSession);

        mockMvc.perform(post("/api/v1/auth/logout")
                        .cookie(new Cookie(SessionCookieFactory.COOKIE_NAME, secondSession)))
                .andExpect(status().isOk())
                .andExpect(header().string(HttpHeaders.SET_COOKIE, org.hamcrest.Matchers.containsString("Max-Age=0")));

        assertThat(sessionTokenRepository.countByUserId(userId)).isZero();
        mockMvc.perform(post("/api/v1/auth/refresh")
                        .cookie(new Cookie(SessionCookieFactory.COOKIE_NAME, secondSession)))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void replayingARotatedSessionRevokesTheWholeFamily() throws Exception {
        String email = uniqueEmail("replay");
        UUID userId = registerAndVerify(email);
        String first = sessionCookie(login(email, PASSWORD));

        String second = sessionCookie(mockMvc.perform(post("/api/v1/auth/refresh")
                        .cookie(new Cookie(SessionCookieFactory.COOKIE_NAME, first)))
                .andExpect(status().isOk())
                .andReturn());
        // move the rotation out of the retry grace so the replay counts as theft
        jdbcTemplate.update("UPDATE session_tokens SET created_at = created_at - INTERVAL '5 minutes' WHERE user_id = ?",
                userId);

        mockMvc.perform(post("/api/v1/auth/refresh")
                        .cookie(new Cookie(SessionCookieFactory.COOKIE_NAME, first)))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.errorCode").value("INVALID_TOKEN"));

        mockMvc.perform(post("/api/v1/auth/refresh")
                        .cookie(new Cookie(SessionCookieFactory.COOKIE_NAME, second)))
                .andExpect(status().isUnauthorized());
        assertThat(sessionTokenRepository.countByUserId(userId)).isZero();
    }

    @Test
    void logoutAllRevokesEverySessionOfTheCaller() throws Exception {
        String email = uniqueEmail("all");
        UUID userId = registerAndVerify(email);
        MvcResult laptop = login(email, PASSWORD);
        login(email, PASSWORD);
        login(email, PASSWORD);
        assertThat(sessionTokenRepository.countByUserId(userId)).isEqualTo(3);

        mockMvc.perform(post("/api/v1/auth/logout-all")
                        .header(HttpHeaders.AUTHORIZATION, "Bearer " + json(laptop).get("accessToken").asText()))
                .andExpect(status().isOk());

        assertThat(sessionTokenRepository.countByUserId(userId)).isZero();
    }

    @Test
    void logoutAllWithoutAccessTokenIsUnauthorized() throws Exception {
        mockMvc.perform(post("/api/v1/auth/logout-all")).andExpect(status().isUnauthorized());
    }

    @Test
    void refreshWithoutCookieIsUnauthorized() throws Exception {
        mockMvc.perform(post("/api/v1/auth/refresh"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.errorCode").value("INVALID_TOKEN"));
    }

    @Test
    void wrongPasswordAndUnknownEmailLookTheSame() throws Exception {
        String email = uniqueEmail("login");
        registerAndVerify(email);

        MvcResult wrongPassword = login(email, "Wrong&Password1");
        MvcResult unknownEmail = login(uniqueEmail("nobody"), "Wrong&Password1");

        assertThat(wrongPassword.getResponse().getStatus()).isEqualTo(401);
        assertThat(unknownEmail.getResponse().getStatus()).isEqualTo(401);
        assertThat(json(wrongPassword).get("detail")).isEqualTo(json(unknownEmail).get("detail"));
        assertThat(json(wrongPassword).get("errorCode")).isEqualTo(json(unknownEmail).get("errorCode"));
    }

    @Test
    void duplicateRegistrationIsAConflict() throws Exception {
        String email = uniqueEmail("dup");
        register(email);

        MvcResult again = postJson("/api/v1/auth/register",
                new com.authplatform.credentialsvc.api.dto.request.RegisterRequest(email.toUpperCase(), PASSWORD, null));

        assertThat(again.getResponse().getStatus()).isEqualTo(409);
        assertThat(json(again).at("/extensions/field").asText()).isEqualTo("email");
    }

    @Test
    void problemResponsesCarryTheCorrelationId() throws Exception {
        mockMvc.perform(post("/api/v1/auth/refresh").header("X-Correlation-ID", "corr-1234"))
                .andExpect(status().isUnauthorized())
                .andExpect(header().string("X-Correlation-ID", "corr-1234"))
                .andExpect(jsonPath("$.correlationId").value("corr-1234"));
    }

    @Test
    void accessTokenOutlivingItsAccountGetsNotFound() throws Exception {
        String email = uniqueEmail("gone");
        UUID userId = registerAndVerify(email);
        String accessToken = json(login(email, PASSWORD)).get("accessToken").asText();

        userRepository.deleteById(userId);

        mockMvc.perform(get("/api/v1/me").header(HttpHeaders.AUTHORIZATION, "Bearer " + accessToken))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.errorCode").value("ACCOUNT_NOT_FOUND"));
    }

    @Test
    void retriedRefreshWithALostResponseKeepsTheNewSession() throws Exception {
        String email = uniqueEmail("retry");
        UUID userId = registerAndVerify(email);
        String first = sessionCookie(login(email, PASSWORD));

        String second = sessionCookie(mockMvc.perform(post("/api/v1/auth/refresh")
                        .cookie(new Cookie(SessionCookieFactory.COOKIE_NAME, first)))
                .andExpect(status().isOk())
                .andReturn());

        mockMvc.perform(post("/api/v1/auth/refresh")
                        .cookie(new Cookie(SessionCookieFactory.COOKIE_NAME, first)))
                .andExpect(status().isUnauthorized());
        assertThat(sessionTokenRepository.countByUserId(userId)).isEqualTo(1);

        mockMvc.perform(post("/api/v1/auth/refresh")
                        .cookie(new Cookie(SessionCookieFactory.COOKIE_NAME, second)))
                .andExpect(status().isOk());
    }
}
