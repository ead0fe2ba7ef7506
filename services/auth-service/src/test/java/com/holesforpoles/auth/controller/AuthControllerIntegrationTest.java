package com.holesforpoles.auth.controller;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.holesforpoles.auth.entity.User;
import com.holesforpoles.auth.repository.UserRepository;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;

/**
 * End-to-end tests over HTTP against an in-memory H2 store.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@DisplayName("Auth endpoints")
class AuthControllerIntegrationTest {

    @Autowired private MockMvc mockMvc;
    @Autowired private ObjectMapper objectMapper;
    @Autowired private UserRepository userRepository;

    @BeforeEach
    void cleanStore() {
        userRepository.deleteAll();
    }

    private ResultActions register(String email, String username, String password) throws Exception {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("email", email);
        body.put("username", username);
        body.put("full_name", "Test User");
        body.put("password", password);
        return mockMvc.perform(post("/auth/register")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(body)));
    }

    private ResultActions login(String username, String password) throws Exception {
        return mockMvc.perform(post("/auth/login")
                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                .param("username", username)
                .param("password", password));
    }

    private String tokenFor(String username, String password) throws Exception {
        String body = login(username, password)
                .andExpect(status().isOk())
                .andReturn().getResponse().getContentAsString();
        JsonNode json = objectMapper.readTree(body);
        return json.get("access_token").asText();
    }

    private static String bearer(String token) {
        return "Bearer " + token;
    }

    @Test
    @DisplayName("register, log in, read the profile and refresh")
    void fullFlow() throws Exception {
        register("alice@example.com", "alice", "Valid123")
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").isNumber())
                .andExpect(jsonPath("$.username").value("alice"))
                .andExpect(jsonPath("$.email").value("alice@example.com"))
                .andExpect(jsonPath("$.full_name").value("Test User"))
                .andExpect(jsonPath("$.is_active").value(true))
                .andExpect(jsonPath("$.created_at").exists())
                .andExpect(jsonPath("$.hashed_password").doesNotExist())
                .andExpect(jsonPath("$.password").doesNotExist());

        login("alice", "Valid123")
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.token_type").value("bearer"))
                .andExpect(jsonPath("$.access_token").isString());

        String token = tokenFor("alice", "Valid123");
        mockMvc.perform(get("/auth/me").header(HttpHeaders.AUTHORIZATION, bearer(token)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.username").value("alice"));

        String refreshed = objectMapper.readTree(mockMvc.perform(post("/auth/refresh")
                        .header(HttpHeaders.AUTHORIZATION, bearer(token)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.token_type").value("bearer"))
                .andReturn().getResponse().getContentAsString()).get("access_token").asText();

        mockMvc.perform(get("/auth/me").header(HttpHeaders.AUTHORIZATION, bearer(refreshed)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.email").value("alice@example.com"));
    }

    @Test
    @DisplayName("login accepts the email address as identifier")
    void loginWithEmail() throws Exception {
        register("alice@example.com", "alice", "Valid123").andExpect(status().isCreated());

        login("alice@example.com", "Valid123")
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.access_token").isString());
    }

    @Test
    @DisplayName("duplicate email and username are rejected with 400")
    void duplicates() throws Exception {
        register("alice@example.com", "alice", "Valid123").andExpect(status().isCreated());

        register("alice@example.com", "alice2", "Valid123")
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.detail").value("Email already registered"));
        register("other@example.com", "alice", "Valid123")
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.detail").value("Username already taken"));
        assertThat(userRepository.count()).isEqualTo(1);
    }

    @Test
    @DisplayName("an email that differs only in domain case is a duplicate")
    void duplicateEmailDomainCase() throws Exception {
        register("alice@Example.COM", "alice1", "Valid123")
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.email").value("alice@example.com"));

        register("alice@example.com", "alice2", "Valid123")
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.detail").value("Email already registered"));
        assertThat(userRepository.count()).isEqualTo(1);
        login("alice@EXAMPLE.com", "Valid123").andExpect(status().isOk());
    }

    @Test
    @DisplayName("weak passwords are rejected with 400")
    void weakPassword() throws Exception {
        register("a@b.com", "ab", "short")
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.detail").value("Password must be at least 8 characters"));
        register("a@b.com", "alice", "alllowercase1")
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.detail").value("Password must contain at least one uppercase letter"));
        register("a@b.com", "alice", "NoDigitsHere")
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.detail").value("Password must contain at least one digit"));
        assertThat(userRepository.count()).isZero();
    }

    @Test
    @DisplayName("wrong password and unknown user get the same 401")
    void loginFailuresAreIndistinguishable() throws Exception {
        register("alice@example.com", "alice", "Valid123").andExpect(status().isCreated());

        String wrongPassword = login("alice", "Wrong1234")
                .andExpect(status().isUnauthorized())
                .andExpect(header().string(HttpHeaders.WWW_AUTHENTICATE, "Bearer"))
                .andReturn().getResponse().getContentAsString();
        String unknownUser = login("nonexistent", "anything")
                .andExpect(status().isUnauthorized())
                .andExpect(header().string(HttpHeaders.WWW_AUTHENTICATE, "Bearer"))
                .andReturn().getResponse().getContentAsString();

        assertThat(objectMapper.readTree(unknownUser).get("detail"))
                .isEqualTo(objectMapper.readTree(wrongPassword).get("detail"));
        assertThat(objectMapper.readTree(unknownUser).get("detail").asText())
                .isEqualTo("Incorrect username or password");
    }

    @Test
    @DisplayName("protected endpoints need a valid bearer token")
    void protectedEndpointsNeedToken() throws Exception {
        mockMvc.perform(get("/auth/me"))
                .andExpect(status().isUnauthorized())
                .andExpect(header().string(HttpHeaders.WWW_AUTHENTICATE, "Bearer"))
                .andExpect(jsonPath("$.detail").value("Could not validate credentials"));
        mockMvc.perform(get("/auth/me").header(HttpHeaders.AUTHORIZATION, bearer("not.a.token")))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.detail").value("Could not validate credentials"));
        mockMvc.perform(post("/auth/refresh"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    @DisplayName("deactivating an account invalidates its unexpired tokens")
    void deactivatedAccount() throws Exception {
        register("alice@example.com", "alice", "Valid123").andExpect(status().isCreated());
        String token = tokenFor("alice", "Valid123");

        User alice = userRepository.findByUsername("alice").orElseThrow();
        alice.setActive(false);
        userRepository.save(alice);

        mockMvc.perform(get("/auth/me").header(HttpHeaders.AUTHORIZATION, bearer(token)))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.detail").value("Inactive user"));
        login("alice", "Valid123")
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.detail").value("Inactive user"));
    }

    @Test
    @DisplayName("a token for a deleted account is refused")
    void deletedAccount() throws Exception {
        register("alice@example.com", "alice", "Valid123").andExpect(status().isCreated());
        String token = tokenFor("alice", "Valid123");

        userRepository.deleteAll();

        mockMvc.perform(get("/auth/me").header(HttpHeaders.AUTHORIZATION, bearer(token)))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.detail").value("Could not validate credentials"));
    }

    @Test
    @DisplayName("a stale token does not block public endpoints")
    void staleTokenOnPublicEndpoint() throws Exception {
        register("alice@example.com", "alice", "Valid123").andExpect(status().isCreated());

        mockMvc.perform(post("/auth/login")
                        .header(HttpHeaders.AUTHORIZATION, bearer("not.a.token"))
                        .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                        .param("username", "alice")
                        .param("password", "Valid123"))
                .andExpect(status().isOk());
    }

    @Test
    @DisplayName("a token with an out-of-range expiry is refused, not a server error")
    void outOfRangeExpiry() throws Exception {
        register("alice@example.com", "alice", "Valid123").andExpect(status().isCreated());
        String header = base64Url("{\"alg\":\"HS256\",\"typ\":\"JWT\"}");
        String payload = base64Url("{\"sub\":\"1\",\"exp\":99999999999999999}");
        String forged = header + "." + payload + ".c2ln";

        mockMvc.perform(get("/auth/me").header(HttpHeaders.AUTHORIZATION, bearer(forged)))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.detail").value("Could not validate credentials"));
        mockMvc.perform(post("/auth/login")
                        .header(HttpHeaders.AUTHORIZATION, bearer(forged))
                        .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                        .param("username", "alice")
                        .param("password", "Valid123"))
                .andExpect(status().isOk());
    }

    private static String base64Url(String value) {
        return Base64.getUrlEncoder().withoutPadding().encodeToString(value.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("welcome and health endpoints are public")
    void statusEndpoints() throws Exception {
        mockMvc.perform(get("/"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("online"));
        mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("operational"))
                .andExpect(jsonPath("$.version").value("0.1.0"))
                .andExpect(jsonPath("$.timestamp").exists());
        mockMvc.perform(get("/actuator/health")).andExpect(status().isOk());
    }
}
