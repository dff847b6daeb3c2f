package com.awardhub.backend.modules.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.LinkedHashMap;
import java.util.Map;

import com.awardhub.backend.modules.auth.application.OtpCodeGenerator;
import com.awardhub.backend.modules.auth.domain.AppUser;
import com.awardhub.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.awardhub.backend.support.AbstractIntegrationTest;
import com.awardhub.backend.support.TestUserFactory;
import com.fasterxml.jackson.databind.JsonNode;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MvcResult;

@SpringBootTest
@AutoConfigureMockMvc
class AuthIntegrationTest extends AbstractIntegrationTest {

    private static final String PHONE = "+998901112233";

    @MockBean
    private OtpCodeGenerator otpCodeGenerator;

    @Autowired
    private AppUserRepository appUserRepository;

    @Autowired
    private TestUserFactory testUserFactory;

    @Test
    void signupCreatesAccountOnlyAfterCodeIsVerified() throws Exception {
        when(otpCodeGenerator.nextCode()).thenReturn("482913");

        MvcResult started = mockMvc.perform(post("/auth/signup/start")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(signupForm(PHONE))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.phoneNumber").value(PHONE))
                .andReturn();
        String verificationId = readBody(started).path("verificationId").asText();
        assertThat(appUserRepository.findByPhoneNumber(PHONE)).isEmpty();

        mockMvc.perform(post("/auth/signup/verify")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("verificationId", verificationId, "code", "000000"))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_VERIFICATION_CODE"));

        MvcResult verified = mockMvc.perform(post("/auth/signup/verify")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("verificationId", verificationId, "code", "482913"))))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.tokens.tokenType").value("Bearer"))
                .andReturn();

        AppUser created = appUserRepository.findByPhoneNumber(PHONE).orElseThrow();
        assertThat(created.getFirstName()).isEqualTo("Sardor");
        assertThat(created.getPasswordHash()).isNotEqualTo("Sardor#2025");

        String accessToken = readBody(verified).path("tokens").path("accessToken").asText();
        mockMvc.perform(get("/users/me").header("Authorization", "Bearer " + accessToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.phoneNumber").value(PHONE));
    }

    @Test
    void signupIsRejectedForRegisteredPhone() throws Exception {
        testUserFactory.ensureApplicant(PHONE);

        mockMvc.perform(post("/auth/signup/start")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(signupForm(PHONE))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.errors.phoneNumber").exists());
    }

    @Test
    void refreshRotatesTokens() throws Exception {
        testUserFactory.ensureApplicant(PHONE);

        MvcResult signedIn = mockMvc.perform(post("/auth/signin")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(
                                Map.of("phoneNumber", PHONE, "password", TestUserFactory.DEFAULT_PASSWORD))))
                .andExpect(status().isOk())
                .andReturn();
        String refreshToken = readBody(signedIn).path("tokens").path("refreshToken").asText();

        MvcResult refreshed = mockMvc.perform(post("/auth/refresh")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("refreshToken", refreshToken))))
                .andExpect(status().isOk())
                .andReturn();
        JsonNode tokens = readBody(refreshed).path("tokens");
        assertThat(tokens.path("refreshToken").asText()).isNotEqualTo(refreshToken);

        mockMvc.perform(post("/auth/refresh")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("refreshToken", refreshToken))))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void wrongPasswordIsUnauthorized() throws Exception {
        testUserFactory.ensureApplicant(PHONE);

        mockMvc.perform(post("/auth/signin")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("phoneNumber", PHONE, "password", "wrong-password"))))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void passwordResetReplacesPassword() throws Exception {
        testUserFactory.ensureApplicant(PHONE);
        when(otpCodeGenerator.nextCode()).thenReturn("731905");

        mockMvc.perform(post("/auth/password/reset-code")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("phoneNumber", PHONE))))
                .andExpect(status().isOk());

        mockMvc.perform(post("/auth/password/reset")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(
                                Map.of("phoneNumber", PHONE, "code", "731905", "newPassword", "Fresh#Password1"))))
                .andExpect(status().isOk());

        assertThat(signIn(PHONE, "Fresh#Password1")).isNotBlank();
    }

    @Test
    void blankProfileNameIsRejected() throws Exception {
        testUserFactory.ensureApplicant(PHONE);
        String token = signIn(PHONE, TestUserFactory.DEFAULT_PASSWORD);

        mockMvc.perform(patch("/users/me")
                        .header("Authorization", "Bearer " + token)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("firstName", "   ", "lastName", " \t "))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.errors.firstName").value("firstName must not be blank"))
                .andExpect(jsonPath("$.errors.lastName").value("lastName must not be blank"));

        mockMvc.perform(get("/users/me").header("Authorization", "Bearer " + token))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.firstName").value("Dilnoza"))
                .andExpect(jsonPath("$.lastName").value("Rahimova"));
    }

    private static Map<String, Object> signupForm(String phoneNumber) {
        Map<String, Object> form = new LinkedHashMap<>();
        form.put("firstName", "Sardor");
        form.put("lastName", "Tursunov");
        form.put("otherName", "Baxtiyorovich");
        form.put("gender", "MALE");
        form.put("email", "sardor.tursunov@example.com");
        form.put("phoneNumber", phoneNumber);
        form.put("password", "Sardor#2025");
        form.put("passwordConfirm", "Sardor#2025");
        form.put("birthDate", "1998-07-21");
        form.put("address", "Mirzo Ulugbek 12, Tashkent");
        form.put("workingPlace", "School 110");
        form.put("pinfl", "52107980123456");
        form.put("passportNumber", "AC7654321");
        return form;
    }
}
