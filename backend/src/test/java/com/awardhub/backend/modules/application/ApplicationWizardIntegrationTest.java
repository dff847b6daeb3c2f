package com.awardhub.backend.modules.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.awardhub.backend.modules.application.domain.Application;
import com.awardhub.backend.modules.application.infrastructure.persistence.ApplicationRepository;
import com.awardhub.backend.modules.notification.domain.Notification;
import com.awardhub.backend.modules.notification.domain.NotificationType;
import com.awardhub.backend.modules.notification.infrastructure.persistence.NotificationRepository;
import com.awardhub.backend.modules.reward.domain.Reward;
import com.awardhub.backend.support.AbstractIntegrationTest;
import com.awardhub.backend.support.TestUserFactory;
import com.fasterxml.jackson.databind.JsonNode;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.ResultActions;

@SpringBootTest
@AutoConfigureMockMvc
class ApplicationWizardIntegrationTest extends AbstractIntegrationTest {

    private static final String APPLICANT_PHONE = "+998935550101";
    private static final String DESCRIPTION =
            "Organised a free robotics club for thirty pupils from three neighbourhood schools.";

    @Autowired
    private TestUserFactory testUserFactory;

    @Autowired
    private ApplicationRepository applicationRepository;

    @Autowired
    private NotificationRepository notificationRepository;

    private Reward reward;
    private String token;

    @BeforeEach
    void setUp() throws Exception {
        testUserFactory.ensureApplicant(APPLICANT_PHONE);
        reward = testUserFactory.createReward("Young Innovator");
        token = signIn(APPLICANT_PHONE, TestUserFactory.DEFAULT_PASSWORD);
    }

    @Test
    void completedWizardBecomesApplicationWithNotification() throws Exception {
        savePersonalInfo().andExpect(status().isOk());
        saveActivityInfo(DESCRIPTION).andExpect(status().isOk());

        MockMultipartFile certificate = new MockMultipartFile("certificates", "olympiad.pdf", "application/pdf",
                "certificate".getBytes(StandardCharsets.UTF_8));
        MockMultipartFile letter = new MockMultipartFile("recommendationLetter", "letter.docx",
                "application/vnd.openxmlformats-officedocument.wordprocessingml.document",
                "letter".getBytes(StandardCharsets.UTF_8));
        mockMvc.perform(multipart("/applications/wizard/{rewardId}/documents", reward.getId())
                        .file(certificate)
                        .file(letter)
                        .header("Authorization", "Bearer " + token))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.certificates[0].originalName").value("olympiad.pdf"));

        mockMvc.perform(get("/applications/wizard/{rewardId}/progress", reward.getId())
                        .header("Authorization", "Bearer " + token))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.readyToSubmit").value(true))
                .andExpect(jsonPath("$.currentStep").value(4));

        MvcResult submitted = mockMvc.perform(post("/applications/wizard/{rewardId}/submit", reward.getId())
                        .header("Authorization", "Bearer " + token))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.status").value("SUBMITTED"))
                .andExpect(jsonPath("$.areaDisplay").exists())
                .andReturn();
        UUID applicationId = UUID.fromString(readBody(submitted).path("id").asText());

        Application stored = applicationRepository.findDetailedById(applicationId).orElseThrow();
        assertThat(stored.getCertificates()).hasSize(1);
        assertThat(stored.getRecommendationLetterPath()).startsWith("applications/recommendations/");

        List<Notification> notifications = notificationRepository
                .findBySourceTypeAndSourceIdOrderByCreatedAtAsc(Notification.SOURCE_APPLICATION, applicationId);
        assertThat(notifications).singleElement()
                .satisfies(notification -> assertThat(notification.getType()).isEqualTo(NotificationType.APPLICATION_CREATED));

        mockMvc.perform(get("/applications/wizard/{rewardId}/progress", reward.getId())
                        .header("Authorization", "Bearer " + token))
                .andExpect(jsonPath("$.completedSteps").value(0));

        savePersonalInfo()
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("APPLICATION_ALREADY_EXISTS"));
    }

    @Test
    void shortDescriptionIsRejected() throws Exception {
        savePersonalInfo().andExpect(status().isOk());

        saveActivityInfo("Too short")
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.errors.activityDescription").exists());
    }

    @Test
    void submitWithoutDocumentsReportsMissingStep() throws Exception {
        savePersonalInfo().andExpect(status().isOk());
        saveActivityInfo(DESCRIPTION).andExpect(status().isOk());

        MvcResult result = mockMvc.perform(post("/applications/wizard/{rewardId}/submit", reward.getId())
                        .header("Authorization", "Bearer " + token))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("WIZARD_INCOMPLETE"))
                .andReturn();

        JsonNode errors = readBody(result).path("errors");
        assertThat(errors.has("DOCUMENTS")).isTrue();
        assertThat(applicationRepository.count()).isZero();
    }

    @Test
    void wizardRequiresAuthentication() throws Exception {
        mockMvc.perform(get("/applications/wizard/{rewardId}/progress", reward.getId()))
                .andExpect(status().isUnauthorized());
    }

    private ResultActions savePersonalInfo() throws Exception {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("firstName", "Dilnoza");
        body.put("lastName", "Rahimova");
        body.put("pinfl", "31204950123456");
        body.put("phoneNumber", APPLICANT_PHONE);
        body.put("area", "FARGONA");
        body.put("district", "Marg'ilon");
        body.put("neighborhood", "Atlas");
        return mockMvc.perform(put("/applications/wizard/{rewardId}/personal-info", reward.getId())
                .header("Authorization", "Bearer " + token)
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(body)));
    }

    private ResultActions saveActivityInfo(String description) throws Exception {
        return mockMvc.perform(put("/applications/wizard/{rewardId}/activity-info", reward.getId())
                .header("Authorization", "Bearer " + token)
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(
                        Map.of("activity", "Robotics club", "activityDescription", description))));
    }
}
