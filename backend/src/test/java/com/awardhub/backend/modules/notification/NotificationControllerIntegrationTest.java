package com.awardhub.backend.modules.notification;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.List;
import java.util.Map;

import com.awardhub.backend.modules.application.domain.Application;
import com.awardhub.backend.modules.auth.domain.AppUser;
import com.awardhub.backend.modules.notification.domain.Notification;
import com.awardhub.backend.modules.notification.domain.NotificationType;
import com.awardhub.backend.modules.notification.infrastructure.persistence.NotificationRepository;
import com.awardhub.backend.modules.reward.domain.Reward;
import com.awardhub.backend.support.AbstractIntegrationTest;
import com.awardhub.backend.support.TestUserFactory;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MvcResult;

@SpringBootTest
@AutoConfigureMockMvc
class NotificationControllerIntegrationTest extends AbstractIntegrationTest {

    private static final String APPLICANT_PHONE = "+998935550202";
    private static final String STAFF_PHONE = "+998935550909";
    private static final String OTHER_PHONE = "+998935550303";

    @Autowired
    private TestUserFactory testUserFactory;

    @Autowired
    private NotificationRepository notificationRepository;

    private Application application;
    private String applicantToken;
    private String staffToken;

    @BeforeEach
    void setUp() throws Exception {
        AppUser applicant = testUserFactory.ensureApplicant(APPLICANT_PHONE);
        testUserFactory.ensureStaff(STAFF_PHONE);
        Reward reward = testUserFactory.createReward("Community Hero");
        application = testUserFactory.submitApplication(applicant, reward);
        applicantToken = signIn(APPLICANT_PHONE, TestUserFactory.DEFAULT_PASSWORD);
        staffToken = signIn(STAFF_PHONE, TestUserFactory.DEFAULT_PASSWORD);
    }

    @Test
    void statusChangeNotifiesApplicantOnce() throws Exception {
        changeStatus("DISTRICT");
        changeStatus("DISTRICT");

        List<Notification> notifications = notificationRepository
                .findBySourceTypeAndSourceIdOrderByCreatedAtAsc(Notification.SOURCE_APPLICATION, application.getId());
        assertThat(notifications)
                .extracting(Notification::getType)
                .containsExactly(NotificationType.APPLICATION_CREATED, NotificationType.APPLICATION_UPDATED);
        assertThat(notifications.get(1).getTitle()).contains("District review");

        mockMvc.perform(get("/notifications").header("Authorization", "Bearer " + applicantToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.items.length()").value(2))
                .andExpect(jsonPath("$.items[0].type").value("APPLICATION_UPDATED"))
                .andExpect(jsonPath("$.stats.unreadCount").value(2));
    }

    @Test
    void openingNotificationMarksItReadOnce() throws Exception {
        changeStatus("REJECTED");
        Notification rejected = latestNotification();

        mockMvc.perform(get("/notifications/{id}", rejected.getId())
                        .header("Authorization", "Bearer " + applicantToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.wasMarkedAsRead").value(true))
                .andExpect(jsonPath("$.source.status").value("REJECTED"))
                .andExpect(jsonPath("$.extraData.reward_name").value("Community Hero"));

        Notification afterFirstRead = notificationRepository.findById(rejected.getId()).orElseThrow();
        assertThat(afterFirstRead.getReadAt()).isNotNull();

        mockMvc.perform(get("/notifications/{id}", rejected.getId())
                        .header("Authorization", "Bearer " + applicantToken))
                .andExpect(jsonPath("$.wasMarkedAsRead").value(false));

        Notification afterSecondRead = notificationRepository.findById(rejected.getId()).orElseThrow();
        assertThat(afterSecondRead.getReadAt()).isEqualTo(afterFirstRead.getReadAt());

        mockMvc.perform(get("/notifications").param("read", "false")
                        .header("Authorization", "Bearer " + applicantToken))
                .andExpect(jsonPath("$.items.length()").value(1))
                .andExpect(jsonPath("$.items[0].type").value("APPLICATION_CREATED"));
    }

    @Test
    void readAllMarksOnlyUnread() throws Exception {
        changeStatus("NEIGHBORHOOD");
        Notification latest = latestNotification();
        mockMvc.perform(patch("/notifications/{id}/read", latest.getId())
                        .header("Authorization", "Bearer " + applicantToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.wasUnread").value(true));

        mockMvc.perform(post("/notifications/read-all")
                        .header("Authorization", "Bearer " + applicantToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.updatedCount").value(1))
                .andExpect(jsonPath("$.totalUnreadBefore").value(1));

        mockMvc.perform(get("/notifications/stats").header("Authorization", "Bearer " + applicantToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.unreadCount").value(0))
                .andExpect(jsonPath("$.byType.APPLICATION_CREATED").value(1))
                .andExpect(jsonPath("$.byType.REWARD_WON").value(0));
    }

    @Test
    void notificationsOfOtherUsersAreHidden() throws Exception {
        testUserFactory.ensureApplicant(OTHER_PHONE);
        String otherToken = signIn(OTHER_PHONE, TestUserFactory.DEFAULT_PASSWORD);
        Notification created = latestNotification();

        mockMvc.perform(get("/notifications/{id}", created.getId())
                        .header("Authorization", "Bearer " + otherToken))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("NOTIFICATION_NOT_FOUND"));
    }

    @Test
    void applicantCannotChangeStatus() throws Exception {
        mockMvc.perform(patch("/applications/{id}/status", application.getId())
                        .header("Authorization", "Bearer " + applicantToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("status", "AWARDED"))))
                .andExpect(status().isForbidden());
    }

    private void changeStatus(String newStatus) throws Exception {
        MvcResult result = mockMvc.perform(patch("/applications/{id}/status", application.getId())
                        .header("Authorization", "Bearer " + staffToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("status", newStatus))))
                .andExpect(status().isOk())
                .andReturn();
        assertThat(readBody(result).path("status").asText()).isEqualTo(newStatus);
    }

    private Notification latestNotification() {
        List<Notification> notifications = notificationRepository
                .findBySourceTypeAndSourceIdOrderByCreatedAtAsc(Notification.SOURCE_APPLICATION, application.getId());
        return notifications.get(notifications.size() - 1);
    }
}
