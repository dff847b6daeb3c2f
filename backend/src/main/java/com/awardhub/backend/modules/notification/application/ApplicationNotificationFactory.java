package com.awardhub.backend.modules.notification.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import com.awardhub.backend.modules.application.domain.Application;
import com.awardhub.backend.modules.application.domain.ApplicationStatus;
import com.awardhub.backend.modules.notification.domain.Notification;
import com.awardhub.backend.modules.notification.domain.NotificationType;

import org.springframework.stereotype.Component;

/**
 * Builds the applicant-facing notification for application lifecycle events.
 */
@Component
public class ApplicationNotificationFactory {

    static final String IN_REVIEW_TITLE = "Your application is under review. Current stage: %s.";
    static final String FINAL_REVIEW_TITLE = "Application status updated";
    static final String CREATED_TITLE = "Your application for the '%s' reward has been submitted successfully.";
    static final String AWARDED_TITLE = "Congratulations! Your application for the '%s' reward passed every stage "
            + "and you have been found worthy of this reward.";
    static final String REJECTED_TITLE = "Unfortunately, your application for the '%s' reward has been rejected.";

    private final Clock clock;

    public ApplicationNotificationFactory(Clock clock) {
        this.clock = clock;
    }

    public Notification created(Application application) {
        String rewardName = application.getReward().getName();
        Map<String, Object> extra = new LinkedHashMap<>();
        extra.put("reward_name", rewardName);
        extra.put("area", application.getArea().getDisplayName());
        extra.put("district", application.getDistrict());
        extra.put("activity", application.getActivity());
        return build(application, NotificationType.APPLICATION_CREATED, CREATED_TITLE.formatted(rewardName), extra);
    }

    /**
     * @return empty for transitions that do not notify the applicant
     */
    public Optional<Notification> statusChanged(Application application, ApplicationStatus previous,
                                                ApplicationStatus current) {
        if (current == null || current == previous) {
            return Optional.empty();
        }
        String rewardName = application.getReward().getName();
        String now = OffsetDateTime.now(clock).toString();
        Map<String, Object> extra = new LinkedHashMap<>();
        extra.put("reward_name", rewardName);

        Notification notification = switch (current) {
            case NEIGHBORHOOD, DISTRICT, REGION -> {
                extra.put("old_status", previous == null ? null : previous.name());
                extra.put("new_status", current.name());
                extra.put("status_display", current.getDisplayName());
                yield build(application, NotificationType.APPLICATION_UPDATED,
                        IN_REVIEW_TITLE.formatted(current.getDisplayName()), extra);
            }
            case FINAL_REVIEW -> {
                extra.put("updated_date", now);
                yield build(application, NotificationType.APPLICATION_UPDATED, FINAL_REVIEW_TITLE, extra);
            }
            case AWARDED -> {
                extra.put("reward_description", application.getReward().getDescription());
                extra.put("won_date", now);
                yield build(application, NotificationType.REWARD_WON, AWARDED_TITLE.formatted(rewardName), extra);
            }
            case REJECTED -> {
                extra.put("rejected_date", now);
                yield build(application, NotificationType.APPLICATION_REJECTED,
                        REJECTED_TITLE.formatted(rewardName), extra);
            }
            case SUBMITTED -> null;
        };
        return Optional.ofNullable(notification);
    }

    private Notification build(Application application, NotificationType type, String title, Map<String, Object> extra) {
        Notification notification = new Notification(application.getUser(), Notification.SOURCE_APPLICATION,
                application.getId(), type, title, extra);
        notification.markSent(OffsetDateTime.now(clock));
        return notification;
    }
}
