package com.awardhub.backend.modules.notification.application;

import com.awardhub.backend.modules.application.domain.ApplicationStatusChangedEvent;
import com.awardhub.backend.modules.application.domain.ApplicationSubmittedEvent;
import com.awardhub.backend.modules.notification.domain.Notification;
import com.awardhub.backend.modules.notification.infrastructure.persistence.NotificationRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Runs inside the transaction that saved the application, so a notification exists if and only if
 * the change it describes was committed.
 */
@Component
public class ApplicationNotificationListener {

    private static final Logger log = LoggerFactory.getLogger(ApplicationNotificationListener.class);

    private final ApplicationNotificationFactory notificationFactory;
    private final NotificationRepository notificationRepository;

    public ApplicationNotificationListener(
            ApplicationNotificationFactory notificationFactory,
            NotificationRepository notificationRepository
    ) {
        this.notificationFactory = notificationFactory;
        this.notificationRepository = notificationRepository;
    }

    @EventListener
    public void onSubmitted(ApplicationSubmittedEvent event) {
        save(notificationFactory.created(event.application()));
    }

    @EventListener
    public void onStatusChanged(ApplicationStatusChangedEvent event) {
        notificationFactory.statusChanged(event.application(), event.previousStatus(), event.newStatus())
                .ifPresent(this::save);
    }

    private void save(Notification notification) {
        Notification saved = notificationRepository.save(notification);
        log.info("Notification {} ({}) created for application {}", saved.getId(), saved.getType(),
                saved.getSourceId());
    }
}
