package com.awardhub.backend.modules.application.domain;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.UUID;

import com.awardhub.backend.support.TestEntities;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ApplicationTest {

    private Application application;

    @BeforeEach
    void setUp() {
        application = TestEntities.application(UUID.randomUUID(),
                TestEntities.user(UUID.randomUUID(), "+998901234567"),
                TestEntities.reward(UUID.randomUUID(), "Young Leader"));
    }

    @Test
    void submittedApplicationStartsAsSubmittedAndRaisesEvent() {
        assertThat(application.getStatus()).isEqualTo(ApplicationStatus.SUBMITTED);
        assertThat(application.getSource()).isEqualTo("web");
        assertThat(application.domainEvents())
                .singleElement()
                .isInstanceOf(ApplicationSubmittedEvent.class);
    }

    @Test
    void statusChangeRecordsPreviousAndNewStatus() {
        application.clearDomainEvents();

        boolean changed = application.changeStatus(ApplicationStatus.REGION);

        assertThat(changed).isTrue();
        assertThat(application.domainEvents())
                .singleElement()
                .isEqualTo(new ApplicationStatusChangedEvent(application, ApplicationStatus.SUBMITTED,
                        ApplicationStatus.REGION));
    }

    @Test
    void sameStatusRaisesNothing() {
        application.clearDomainEvents();

        assertThat(application.changeStatus(ApplicationStatus.SUBMITTED)).isFalse();
        assertThat(application.changeStatus(null)).isFalse();
        assertThat(application.domainEvents()).isEmpty();
    }

    @Test
    void attachmentsKeepOriginalNames() {
        application.addCertificate("applications/certificates/a.pdf", "diploma.pdf", 1024);
        application.addFile("applications/files/b.png", "photo.png", 2048);

        assertThat(application.getCertificates()).singleElement()
                .satisfies(certificate -> {
                    assertThat(certificate.getOriginalName()).isEqualTo("diploma.pdf");
                    assertThat(certificate.getApplication()).isSameAs(application);
                });
        assertThat(application.getFiles()).hasSize(1);
    }
}
