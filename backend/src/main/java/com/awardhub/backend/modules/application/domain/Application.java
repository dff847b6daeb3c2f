package com.awardhub.backend.modules.application.domain;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

import com.awardhub.backend.global.jpa.AbstractTimestampedEntity;
import com.awardhub.backend.modules.auth.domain.AppUser;
import com.awardhub.backend.modules.reward.domain.Reward;

import jakarta.persistence.CascadeType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.OneToMany;
import jakarta.persistence.OrderBy;
import jakarta.persistence.Table;
import jakarta.persistence.Transient;
import jakarta.persistence.UniqueConstraint;

import org.hibernate.annotations.UuidGenerator;
import org.springframework.data.domain.AfterDomainEventPublication;
import org.springframework.data.domain.DomainEvents;

/**
 * A user's application for one reward. Creation and every real status change register a
 * domain event that the repository publishes on {@code save}.
 */
@Entity
@Table(
        name = "application",
        uniqueConstraints = @UniqueConstraint(name = Application.USER_REWARD_CONSTRAINT, columnNames = {"user_id", "reward_id"})
)
public class Application extends AbstractTimestampedEntity {

    public static final String USER_REWARD_CONSTRAINT = "uq_application_user_reward";
    public static final String SOURCE_WEB = "web";

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "user_id", nullable = false)
    private AppUser user;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "reward_id", nullable = false)
    private Reward reward;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private ApplicationStatus status = ApplicationStatus.SUBMITTED;

    @Enumerated(EnumType.STRING)
    @Column(name = "area", nullable = false, length = 20)
    private Area area;

    @Column(name = "district", nullable = false, length = 200)
    private String district;

    @Column(name = "neighborhood", nullable = false, length = 200)
    private String neighborhood;

    @Column(name = "contact_phone", length = 20)
    private String contactPhone;

    @Column(name = "activity", nullable = false, length = 200)
    private String activity;

    @Column(name = "activity_description", nullable = false)
    private String activityDescription;

    @Column(name = "recommendation_letter_path", length = 500)
    private String recommendationLetterPath;

    @Column(name = "source", length = 50)
    private String source;

    @OneToMany(mappedBy = "application", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("createdAt asc")
    private List<Certificate> certificates = new ArrayList<>();

    @OneToMany(mappedBy = "application", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("createdAt asc")
    private List<ApplicationFile> files = new ArrayList<>();

    @Transient
    private final List<Object> domainEvents = new ArrayList<>();

    protected Application() {
    }

    public static Application submit(AppUser user, Reward reward, Area area, String district, String neighborhood,
                                      String contactPhone, String activity, String activityDescription) {
        Application application = new Application();
        application.user = user;
        application.reward = reward;
        application.area = area;
        application.district = district;
        application.neighborhood = neighborhood;
        application.contactPhone = contactPhone;
        application.activity = activity;
        application.activityDescription = activityDescription;
        application.source = SOURCE_WEB;
        application.status = ApplicationStatus.SUBMITTED;
        application.domainEvents.add(new ApplicationSubmittedEvent(application));
        return application;
    }

    /**
     * Moves the application to {@code newStatus}.
     *
     * @return {@code false} when the status is unchanged; no event is registered in that case
     */
    public boolean changeStatus(ApplicationStatus newStatus) {
        if (newStatus == null || newStatus == status) {
            return false;
        }
        ApplicationStatus previous = status;
        status = newStatus;
        domainEvents.add(new ApplicationStatusChangedEvent(this, previous, newStatus));
        return true;
    }

    public void addCertificate(String filePath, String originalName, long fileSize) {
        certificates.add(new Certificate(this, filePath, originalName, fileSize));
    }

    public void addFile(String filePath, String originalName, long fileSize) {
        files.add(new ApplicationFile(this, filePath, originalName, fileSize));
    }

    @DomainEvents
    Collection<Object> domainEvents() {
        return Collections.unmodifiableList(domainEvents);
    }

    @AfterDomainEventPublication
    void clearDomainEvents() {
        domainEvents.clear();
    }

    public UUID getId() {
        return id;
    }

    public AppUser getUser() {
        return user;
    }

    public Reward getReward() {
        return reward;
    }

    public ApplicationStatus getStatus() {
        return status;
    }

    public Area getArea() {
        return area;
    }

    public String getDistrict() {
        return district;
    }

    public String getNeighborhood() {
        return neighborhood;
    }

    public String getContactPhone() {
        return contactPhone;
    }

    public String getActivity() {
        return activity;
    }

    public String getActivityDescription() {
        return activityDescription;
    }

    public String getRecommendationLetterPath() {
        return recommendationLetterPath;
    }

    public void setRecommendationLetterPath(String recommendationLetterPath) {
        this.recommendationLetterPath = recommendationLetterPath;
    }

    public String getSource() {
        return source;
    }

    public List<Certificate> getCertificates() {
        return Collections.unmodifiableList(certificates);
    }

    public List<ApplicationFile> getFiles() {
        return Collections.unmodifiableList(files);
    }
}
