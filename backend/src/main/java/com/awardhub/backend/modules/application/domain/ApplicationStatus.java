package com.awardhub.backend.modules.application.domain;

import java.util.EnumSet;
import java.util.Set;

/**
 * Review pipeline. Order of declaration is the order of the stages.
 */
public enum ApplicationStatus {
    SUBMITTED("Submitted"),
    NEIGHBORHOOD("Neighborhood review"),
    DISTRICT("District review"),
    REGION("Region review"),
    FINAL_REVIEW("Final review"),
    AWARDED("Awarded"),
    REJECTED("Rejected");

    public static final Set<ApplicationStatus> PENDING = EnumSet.of(SUBMITTED, NEIGHBORHOOD, DISTRICT, REGION);
    public static final Set<ApplicationStatus> IN_REVIEW = EnumSet.of(NEIGHBORHOOD, DISTRICT, REGION);

    private final String displayName;

    ApplicationStatus(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    public boolean isFinal() {
        return this == AWARDED || this == REJECTED;
    }
}
