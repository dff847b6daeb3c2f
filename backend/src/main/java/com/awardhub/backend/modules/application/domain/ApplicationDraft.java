package com.awardhub.backend.modules.application.domain;

import java.util.ArrayList;
import java.util.List;

/**
 * Wizard state for one (user, reward) pair. Each step is {@code null} until submitted.
 */
public record ApplicationDraft(
        PersonalInfo personalInfo,
        ActivityInfo activityInfo,
        Documents documents
) {

    public static ApplicationDraft empty() {
        return new ApplicationDraft(null, null, null);
    }

    public ApplicationDraft withPersonalInfo(PersonalInfo info) {
        return new ApplicationDraft(info, activityInfo, documents);
    }

    public ApplicationDraft withActivityInfo(ActivityInfo info) {
        return new ApplicationDraft(personalInfo, info, documents);
    }

    public ApplicationDraft withDocuments(Documents newDocuments) {
        return new ApplicationDraft(personalInfo, activityInfo, newDocuments);
    }

    public boolean hasStep(WizardStep step) {
        return switch (step) {
            case PERSONAL_INFO -> personalInfo != null;
            case ACTIVITY_INFO -> activityInfo != null;
            case DOCUMENTS -> documents != null;
        };
    }

    public List<WizardStep> missingSteps() {
        List<WizardStep> missing = new ArrayList<>();
        for (WizardStep step : WizardStep.values()) {
            if (!hasStep(step)) {
                missing.add(step);
            }
        }
        return missing;
    }

    public List<StagedDocument> stagedDocuments() {
        return documents == null ? List.of() : documents.all();
    }

    public record PersonalInfo(
            String firstName,
            String lastName,
            String pinfl,
            String phoneNumber,
            Area area,
            String district,
            String neighborhood
    ) {
    }

    public record ActivityInfo(String activity, String activityDescription) {
    }

    public record Documents(
            StagedDocument recommendationLetter,
            List<StagedDocument> certificates,
            List<StagedDocument> files
    ) {

        public Documents {
            certificates = certificates == null ? List.of() : List.copyOf(certificates);
            files = files == null ? List.of() : List.copyOf(files);
        }

        public List<StagedDocument> all() {
            List<StagedDocument> all = new ArrayList<>();
            if (recommendationLetter != null) {
                all.add(recommendationLetter);
            }
            all.addAll(certificates);
            all.addAll(files);
            return all;
        }
    }
}
