package com.awardhub.backend.modules.application.domain;

public enum WizardStep {
    PERSONAL_INFO(1),
    ACTIVITY_INFO(2),
    DOCUMENTS(3);

    private final int number;

    WizardStep(int number) {
        this.number = number;
    }

    public int getNumber() {
        return number;
    }
}
