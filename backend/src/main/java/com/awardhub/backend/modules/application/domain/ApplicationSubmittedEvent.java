package com.awardhub.backend.modules.application.domain;

public record ApplicationSubmittedEvent(Application application) {
}
