package com.awardhub.backend.modules.application.application;

import com.awardhub.backend.global.storage.MediaUrls;
import com.awardhub.backend.modules.application.domain.Application;
import com.awardhub.backend.modules.application.domain.ApplicationFile;
import com.awardhub.backend.modules.application.domain.Certificate;
import com.awardhub.backend.modules.application.presentation.dto.ApplicantResponse;
import com.awardhub.backend.modules.application.presentation.dto.ApplicationDetailResponse;
import com.awardhub.backend.modules.application.presentation.dto.ApplicationSummaryResponse;
import com.awardhub.backend.modules.application.presentation.dto.AttachmentResponse;

import org.springframework.stereotype.Component;

@Component
public class ApplicationResponseMapper {

    public ApplicationSummaryResponse toSummary(Application application, boolean includeApplicant) {
        return new ApplicationSummaryResponse(
                application.getId(),
                application.getReward().getId(),
                application.getReward().getName(),
                application.getStatus(),
                application.getStatus().getDisplayName(),
                application.getArea(),
                application.getArea().getDisplayName(),
                application.getDistrict(),
                application.getActivity(),
                application.getSource(),
                application.getCreatedAt(),
                application.getUpdatedAt(),
                includeApplicant ? ApplicantResponse.from(application.getUser()) : null
        );
    }

    public ApplicationDetailResponse toDetail(Application application) {
        return new ApplicationDetailResponse(
                application.getId(),
                application.getReward().getId(),
                application.getReward().getName(),
                application.getStatus(),
                application.getStatus().getDisplayName(),
                application.getArea(),
                application.getArea().getDisplayName(),
                application.getDistrict(),
                application.getNeighborhood(),
                application.getContactPhone(),
                application.getActivity(),
                application.getActivityDescription(),
                MediaUrls.of(application.getRecommendationLetterPath()),
                application.getSource(),
                application.getCertificates().stream().map(this::toAttachment).toList(),
                application.getFiles().stream().map(this::toAttachment).toList(),
                ApplicantResponse.from(application.getUser()),
                application.getCreatedAt(),
                application.getUpdatedAt()
        );
    }

    private AttachmentResponse toAttachment(Certificate certificate) {
        return new AttachmentResponse(certificate.getId(), MediaUrls.of(certificate.getFilePath()),
                certificate.getOriginalName(), certificate.getFileSize());
    }

    private AttachmentResponse toAttachment(ApplicationFile file) {
        return new AttachmentResponse(file.getId(), MediaUrls.of(file.getFilePath()),
                file.getOriginalName(), file.getFileSize());
    }
}
