package com.awardhub.backend.modules.application.application;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.awardhub.backend.global.error.ProblemException;
import com.awardhub.backend.global.storage.FileStorage;
import com.awardhub.backend.global.storage.StoredFile;
import com.awardhub.backend.global.storage.UploadRule;
import com.awardhub.backend.modules.application.domain.Application;
import com.awardhub.backend.modules.application.domain.ApplicationDraft;
import com.awardhub.backend.modules.application.domain.ApplicationDraft.ActivityInfo;
import com.awardhub.backend.modules.application.domain.ApplicationDraft.Documents;
import com.awardhub.backend.modules.application.domain.ApplicationDraft.PersonalInfo;
import com.awardhub.backend.modules.application.domain.StagedDocument;
import com.awardhub.backend.modules.application.domain.WizardStep;
import com.awardhub.backend.modules.application.infrastructure.cache.ApplicationDraftStore;
import com.awardhub.backend.modules.application.infrastructure.persistence.ApplicationRepository;
import com.awardhub.backend.modules.application.presentation.dto.ActivityInfoRequest;
import com.awardhub.backend.modules.application.presentation.dto.ApplicationDetailResponse;
import com.awardhub.backend.modules.application.presentation.dto.DocumentsResponse;
import com.awardhub.backend.modules.application.presentation.dto.PersonalInfoRequest;
import com.awardhub.backend.modules.application.presentation.dto.WizardProgressResponse;
import com.awardhub.backend.modules.application.presentation.dto.WizardReviewResponse;
import com.awardhub.backend.modules.application.presentation.dto.WizardStepResponse;
import com.awardhub.backend.modules.auth.domain.AppUser;
import com.awardhub.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.awardhub.backend.modules.reward.application.RewardService;
import com.awardhub.backend.modules.reward.domain.Reward;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.web.multipart.MultipartFile;

/**
 * Three-step application wizard. Step payloads accumulate in a cached draft per (user, reward);
 * uploads go straight to temporary storage and only their metadata is cached.
 */
@Service
public class ApplicationWizardService {

    static final int MIN_DESCRIPTION_LENGTH = 50;
    static final int MAX_ATTACHMENTS = 10;
    static final String CERTIFICATE_DIRECTORY = "applications/certificates";
    static final String FILE_DIRECTORY = "applications/files";
    static final String RECOMMENDATION_DIRECTORY = "applications/recommendations";

    private static final Logger log = LoggerFactory.getLogger(ApplicationWizardService.class);

    private final ApplicationDraftStore draftStore;
    private final ApplicationRepository applicationRepository;
    private final AppUserRepository appUserRepository;
    private final RewardService rewardService;
    private final FileStorage fileStorage;
    private final ApplicationResponseMapper responseMapper;

    public ApplicationWizardService(
            ApplicationDraftStore draftStore,
            ApplicationRepository applicationRepository,
            AppUserRepository appUserRepository,
            RewardService rewardService,
            FileStorage fileStorage,
            ApplicationResponseMapper responseMapper
    ) {
        this.draftStore = draftStore;
        this.applicationRepository = applicationRepository;
        this.appUserRepository = appUserRepository;
        this.rewardService = rewardService;
        this.fileStorage = fileStorage;
        this.responseMapper = responseMapper;
    }

    @Transactional(readOnly = true)
    public WizardStepResponse<PersonalInfo> getPersonalInfo(UUID userId, UUID rewardId) {
        rewardService.loadReward(rewardId);
        PersonalInfo saved = draftStore.load(userId, rewardId).personalInfo();
        if (saved != null) {
            return new WizardStepResponse<>(rewardId, WizardStep.PERSONAL_INFO.getNumber(), true, saved);
        }
        AppUser user = loadUser(userId);
        PersonalInfo prefill = new PersonalInfo(user.getFirstName(), user.getLastName(), user.getPinfl(),
                user.getPhoneNumber(), null, null, null);
        return new WizardStepResponse<>(rewardId, WizardStep.PERSONAL_INFO.getNumber(), false, prefill);
    }

    @Transactional(readOnly = true)
    public WizardStepResponse<PersonalInfo> savePersonalInfo(UUID userId, UUID rewardId, PersonalInfoRequest request) {
        rewardService.loadReward(rewardId);
        ensureNoApplication(userId, rewardId);

        PersonalInfo info = new PersonalInfo(
                request.firstName().trim(),
                request.lastName().trim(),
                request.pinfl(),
                request.phoneNumber().trim(),
                request.area(),
                request.district().trim(),
                request.neighborhood().trim()
        );
        draftStore.save(userId, rewardId, draftStore.load(userId, rewardId).withPersonalInfo(info));
        return new WizardStepResponse<>(rewardId, WizardStep.PERSONAL_INFO.getNumber(), true, info);
    }

    public WizardStepResponse<ActivityInfo> getActivityInfo(UUID userId, UUID rewardId) {
        ActivityInfo saved = draftStore.load(userId, rewardId).activityInfo();
        return new WizardStepResponse<>(rewardId, WizardStep.ACTIVITY_INFO.getNumber(), saved != null, saved);
    }

    public WizardStepResponse<ActivityInfo> saveActivityInfo(UUID userId, UUID rewardId, ActivityInfoRequest request) {
        ApplicationDraft draft = draftStore.load(userId, rewardId);
        requireSteps(draft, WizardStep.PERSONAL_INFO);

        String description = request.activityDescription().trim();
        if (description.length() < MIN_DESCRIPTION_LENGTH) {
            throw ProblemException.validation(Map.of("activityDescription",
                    "Activity description must be at least " + MIN_DESCRIPTION_LENGTH + " characters"));
        }

        ActivityInfo info = new ActivityInfo(request.activity().trim(), description);
        draftStore.save(userId, rewardId, draft.withActivityInfo(info));
        return new WizardStepResponse<>(rewardId, WizardStep.ACTIVITY_INFO.getNumber(), true, info);
    }

    public WizardStepResponse<DocumentsResponse> getDocuments(UUID userId, UUID rewardId) {
        Documents saved = draftStore.load(userId, rewardId).documents();
        return new WizardStepResponse<>(rewardId, WizardStep.DOCUMENTS.getNumber(), saved != null,
                DocumentsResponse.from(saved));
    }

    /**
     * Stages the uploads and records their metadata. Replaces anything staged by an earlier call.
     */
    public WizardStepResponse<DocumentsResponse> saveDocuments(
            UUID userId,
            UUID rewardId,
            MultipartFile recommendationLetter,
            List<MultipartFile> certificates,
            List<MultipartFile> files
    ) {
        ApplicationDraft draft = draftStore.load(userId, rewardId);
        requireSteps(draft, WizardStep.PERSONAL_INFO, WizardStep.ACTIVITY_INFO);

        List<MultipartFile> certificateUploads = nonEmpty(certificates);
        List<MultipartFile> fileUploads = nonEmpty(files);
        MultipartFile letter = recommendationLetter != null && !recommendationLetter.isEmpty() ? recommendationLetter : null;
        validateUploads(letter, certificateUploads, fileUploads);

        String ownerKey = userId + "_" + rewardId;
        List<StagedDocument> staged = new ArrayList<>();
        Documents documents;
        try {
            StagedDocument stagedLetter = letter == null ? null : stage(ownerKey, letter, staged);
            List<StagedDocument> stagedCertificates = new ArrayList<>();
            for (MultipartFile certificate : certificateUploads) {
                stagedCertificates.add(stage(ownerKey, certificate, staged));
            }
            List<StagedDocument> stagedFiles = new ArrayList<>();
            for (MultipartFile file : fileUploads) {
                stagedFiles.add(stage(ownerKey, file, staged));
            }
            documents = new Documents(stagedLetter, stagedCertificates, stagedFiles);
        } catch (RuntimeException ex) {
            deleteTemporaryQuietly(staged);
            throw ex;
        }

        List<StagedDocument> replaced = draft.stagedDocuments();
        draftStore.save(userId, rewardId, draft.withDocuments(documents));
        deleteTemporaryQuietly(replaced);

        return new WizardStepResponse<>(rewardId, WizardStep.DOCUMENTS.getNumber(), true, DocumentsResponse.from(documents));
    }

    @Transactional(readOnly = true)
    public WizardReviewResponse review(UUID userId, UUID rewardId) {
        Reward reward = rewardService.loadReward(rewardId);
        ApplicationDraft draft = draftStore.load(userId, rewardId);
        requireComplete(draft);
        return new WizardReviewResponse(
                rewardId,
                reward.getName(),
                draft.personalInfo(),
                draft.activityInfo(),
                DocumentsResponse.from(draft.documents())
        );
    }

    public WizardProgressResponse progress(UUID userId, UUID rewardId) {
        ApplicationDraft draft = draftStore.load(userId, rewardId);
        boolean personal = draft.hasStep(WizardStep.PERSONAL_INFO);
        boolean activity = draft.hasStep(WizardStep.ACTIVITY_INFO);
        boolean documents = draft.hasStep(WizardStep.DOCUMENTS);
        int completed = WizardStep.values().length - draft.missingSteps().size();
        int currentStep = draft.missingSteps().stream()
                .findFirst()
                .map(WizardStep::getNumber)
                // all steps done: the client is on the review page
                .orElse(WizardStep.values().length + 1);
        return new WizardProgressResponse(rewardId, personal, activity, documents, completed, currentStep,
                draft.missingSteps().isEmpty());
    }

    /**
     * Turns a complete draft into an Application. The existence check, file promotion and insert share one
     * transaction; the unique (user, reward) constraint backs the check against concurrent double submits.
     * Draft and staged files are discarded only after commit, and failures there are logged, not raised.
     */
    @Transactional
    public ApplicationDetailResponse submit(UUID userId, UUID rewardId) {
        ApplicationDraft draft = draftStore.load(userId, rewardId);
        requireComplete(draft);
        ensureNoApplication(userId, rewardId);

        Reward reward = rewardService.loadReward(rewardId);
        AppUser user = loadUser(userId);
        Documents documents = draft.documents();

        for (StagedDocument document : documents.all()) {
            if (!fileStorage.temporaryExists(document.path())) {
                throw ProblemException.badRequest("DOCUMENTS_EXPIRED",
                        "Uploaded documents are no longer available. Please upload them again.");
            }
        }

        List<String> promoted = new ArrayList<>();
        boolean deferred = registerCompletionCleanup(userId, rewardId, documents.all(), promoted);
        Application saved;
        try {
            saved = persist(user, reward, draft, promoted);
        } catch (RuntimeException ex) {
            if (!deferred) {
                promoted.forEach(this::deleteMediaQuietly);
            }
            throw ex;
        }
        if (!deferred) {
            discardDraftQuietly(userId, rewardId, documents.all());
        }
        log.info("Application {} submitted by user {} for reward {}", saved.getId(), userId, rewardId);
        return responseMapper.toDetail(saved);
    }

    private Application persist(AppUser user, Reward reward, ApplicationDraft draft, List<String> promoted) {
        PersonalInfo personal = draft.personalInfo();
        ActivityInfo activity = draft.activityInfo();
        Documents documents = draft.documents();
        Application application = Application.submit(
                user,
                reward,
                personal.area(),
                personal.district(),
                personal.neighborhood(),
                personal.phoneNumber(),
                activity.activity(),
                activity.activityDescription()
        );
        if (documents.recommendationLetter() != null) {
            application.setRecommendationLetterPath(
                    promote(documents.recommendationLetter(), RECOMMENDATION_DIRECTORY, promoted));
        }
        for (StagedDocument certificate : documents.certificates()) {
            application.addCertificate(promote(certificate, CERTIFICATE_DIRECTORY, promoted),
                    certificate.originalName(), certificate.size());
        }
        for (StagedDocument file : documents.files()) {
            application.addFile(promote(file, FILE_DIRECTORY, promoted), file.originalName(), file.size());
        }

        user.setFirstName(personal.firstName());
        user.setLastName(personal.lastName());
        user.setPinfl(personal.pinfl());
        appUserRepository.save(user);

        return applicationRepository.saveAndFlush(application);
    }

    public void clearDraft(UUID userId, UUID rewardId) {
        ApplicationDraft draft = draftStore.load(userId, rewardId);
        draftStore.remove(userId, rewardId);
        deleteTemporaryQuietly(draft.stagedDocuments());
    }

    /**
     * Defers draft and staged-file cleanup to transaction completion. Returns false when no
     * transaction synchronization is active, in which case the caller cleans up itself.
     */
    private boolean registerCompletionCleanup(UUID userId, UUID rewardId, List<StagedDocument> staged, List<String> promoted) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            return false;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCompletion(int status) {
                if (status == STATUS_COMMITTED) {
                    discardDraftQuietly(userId, rewardId, staged);
                } else {
                    promoted.forEach(ApplicationWizardService.this::deleteMediaQuietly);
                }
            }
        });
        return true;
    }

    private void discardDraftQuietly(UUID userId, UUID rewardId, List<StagedDocument> staged) {
        try {
            draftStore.remove(userId, rewardId);
        } catch (RuntimeException ex) {
            log.warn("Could not clear wizard draft for user {} reward {}", userId, rewardId, ex);
        }
        deleteTemporaryQuietly(staged);
    }

    private String promote(StagedDocument document, String directory, List<String> promoted) {
        String path = fileStorage.promote(document.path(), directory);
        promoted.add(path);
        return path;
    }

    private StagedDocument stage(String ownerKey, MultipartFile upload, List<StagedDocument> staged) {
        StoredFile stored = fileStorage.stageTemporary(ownerKey, upload);
        StagedDocument document = new StagedDocument(stored.path(), stored.originalName(), stored.size());
        staged.add(document);
        return document;
    }

    private void validateUploads(MultipartFile letter, List<MultipartFile> certificates, List<MultipartFile> files) {
        Map<String, String> errors = new LinkedHashMap<>();
        if (letter != null) {
            UploadRule.DOCUMENT.check(letter).ifPresent(message -> errors.put("recommendationLetter", message));
        }
        checkAll("certificates", certificates, errors);
        checkAll("files", files, errors);
        if (!errors.isEmpty()) {
            throw ProblemException.validation(errors);
        }
    }

    private void checkAll(String field, List<MultipartFile> uploads, Map<String, String> errors) {
        if (uploads.size() > MAX_ATTACHMENTS) {
            errors.put(field, "At most " + MAX_ATTACHMENTS + " files are allowed");
            return;
        }
        for (int i = 0; i < uploads.size(); i++) {
            int index = i;
            UploadRule.DOCUMENT.check(uploads.get(i))
                    .ifPresent(message -> errors.putIfAbsent(field + "[" + index + "]", message));
        }
    }

    private List<MultipartFile> nonEmpty(List<MultipartFile> uploads) {
        if (uploads == null) {
            return List.of();
        }
        return uploads.stream().filter(upload -> upload != null && !upload.isEmpty()).toList();
    }

    private void requireSteps(ApplicationDraft draft, WizardStep... steps) {
        for (WizardStep step : steps) {
            if (!draft.hasStep(step)) {
                throw ProblemException.badRequest("PREVIOUS_STEP_REQUIRED",
                        "Please complete step " + step.getNumber() + " first");
            }
        }
    }

    private void requireComplete(ApplicationDraft draft) {
        List<WizardStep> missing = draft.missingSteps();
        if (missing.isEmpty()) {
            return;
        }
        Map<String, String> errors = new LinkedHashMap<>();
        missing.forEach(step -> errors.put(step.name(), "Step " + step.getNumber() + " is not completed"));
        throw new ProblemException(HttpStatus.BAD_REQUEST, "WIZARD_INCOMPLETE",
                "Application is incomplete. Please complete all steps.", errors);
    }

    private void ensureNoApplication(UUID userId, UUID rewardId) {
        if (applicationRepository.existsByUserIdAndRewardId(userId, rewardId)) {
            throw ProblemException.badRequest("APPLICATION_ALREADY_EXISTS",
                    "You have already applied for this reward");
        }
    }

    private AppUser loadUser(UUID userId) {
        return appUserRepository.findById(userId)
                .orElseThrow(() -> ProblemException.notFound("USER_NOT_FOUND"));
    }

    private void deleteTemporaryQuietly(List<StagedDocument> documents) {
        for (StagedDocument document : documents) {
            try {
                fileStorage.deleteTemporary(document.path());
            } catch (RuntimeException ex) {
                log.warn("Could not delete staged upload {}", document.path(), ex);
            }
        }
    }

    private void deleteMediaQuietly(String mediaPath) {
        try {
            fileStorage.delete(mediaPath);
        } catch (RuntimeException ex) {
            log.warn("Could not delete promoted file {}", mediaPath, ex);
        }
    }
}
