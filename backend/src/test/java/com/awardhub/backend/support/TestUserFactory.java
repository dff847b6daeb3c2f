package com.awardhub.backend.support;

import java.time.LocalDate;

import com.awardhub.backend.modules.application.domain.Application;
import com.awardhub.backend.modules.application.domain.Area;
import com.awardhub.backend.modules.application.infrastructure.persistence.ApplicationRepository;
import com.awardhub.backend.modules.auth.domain.AppUser;
import com.awardhub.backend.modules.auth.domain.Gender;
import com.awardhub.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.awardhub.backend.modules.reward.domain.Reward;
import com.awardhub.backend.modules.reward.infrastructure.persistence.RewardRepository;

import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

@Component
@Transactional
public class TestUserFactory {

    public static final String DEFAULT_PASSWORD = "Applicant#2025";

    private final AppUserRepository appUserRepository;
    private final RewardRepository rewardRepository;
    private final ApplicationRepository applicationRepository;
    private final PasswordEncoder passwordEncoder;

    public TestUserFactory(
            AppUserRepository appUserRepository,
            RewardRepository rewardRepository,
            ApplicationRepository applicationRepository,
            PasswordEncoder passwordEncoder
    ) {
        this.appUserRepository = appUserRepository;
        this.rewardRepository = rewardRepository;
        this.applicationRepository = applicationRepository;
        this.passwordEncoder = passwordEncoder;
    }

    public AppUser ensureApplicant(String phoneNumber) {
        return ensureUser(phoneNumber, false);
    }

    public AppUser ensureStaff(String phoneNumber) {
        return ensureUser(phoneNumber, true);
    }

    public Reward createReward(String name) {
        return rewardRepository.save(new Reward(name, name + " is granted for outstanding community work."));
    }

    /**
     * Inserts a submitted application directly, skipping the wizard. Listeners still see the submit event.
     */
    public Application submitApplication(AppUser applicant, Reward reward) {
        Application application = Application.submit(applicant, reward, Area.NAMANGAN, "Chust", "Olmazor",
                applicant.getPhoneNumber(), "Mentoring",
                "Mentored twenty first-year students in mathematics every weekend for two years.");
        return applicationRepository.saveAndFlush(application);
    }

    private AppUser ensureUser(String phoneNumber, boolean staff) {
        AppUser user = appUserRepository.findByPhoneNumber(phoneNumber).orElseGet(AppUser::new);
        user.setPhoneNumber(phoneNumber);
        user.setEmail(phoneNumber.replace("+", "") + "@example.com");
        user.setPasswordHash(passwordEncoder.encode(DEFAULT_PASSWORD));
        user.setFirstName("Dilnoza");
        user.setLastName("Rahimova");
        user.setOtherName("Akmalovna");
        user.setGender(Gender.FEMALE);
        user.setBirthDate(LocalDate.of(1995, 4, 12));
        user.setAddress("Chilonzor 5, Tashkent");
        user.setPinfl("31204950123456");
        user.setPassportNumber("AB1234567");
        user.setActive(true);
        user.setStaff(staff);
        return appUserRepository.save(user);
    }
}
