package com.kitchensync.backend.users.user.service;

import com.kitchensync.backend.sync.model.SyncPreferences;
import com.kitchensync.backend.users.user.repo.UserRepo;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;

/**
 * 同步寫入後回寫到帳號列的欄位。
 * 找不到使用者只記 warn，不讓同步失敗。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class UserAccountService {

    private final UserRepo userRepo;

    /** 只覆寫 prefs 中有帶的欄位 */
    @Transactional
    public void applyPreferences(Long userId, SyncPreferences p) {
        var found = userRepo.findById(userId);
        if (found.isEmpty()) {
            log.warn("prefs_projection_skipped userId={} reason=USER_NOT_FOUND", userId);
            return;
        }
        var u = found.get();
        if (p.servingSize() != null) u.setHouseholdSize(p.servingSize());
        if (p.dailyMeals() != null) u.setDailyMeals(p.dailyMeals());
        if (p.dietaryRestrictions() != null) u.setDietaryRestrictions(new ArrayList<>(p.dietaryRestrictions()));
        if (p.cuisinePreferences() != null) u.setFavoriteCategories(new ArrayList<>(p.cuisinePreferences()));
        if (p.storageAreas() != null) u.setStorageAreasEnabled(new ArrayList<>(p.storageAreas()));
        if (p.cookingLevel() != null) u.setCookingSkillLevel(p.accountSkillLevel());
        if (p.expirationAlertDays() != null) u.setExpirationAlertDays(p.expirationAlertDays());
        userRepo.save(u);
    }

    @Transactional
    public void markOnboardingCompleted(Long userId) {
        userRepo.findById(userId).ifPresentOrElse(u -> {
            if (!u.isHasCompletedOnboarding()) {
                u.setHasCompletedOnboarding(true);
                userRepo.save(u);
                log.info("onboarding_completed userId={}", userId);
            }
        }, () -> log.warn("onboarding_flag_skipped userId={} reason=USER_NOT_FOUND", userId));
    }
}
