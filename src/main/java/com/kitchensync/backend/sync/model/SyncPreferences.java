package com.kitchensync.backend.sync.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

import java.util.List;

/**
 * preferences blob 中認得的欄位；其他 key 不驗證，原樣存回 blob。
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SyncPreferences(
        @Min(1) @Max(10) Integer servingSize,
        @Min(1) @Max(10) Integer dailyMeals,
        @Size(max = 50) List<@NotNull @Size(max = 100) String> dietaryRestrictions,
        @Size(max = 50) List<@NotNull @Size(max = 100) String> cuisinePreferences,
        @Size(max = 20) List<@NotNull @Size(max = 50) String> storageAreas,
        @Pattern(regexp = "basic|intermediate|professional") String cookingLevel,
        @Min(1) @Max(30) Integer expirationAlertDays
) {
    /** basic→beginner、professional→advanced，其餘原樣 */
    public String accountSkillLevel() {
        if (cookingLevel == null) return null;
        return switch (cookingLevel) {
            case "basic" -> "beginner";
            case "professional" -> "advanced";
            default -> cookingLevel;
        };
    }
}
