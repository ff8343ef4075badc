package com.kitchensync.backend.users.user.entity;

import jakarta.persistence.*;
import lombok.Data;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Data
@Entity
@Table(
        name = "users",
        uniqueConstraints = {
                @UniqueConstraint(name = "ux_users_email", columnNames = {"email"})
        }
)
public class User {

    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "email", length = 320)
    private String email;

    @Column private String name;

    @Column(name = "status", nullable = false, length = 16)
    private String status = "ACTIVE";

    @Column(name = "has_completed_onboarding", nullable = false)
    private boolean hasCompletedOnboarding = false;

    // ===== 由同步的 preferences 投影過來的欄位 =====

    @Column(name = "household_size")
    private Integer householdSize;

    @Column(name = "daily_meals")
    private Integer dailyMeals;

    /** beginner / intermediate / advanced */
    @Column(name = "cooking_skill_level", length = 16)
    private String cookingSkillLevel;

    @Column(name = "expiration_alert_days")
    private Integer expirationAlertDays;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "dietary_restrictions", columnDefinition = "JSON")
    private List<String> dietaryRestrictions = new ArrayList<>();

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "favorite_categories", columnDefinition = "JSON")
    private List<String> favoriteCategories = new ArrayList<>();

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "storage_areas_enabled", columnDefinition = "JSON")
    private List<String> storageAreasEnabled = new ArrayList<>();

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    /** 統一以小寫寫入，避免大小寫造成重複帳號 */
    public void setEmail(String email) {
        this.email = (email == null) ? null : email.trim().toLowerCase();
    }

    @PrePersist
    void onCreate() {
        if (createdAt == null) createdAt = Instant.now();
        if (updatedAt == null) updatedAt = Instant.now();
    }

    @PreUpdate
    void onUpdate() {
        updatedAt = Instant.now();
    }
}
