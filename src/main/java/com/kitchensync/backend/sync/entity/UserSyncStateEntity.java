package com.kitchensync.backend.sync.entity;

import com.fasterxml.jackson.databind.JsonNode;
import com.kitchensync.backend.sync.model.SyncSection;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.Collection;
import java.util.HashMap;
import java.util.Map;

/**
 * 每個使用者一筆的同步狀態。
 * 第一次成功寫入時才建立；沒有這筆代表「還沒有資料」，跟「資料是空的」不同。
 *
 * <p>sectionTimestamps 的每個值都 ≤ updatedAt，且只會往前推。</p>
 */
@Getter
@Setter
@Entity
@Table(name = "user_sync_state")
public class UserSyncStateEntity {

    @Id
    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "last_synced_at")
    private Instant lastSyncedAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    /** section wire name -> ISO-8601 instant */
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "section_timestamps", columnDefinition = "JSON")
    private Map<String, String> sectionTimestamps = new HashMap<>();

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "preferences", columnDefinition = "JSON")
    private JsonNode preferences;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "waste_log", columnDefinition = "JSON")
    private JsonNode wasteLog;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "consumed_log", columnDefinition = "JSON")
    private JsonNode consumedLog;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "analytics", columnDefinition = "JSON")
    private JsonNode analytics;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "onboarding", columnDefinition = "JSON")
    private JsonNode onboarding;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "custom_locations", columnDefinition = "JSON")
    private JsonNode customLocations;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "user_profile", columnDefinition = "JSON")
    private JsonNode userProfile;

    /** 最後一次併入的 guest session */
    @Column(name = "guest_id", length = 128)
    private String guestId;

    @Column(name = "guest_migrated_at")
    private Instant guestMigratedAt;

    @Column(name = "created_at_utc", nullable = false, updatable = false)
    private Instant createdAtUtc;

    public static UserSyncStateEntity newFor(Long userId) {
        UserSyncStateEntity e = new UserSyncStateEntity();
        e.setUserId(userId);
        return e;
    }

    @PrePersist
    void prePersist() {
        if (createdAtUtc == null) createdAtUtc = Instant.now();
        if (updatedAt == null) updatedAt = createdAtUtc;
    }

    public JsonNode blob(SyncSection section) {
        return switch (section) {
            case PREFERENCES -> preferences;
            case WASTE_LOG -> wasteLog;
            case CONSUMED_LOG -> consumedLog;
            case ANALYTICS -> analytics;
            case ONBOARDING -> onboarding;
            case CUSTOM_LOCATIONS -> customLocations;
            case USER_PROFILE -> userProfile;
            default -> throw new IllegalArgumentException("NOT_A_BLOB_SECTION: " + section.wireName());
        };
    }

    public void putBlob(SyncSection section, JsonNode value) {
        switch (section) {
            case PREFERENCES -> preferences = value;
            case WASTE_LOG -> wasteLog = value;
            case CONSUMED_LOG -> consumedLog = value;
            case ANALYTICS -> analytics = value;
            case ONBOARDING -> onboarding = value;
            case CUSTOM_LOCATIONS -> customLocations = value;
            case USER_PROFILE -> userProfile = value;
            default -> throw new IllegalArgumentException("NOT_A_BLOB_SECTION: " + section.wireName());
        }
    }

    /** 沒寫過或格式壞掉都回 null */
    public Instant sectionUpdatedAt(SyncSection section) {
        if (sectionTimestamps == null) return null;
        String raw = sectionTimestamps.get(section.wireName());
        if (raw == null) return null;
        try {
            return Instant.parse(raw);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    /**
     * 下一個伺服器戳記：max(時鐘, 上次 updatedAt)，取到毫秒。
     * 伺服器時鐘往回跳時也不會讓 updatedAt 倒退。
     */
    public Instant nextStamp(Instant clockNow) {
        Instant now = clockNow.truncatedTo(ChronoUnit.MILLIS);
        if (updatedAt != null && updatedAt.isAfter(now)) return updatedAt;
        return now;
    }

    /**
     * 把 sections 標記為在 now 寫入，同時推進 updatedAt 與 lastSyncedAt。
     * map 每次換新的實例，JSON 欄位才會被 Hibernate 視為 dirty。
     */
    public void stampSections(Collection<SyncSection> sections, Instant now) {
        Map<String, String> next = (sectionTimestamps == null) ? new HashMap<>() : new HashMap<>(sectionTimestamps);
        for (SyncSection s : sections) {
            Instant prev = sectionUpdatedAt(s);
            Instant stamp = (prev != null && prev.isAfter(now)) ? prev : now;
            next.put(s.wireName(), stamp.toString());
        }
        this.sectionTimestamps = next;
        if (updatedAt == null || now.isAfter(updatedAt)) this.updatedAt = now;
        this.lastSyncedAt = this.updatedAt;
    }
}
