package com.kitchensync.backend.sync.service;

import com.kitchensync.backend.sync.entity.UserSyncStateEntity;
import com.kitchensync.backend.sync.model.SyncSection;
import com.kitchensync.backend.sync.repo.UserSyncStateRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.Optional;
import java.util.function.BiConsumer;

/**
 * 同步狀態紀錄的唯一寫入口。
 * 所有 writer 都透過 {@link #applyAndStamp} 改 blob、推進時間戳，確保 updatedAt 單調不退。
 * 第一次寫入撞到主鍵衝突時重試一次。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SyncStateService {

    private final UserSyncStateRepository repo;
    private final SyncStateWriter writer;
    private final Clock clock;

    @Transactional(readOnly = true)
    public Optional<UserSyncStateEntity> find(Long userId) {
        return repo.findById(userId);
    }

    /**
     * 鎖住（或建立）使用者的紀錄，套用 mutator，再把 sections 標記為剛寫入。
     * mutator 第二個參數是這次的蓋章時間；重試時會再跑一次，所以 mutator 要能重跑。
     */
    public StampResult applyAndStamp(Long userId, Collection<SyncSection> sections,
                                     BiConsumer<UserSyncStateEntity, Instant> mutator) {
        try {
            return writer.stamp(userId, sections, mutator);
        } catch (DataIntegrityViolationException e) {
            // 競態：兩個請求同時建立第一筆紀錄，輸的那邊重來一次會鎖到已存在的那筆
            log.info("sync_state_insert_race userId={} retrying", userId);
            return writer.stamp(userId, sections, mutator);
        }
    }

    /** 寫入 section 資料前先拿一個不會倒退的時間戳 */
    @Transactional(readOnly = true)
    public Instant peekNextStamp(Long userId) {
        return repo.findById(userId)
                .map(s -> s.nextStamp(clock.instant()))
                .orElseGet(() -> UserSyncStateEntity.newFor(userId).nextStamp(clock.instant()));
    }

    public record StampResult(Instant stampedAt, boolean existedBefore, UserSyncStateEntity state) {}
}
