package com.kitchensync.backend.sync.service;

import com.kitchensync.backend.sync.entity.UserSyncStateEntity;
import com.kitchensync.backend.sync.model.SyncSection;
import com.kitchensync.backend.sync.repo.UserSyncStateRepository;
import com.kitchensync.backend.sync.service.SyncStateService.StampResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.Optional;
import java.util.function.BiConsumer;

/**
 * 單次「鎖住 → 改 → 蓋章」的 transaction。
 * 重試由 {@link SyncStateService} 在 transaction 外面做，所以這裡要是獨立的 bean。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SyncStateWriter {

    private final UserSyncStateRepository repo;
    private final Clock clock;

    @Transactional
    public StampResult stamp(Long userId, Collection<SyncSection> sections,
                             BiConsumer<UserSyncStateEntity, Instant> mutator) {
        Optional<UserSyncStateEntity> locked = repo.findByUserIdForUpdate(userId);
        boolean existed = locked.isPresent();
        UserSyncStateEntity state = locked.orElseGet(() -> UserSyncStateEntity.newFor(userId));

        Instant now = state.nextStamp(clock.instant());
        mutator.accept(state, now);
        state.stampSections(sections, now);
        // 新紀錄立刻 flush，主鍵衝突才會在這裡變成 DataIntegrityViolationException
        repo.saveAndFlush(state);

        log.debug("sync_state_stamped userId={} sections={} existedBefore={} at={}", userId, sections.size(), existed, now);
        return new StampResult(now, existed, state);
    }
}
