package com.kitchensync.backend.sync.service;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.kitchensync.backend.sync.model.SyncSection;
import com.kitchensync.backend.sync.repo.UserSyncStateRepository;
import com.kitchensync.backend.testsupport.BaseSpringTest;
import com.kitchensync.backend.testsupport.MutableClock;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@Import({SyncStateService.class, SyncStateWriter.class, SyncStateServiceTest.ClockConfig.class})
class SyncStateServiceTest extends BaseSpringTest {

    static final Instant START = Instant.parse("2026-04-01T12:00:00Z");

    @TestConfiguration
    static class ClockConfig {
        @Bean
        MutableClock clock() {
            return new MutableClock(START);
        }
    }

    @Autowired SyncStateService service;
    @Autowired UserSyncStateRepository repo;
    @Autowired MutableClock clock;

    @Test
    void first_write_should_create_record_lazily() {
        assertThat(service.find(5L)).isEmpty();

        var r = service.applyAndStamp(5L, List.of(SyncSection.INVENTORY), (s, now) -> { });

        assertThat(r.existedBefore()).isFalse();
        var saved = repo.findById(5L).orElseThrow();
        assertThat(saved.getUpdatedAt()).isEqualTo(r.stampedAt());
        assertThat(saved.sectionUpdatedAt(SyncSection.INVENTORY)).isEqualTo(r.stampedAt());
    }

    @Test
    void stamps_should_stay_monotonic_when_clock_goes_back() {
        clock.set(START);
        var first = service.applyAndStamp(6L, List.of(SyncSection.RECIPES), (s, now) -> { });

        clock.set(START.minus(Duration.ofMinutes(10)));
        var second = service.applyAndStamp(6L, List.of(SyncSection.RECIPES), (s, now) -> { });

        assertThat(second.existedBefore()).isTrue();
        assertThat(second.stampedAt()).isAfterOrEqualTo(first.stampedAt());
        assertThat(repo.findById(6L).orElseThrow().getUpdatedAt()).isEqualTo(first.stampedAt());
    }

    @Test
    void mutator_changes_should_be_persisted() {
        clock.set(START);
        service.applyAndStamp(7L, List.of(SyncSection.USER_PROFILE),
                (s, now) -> s.putBlob(SyncSection.USER_PROFILE,
                        JsonNodeFactory.instance.objectNode().put("nick", "chef")));

        var saved = repo.findById(7L).orElseThrow();
        assertThat(saved.getUserProfile().get("nick").asText()).isEqualTo("chef");
    }

    /**
     * 兩個請求同時建立第一筆紀錄：兩邊都在 mutator 裡等到對方也進來，
     * 輸的那邊撞主鍵後要重試成功，兩個 section 都要蓋到章。
     */
    @Test
    @Transactional(propagation = Propagation.NOT_SUPPORTED)
    void concurrent_first_writes_should_both_succeed() throws Exception {
        Long userId = 4242L;
        clock.set(START);
        CountDownLatch bothInside = new CountDownLatch(2);

        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Future<SyncStateService.StampResult> a = pool.submit(() -> service.applyAndStamp(userId,
                    List.of(SyncSection.INVENTORY), (s, now) -> awaitPeer(bothInside)));
            Future<SyncStateService.StampResult> b = pool.submit(() -> service.applyAndStamp(userId,
                    List.of(SyncSection.RECIPES), (s, now) -> awaitPeer(bothInside)));

            a.get(30, TimeUnit.SECONDS);
            b.get(30, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }

        var saved = repo.findById(userId).orElseThrow();
        assertThat(saved.sectionUpdatedAt(SyncSection.INVENTORY)).isEqualTo(START);
        assertThat(saved.sectionUpdatedAt(SyncSection.RECIPES)).isEqualTo(START);
        assertThat(saved.getUpdatedAt()).isEqualTo(START);

        repo.deleteById(userId);
    }

    // 重試時 latch 已經歸零，直接通過
    private static void awaitPeer(CountDownLatch latch) {
        latch.countDown();
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }
}
