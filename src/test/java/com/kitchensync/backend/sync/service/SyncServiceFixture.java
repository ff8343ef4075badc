package com.kitchensync.backend.sync.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.kitchensync.backend.sync.entity.UserSyncStateEntity;
import com.kitchensync.backend.sync.model.SyncSection;
import com.kitchensync.backend.sync.repo.CookwareItemRepository;
import com.kitchensync.backend.sync.repo.InventoryItemRepository;
import com.kitchensync.backend.sync.repo.MealPlanItemRepository;
import com.kitchensync.backend.sync.repo.RecipeItemRepository;
import com.kitchensync.backend.sync.repo.ShoppingItemRepository;
import com.kitchensync.backend.sync.store.CookwareSectionStore;
import com.kitchensync.backend.sync.store.InventorySectionStore;
import com.kitchensync.backend.sync.store.MealPlanSectionStore;
import com.kitchensync.backend.sync.store.RecipeSectionStore;
import com.kitchensync.backend.sync.store.SectionStores;
import com.kitchensync.backend.sync.store.ShoppingSectionStore;
import jakarta.validation.Validation;
import org.mockito.Mockito;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.BiConsumer;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;

/**
 * writer 單元測試共用：真的 store（repo 是 mock）+ 記憶體裡的同步狀態紀錄。
 */
class SyncServiceFixture {

    static final Instant STAMP = Instant.parse("2026-06-01T00:00:00Z");

    final ObjectMapper om = new ObjectMapper();

    final InventoryItemRepository inventoryRepo = Mockito.mock(InventoryItemRepository.class);
    final RecipeItemRepository recipeRepo = Mockito.mock(RecipeItemRepository.class);
    final MealPlanItemRepository mealPlanRepo = Mockito.mock(MealPlanItemRepository.class);
    final ShoppingItemRepository shoppingRepo = Mockito.mock(ShoppingItemRepository.class);
    final CookwareItemRepository cookwareRepo = Mockito.mock(CookwareItemRepository.class);

    final SectionStores stores = new SectionStores(List.of(
            new InventorySectionStore(inventoryRepo, om),
            new RecipeSectionStore(recipeRepo, om),
            new MealPlanSectionStore(mealPlanRepo, om),
            new ShoppingSectionStore(shoppingRepo, om),
            new CookwareSectionStore(cookwareRepo, om)
    ));

    final PreferencesValidator prefsValidator =
            new PreferencesValidator(om, Validation.buildDefaultValidatorFactory().getValidator());

    final SyncStateService syncState = Mockito.mock(SyncStateService.class);

    /** 目前「資料庫」裡的紀錄；null = 沒有 */
    UserSyncStateEntity state;
    /** 每次 applyAndStamp 實際蓋到章的 section */
    final List<Collection<SyncSection>> stampedSections = new ArrayList<>();

    @SuppressWarnings("unchecked")
    SyncServiceFixture() {
        Mockito.when(syncState.peekNextStamp(anyLong())).thenReturn(STAMP);
        Mockito.when(syncState.find(anyLong())).thenAnswer(inv -> Optional.ofNullable(state));
        Mockito.when(syncState.applyAndStamp(anyLong(), any(), any())).thenAnswer(inv -> {
            Long userId = inv.getArgument(0);
            Collection<SyncSection> sections = inv.getArgument(1);
            BiConsumer<UserSyncStateEntity, Instant> mutator = inv.getArgument(2);

            boolean existed = state != null;
            if (state == null) state = UserSyncStateEntity.newFor(userId);
            Map<String, String> before = new HashMap<>(state.getSectionTimestamps());
            Instant now = state.nextStamp(STAMP);
            mutator.accept(state, now);
            state.stampSections(sections, now);

            // 呼叫端指定的 + mutator 自己蓋章的
            Set<SyncSection> stamped = new LinkedHashSet<>(sections);
            for (SyncSection s : SyncSection.values()) {
                String after = state.getSectionTimestamps().get(s.wireName());
                if (after != null && !after.equals(before.get(s.wireName()))) stamped.add(s);
            }
            stampedSections.add(List.copyOf(stamped));
            return new SyncStateService.StampResult(now, existed, state);
        });
    }
}
