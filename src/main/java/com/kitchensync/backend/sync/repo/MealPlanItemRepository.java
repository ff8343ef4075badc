package com.kitchensync.backend.sync.repo;

import com.kitchensync.backend.sync.entity.MealPlanItemEntity;

public interface MealPlanItemRepository extends SyncItemRepository<MealPlanItemEntity> {
}
