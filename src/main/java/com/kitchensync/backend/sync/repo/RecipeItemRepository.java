package com.kitchensync.backend.sync.repo;

import com.kitchensync.backend.sync.entity.RecipeItemEntity;

public interface RecipeItemRepository extends SyncItemRepository<RecipeItemEntity> {
}
