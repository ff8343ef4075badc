package com.kitchensync.backend.sync.repo;

import com.kitchensync.backend.sync.entity.ShoppingItemEntity;

public interface ShoppingItemRepository extends SyncItemRepository<ShoppingItemEntity> {
}
