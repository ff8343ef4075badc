package com.kitchensync.backend.sync.repo;

import com.kitchensync.backend.sync.entity.CookwareItemEntity;

public interface CookwareItemRepository extends SyncItemRepository<CookwareItemEntity> {
}
