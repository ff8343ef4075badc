package com.kitchensync.backend.sync.repo;

import com.kitchensync.backend.sync.entity.InventoryItemEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;

/**
 * 除了共用查詢，計數、分頁與匯出只看沒被軟刪除的 item。
 */
public interface InventoryItemRepository extends SyncItemRepository<InventoryItemEntity> {

    List<InventoryItemEntity> findByUserIdAndDeletedAtIsNullOrderBySortOrderAsc(Long userId);

    long countByUserIdAndDeletedAtIsNull(Long userId);

    @Query("""
            select e from InventoryItemEntity e
            where e.userId = :userId and e.deletedAt is null
            order by e.updatedAtUtc asc, e.id asc
            """)
    List<InventoryItemEntity> livePageFirst(@Param("userId") Long userId, Pageable pageable);

    @Query("""
            select e from InventoryItemEntity e
            where e.userId = :userId and e.deletedAt is null
              and (e.updatedAtUtc > :at or (e.updatedAtUtc = :at and e.id > :rowId))
            order by e.updatedAtUtc asc, e.id asc
            """)
    List<InventoryItemEntity> livePageAfter(@Param("userId") Long userId, @Param("at") Instant at,
                                            @Param("rowId") String rowId, Pageable pageable);
}
