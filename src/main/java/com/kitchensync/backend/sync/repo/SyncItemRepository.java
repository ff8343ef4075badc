package com.kitchensync.backend.sync.repo;

import com.kitchensync.backend.sync.entity.SyncItemEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.NoRepositoryBean;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * 五種正規化 item 共用的查詢；#{#entityName} 由各子介面帶入實際 entity。
 */
@NoRepositoryBean
public interface SyncItemRepository<E extends SyncItemEntity> extends JpaRepository<E, String> {

    List<E> findByUserIdOrderBySortOrderAsc(Long userId);

    Optional<E> findByUserIdAndItemId(Long userId, String itemId);

    List<E> findByUserIdAndItemIdIn(Long userId, Collection<String> itemIds);

    long countByUserId(Long userId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from #{#entityName} e where e.userId = :userId")
    int deleteAllForUser(@Param("userId") Long userId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from #{#entityName} e where e.userId = :userId and e.itemId = :itemId")
    int deleteOne(@Param("userId") Long userId, @Param("itemId") String itemId);

    @Query("select coalesce(max(e.sortOrder), -1) from #{#entityName} e where e.userId = :userId")
    int maxSortOrder(@Param("userId") Long userId);

    // ===== 游標分頁：updatedAtUtc 升冪，同時間再比 row id =====

    @Query("""
            select e from #{#entityName} e
            where e.userId = :userId
            order by e.updatedAtUtc asc, e.id asc
            """)
    List<E> pageFirst(@Param("userId") Long userId, Pageable pageable);

    @Query("""
            select e from #{#entityName} e
            where e.userId = :userId
              and (e.updatedAtUtc > :at or (e.updatedAtUtc = :at and e.id > :rowId))
            order by e.updatedAtUtc asc, e.id asc
            """)
    List<E> pageAfter(@Param("userId") Long userId, @Param("at") Instant at, @Param("rowId") String rowId,
                      Pageable pageable);
}
