package com.kitchensync.backend.sync.repo;

import com.kitchensync.backend.sync.entity.UserSyncStateEntity;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

public interface UserSyncStateRepository extends JpaRepository<UserSyncStateEntity, Long> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select s from UserSyncStateEntity s where s.userId = :userId")
    Optional<UserSyncStateEntity> findByUserIdForUpdate(@Param("userId") Long userId);
}
