package com.kitchensync.backend.sync.entity;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

@Getter
@Setter
@Entity
@Table(name = "cookware_items",
        uniqueConstraints = @UniqueConstraint(name = "ux_cookware_user_item", columnNames = {"user_id", "item_id"}),
        indexes = @Index(name = "idx_cookware_user_order", columnList = "user_id,sort_order")
)
public class CookwareItemEntity extends SyncItemEntity {

    @Column(length = 255)
    private String name;

    @Column(length = 64)
    private String category;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "alternatives", columnDefinition = "JSON")
    private JsonNode alternatives;
}
