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
@Table(name = "inventory_items",
        uniqueConstraints = @UniqueConstraint(name = "ux_inventory_user_item", columnNames = {"user_id", "item_id"}),
        indexes = @Index(name = "idx_inventory_user_order", columnList = "user_id,sort_order")
)
public class InventoryItemEntity extends SyncItemEntity {

    @Column(length = 255)
    private String name;

    @Column(length = 64)
    private String barcode;

    private Double quantity;

    @Column(length = 32)
    private String unit;

    @Column(name = "storage_location", length = 64)
    private String storageLocation;

    // 日期照 client 格式原樣存（可能是 yyyy-MM-dd 或完整 ISO）
    @Column(name = "purchase_date", length = 40)
    private String purchaseDate;

    @Column(name = "expiration_date", length = 40)
    private String expirationDate;

    @Column(length = 64)
    private String category;

    @Column(name = "usda_category", length = 128)
    private String usdaCategory;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "nutrition", columnDefinition = "JSON")
    private JsonNode nutrition;

    @Column(columnDefinition = "TEXT")
    private String notes;

    @Column(name = "image_uri", length = 1024)
    private String imageUri;

    @Column(name = "fdc_id")
    private Long fdcId;

    /** 軟刪除標記；client 端自己過濾 */
    @Column(name = "deleted_at", length = 40)
    private String deletedAt;
}
