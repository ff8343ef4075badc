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
@Table(name = "shopping_items",
        uniqueConstraints = @UniqueConstraint(name = "ux_shopping_user_item", columnNames = {"user_id", "item_id"}),
        indexes = @Index(name = "idx_shopping_user_order", columnList = "user_id,sort_order")
)
public class ShoppingItemEntity extends SyncItemEntity {

    @Column(length = 255)
    private String name;

    private Double quantity;

    @Column(length = 32)
    private String unit;

    @Column(name = "is_checked")
    private Boolean isChecked;

    @Column(length = 64)
    private String category;

    /** client 的 recipe id 可能是字串或數字，原樣保存 */
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "recipe_id", columnDefinition = "JSON")
    private JsonNode recipeId;
}
