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
@Table(name = "meal_plan_items",
        uniqueConstraints = @UniqueConstraint(name = "ux_meal_plan_user_item", columnNames = {"user_id", "item_id"}),
        indexes = @Index(name = "idx_meal_plan_user_order", columnList = "user_id,sort_order")
)
public class MealPlanItemEntity extends SyncItemEntity {

    // date 是保留字，欄位改名
    @Column(name = "plan_date", length = 40)
    private String date;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "meals", columnDefinition = "JSON")
    private JsonNode meals;
}
