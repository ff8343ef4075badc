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
@Table(name = "recipe_items",
        uniqueConstraints = @UniqueConstraint(name = "ux_recipe_user_item", columnNames = {"user_id", "item_id"}),
        indexes = @Index(name = "idx_recipe_user_order", columnList = "user_id,sort_order")
)
public class RecipeItemEntity extends SyncItemEntity {

    @Column(length = 255)
    private String title;

    @Column(columnDefinition = "TEXT")
    private String description;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "ingredients", columnDefinition = "JSON")
    private JsonNode ingredients;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "instructions", columnDefinition = "JSON")
    private JsonNode instructions;

    @Column(name = "prep_time")
    private Integer prepTime;

    @Column(name = "cook_time")
    private Integer cookTime;

    private Integer servings;

    @Column(name = "image_uri", length = 1024)
    private String imageUri;

    @Column(name = "cloud_image_uri", length = 1024)
    private String cloudImageUri;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "nutrition", columnDefinition = "JSON")
    private JsonNode nutrition;

    @Column(name = "is_favorite")
    private Boolean isFavorite;
}
