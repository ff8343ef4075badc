package com.kitchensync.backend.sync.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.kitchensync.backend.sync.entity.RecipeItemEntity;
import com.kitchensync.backend.sync.model.SyncSection;
import com.kitchensync.backend.sync.repo.RecipeItemRepository;
import org.springframework.stereotype.Component;

import java.util.Set;

@Component
public class RecipeSectionStore extends AbstractSectionStore<RecipeItemEntity> {

    private static final Set<String> KNOWN = Set.of(
            ID_KEY, "title", "description", "ingredients", "instructions", "prepTime", "cookTime",
            "servings", "imageUri", "cloudImageUri", "nutrition", "isFavorite"
    );

    public RecipeSectionStore(RecipeItemRepository repo, ObjectMapper om) {
        super(repo, om);
    }

    @Override
    public SyncSection section() {
        return SyncSection.RECIPES;
    }

    @Override
    protected RecipeItemEntity newEntity() {
        return new RecipeItemEntity();
    }

    @Override
    protected Set<String> knownKeys() {
        return KNOWN;
    }

    @Override
    protected void readKnownFields(ItemFieldReader in, RecipeItemEntity e) {
        e.setTitle(in.text("title"));
        e.setDescription(in.text("description"));
        e.setIngredients(in.structure("ingredients"));
        e.setInstructions(in.structure("instructions"));
        e.setPrepTime(in.integer("prepTime"));
        e.setCookTime(in.integer("cookTime"));
        e.setServings(in.integer("servings"));
        e.setImageUri(in.text("imageUri"));
        e.setCloudImageUri(in.text("cloudImageUri"));
        e.setNutrition(in.structure("nutrition"));
        e.setIsFavorite(in.bool("isFavorite"));
    }

    @Override
    protected void writeKnownFields(RecipeItemEntity e, ItemJsonWriter out) {
        out.text("title", e.getTitle())
                .text("description", e.getDescription())
                .json("ingredients", e.getIngredients())
                .json("instructions", e.getInstructions())
                .integer("prepTime", e.getPrepTime())
                .integer("cookTime", e.getCookTime())
                .integer("servings", e.getServings())
                .text("imageUri", e.getImageUri())
                .text("cloudImageUri", e.getCloudImageUri())
                .json("nutrition", e.getNutrition())
                .bool("isFavorite", e.getIsFavorite());
    }
}
