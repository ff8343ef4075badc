package com.kitchensync.backend.sync.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.kitchensync.backend.sync.entity.ShoppingItemEntity;
import com.kitchensync.backend.sync.model.SyncSection;
import com.kitchensync.backend.sync.repo.ShoppingItemRepository;
import org.springframework.stereotype.Component;

import java.util.Set;

@Component
public class ShoppingSectionStore extends AbstractSectionStore<ShoppingItemEntity> {

    private static final Set<String> KNOWN = Set.of(
            ID_KEY, "name", "quantity", "unit", "isChecked", "category", "recipeId"
    );

    public ShoppingSectionStore(ShoppingItemRepository repo, ObjectMapper om) {
        super(repo, om);
    }

    @Override
    public SyncSection section() {
        return SyncSection.SHOPPING_LIST;
    }

    @Override
    protected ShoppingItemEntity newEntity() {
        return new ShoppingItemEntity();
    }

    @Override
    protected Set<String> knownKeys() {
        return KNOWN;
    }

    @Override
    protected void readKnownFields(ItemFieldReader in, ShoppingItemEntity e) {
        e.setName(in.text("name"));
        e.setQuantity(in.number("quantity"));
        e.setUnit(in.text("unit"));
        e.setIsChecked(in.bool("isChecked"));
        e.setCategory(in.text("category"));
        e.setRecipeId(in.any("recipeId"));
    }

    @Override
    protected void writeKnownFields(ShoppingItemEntity e, ItemJsonWriter out) {
        out.text("name", e.getName())
                .number("quantity", e.getQuantity())
                .text("unit", e.getUnit())
                .bool("isChecked", e.getIsChecked())
                .text("category", e.getCategory())
                .json("recipeId", e.getRecipeId());
    }
}
