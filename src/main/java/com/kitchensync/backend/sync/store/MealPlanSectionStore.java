package com.kitchensync.backend.sync.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.kitchensync.backend.sync.entity.MealPlanItemEntity;
import com.kitchensync.backend.sync.model.SyncSection;
import com.kitchensync.backend.sync.repo.MealPlanItemRepository;
import org.springframework.stereotype.Component;

import java.util.Set;

@Component
public class MealPlanSectionStore extends AbstractSectionStore<MealPlanItemEntity> {

    private static final Set<String> KNOWN = Set.of(ID_KEY, "date", "meals");

    public MealPlanSectionStore(MealPlanItemRepository repo, ObjectMapper om) {
        super(repo, om);
    }

    @Override
    public SyncSection section() {
        return SyncSection.MEAL_PLANS;
    }

    @Override
    protected MealPlanItemEntity newEntity() {
        return new MealPlanItemEntity();
    }

    @Override
    protected Set<String> knownKeys() {
        return KNOWN;
    }

    @Override
    protected void readKnownFields(ItemFieldReader in, MealPlanItemEntity e) {
        e.setDate(in.text("date"));
        e.setMeals(in.structure("meals"));
    }

    @Override
    protected void writeKnownFields(MealPlanItemEntity e, ItemJsonWriter out) {
        out.text("date", e.getDate())
                .json("meals", e.getMeals());
    }
}
