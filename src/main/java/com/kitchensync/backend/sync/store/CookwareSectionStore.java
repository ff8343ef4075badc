package com.kitchensync.backend.sync.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.kitchensync.backend.sync.entity.CookwareItemEntity;
import com.kitchensync.backend.sync.model.SyncSection;
import com.kitchensync.backend.sync.repo.CookwareItemRepository;
import org.springframework.stereotype.Component;

import java.util.Set;

@Component
public class CookwareSectionStore extends AbstractSectionStore<CookwareItemEntity> {

    private static final Set<String> KNOWN = Set.of(ID_KEY, "name", "category", "alternatives");

    public CookwareSectionStore(CookwareItemRepository repo, ObjectMapper om) {
        super(repo, om);
    }

    @Override
    public SyncSection section() {
        return SyncSection.COOKWARE;
    }

    @Override
    protected CookwareItemEntity newEntity() {
        return new CookwareItemEntity();
    }

    @Override
    protected Set<String> knownKeys() {
        return KNOWN;
    }

    @Override
    protected void readKnownFields(ItemFieldReader in, CookwareItemEntity e) {
        e.setName(in.text("name"));
        e.setCategory(in.text("category"));
        e.setAlternatives(in.structure("alternatives"));
    }

    @Override
    protected void writeKnownFields(CookwareItemEntity e, ItemJsonWriter out) {
        out.text("name", e.getName())
                .text("category", e.getCategory())
                .json("alternatives", e.getAlternatives());
    }
}
