package com.kitchensync.backend.sync.store;

import com.kitchensync.backend.sync.model.SyncSection;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/** section -> store；五個正規化 section 都必須有對應的 store */
@Component
public class SectionStores {

    private final Map<SyncSection, AbstractSectionStore<?>> bySection = new EnumMap<>(SyncSection.class);

    public SectionStores(List<AbstractSectionStore<?>> stores) {
        for (AbstractSectionStore<?> s : stores) {
            if (bySection.put(s.section(), s) != null) {
                throw new IllegalStateException("duplicate section store: " + s.section());
            }
        }
        for (SyncSection s : SyncSection.normalized()) {
            if (!bySection.containsKey(s)) throw new IllegalStateException("missing section store: " + s);
        }
    }

    public AbstractSectionStore<?> get(SyncSection section) {
        AbstractSectionStore<?> s = bySection.get(section);
        if (s == null) throw new IllegalArgumentException("UNKNOWN_SECTION");
        return s;
    }

    public CookwareSectionStore cookware() {
        return (CookwareSectionStore) bySection.get(SyncSection.COOKWARE);
    }
}
