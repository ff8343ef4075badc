package com.kitchensync.backend.sync.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.kitchensync.backend.sync.entity.InventoryItemEntity;
import com.kitchensync.backend.sync.model.SyncSection;
import com.kitchensync.backend.sync.repo.InventoryItemRepository;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Set;

@Component
public class InventorySectionStore extends AbstractSectionStore<InventoryItemEntity> {

    private static final Set<String> KNOWN = Set.of(
            ID_KEY, "name", "barcode", "quantity", "unit", "storageLocation", "purchaseDate",
            "expirationDate", "category", "usdaCategory", "nutrition", "notes", "imageUri", "fdcId", "deletedAt"
    );

    private final InventoryItemRepository inventoryRepo;

    public InventorySectionStore(InventoryItemRepository repo, ObjectMapper om) {
        super(repo, om);
        this.inventoryRepo = repo;
    }

    @Override
    public SyncSection section() {
        return SyncSection.INVENTORY;
    }

    @Override
    protected InventoryItemEntity newEntity() {
        return new InventoryItemEntity();
    }

    @Override
    protected Set<String> knownKeys() {
        return KNOWN;
    }

    // 軟刪除的 item 不出現在分頁與匯出；完整讀取照樣帶，由 client 自己過濾

    /** 軟刪除的 item 不佔 pantry 名額 */
    @Override
    @Transactional(readOnly = true)
    public long count(Long userId) {
        return inventoryRepo.countByUserIdAndDeletedAtIsNull(userId);
    }

    @Override
    protected List<InventoryItemEntity> liveRows(Long userId) {
        return inventoryRepo.findByUserIdAndDeletedAtIsNullOrderBySortOrderAsc(userId);
    }

    @Override
    protected List<InventoryItemEntity> pageFirst(Long userId, Pageable window) {
        return inventoryRepo.livePageFirst(userId, window);
    }

    @Override
    protected List<InventoryItemEntity> pageAfter(Long userId, PageCursor after, Pageable window) {
        return inventoryRepo.livePageAfter(userId, after.updatedAt(), after.rowId(), window);
    }

    @Override
    protected void readKnownFields(ItemFieldReader in, InventoryItemEntity e) {
        e.setName(in.text("name"));
        e.setBarcode(in.text("barcode"));
        e.setQuantity(in.number("quantity"));
        e.setUnit(in.text("unit"));
        e.setStorageLocation(in.text("storageLocation"));
        e.setPurchaseDate(in.text("purchaseDate"));
        e.setExpirationDate(in.text("expirationDate"));
        e.setCategory(in.text("category"));
        e.setUsdaCategory(in.text("usdaCategory"));
        e.setNutrition(in.structure("nutrition"));
        e.setNotes(in.text("notes"));
        e.setImageUri(in.text("imageUri"));
        e.setFdcId(in.longInteger("fdcId"));
        e.setDeletedAt(in.text("deletedAt"));
    }

    @Override
    protected void writeKnownFields(InventoryItemEntity e, ItemJsonWriter out) {
        out.text("name", e.getName())
                .text("barcode", e.getBarcode())
                .number("quantity", e.getQuantity())
                .text("unit", e.getUnit())
                .text("storageLocation", e.getStorageLocation())
                .text("purchaseDate", e.getPurchaseDate())
                .text("expirationDate", e.getExpirationDate())
                .text("category", e.getCategory())
                .text("usdaCategory", e.getUsdaCategory())
                .json("nutrition", e.getNutrition())
                .text("notes", e.getNotes())
                .text("imageUri", e.getImageUri())
                .longInteger("fdcId", e.getFdcId())
                .text("deletedAt", e.getDeletedAt());
    }
}
