package com.kitchensync.backend.sync.model;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 一個可同步的資料區塊。
 * NORMALIZED：每個 item 一列；ARRAY_BLOB：JSON 陣列整包存，guest merge 時依 id 附加；
 * VALUE_BLOB：整包 JSON，guest merge 時先寫先贏。
 */
public enum SyncSection {

    INVENTORY("inventory", Kind.NORMALIZED),
    RECIPES("recipes", Kind.NORMALIZED),
    MEAL_PLANS("mealPlans", Kind.NORMALIZED),
    SHOPPING_LIST("shoppingList", Kind.NORMALIZED),
    COOKWARE("cookware", Kind.NORMALIZED),

    PREFERENCES("preferences", Kind.VALUE_BLOB),
    WASTE_LOG("wasteLog", Kind.ARRAY_BLOB),
    CONSUMED_LOG("consumedLog", Kind.ARRAY_BLOB),
    ANALYTICS("analytics", Kind.VALUE_BLOB),
    ONBOARDING("onboarding", Kind.VALUE_BLOB),
    CUSTOM_LOCATIONS("customLocations", Kind.ARRAY_BLOB),
    USER_PROFILE("userProfile", Kind.VALUE_BLOB);

    public enum Kind { NORMALIZED, ARRAY_BLOB, VALUE_BLOB }

    private static final Map<String, SyncSection> BY_WIRE = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(SyncSection::wireName, Function.identity()));

    private final String wireName;
    private final Kind kind;

    SyncSection(String wireName, Kind kind) {
        this.wireName = wireName;
        this.kind = kind;
    }

    public String wireName() {
        return wireName;
    }

    public Kind kind() {
        return kind;
    }

    public boolean isNormalized() {
        return kind == Kind.NORMALIZED;
    }

    public boolean isBlob() {
        return kind != Kind.NORMALIZED;
    }

    public static Optional<SyncSection> fromWireName(String name) {
        if (name == null) return Optional.empty();
        return Optional.ofNullable(BY_WIRE.get(name));
    }

    public static Set<SyncSection> normalized() {
        return EnumSet.of(INVENTORY, RECIPES, MEAL_PLANS, SHOPPING_LIST, COOKWARE);
    }

    public static Set<SyncSection> blobs() {
        return EnumSet.complementOf(EnumSet.copyOf(normalized()));
    }
}
