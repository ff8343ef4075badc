package com.kitchensync.backend.sync.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kitchensync.backend.sync.store.AbstractSectionStore.UpsertOutcome;
import com.kitchensync.backend.sync.web.SyncValidationException;
import com.kitchensync.backend.testsupport.BaseSpringTest;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DataJpaTest
@Import({
        JacksonAutoConfiguration.class,
        InventorySectionStore.class,
        RecipeSectionStore.class,
        MealPlanSectionStore.class,
        ShoppingSectionStore.class,
        CookwareSectionStore.class
})
class SectionStoreJpaTest extends BaseSpringTest {

    private static final Instant T1 = Instant.parse("2026-02-01T08:00:00Z");
    private static final Instant T2 = Instant.parse("2026-02-01T09:00:00Z");

    @Autowired ObjectMapper om;
    @Autowired InventorySectionStore inventory;
    @Autowired RecipeSectionStore recipes;
    @Autowired ShoppingSectionStore shopping;
    @Autowired CookwareSectionStore cookware;

    private JsonNode json(String s) throws Exception {
        return om.readTree(s);
    }

    @Test
    void replaceAll_should_round_trip_known_and_extension_fields_in_order() throws Exception {
        JsonNode items = json("""
            [
              {"id":"milk","name":"Milk","quantity":2,"unit":"l","nutrition":{"kcal":42},
               "fdcId":1234,"brand":"Farm","tags":["dairy"]},
              {"id":"eggs","name":"Eggs","quantity":0.5,"storageLocation":"fridge","deletedAt":"2026-01-30T00:00:00Z"}
            ]
        """);

        inventory.replaceAll(1L, inventory.prepare(items), T1);

        assertThat(inventory.readAll(1L)).isEqualTo(items);
    }

    @Test
    void replaceAll_should_drop_items_missing_from_payload_and_empty_array_clears() throws Exception {
        recipes.replaceAll(1L, recipes.prepare(json("[{\"id\":\"r1\",\"title\":\"Soup\"},{\"id\":\"r2\"}]")), T1);
        recipes.replaceAll(1L, recipes.prepare(json("[{\"id\":\"r2\",\"title\":\"Stew\",\"servings\":4}]")), T2);

        assertThat(recipes.readAll(1L)).isEqualTo(json("[{\"id\":\"r2\",\"title\":\"Stew\",\"servings\":4}]"));

        recipes.replaceAll(1L, recipes.prepare(json("[]")), T2);
        assertThat(recipes.readAll(1L)).isEmpty();
    }

    @Test
    void replaceAll_should_not_touch_other_users() throws Exception {
        cookware.replaceAll(1L, cookware.prepare(json("[{\"id\":\"pan\"}]")), T1);
        cookware.replaceAll(2L, cookware.prepare(json("[{\"id\":\"wok\"}]")), T1);

        cookware.replaceAll(1L, cookware.prepare(json("[]")), T2);

        assertThat(cookware.count(1L)).isZero();
        assertThat(cookware.readAll(2L)).isEqualTo(json("[{\"id\":\"wok\"}]"));
    }

    @Test
    void numeric_ids_should_match_by_text_and_duplicates_keep_last() throws Exception {
        var prepared = shopping.prepare(json("""
            [{"id":1,"name":"first"},{"id":"2","name":"b"},{"id":"1","name":"last","recipeId":77}]
        """));

        shopping.replaceAll(1L, prepared, T1);

        assertThat(shopping.readAll(1L)).isEqualTo(json("""
            [{"id":"2","name":"b"},{"id":"1","name":"last","recipeId":77}]
        """));
    }

    @Test
    void numeric_id_should_come_back_as_number() throws Exception {
        cookware.replaceAll(1L, cookware.prepare(json("[{\"id\":7,\"name\":\"Pan\"},{\"id\":2.5}]")), T1);

        assertThat(cookware.readAll(1L)).isEqualTo(json("[{\"id\":7,\"name\":\"Pan\"},{\"id\":2.5}]"));
        assertThat(cookware.exists(1L, "7")).isTrue();
    }

    @Test
    void mistyped_known_fields_should_round_trip_unchanged() throws Exception {
        JsonNode pantry = json("""
            [{"id":"a","quantity":"2","name":42,"nutrition":"n/a","fdcId":"123"},
             {"id":"b","quantity":2.0},
             {"id":"c","quantity":3}]
        """);
        JsonNode dishes = json("[{\"id\":\"r\",\"servings\":2.5,\"prepTime\":\"10m\",\"isFavorite\":\"yes\"}]");

        inventory.replaceAll(1L, inventory.prepare(pantry), T1);
        recipes.replaceAll(1L, recipes.prepare(dishes), T1);

        assertThat(inventory.readAll(1L)).isEqualTo(pantry);
        assertThat(recipes.readAll(1L)).isEqualTo(dishes);
    }

    @Test
    void explicit_null_known_fields_should_be_kept() throws Exception {
        JsonNode items = json("[{\"id\":\"a\",\"notes\":null,\"name\":\"A\",\"quantity\":null}]");

        inventory.replaceAll(1L, inventory.prepare(items), T1);

        assertThat(inventory.readAll(1L)).isEqualTo(items);
    }

    @Test
    void structural_errors_should_reject_whole_section_before_write() throws Exception {
        inventory.replaceAll(1L, inventory.prepare(json("[{\"id\":\"keep\"}]")), T1);

        SyncValidationException ex = assertThrows(SyncValidationException.class,
                () -> inventory.prepare(json("[{\"id\":\"a\",\"quantity\":\"two\"},{\"name\":\"no id\"},\"x\"]")));

        assertThat(ex.section()).isEqualTo("inventory");
        assertThat(ex.errors()).containsExactly("[1].id: required string or number", "[2]: expected object");
        assertThat(inventory.readAll(1L)).isEqualTo(json("[{\"id\":\"keep\"}]"));
    }

    @Test
    void upsertAll_should_overwrite_same_id_and_keep_others() throws Exception {
        inventory.replaceAll(1L, inventory.prepare(json("[{\"id\":\"x\",\"name\":\"X\"},{\"id\":\"y\",\"name\":\"Y\"}]")), T1);

        var counts = inventory.upsertAll(1L, inventory.prepare(json("[{\"id\":\"y\",\"name\":\"Y2\"},{\"id\":\"z\"}]")), T2);

        assertThat(counts.inserted()).isEqualTo(1);
        assertThat(counts.updated()).isEqualTo(1);
        assertThat(inventory.readAll(1L)).isEqualTo(json("""
            [{"id":"x","name":"X"},{"id":"y","name":"Y2"},{"id":"z"}]
        """));
    }

    @Test
    void upsertOne_should_skip_stale_update_and_return_server_version() throws Exception {
        inventory.upsertOne(1L, inventory.prepareOne(json("{\"id\":\"a\",\"name\":\"server\"}")), T1, T2);

        UpsertOutcome stale = inventory.upsertOne(1L, inventory.prepareOne(json("{\"id\":\"a\",\"name\":\"old\"}")),
                T1, T2.plusSeconds(1));

        assertThat(stale.isSkipped()).isTrue();
        assertThat(stale.serverVersion()).isEqualTo(json("{\"id\":\"a\",\"name\":\"server\"}"));

        UpsertOutcome fresh = inventory.upsertOne(1L, inventory.prepareOne(json("{\"id\":\"a\",\"name\":\"new\"}")),
                T2.plusSeconds(5), T2.plusSeconds(5));

        assertThat(fresh.operation()).isEqualTo(UpsertOutcome.UPDATED);
        assertThat(inventory.readAll(1L)).isEqualTo(json("[{\"id\":\"a\",\"name\":\"new\"}]"));
    }

    @Test
    void deleteOne_and_existingItemIds() throws Exception {
        cookware.replaceAll(1L, cookware.prepare(json("[{\"id\":\"pan\"},{\"id\":\"pot\"}]")), T1);

        assertThat(cookware.existingItemIds(1L, Set.of("pan", "wok"))).containsExactly("pan");
        assertThat(cookware.deleteOne(1L, "pan")).isTrue();
        assertThat(cookware.deleteOne(1L, "pan")).isFalse();
        assertThat(cookware.readAll(1L)).isEqualTo(json("[{\"id\":\"pot\"}]"));
    }

    @Test
    void page_should_walk_all_live_items_once_and_skip_soft_deleted() throws Exception {
        inventory.replaceAll(1L, inventory.prepare(json("""
            [{"id":"a"},{"id":"b"},{"id":"gone","deletedAt":"2026-01-30T00:00:00Z"},{"id":"c"},{"id":"d"}]
        """)), T1);
        inventory.upsertAll(1L, inventory.prepare(json("[{\"id\":\"e\"}]")), T2);

        List<String> seen = new ArrayList<>();
        PageCursor cursor = null;
        int pages = 0;
        do {
            var page = inventory.page(1L, 2, cursor);
            page.items().forEach(i -> seen.add(i.get("id").asText()));
            cursor = page.next() == null ? null : PageCursor.decodeOrNull(page.next().encode());
            pages++;
        } while (cursor != null && pages < 10);

        assertThat(inventory.count(1L)).isEqualTo(5);
        assertThat(pages).isEqualTo(3);
        assertThat(seen).hasSize(5).containsExactlyInAnyOrder("a", "b", "c", "d", "e");
        // T2 寫入的排最後
        assertThat(seen.get(4)).isEqualTo("e");
    }

    @Test
    void page_without_more_rows_should_have_no_cursor() throws Exception {
        recipes.replaceAll(1L, recipes.prepare(json("[{\"id\":\"r1\"},{\"id\":\"r2\"}]")), T1);

        var page = recipes.page(1L, 2, null);

        assertThat(page.items()).hasSize(2);
        assertThat(page.next()).isNull();
    }

    @Test
    void upsertIfNewer_should_keep_newer_server_rows() throws Exception {
        recipes.replaceAll(1L, recipes.prepare(json("[{\"id\":\"r1\",\"title\":\"server\"},{\"id\":\"r2\",\"title\":\"server\"}]")), T2);

        var counts = recipes.upsertIfNewer(1L, recipes.prepare(json("""
            [{"id":"r1","title":"older"},{"id":"r2","title":"newer"},{"id":"r3","title":"added"}]
        """)), item -> "r2".equals(item.getItemId()) ? T2.plusSeconds(60) : T1, T2.plusSeconds(120));

        assertThat(counts.inserted()).isEqualTo(1);
        assertThat(counts.updated()).isEqualTo(1);
        assertThat(counts.skipped()).isEqualTo(1);
        assertThat(recipes.readAll(1L)).isEqualTo(json("""
            [{"id":"r1","title":"server"},{"id":"r2","title":"newer"},{"id":"r3","title":"added"}]
        """));
    }

    @Test
    void exportAll_should_add_updated_at_and_skip_soft_deleted() throws Exception {
        inventory.replaceAll(1L, inventory.prepare(json("""
            [{"id":"milk","name":"Milk"},
             {"id":"eggs","deletedAt":"2026-01-30T00:00:00Z"},
             {"id":"jam","updatedAt":"2025-12-01T00:00:00Z"}]
        """)), T1);

        assertThat(inventory.exportAll(1L)).isEqualTo(json("""
            [{"id":"milk","name":"Milk","updatedAt":"2026-02-01T08:00:00Z"},
             {"id":"jam","updatedAt":"2025-12-01T00:00:00Z"}]
        """));
    }
}
