package com.kitchensync.backend.sync.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.Validation;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PreferencesValidatorTest {

    private final ObjectMapper om = new ObjectMapper();
    private final PreferencesValidator validator =
            new PreferencesValidator(om, Validation.buildDefaultValidatorFactory().getValidator());

    private JsonNode json(String s) throws Exception {
        return om.readTree(s);
    }

    @Test
    void valid_prefs_with_unknown_keys_should_pass() throws Exception {
        var r = validator.validate(json("""
            {"servingSize":4,"dailyMeals":3,"cookingLevel":"professional",
             "dietaryRestrictions":["vegan"],"themeColor":"green"}
        """));

        assertThat(r.isValid()).isTrue();
        assertThat(r.preferences().servingSize()).isEqualTo(4);
        assertThat(r.preferences().accountSkillLevel()).isEqualTo("advanced");
    }

    @Test
    void out_of_range_should_report_path_and_message() throws Exception {
        var r = validator.validate(json("{\"servingSize\":0,\"expirationAlertDays\":31}"));

        assertThat(r.isValid()).isFalse();
        assertThat(r.error()).contains("servingSize: ").contains("expirationAlertDays: ").contains("; ");
    }

    @Test
    void list_element_errors_should_use_index_path() throws Exception {
        String longName = "x".repeat(51);
        var r = validator.validate(json("{\"storageAreas\":[\"fridge\",\"" + longName + "\"]}"));

        assertThat(r.isValid()).isFalse();
        assertThat(r.error()).startsWith("storageAreas[1]: ");
    }

    @Test
    void wrong_types_should_fail_without_coercion() throws Exception {
        assertThat(validator.validate(json("{\"servingSize\":\"3\"}")).error()).isEqualTo("servingSize: invalid type");
        assertThat(validator.validate(json("{\"dailyMeals\":2.5}")).error()).isEqualTo("dailyMeals: invalid type");
    }

    @Test
    void unknown_cooking_level_should_fail() throws Exception {
        var r = validator.validate(json("{\"cookingLevel\":\"chef\"}"));

        assertThat(r.isValid()).isFalse();
        assertThat(r.error()).startsWith("cookingLevel: ");
    }

    @Test
    void non_object_should_fail() throws Exception {
        assertThat(validator.validate(json("[1,2]")).isValid()).isFalse();
        assertThat(validator.validate(null).isValid()).isFalse();
    }
}
