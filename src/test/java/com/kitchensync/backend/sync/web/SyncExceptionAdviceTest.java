package com.kitchensync.backend.sync.web;

import com.kitchensync.backend.auth.security.AccessTokenFilter;
import com.kitchensync.backend.auth.security.AuthContext;
import com.kitchensync.backend.common.web.RequestIdFilter;
import com.kitchensync.backend.sync.controller.SyncBackupController;
import com.kitchensync.backend.sync.controller.SyncController;
import com.kitchensync.backend.sync.dto.ItemSyncResponse;
import com.kitchensync.backend.sync.service.GuestDataMergeService;
import com.kitchensync.backend.sync.service.SyncBackupService;
import com.kitchensync.backend.sync.service.SyncItemService;
import com.kitchensync.backend.sync.service.SyncReadService;
import com.kitchensync.backend.sync.service.SyncWriteService;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.security.servlet.SecurityAutoConfiguration;
import org.springframework.boot.autoconfigure.security.servlet.SecurityFilterAutoConfiguration;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.FilterType;
import org.springframework.context.annotation.Import;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

import static org.mockito.ArgumentMatchers.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@ActiveProfiles("test")
@WebMvcTest(
        controllers = {SyncController.class, SyncBackupController.class},
        excludeAutoConfiguration = {
                SecurityAutoConfiguration.class,
                SecurityFilterAutoConfiguration.class
        },
        excludeFilters = {
                @ComponentScan.Filter(type = FilterType.ASSIGNABLE_TYPE, classes = AccessTokenFilter.class)
        }
)
@Import({SyncExceptionAdvice.class, RequestIdFilter.class})
class SyncExceptionAdviceTest {

    @Autowired MockMvc mvc;

    @MockitoBean AuthContext auth;
    @MockitoBean SyncReadService readService;
    @MockitoBean SyncWriteService writeService;
    @MockitoBean GuestDataMergeService mergeService;
    @MockitoBean SyncItemService itemService;
    @MockitoBean SyncBackupService backupService;

    private static final String BACKUP_BODY = """
            {"mode":"merge","backup":{"version":1,"exportedAt":"2026-05-01T00:00:00Z","data":{}}}
            """;

    @Test
    void cookware_limit_should_403_with_limit_and_count() throws Exception {
        Mockito.when(auth.requireUserId()).thenReturn(1L);
        Mockito.when(writeService.write(eq(1L), any())).thenThrow(new CookwareLimitExceededException(5, 7));

        mvc.perform(post("/api/v1/sync")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"data\":{\"cookware\":[]}}")
                        .header("X-Request-Id", "RID-1"))
                .andExpect(status().isForbidden())
                .andExpect(header().string("X-Request-Id", "RID-1"))
                .andExpect(jsonPath("$.code").value("COOKWARE_LIMIT_REACHED"))
                .andExpect(jsonPath("$.requestId").value("RID-1"))
                .andExpect(jsonPath("$.details.limit").value(5))
                .andExpect(jsonPath("$.details.count").value(7));
    }

    @Test
    void feature_gate_should_403_with_feature_name() throws Exception {
        Mockito.when(auth.requireUserId()).thenReturn(1L);
        Mockito.when(writeService.write(eq(1L), any())).thenThrow(new FeatureNotAvailableException("customStorageAreas"));

        mvc.perform(post("/api/v1/sync")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"data\":{}}"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("FEATURE_NOT_AVAILABLE"))
                .andExpect(jsonPath("$.details.feature").value("customStorageAreas"));
    }

    @Test
    void validation_failure_should_400_with_section_and_errors() throws Exception {
        Mockito.when(auth.requireUserId()).thenReturn(1L);
        Mockito.when(writeService.write(eq(1L), any()))
                .thenThrow(new SyncValidationException("recipes", List.of("[0].id: required string or number")));

        mvc.perform(post("/api/v1/sync")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"data\":{}}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("SYNC_VALIDATION_FAILED"))
                .andExpect(jsonPath("$.details.section").value("recipes"))
                .andExpect(jsonPath("$.details.errors[0]").value("[0].id: required string or number"));
    }

    @Test
    void missing_body_should_400_missing_data() throws Exception {
        Mockito.when(auth.requireUserId()).thenReturn(1L);

        mvc.perform(post("/api/v1/migrate-guest-data").contentType(MediaType.APPLICATION_JSON))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("MISSING_DATA"));

        Mockito.verifyNoInteractions(mergeService);
    }

    @Test
    void malformed_json_should_400() throws Exception {
        Mockito.when(auth.requireUserId()).thenReturn(1L);

        mvc.perform(post("/api/v1/sync")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"data\":"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("MALFORMED_JSON"));
    }

    @Test
    void unknown_section_should_400() throws Exception {
        Mockito.when(auth.requireUserId()).thenReturn(1L);
        Mockito.when(itemService.delete(1L, "pantry", "x")).thenThrow(new IllegalArgumentException("UNKNOWN_SECTION"));

        mvc.perform(delete("/api/v1/sync/pantry/items/x"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("UNKNOWN_SECTION"));
    }

    @Test
    void unauthenticated_should_keep_401() throws Exception {
        Mockito.when(auth.requireUserId())
                .thenThrow(new ResponseStatusException(HttpStatus.UNAUTHORIZED, "UNAUTHENTICATED"));

        mvc.perform(get("/api/v1/sync"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("UNAUTHENTICATED"));

        Mockito.verifyNoInteractions(readService);
    }

    @Test
    void storage_failure_should_500_without_leaking_details() throws Exception {
        Mockito.when(auth.requireUserId()).thenReturn(1L);
        Mockito.when(readService.read(eq(1L), any()))
                .thenThrow(new DataAccessResourceFailureException("db down: jdbc://secret"));

        mvc.perform(get("/api/v1/sync").header("X-Request-Id", "RID-500"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.code").value("INTERNAL_ERROR"))
                .andExpect(jsonPath("$.message").value("Internal server error"))
                .andExpect(jsonPath("$.requestId").value("RID-500"));
    }

    @Test
    void success_should_wrap_in_envelope() throws Exception {
        Mockito.when(auth.requireUserId()).thenReturn(1L);
        Mockito.when(itemService.delete(1L, "recipes", "r1"))
                .thenReturn(new ItemSyncResponse("2026-06-01T00:00:00Z", "deleted", "r1", null, null));

        mvc.perform(delete("/api/v1/sync/recipes/items/r1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.operation").value("deleted"))
                .andExpect(jsonPath("$.data.reason").doesNotExist());
    }

    @Test
    void pantry_limit_should_403_with_limit_and_zero_remaining() throws Exception {
        Mockito.when(auth.requireUserId()).thenReturn(1L);
        Mockito.when(itemService.upsert(eq(1L), eq("inventory"), any(), any()))
                .thenThrow(new PantryLimitExceededException(25));

        mvc.perform(put("/api/v1/sync/inventory/items")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"data\":{\"id\":\"x\"}}"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("PANTRY_LIMIT_REACHED"))
                .andExpect(jsonPath("$.details.limit").value(25))
                .andExpect(jsonPath("$.details.remaining").value(0));
    }

    @Test
    void non_numeric_limit_should_400_invalid_limit() throws Exception {
        Mockito.when(auth.requireUserId()).thenReturn(1L);

        mvc.perform(get("/api/v1/sync/recipes/items").param("limit", "abc"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_LIMIT"));

        Mockito.verifyNoInteractions(itemService);
    }

    @Test
    void import_with_bad_mode_should_400_with_field_errors() throws Exception {
        Mockito.when(auth.requireUserId()).thenReturn(1L);

        mvc.perform(post("/api/v1/sync/import")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(BACKUP_BODY.replace("merge", "overwrite")))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_REQUEST"))
                .andExpect(jsonPath("$.details.fields.mode").value("mode must be merge or replace"));

        Mockito.verifyNoInteractions(backupService);
    }

    @Test
    void import_validation_failure_should_400_with_errors() throws Exception {
        Mockito.when(auth.requireUserId()).thenReturn(1L);
        Mockito.when(backupService.importBackup(eq(1L), any()))
                .thenThrow(new ImportValidationException(List.of("inventory[0].id: required string or number")));

        mvc.perform(post("/api/v1/sync/import").contentType(MediaType.APPLICATION_JSON).content(BACKUP_BODY))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("IMPORT_VALIDATION_FAILED"))
                .andExpect(jsonPath("$.details.errors[0]").value("inventory[0].id: required string or number"));
    }

    @Test
    void import_oversized_array_should_400_with_violations() throws Exception {
        Mockito.when(auth.requireUserId()).thenReturn(1L);
        Mockito.when(backupService.importBackup(eq(1L), any())).thenThrow(new ImportArrayTooLargeException(10_000,
                List.of(new ImportArrayTooLargeException.Violation("wasteLog", 10_001))));

        mvc.perform(post("/api/v1/sync/import").contentType(MediaType.APPLICATION_JSON).content(BACKUP_BODY))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("IMPORT_ARRAY_TOO_LARGE"))
                .andExpect(jsonPath("$.details.limit").value(10_000))
                .andExpect(jsonPath("$.details.violations[0].section").value("wasteLog"))
                .andExpect(jsonPath("$.details.violations[0].count").value(10_001));
    }
}
