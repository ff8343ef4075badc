package com.kitchensync.backend.sync.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.cfg.CoercionAction;
import com.fasterxml.jackson.databind.cfg.CoercionInputShape;
import com.fasterxml.jackson.databind.exc.MismatchedInputException;
import com.fasterxml.jackson.databind.type.LogicalType;
import com.kitchensync.backend.sync.model.SyncPreferences;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 驗證 preferences blob。
 * 驗證失敗不會中斷同步，只回報錯誤字串（"path: message"，以 "; " 串接）。
 */
@Component
public class PreferencesValidator {

    private final ObjectMapper strict;
    private final Validator validator;

    public PreferencesValidator(ObjectMapper om, Validator validator) {
        // 不接受 "3" 當整數、也不接受 2.5 被截成 2
        this.strict = om.copy().disable(DeserializationFeature.ACCEPT_FLOAT_AS_INT);
        this.strict.coercionConfigFor(LogicalType.Integer).setCoercion(CoercionInputShape.String, CoercionAction.Fail);
        this.validator = validator;
    }

    public Result validate(JsonNode prefs) {
        if (prefs == null || !prefs.isObject()) {
            return Result.invalid("preferences: must be an object");
        }

        SyncPreferences parsed;
        try {
            parsed = strict.treeToValue(prefs, SyncPreferences.class);
        } catch (MismatchedInputException e) {
            return Result.invalid(pathOf(e) + ": invalid type");
        } catch (JsonProcessingException e) {
            return Result.invalid("preferences: " + e.getOriginalMessage());
        }

        List<String> errors = validator.validate(parsed).stream()
                .map(PreferencesValidator::format)
                .sorted()
                .collect(Collectors.toList());

        if (!errors.isEmpty()) return Result.invalid(String.join("; ", errors));
        return Result.valid(parsed);
    }

    private static String format(ConstraintViolation<SyncPreferences> v) {
        String path = v.getPropertyPath().toString().replace(".<list element>", "");
        return path + ": " + v.getMessage();
    }

    private static String pathOf(MismatchedInputException e) {
        StringBuilder sb = new StringBuilder();
        for (var ref : e.getPath()) {
            if (ref.getFieldName() != null) {
                if (!sb.isEmpty()) sb.append('.');
                sb.append(ref.getFieldName());
            } else if (ref.getIndex() >= 0) {
                sb.append('[').append(ref.getIndex()).append(']');
            }
        }
        return sb.isEmpty() ? "preferences" : sb.toString();
    }

    public record Result(SyncPreferences preferences, String error) {
        static Result valid(SyncPreferences p) { return new Result(p, null); }
        static Result invalid(String error) { return new Result(null, error); }

        public boolean isValid() {
            return error == null;
        }
    }
}
