package com.kitchensync.backend.common.web;

/**
 * 成功回應的統一外層：{ "success": true, "data": ... }
 * 錯誤回應不走這裡，由各 feature 的 advice 自己組。
 */
public record ApiResponse<T>(
        boolean success,
        T data
) {
    public static <T> ApiResponse<T> ok(T data) {
        return new ApiResponse<>(true, data);
    }
}
