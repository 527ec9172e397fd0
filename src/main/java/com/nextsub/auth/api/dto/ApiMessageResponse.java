package com.nextsub.auth.api.dto;

public record ApiMessageResponse(boolean success, String message) {

    public static ApiMessageResponse ok(String message) {
        return new ApiMessageResponse(true, message);
    }
}
