package com.nextsub.auth.api.dto;

public record AdminInfoResponse(boolean success, AdminView admin) {

    public record AdminView(String email, String role) {
    }
}
