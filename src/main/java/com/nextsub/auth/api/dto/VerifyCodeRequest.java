package com.nextsub.auth.api.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record VerifyCodeRequest(
        @NotBlank(message = "Email and code are required")
        @Email(message = "Email format is invalid")
        @Size(max = 254, message = "Email is too long")
        String email,
        @NotBlank(message = "Email and code are required")
        @Size(max = 128, message = "Code is too long")
        String code
) {
}
