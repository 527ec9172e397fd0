package com.nextsub.auth.token;

import java.time.Instant;

public record AdminSessionToken(
        String token,
        String principalId,
        String role,
        Instant issuedAt,
        Instant expiresAt
) {
}
