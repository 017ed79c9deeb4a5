package cull.email.app.entity;

import lombok.Data;

import java.time.Instant;

@Data
public class OAuthToken {
    private String accessToken;

    private String refreshToken;

    private Instant expiry;

    private String scopes;
}
