package com.example.marketplace.chat.service;

import com.example.marketplace.chat.config.ChatProperties;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.MalformedJwtException;
import io.jsonwebtoken.security.Keys;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.Date;
import javax.crypto.SecretKey;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Issues and verifies the HS256 access tokens shared with the account service. The user id travels
 * in the {@code id} claim.
 */
@Component
public class TokenService {

    static final String USER_ID_CLAIM = "id";
    static final int MIN_SECRET_BYTES = 32;

    private final ChatProperties chatProperties;
    private final Clock clock;
    private final SecretKey signingKey;

    public TokenService(ChatProperties chatProperties, Clock clock) {
        this.chatProperties = chatProperties;
        this.clock = clock;
        this.signingKey = Keys.hmacShaKeyFor(secretBytes(chatProperties.getJwt().getSecret()));
    }

    public String issue(String userId) {
        Instant now = clock.instant();
        return Jwts.builder()
                .claim(USER_ID_CLAIM, userId)
                .issuedAt(Date.from(now))
                .expiration(Date.from(now.plus(chatProperties.getJwt().getExpiresIn())))
                .signWith(signingKey)
                .compact();
    }

    /**
     * @return the user id carried by the token
     * @throws JwtException when the token is malformed, expired, badly signed or carries no id
     */
    public String verify(String token) {
        Claims claims = Jwts.parser()
                .verifyWith(signingKey)
                .clock(() -> Date.from(clock.instant()))
                .build()
                .parseSignedClaims(token)
                .getPayload();
        String userId = claims.get(USER_ID_CLAIM, String.class);
        if (!StringUtils.hasText(userId)) {
            throw new MalformedJwtException("Token does not carry a user id");
        }
        return userId;
    }

    private static byte[] secretBytes(String secret) {
        byte[] bytes = secret != null ? secret.getBytes(StandardCharsets.UTF_8) : new byte[0];
        if (bytes.length < MIN_SECRET_BYTES) {
            throw new IllegalStateException(
                    "chat.jwt.secret (JWT_SECRET) must be at least %d bytes to sign HS256 tokens, got %d"
                            .formatted(MIN_SECRET_BYTES, bytes.length));
        }
        return bytes;
    }
}
