package com.example.marketplace.chat.service;

import com.example.marketplace.chat.service.exception.AuthenticationException;
import com.example.marketplace.chat.service.exception.AuthenticationException.Reason;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Resolves the identity behind a socket handshake credential. Has no side effects: the caller
 * decides what to do with the identity or the refusal.
 */
@Component
@RequiredArgsConstructor
public class ConnectionAuthenticator {

    private final TokenService tokenService;

    public String authenticate(String token) {
        if (!StringUtils.hasText(token)) {
            throw new AuthenticationException(Reason.MISSING_TOKEN);
        }
        try {
            return tokenService.verify(token);
        } catch (ExpiredJwtException ex) {
            throw new AuthenticationException(Reason.EXPIRED_TOKEN, ex);
        } catch (JwtException | IllegalArgumentException ex) {
            throw new AuthenticationException(Reason.INVALID_TOKEN, ex);
        }
    }
}
