package com.example.marketplace.chat.config;

import com.example.marketplace.chat.domain.UserAccount;
import com.example.marketplace.chat.service.TokenService;
import com.example.marketplace.chat.service.UserDirectory;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Authenticates {@code /api/messages} requests from their bearer token and exposes the caller's
 * user id as the {@value #AUTHENTICATED_USER_ATTRIBUTE} request attribute.
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 2)
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    public static final String AUTHENTICATED_USER_ATTRIBUTE = "authenticatedUserId";

    private static final String PROTECTED_PREFIX = "/api/messages";
    private static final String BEARER_PREFIX = "Bearer ";

    private final TokenService tokenService;
    private final UserDirectory userDirectory;
    private final ObjectMapper objectMapper;

    public JwtAuthenticationFilter(TokenService tokenService, UserDirectory userDirectory, ObjectMapper objectMapper) {
        this.tokenService = tokenService;
        this.userDirectory = userDirectory;
        this.objectMapper = objectMapper;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !request.getRequestURI().startsWith(PROTECTED_PREFIX)
                || "OPTIONS".equalsIgnoreCase(request.getMethod());
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        String header = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (header == null || !header.startsWith(BEARER_PREFIX)) {
            reject(response, HttpStatus.UNAUTHORIZED,
                    "Missing Authorization header. Include Authorization: Bearer <token> in requests.");
            return;
        }

        String userId;
        try {
            userId = tokenService.verify(header.substring(BEARER_PREFIX.length()).trim());
        } catch (ExpiredJwtException ex) {
            reject(response, HttpStatus.UNAUTHORIZED, "Token expired");
            return;
        } catch (JwtException | IllegalArgumentException ex) {
            log.debug("Rejected bearer token on {}: {}", request.getRequestURI(), ex.getMessage());
            reject(response, HttpStatus.UNAUTHORIZED, "Invalid token");
            return;
        }

        Optional<UserAccount> account = userDirectory.findAccount(userId);
        if (account.isEmpty()) {
            reject(response, HttpStatus.UNAUTHORIZED, "User not found");
            return;
        }
        if (!account.get().isActive()) {
            reject(response, HttpStatus.UNAUTHORIZED, "User account is deactivated");
            return;
        }
        if (account.get().isSuspended()) {
            reject(response, HttpStatus.FORBIDDEN, "User account is suspended");
            return;
        }

        request.setAttribute(AUTHENTICATED_USER_ATTRIBUTE, userId);
        filterChain.doFilter(request, response);
    }

    private void reject(HttpServletResponse response, HttpStatus status, String message) throws IOException {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("timestamp", Instant.now().toString());
        payload.put("error", message);
        response.setStatus(status.value());
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.getWriter().write(objectMapper.writeValueAsString(payload));
    }
}
