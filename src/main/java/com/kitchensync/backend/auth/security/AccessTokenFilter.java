package com.kitchensync.backend.auth.security;

import com.kitchensync.backend.auth.entity.AuthToken;
import com.kitchensync.backend.auth.repo.AuthTokenRepo;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.time.Clock;
import java.util.Collections;
import java.util.Optional;

@Slf4j
@Component
public class AccessTokenFilter extends OncePerRequestFilter {

    private final AuthTokenRepo tokens;
    private final Clock clock;

    public AccessTokenFilter(AuthTokenRepo tokens, Clock clock) {
        this.tokens = tokens;
        this.clock = clock;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        // 健康檢查與 API 文件不需要 token
        String p = request.getRequestURI();
        return p.startsWith("/actuator") || p.startsWith("/v3/api-docs") || p.startsWith("/swagger-ui");
    }

    @Override
    protected void doFilterInternal(HttpServletRequest req, HttpServletResponse res, FilterChain chain)
            throws ServletException, IOException {

        String auth = req.getHeader(HttpHeaders.AUTHORIZATION);
        if (auth == null || !auth.startsWith("Bearer ")) {
            chain.doFilter(req, res); // 交給 EntryPoint 回 401
            return;
        }

        String raw = auth.substring(7).trim();
        Optional<AuthToken> found = tokens.findByToken(raw);
        if (found.isEmpty()) {
            unauthorized(res);
            return;
        }

        AuthToken at = found.get();
        boolean active = at.getType() == AuthToken.TokenType.ACCESS
                && !at.isRevoked()
                && at.getExpiresAt() != null
                && at.getExpiresAt().isAfter(clock.instant());

        if (!active || at.getUserId() == null) {
            log.debug("rejected access token id={} revoked={} expiresAt={}", at.getId(), at.isRevoked(), at.getExpiresAt());
            unauthorized(res);
            return;
        }

        // principal 只放 userId（Long），不放 entity
        var authentication = new UsernamePasswordAuthenticationToken(at.getUserId(), null, Collections.emptyList());
        authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(req));
        SecurityContextHolder.getContext().setAuthentication(authentication);

        chain.doFilter(req, res);
    }

    private static void unauthorized(HttpServletResponse res) throws IOException {
        res.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
        res.setContentType("application/json");
        res.getWriter().write("{\"code\":\"UNAUTHORIZED\",\"message\":\"Invalid or expired access token\"}");
    }
}
