package com.aiinpocket.gmtracker.security;

import com.aiinpocket.gmtracker.config.GamificationProperties;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.List;

/**
 * 管理端點的 Bearer 金鑰驗證。
 * 金鑰正確時在 SecurityContext 放入 ROLE_ADMIN；未設定金鑰時所有管理請求都不會通過。
 */
@RequiredArgsConstructor
@Slf4j
public class AdminApiKeyFilter extends OncePerRequestFilter {

    static final String ADMIN_PATH = "/api/gamification/admin/";
    private static final String BEARER = "Bearer ";

    private final GamificationProperties props;

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !request.getRequestURI().startsWith(ADMIN_PATH);
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {
        if (isValidKey(request.getHeader("Authorization"))) {
            var auth = new UsernamePasswordAuthenticationToken(
                    "admin", null, List.of(new SimpleGrantedAuthority("ROLE_ADMIN")));
            SecurityContextHolder.getContext().setAuthentication(auth);
        } else {
            log.warn("[管理驗證] 無效的管理金鑰: {} {}", request.getMethod(), request.getRequestURI());
        }
        chain.doFilter(request, response);
    }

    boolean isValidKey(String header) {
        String expected = props.adminApiKey();
        if (expected == null || expected.isBlank()) {
            return false;
        }
        if (header == null || !header.startsWith(BEARER)) {
            return false;
        }
        byte[] provided = header.substring(BEARER.length()).getBytes(StandardCharsets.UTF_8);
        return MessageDigest.isEqual(provided, expected.getBytes(StandardCharsets.UTF_8));
    }
}
