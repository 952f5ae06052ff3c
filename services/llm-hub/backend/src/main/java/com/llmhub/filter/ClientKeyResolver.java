package com.llmhub.filter;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Optional;

/**
 * 요청 주체 식별
 * - Bearer 토큰이 있으면 토큰 지문(SHA-256 앞 16자리), 없으면 클라이언트 IP
 * - 원본 토큰은 로그/버킷 키에 남기지 않음
 */
@Component
public class ClientKeyResolver {

    private static final String BEARER_PREFIX = "Bearer ";

    public Optional<String> bearerToken(HttpServletRequest request) {
        String header = request.getHeader("Authorization");
        if (header == null || !header.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            return Optional.empty();
        }
        String token = header.substring(BEARER_PREFIX.length()).trim();
        return token.isEmpty() ? Optional.empty() : Optional.of(token);
    }

    public String resolve(HttpServletRequest request) {
        return bearerToken(request)
                .map(token -> "token:" + fingerprint(token))
                .orElseGet(() -> "ip:" + resolveIp(request));
    }

    // 프록시(L4, Nginx 등) 뒤에서도 실제 사용자 IP
    public String resolveIp(HttpServletRequest request) {
        String forwardedFor = request.getHeader("X-Forwarded-For");

        if (forwardedFor != null && !forwardedFor.isBlank()) {
            // 여러 프록시를 거친 경우 첫 번째 IP가 실제 클라이언트 IP
            return forwardedFor.split(",")[0].trim();
        }
        return request.getRemoteAddr();
    }

    static String fingerprint(String token) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(token.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest).substring(0, 16);
        } catch (NoSuchAlgorithmException e) {
            // 모든 JRE 에 SHA-256 이 포함됨
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }
}
