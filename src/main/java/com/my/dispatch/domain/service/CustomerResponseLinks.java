package com.my.dispatch.domain.service;

import com.my.dispatch.domain.model.CustomerLinkAction;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;
import java.util.Optional;

/**
 * 왜: 캘린더 앱이 수락/거절 버튼을 보여주지 않는 고객도 응답할 수 있도록 일정별 서명 링크를 만들고 검증하기 위함.
 * <p>
 * 토큰은 {@code "scheduleId:action"} 의 HMAC-SHA256 16진수 앞 32자다. 비밀 값이 없으면 링크 기능 전체가 꺼진다.
 */
public class CustomerResponseLinks {

    static final String RESPONSE_PATH = "/api/public/schedule-response";
    private static final String ALGORITHM = "HmacSHA256";
    private static final int TOKEN_LENGTH = 32;

    private final Optional<byte[]> secret;
    private final Optional<String> baseUrl;

    public CustomerResponseLinks(Optional<String> secret, Optional<String> baseUrl) {
        this.secret = secret.filter(value -> !value.isBlank()).map(value -> value.getBytes(StandardCharsets.UTF_8));
        this.baseUrl = baseUrl.filter(value -> !value.isBlank()).map(CustomerResponseLinks::trimTrailingSlash);
    }

    public static CustomerResponseLinks disabled() {
        return new CustomerResponseLinks(Optional.empty(), Optional.empty());
    }

    public boolean enabled() {
        return secret.isPresent();
    }

    public String token(String scheduleId, CustomerLinkAction action) {
        byte[] key = secret.orElseThrow(() -> new IllegalStateException("고객 응답 링크 비밀 값이 설정되지 않았습니다."));
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(key, ALGORITHM));
            byte[] digest = mac.doFinal((scheduleId + ":" + action.wireName()).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest).substring(0, TOKEN_LENGTH);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("고객 응답 토큰 생성 실패", e);
        }
    }

    /**
     * 비밀 값이 없거나 토큰 길이가 다르면 false. 비교는 상수 시간으로 한다.
     */
    public boolean verify(String scheduleId, CustomerLinkAction action, String token) {
        if (!enabled() || token == null || token.length() != TOKEN_LENGTH) {
            return false;
        }
        byte[] expected = token(scheduleId, action).getBytes(StandardCharsets.US_ASCII);
        return MessageDigest.isEqual(expected, token.getBytes(StandardCharsets.US_ASCII));
    }

    /**
     * 비밀 값과 공개 기본 URL 이 모두 있을 때만 링크를 만든다.
     */
    public Optional<String> url(String scheduleId, CustomerLinkAction action) {
        if (!enabled()) {
            return Optional.empty();
        }
        return baseUrl.map(base -> base + RESPONSE_PATH
                + "?action=" + action.wireName()
                + "&scheduleId=" + URLEncoder.encode(scheduleId, StandardCharsets.UTF_8)
                + "&token=" + token(scheduleId, action));
    }

    private static String trimTrailingSlash(String value) {
        return value.endsWith("/") ? value.substring(0, value.length() - 1) : value;
    }
}
