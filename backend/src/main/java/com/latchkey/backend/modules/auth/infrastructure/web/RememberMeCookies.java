package com.latchkey.backend.modules.auth.infrastructure.web;

import java.time.Duration;
import java.util.Arrays;
import java.util.Optional;

import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.security.crypto.encrypt.Encryptors;
import org.springframework.security.crypto.encrypt.TextEncryptor;
import org.springframework.stereotype.Component;

/**
 * Long-lived remember-me cookie. The value is sealed with AES-GCM, so the client can neither
 * read the remember token nor alter it without detection.
 */
@Component
public class RememberMeCookies {

    private static final Logger log = LoggerFactory.getLogger(RememberMeCookies.class);

    private final TextEncryptor encryptor;
    private final String cookieName;
    private final Duration maxAge;
    private final boolean secure;

    public RememberMeCookies(
            @Value("${latchkey.remember-me.secret}") String secret,
            @Value("${latchkey.remember-me.salt}") String salt,
            @Value("${latchkey.remember-me.cookie-name:remember_token}") String cookieName,
            @Value("${latchkey.remember-me.max-age:P7300D}") Duration maxAge,
            @Value("${latchkey.remember-me.secure:true}") boolean secure
    ) {
        this.encryptor = Encryptors.delux(secret, salt);
        this.cookieName = cookieName;
        this.maxAge = maxAge;
        this.secure = secure;
    }

    public void write(HttpServletResponse response, String rememberToken) {
        response.addCookie(buildCookie(encryptor.encrypt(rememberToken), (int) maxAge.toSeconds()));
    }

    public void clear(HttpServletResponse response) {
        response.addCookie(buildCookie("", 0));
    }

    public Optional<String> read(HttpServletRequest request) {
        Cookie[] cookies = request.getCookies();
        if (cookies == null) {
            return Optional.empty();
        }
        return Arrays.stream(cookies)
                .filter(cookie -> cookieName.equals(cookie.getName()))
                .map(Cookie::getValue)
                .filter(value -> value != null && !value.isBlank())
                .findFirst()
                .flatMap(this::open);
    }

    private Optional<String> open(String sealed) {
        try {
            return Optional.of(encryptor.decrypt(sealed));
        } catch (IllegalArgumentException | IllegalStateException | IndexOutOfBoundsException ex) {
            log.debug("Ignoring remember-me cookie that failed to decrypt");
            return Optional.empty();
        }
    }

    private Cookie buildCookie(String value, int maxAgeSeconds) {
        Cookie cookie = new Cookie(cookieName, value);
        cookie.setPath("/");
        cookie.setHttpOnly(true);
        cookie.setSecure(secure);
        cookie.setMaxAge(maxAgeSeconds);
        cookie.setAttribute("SameSite", "Lax");
        return cookie;
    }
}
