package com.example.mediacache.session;

import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;

/**
 * Derives a session id from connection attributes, so repeat requests from the same
 * client correlate without a login. Clients sharing both address and user agent
 * (for example behind one proxy) resolve to the same id.
 */
public final class ClientIdentityResolver {

    private ClientIdentityResolver() {
    }

    public static String identify(String clientAddress, String userAgent) {
        String combined = nullToEmpty(clientAddress) + "_" + nullToEmpty(userAgent);
        return DigestUtils.md5DigestAsHex(combined.getBytes(StandardCharsets.UTF_8));
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
