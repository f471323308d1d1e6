package com.example.mediacache.core;

import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps a request locator to the key the metadata cache stores it under.
 *
 * <p>YouTube locators in any of the known URL shapes collapse to {@code yt_<videoId>},
 * so a watch link and a short link for the same video share one cache entry. Every other
 * locator is keyed by the MD5 hex digest of its raw text.
 */
public final class KeyNormalizer {

    public static final String VIDEO_KEY_PREFIX = "yt_";

    private static final List<Pattern> VIDEO_ID_PATTERNS = List.of(
        Pattern.compile("youtube\\.com/watch\\?v=([\\w-]+)"),
        Pattern.compile("youtu\\.be/([\\w-]+)"),
        Pattern.compile("youtube\\.com/embed/([\\w-]+)"),
        Pattern.compile("youtube\\.com/v/([\\w-]+)")
    );

    private KeyNormalizer() {
    }

    public static String normalize(String locator) {
        String raw = locator == null ? "" : locator;
        if (raw.contains("youtube.com") || raw.contains("youtu.be")) {
            for (Pattern pattern : VIDEO_ID_PATTERNS) {
                Matcher m = pattern.matcher(raw);
                if (m.find()) {
                    return VIDEO_KEY_PREFIX + m.group(1);
                }
            }
        }
        return DigestUtils.md5DigestAsHex(raw.getBytes(StandardCharsets.UTF_8));
    }
}
