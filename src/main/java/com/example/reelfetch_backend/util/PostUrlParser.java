package com.example.reelfetch_backend.util;

import com.example.reelfetch_backend.exception.ErrorKind;
import com.example.reelfetch_backend.exception.RetrievalException;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts the post shortcode from {@code instagram.com/p/<code>} and {@code instagram.com/reel/<code>} links.
 */
public final class PostUrlParser {
    private static final Pattern POST_PATTERN = Pattern.compile("instagram\\.com/(?:reel|p)/([^/?#&]+)");
    private static final Pattern SHORTCODE = Pattern.compile("[A-Za-z0-9_-]+");

    private PostUrlParser() {
    }

    public static String extractShortcode(String url) {
        if (url == null) {
            throw new RetrievalException(ErrorKind.INVALID_INPUT, "URL is required");
        }
        Matcher matcher = POST_PATTERN.matcher(url);
        if (!matcher.find()) {
            throw new RetrievalException(ErrorKind.INVALID_INPUT,
                    "Could not parse shortcode from URL. Ensure it is a valid Instagram post or reel URL.");
        }
        String shortcode = matcher.group(1);
        if (!SHORTCODE.matcher(shortcode).matches()) {
            throw new RetrievalException(ErrorKind.INVALID_INPUT, "Invalid shortcode in URL.");
        }
        return shortcode;
    }
}
