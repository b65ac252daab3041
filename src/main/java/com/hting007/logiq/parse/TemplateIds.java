package com.hting007.logiq.parse;

import com.google.common.hash.Hashing;

import java.nio.charset.StandardCharsets;

/**
 * Template fingerprints: the first 8 bytes of the MD5 of the template text, as 16 hex chars.
 */
public final class TemplateIds {

    public static final int ID_LENGTH = 16;

    private TemplateIds() {}

    // fingerprint only
    @SuppressWarnings("deprecation")
    public static String of(String template) {
        if (template == null || template.isEmpty()) return "";
        return Hashing.md5().hashString(template, StandardCharsets.UTF_8).toString().substring(0, ID_LENGTH);
    }
}
