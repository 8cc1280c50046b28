package com.voxpop.backend.util;

import java.text.Normalizer;
import java.util.Locale;
import java.util.regex.Pattern;

public final class TextNormalizer {

    private static final Pattern DIACRITICS = Pattern.compile("\\p{M}+");
    private static final Pattern NON_SLUG = Pattern.compile("[^a-z0-9]+");

    private TextNormalizer() {
    }

    /**
     * Lower-cased, trimmed and without accents: "Seção Eleitoral" becomes "secao eleitoral".
     */
    public static String fold(String text) {
        if (text == null) {
            return "";
        }
        String decomposed = Normalizer.normalize(text, Normalizer.Form.NFD);
        return DIACRITICS.matcher(decomposed).replaceAll("").toLowerCase(Locale.ROOT).trim();
    }

    public static String slugify(String text) {
        String slug = NON_SLUG.matcher(fold(text)).replaceAll("-");
        return slug.replaceAll("^-+|-+$", "");
    }
}
