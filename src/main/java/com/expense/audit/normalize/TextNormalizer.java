package com.expense.audit.normalize;

import java.text.Normalizer;
import java.util.Locale;

/**
 * Canonicalizes free-text fields for comparison (never for display).
 *
 * Steps: NFKC composition, dash variants folded to ASCII '-', trim, lowercase.
 */
public final class TextNormalizer {

    // hyphen, hyphen-minus, figure dash, en dash, em dash, horizontal bar,
    // small em dash, small hyphen-minus, fullwidth hyphen-minus
    private static final String DASHES = "‐-‒–—―﹘﹣－";

    private TextNormalizer() {}

    public static String normalize(String value) {
        if (value == null || value.isEmpty()) {
            return "";
        }
        String s = Normalizer.normalize(value, Normalizer.Form.NFKC);
        StringBuilder sb = new StringBuilder(s.length());
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            sb.append(DASHES.indexOf(c) >= 0 ? '-' : c);
        }
        return sb.toString().strip().toLowerCase(Locale.ROOT);
    }
}
