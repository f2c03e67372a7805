package com.tdnet.common.issuer;

import java.util.Locale;

/**
 * Canonical form of TDnet issuer codes.
 *
 * <p>Listing pages and file names carry five-character codes ({@code 72030}, {@code 13264}) while the
 * reference table uses four ({@code 7203}); alphanumeric codes such as {@code 130a} are uppercased.
 * The normalized form is the only join key between listing data and the reference table.
 */
public final class IssuerCodes {

    private IssuerCodes() {
    }

    public static String normalize(String raw) {
        if (raw == null) {
            return "";
        }
        String code = raw.trim().toUpperCase(Locale.ROOT);
        if (code.length() == 5 && code.charAt(4) == '0' && isDigits(code.substring(0, 4))) {
            return code.substring(0, 4);
        }
        if (code.length() == 5 && isDigits(code)) {
            return code.substring(0, 4);
        }
        return code;
    }

    /**
     * Listing code as it appears on the page, trimmed and uppercased but not shortened.
     */
    public static String clean(String raw) {
        return raw == null ? "" : raw.trim().toUpperCase(Locale.ROOT);
    }

    private static boolean isDigits(String value) {
        if (value.isEmpty()) {
            return false;
        }
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c < '0' || c > '9') {
                return false;
            }
        }
        return true;
    }
}
