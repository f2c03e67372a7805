package com.tdnet.common.issuer;

public final class SizeClass {

    public static final String UNKNOWN = "Unknown";

    private static final String TOPIX_PREFIX = "TOPIX ";
    private static final String[] LARGE_CAP_MARKERS = {"Core30", "Large70", "Mid400"};

    private SizeClass() {
    }

    public static String normalize(String size) {
        if (size == null) {
            return UNKNOWN;
        }
        String value = size.trim();
        if (value.isEmpty() || value.equals("-")) {
            return UNKNOWN;
        }
        if (value.startsWith(TOPIX_PREFIX)) {
            return value.substring(TOPIX_PREFIX.length()).trim();
        }
        return value;
    }

    /**
     * True for the TOPIX Core30 / Large70 / Mid400 buckets; everything else, unknown included, is small cap.
     */
    public static boolean isLargeCap(String size) {
        if (size == null) {
            return false;
        }
        for (String marker : LARGE_CAP_MARKERS) {
            if (size.contains(marker)) {
                return true;
            }
        }
        return false;
    }
}
