package com.tdnet.common.storage;

import com.tdnet.common.disclosure.Disclosure;
import com.tdnet.common.issuer.IssuerInfo;
import java.util.Optional;
import java.util.StringJoiner;
import java.util.regex.Pattern;

/**
 * Maps disclosures and derived artifacts to object keys under a fixed base path.
 * Every method is pure; the same input always yields the same key.
 */
public class PathNamer {

    public static final String SECTORS_DIR = "sectors";
    public static final String SUMMARIES_DIR = "insights-summaries";
    public static final String SECTOR_INSIGHTS_DIR = "insights-sectors";
    public static final String SECTOR_ANALYSIS_DIR = "sectors-analysis";

    static final int TITLE_MAX = 50;
    static final int COMPANY_MAX = 30;
    static final int SAFE_NAME_MAX = 50;

    private static final Pattern FORBIDDEN = Pattern.compile("[<>:\"/\\\\|?*]");
    private static final Pattern DATE = Pattern.compile("\\d{8}");

    private final String basePath;

    public PathNamer(String basePath) {
        this.basePath = trimSlashes(basePath == null ? "" : basePath);
    }

    public String documentKey(Disclosure disclosure, String date, LayoutMode mode, IssuerInfo issuer) {
        String code = disclosure.code() == null || disclosure.code().isBlank() ? "unknown" : disclosure.code().trim();
        String title = sanitize(disclosure.title() == null ? "unknown" : disclosure.title(), TITLE_MAX);
        return switch (mode) {
            case DATE -> join(basePath, datePath(date), disclosure.docType().wireName(), code + "_" + title + ".pdf");
            case DATE_FLAT -> join(basePath, datePath(date), code + "_" + title + ".pdf");
            case SECTOR -> {
                IssuerInfo info = issuer == null ? IssuerInfo.unknown(code) : issuer;
                String company = sanitize(
                    disclosure.companyName() == null || disclosure.companyName().isBlank()
                        ? info.name() : disclosure.companyName(),
                    COMPANY_MAX);
                yield join(basePath, SECTORS_DIR, sanitize(info.sector(), Integer.MAX_VALUE),
                    sanitize(info.size(), Integer.MAX_VALUE), code + "_" + company + "_" + title + ".pdf");
            }
        };
    }

    public String metadataKey(String date) {
        return join(basePath, datePath(date), "metadata_" + date + ".json");
    }

    public String summariesPrefix(String date) {
        return join(basePath, SUMMARIES_DIR, date) + "/";
    }

    public String summaryKey(String date, String sector, String size, String code, String name) {
        String fileName = String.join("__", date, safeName(sector), safeName(size), code, safeName(name))
            + "_summary.md";
        return join(basePath, SUMMARIES_DIR, date, fileName);
    }

    public String sectorInsightKey(String date, String sector, String size) {
        return join(basePath, SECTOR_INSIGHTS_DIR, date, safeName(sector) + "_" + safeName(size) + "_insights.md");
    }

    public String sectorsPrefix() {
        return join(basePath, SECTORS_DIR) + "/";
    }

    public String companyTimeseriesKey(String sector, String size, String code) {
        return join(basePath, SECTOR_ANALYSIS_DIR, sector, size, code + "_timeseries_summary.md");
    }

    public String sectorTimeseriesKey(String sector, String size) {
        return join(basePath, SECTOR_ANALYSIS_DIR, sector, size, "sector_timeseries_insights.md");
    }

    /**
     * Reads (sector, size, code) back out of a {@link LayoutMode#SECTOR} key. Anything that is not a PDF
     * exactly three levels below the sectors prefix is rejected.
     */
    public Optional<SectorKey> parseSectorKey(String key) {
        String prefix = sectorsPrefix();
        if (key == null || !key.startsWith(prefix) || !key.toLowerCase().endsWith(".pdf")) {
            return Optional.empty();
        }
        String[] parts = key.substring(prefix.length()).split("/");
        if (parts.length != 3 || parts[0].isEmpty() || parts[1].isEmpty()) {
            return Optional.empty();
        }
        String fileName = parts[2];
        int underscore = fileName.indexOf('_');
        String code = underscore > 0 ? fileName.substring(0, underscore) : fileName.substring(0, fileName.length() - 4);
        if (code.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new SectorKey(parts[0], parts[1], code, key));
    }

    public static String sanitize(String value, int maxLength) {
        String cleaned = FORBIDDEN.matcher(value == null ? "" : value).replaceAll("").replace(' ', '_');
        if (cleaned.length() > maxLength) {
            cleaned = cleaned.substring(0, maxLength);
        }
        int end = cleaned.length();
        while (end > 0 && cleaned.charAt(end - 1) == '_') {
            end--;
        }
        return cleaned.substring(0, end);
    }

    public static String safeName(String value) {
        if (value == null) {
            return "";
        }
        StringBuilder kept = new StringBuilder();
        value.codePoints()
            .filter(cp -> Character.isLetterOrDigit(cp) || cp == ' ' || cp == '-' || cp == '_')
            .forEach(kept::appendCodePoint);
        String result = kept.toString().strip().replace(' ', '_');
        return result.length() > SAFE_NAME_MAX ? result.substring(0, SAFE_NAME_MAX) : result;
    }

    static String datePath(String date) {
        if (date == null || !DATE.matcher(date).matches()) {
            throw new IllegalArgumentException("Date must be YYYYMMDD: " + date);
        }
        return date.substring(0, 4) + "/" + date.substring(4, 6) + "/" + date.substring(6, 8);
    }

    private static String join(String... segments) {
        StringJoiner joiner = new StringJoiner("/");
        for (String segment : segments) {
            if (segment != null && !segment.isEmpty()) {
                joiner.add(segment);
            }
        }
        return joiner.toString();
    }

    private static String trimSlashes(String value) {
        int start = 0;
        int end = value.length();
        while (start < end && value.charAt(start) == '/') {
            start++;
        }
        while (end > start && value.charAt(end - 1) == '/') {
            end--;
        }
        return value.substring(start, end);
    }
}
