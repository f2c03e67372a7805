package com.tdnet.insight.sequence;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Orders one issuer's files oldest first. A {@code yyyyQn} token wins over an eight digit date; within
 * the same key the input order is kept, so the last element is the latest filing.
 */
public class QuarterSequencer {

    private static final Pattern QUARTER = Pattern.compile("(\\d{4})Q([1-4])");
    private static final Pattern DATE = Pattern.compile("(\\d{8})");

    public QuarterKey keyOf(String path) {
        String fileName = fileName(path);
        Matcher quarter = QUARTER.matcher(fileName);
        if (quarter.find()) {
            int year = Integer.parseInt(quarter.group(1));
            int q = Integer.parseInt(quarter.group(2));
            return new QuarterKey(year, q, 0, year + " Q" + q);
        }
        Matcher date = DATE.matcher(fileName);
        if (date.find()) {
            String digits = date.group(1);
            int year = Integer.parseInt(digits.substring(0, 4));
            int month = Integer.parseInt(digits.substring(4, 6));
            int day = Integer.parseInt(digits.substring(6, 8));
            return new QuarterKey(year, (month - 1) / 3 + 1, day, digits.substring(0, 4) + "-" + digits.substring(4, 6));
        }
        return QuarterKey.UNMATCHED;
    }

    public List<String> sequence(List<String> paths) {
        List<String> sorted = new ArrayList<>(paths);
        sorted.sort(Comparator.comparing(this::keyOf));
        return sorted;
    }

    public String label(String path) {
        return keyOf(path).label();
    }

    static String fileName(String path) {
        return path.substring(path.lastIndexOf('/') + 1);
    }
}
