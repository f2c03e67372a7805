package com.tdnet.insight.sequence;

import java.util.Comparator;

/**
 * Sort key derived from a file name. Names without a quarter or date token get
 * {@code (9999, 9, 99)} and sort last.
 */
public record QuarterKey(int year, int quarter, int day, String label) implements Comparable<QuarterKey> {

    static final QuarterKey UNMATCHED = new QuarterKey(9999, 9, 99, "unknown");

    private static final Comparator<QuarterKey> ORDER = Comparator.comparingInt(QuarterKey::year)
        .thenComparingInt(QuarterKey::quarter)
        .thenComparingInt(QuarterKey::day);

    @Override
    public int compareTo(QuarterKey other) {
        return ORDER.compare(this, other);
    }
}
