package com.tdnet.insight.grouping;

import com.tdnet.common.disclosure.Disclosure;
import com.tdnet.common.issuer.IssuerCodes;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * @param include   substring that must occur in the title or storage path; {@code null} accepts everything
 * @param codes     issuer codes to keep, normalized on construction; empty keeps every issuer
 * @param maxGroups upper bound on the number of groups; {@code null} means unbounded
 */
public record GroupingFilter(
    String include,
    Set<String> codes,
    Integer maxGroups
) {
    public GroupingFilter {
        include = include == null || include.isEmpty() ? null : include;
        codes = codes == null ? Set.of() : codes.stream()
            .map(IssuerCodes::normalize)
            .filter(code -> !code.isEmpty())
            .collect(Collectors.toUnmodifiableSet());
        if (maxGroups != null && maxGroups < 1) {
            throw new IllegalArgumentException("maxGroups must be >= 1 but was " + maxGroups);
        }
    }

    public static GroupingFilter none() {
        return new GroupingFilter(null, Set.of(), null);
    }

    public static GroupingFilter of(String include, List<String> codes, Integer maxGroups) {
        return new GroupingFilter(include, codes == null ? Set.of() : Set.copyOf(codes), maxGroups);
    }

    boolean accepts(Disclosure disclosure) {
        if (include != null && !contains(disclosure.title(), include) && !contains(disclosure.storagePath(), include)) {
            return false;
        }
        return codes.isEmpty() || codes.contains(disclosure.normalizedCode());
    }

    boolean hasRoomFor(int groupCount) {
        return maxGroups == null || groupCount < maxGroups;
    }

    private static boolean contains(String value, String part) {
        return value != null && value.contains(part);
    }
}
