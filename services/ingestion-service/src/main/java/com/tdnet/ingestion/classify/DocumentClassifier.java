package com.tdnet.ingestion.classify;

import com.tdnet.common.disclosure.DocType;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Title-based classification. Keyword groups are checked in order and the first group with a substring
 * match wins, so a results briefing titled "決算説明資料" is {@link DocType#TANSHIN}.
 */
@Component
public class DocumentClassifier {

    private static final List<Map.Entry<DocType, List<String>>> KEYWORDS = List.of(
        Map.entry(DocType.TANSHIN, List.of(
            "決算短信", "決算短", "短信", "決算", "業績", "financial results", "earnings")),
        Map.entry(DocType.PRESENTATION, List.of(
            "説明資料", "補足資料", "プレゼンテーション", "資料", "説明", "presentation", "supplementary")),
        Map.entry(DocType.DIVIDEND, List.of(
            "配当", "配当金", "配当政策", "dividend")),
        Map.entry(DocType.OTHER, List.of(
            "開示事項", "経過", "変更", "修正", "訂正", "重要", "notice", "revision", "correction"))
    );

    public Optional<DocType> classify(String title) {
        if (title == null || title.isBlank()) {
            return Optional.empty();
        }
        String normalized = title.toLowerCase(Locale.ROOT);
        for (Map.Entry<DocType, List<String>> group : KEYWORDS) {
            for (String keyword : group.getValue()) {
                if (normalized.contains(keyword)) {
                    return Optional.of(group.getKey());
                }
            }
        }
        return Optional.empty();
    }
}
