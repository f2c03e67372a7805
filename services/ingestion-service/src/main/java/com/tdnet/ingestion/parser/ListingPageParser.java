package com.tdnet.ingestion.parser;

import com.tdnet.ingestion.domain.ListingRow;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Extracts disclosure rows from a TDnet listing table. Columns are time, code, company, title (linking
 * the PDF), exchange and history; rows with fewer than six cells are layout rows.
 */
@Component
public class ListingPageParser {

    private static final Logger LOGGER = LoggerFactory.getLogger(ListingPageParser.class);

    private static final int MIN_CELLS = 6;
    private static final Set<String> HEADER_LABELS = Set.of("時刻", "コード", "会社名", "タイトル");

    public List<ListingRow> parse(String html, String pageUrl) {
        Document document = Jsoup.parse(html == null ? "" : html, pageUrl);
        List<ListingRow> rows = new ArrayList<>();
        for (Element tr : document.select("tr")) {
            try {
                ListingRow row = extract(tr);
                if (row != null) {
                    rows.add(row);
                }
            } catch (RuntimeException ex) {
                LOGGER.warn("Skipping malformed listing row on {}: {}", pageUrl, ex.getMessage());
            }
        }
        return rows;
    }

    private ListingRow extract(Element tr) {
        List<Element> cells = tr.children().stream()
            .filter(child -> child.normalName().equals("td"))
            .toList();
        if (cells.size() < MIN_CELLS) {
            return null;
        }
        String time = cells.get(0).text().trim();
        String code = cells.get(1).text().trim();
        String company = cells.get(2).text().trim();
        Element titleCell = cells.get(3);
        String title = titleCell.text().trim();
        if (isHeaderLike(time) || isHeaderLike(code) || isHeaderLike(company) || isHeaderLike(title)) {
            return null;
        }

        String pdfUrl = null;
        Element link = titleCell.selectFirst("a[href]");
        if (link != null) {
            String resolved = link.absUrl("href");
            pdfUrl = resolved.isEmpty() ? null : resolved;
        }
        return new ListingRow(time, code, company, title, pdfUrl);
    }

    private boolean isHeaderLike(String value) {
        return value.isEmpty() || HEADER_LABELS.contains(value);
    }
}
