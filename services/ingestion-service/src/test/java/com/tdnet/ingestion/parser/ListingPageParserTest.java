package com.tdnet.ingestion.parser;

import static com.tdnet.ingestion.ListingHtml.page;
import static com.tdnet.ingestion.ListingHtml.row;
import static org.assertj.core.api.Assertions.assertThat;

import com.tdnet.ingestion.ListingHtml;
import com.tdnet.ingestion.domain.ListingRow;
import java.util.List;
import org.junit.jupiter.api.Test;

class ListingPageParserTest {

    private static final String PAGE_URL = "https://www.release.tdnet.info/inbs/I_list_001_20240201.html";

    private final ListingPageParser parser = new ListingPageParser();

    @Test
    void extractsDataRowsAndResolvesLinks() {
        String html = page(
            row("15:00", "72030", "トヨタ自動車", "2024年3月期 第3四半期決算短信", "140120240201000001.pdf"),
            row("15:30", "67580", "ソニーグループ", "決算説明資料", "/inbs/140120240201000002.pdf"),
            row("16:00", "99840", "ソフトバンクグループ", "配当予想の修正", "https://cdn.example.com/x.pdf"));

        List<ListingRow> rows = parser.parse(html, PAGE_URL);

        assertThat(rows).extracting(ListingRow::pdfUrl).containsExactly(
            "https://www.release.tdnet.info/inbs/140120240201000001.pdf",
            "https://www.release.tdnet.info/inbs/140120240201000002.pdf",
            "https://cdn.example.com/x.pdf");
        assertThat(rows.get(0)).isEqualTo(new ListingRow("15:00", "72030", "トヨタ自動車",
            "2024年3月期 第3四半期決算短信", "https://www.release.tdnet.info/inbs/140120240201000001.pdf"));
    }

    @Test
    void dropsHeaderAndShortRows() {
        String html = page(
            row("時刻", "コード", "会社名", "タイトル", null),
            "<tr><td>15:00</td><td>72030</td><td>トヨタ自動車</td></tr>",
            row("", "13010", "極洋", "決算短信", "a.pdf"),
            row("15:00", "13010", "極洋", "決算短信", "a.pdf"));

        assertThat(parser.parse(html, PAGE_URL)).singleElement()
            .extracting(ListingRow::code).isEqualTo("13010");
    }

    @Test
    void rowWithoutLinkKeepsNullUrl() {
        String html = page(row("15:00", "72030", "トヨタ自動車", "決算短信", null));

        assertThat(parser.parse(html, PAGE_URL)).singleElement()
            .extracting(ListingRow::pdfUrl).isNull();
    }

    @Test
    void pageWithoutTableYieldsNothing() {
        assertThat(parser.parse(ListingHtml.emptyPage(), PAGE_URL)).isEmpty();
        assertThat(parser.parse(null, PAGE_URL)).isEmpty();
    }
}
