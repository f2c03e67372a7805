package com.tdnet.common.storage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.tdnet.common.disclosure.Disclosure;
import com.tdnet.common.disclosure.DocType;
import com.tdnet.common.issuer.IssuerInfo;
import org.junit.jupiter.api.Test;

class PathNamerTest {

    private final PathNamer namer = new PathNamer("tdnet");

    private final Disclosure tanshin = new Disclosure("15:00", "72030", "トヨタ自動車",
        "2024年3月期 第3四半期決算短信〔日本基準〕(連結)", DocType.TANSHIN, "https://example/a.pdf", null);

    @Test
    void dateLayoutPartitionsByDocType() {
        assertThat(namer.documentKey(tanshin, "20240201", LayoutMode.DATE, null))
            .isEqualTo("tdnet/2024/02/01/tanshin/72030_2024年3月期_第3四半期決算短信〔日本基準〕(連結).pdf");
    }

    @Test
    void flatLayoutOmitsDocType() {
        assertThat(namer.documentKey(tanshin, "20240201", LayoutMode.DATE_FLAT, null))
            .isEqualTo("tdnet/2024/02/01/72030_2024年3月期_第3四半期決算短信〔日本基準〕(連結).pdf");
    }

    @Test
    void sectorLayoutUsesIssuerAttributes() {
        IssuerInfo toyota = new IssuerInfo("7203", "トヨタ自動車", "輸送用機器", "Core30");

        assertThat(namer.documentKey(tanshin, "20240201", LayoutMode.SECTOR, toyota))
            .isEqualTo("tdnet/sectors/輸送用機器/Core30/72030_トヨタ自動車_2024年3月期_第3四半期決算短信〔日本基準〕(連結).pdf");
        assertThat(namer.documentKey(tanshin, "20240201", LayoutMode.SECTOR, null))
            .startsWith("tdnet/sectors/Unknown/Unknown/72030_");
    }

    @Test
    void sanitizeRemovesForbiddenCharactersAndTruncates() {
        assertThat(PathNamer.sanitize("a<b>c:d\"e/f\\g|h?i*j", 50)).isEqualTo("abcdefghij");
        assertThat(PathNamer.sanitize("x".repeat(49) + " y", 50)).isEqualTo("x".repeat(49));
        assertThat(PathNamer.sanitize("trailing  ", 50)).isEqualTo("trailing");
    }

    @Test
    void emptyBaseYieldsNoLeadingSlash() {
        PathNamer bare = new PathNamer("");

        assertThat(bare.metadataKey("20240101")).isEqualTo("2024/01/01/metadata_20240101.json");
        assertThat(new PathNamer("/tdnet/").metadataKey("20240101")).isEqualTo("tdnet/2024/01/01/metadata_20240101.json");
    }

    @Test
    void artifactKeys() {
        assertThat(namer.summaryKey("20240201", "輸送用機器", "Small 1", "7203", "トヨタ自動車(株)"))
            .isEqualTo("tdnet/insights-summaries/20240201/20240201__輸送用機器__Small_1__7203__トヨタ自動車株_summary.md");
        assertThat(namer.sectorInsightKey("20240201", "輸送用機器", "Core30"))
            .isEqualTo("tdnet/insights-sectors/20240201/輸送用機器_Core30_insights.md");
        assertThat(namer.companyTimeseriesKey("電気機器", "Core30", "6758"))
            .isEqualTo("tdnet/sectors-analysis/電気機器/Core30/6758_timeseries_summary.md");
        assertThat(namer.sectorTimeseriesKey("電気機器", "Core30"))
            .isEqualTo("tdnet/sectors-analysis/電気機器/Core30/sector_timeseries_insights.md");
    }

    @Test
    void parsesSectorLayoutKeys() {
        assertThat(namer.parseSectorKey("tdnet/sectors/電気機器/Core30/67580_ソニー_2024Q1決算短信.pdf"))
            .hasValueSatisfying(key -> {
                assertThat(key.sector()).isEqualTo("電気機器");
                assertThat(key.size()).isEqualTo("Core30");
                assertThat(key.code()).isEqualTo("67580");
                assertThat(key.fileName()).isEqualTo("67580_ソニー_2024Q1決算短信.pdf");
            });
        assertThat(namer.parseSectorKey("tdnet/sectors/電気機器/67580_x.pdf")).isEmpty();
        assertThat(namer.parseSectorKey("tdnet/sectors/電気機器/Core30/notes.txt")).isEmpty();
        assertThat(namer.parseSectorKey("other/sectors/a/b/1_x.pdf")).isEmpty();
    }

    @Test
    void rejectsMalformedDate() {
        assertThatThrownBy(() -> namer.metadataKey("2024-01-01")).isInstanceOf(IllegalArgumentException.class);
    }
}
