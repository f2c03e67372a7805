package com.tdnet.insight.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tdnet.common.disclosure.Disclosure;
import com.tdnet.common.disclosure.DocType;
import com.tdnet.common.issuer.IssuerDirectory;
import com.tdnet.common.issuer.IssuerInfo;
import com.tdnet.common.metadata.DailyMetadata;
import com.tdnet.common.storage.LocalObjectStore;
import com.tdnet.common.storage.PathNamer;
import com.tdnet.insight.FakeSummarizationClient;
import com.tdnet.insight.TestPdfs;
import com.tdnet.insight.catalog.MetadataDocumentCatalog;
import com.tdnet.insight.extract.PdfTextExtractor;
import com.tdnet.insight.grouping.DocumentGrouper;
import com.tdnet.insight.grouping.GroupingFilter;
import com.tdnet.insight.summarize.PromptTemplates;
import com.tdnet.insight.summarize.RetryingSummarizer;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CompanySummaryServiceTest {

    @TempDir
    Path storageRoot;

    @TempDir
    Path localDir;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final PathNamer namer = new PathNamer("tdnet");
    private final IssuerDirectory issuers = new IssuerDirectory(
        Map.of("7203", new IssuerInfo("7203", "トヨタ自動車", "輸送用機器", "Core30"),
            "4890", new IssuerInfo("4890", "坪田ラボ", "精密機器", "Small 2")),
        Map.of());

    private LocalObjectStore store;

    @BeforeEach
    void setUp() {
        store = new LocalObjectStore(storageRoot);
    }

    /**
     * Documents of one issuer are joined in listing order; a document that cannot be read contributes a
     * marker instead of failing the group. Output goes under the last date of the range.
     */
    @Test
    void summarizesEachIssuerUnderTheLastDate() throws Exception {
        TestPdfs.write(storageRoot.resolve("tdnet/2024/01/04/tanshin/72030_a.pdf"), "Toyota quarterly results");
        TestPdfs.write(storageRoot.resolve("tdnet/2024/01/04/tanshin/48900_c.pdf"), "Tsubota lab results");
        writeSidecar("20240104", List.of(
            doc("72030", "決算短信", "tdnet/2024/01/04/tanshin/72030_a.pdf"),
            doc("48900", "四半期決算短信", "tdnet/2024/01/04/tanshin/48900_c.pdf"),
            doc("72030", "配当予想の修正", "tdnet/2024/01/04/dividend/72030_missing.pdf")));
        FakeSummarizationClient client = new FakeSummarizationClient();

        List<String> keys = service(client).generate("20240104", "20240105", GroupingFilter.none(), null);

        String toyotaKey = namer.summaryKey("20240105", "輸送用機器", "Core30", "7203", "トヨタ自動車");
        String tsubotaKey = namer.summaryKey("20240105", "精密機器", "Small 2", "4890", "坪田ラボ");
        assertThat(keys).containsExactly(toyotaKey, tsubotaKey);
        assertThat(store.exists(toyotaKey)).isTrue();
        assertThat(store.readText(tsubotaKey)).startsWith("# summary");

        FakeSummarizationClient.Call toyota = callFor(client, "7203");
        assertThat(toyota.content())
            .startsWith("--- Document: 決算短信 ---\nToyota quarterly results")
            .contains("\n\n--- Document: 配当予想の修正 ---\n--- Text extraction failed: 配当予想の修正 ---");
        assertThat(toyota.systemPrompt()).contains("## リスク要因");
        assertThat(toyota.userPrompt()).contains("トヨタ自動車", "- 決算短信\n- 配当予想の修正");

        assertThat(callFor(client, "4890").systemPrompt()).doesNotContain("## リスク要因");
    }

    @Test
    void failedGroupIsExcludedAndSiblingsContinue() throws Exception {
        TestPdfs.write(storageRoot.resolve("tdnet/2024/01/04/tanshin/72030_a.pdf"), "Toyota quarterly results");
        TestPdfs.write(storageRoot.resolve("tdnet/2024/01/04/tanshin/48900_c.pdf"), "Tsubota lab results");
        writeSidecar("20240104", List.of(
            doc("72030", "決算短信", "tdnet/2024/01/04/tanshin/72030_a.pdf"),
            doc("48900", "四半期決算短信", "tdnet/2024/01/04/tanshin/48900_c.pdf")));
        FakeSummarizationClient client = new FakeSummarizationClient(call -> call.content().contains("Toyota"));

        List<String> keys = service(client).generate("20240104", "20240104", GroupingFilter.none(), null);

        assertThat(keys).containsExactly(namer.summaryKey("20240104", "精密機器", "Small 2", "4890", "坪田ラボ"));
        assertThat(client.calls()).hasSize(2);
    }

    @Test
    void localDirectoryReplacesTheSidecars() throws Exception {
        TestPdfs.write(localDir.resolve("72030_2024Q1 results.pdf"), "Local Toyota text");
        TestPdfs.write(localDir.resolve("48900_2024Q1 results.pdf"), "Local Tsubota text");
        FakeSummarizationClient client = new FakeSummarizationClient();

        List<String> keys = service(client).generate("20240110", "20240110",
            GroupingFilter.of(null, List.of("7203"), null), localDir);

        assertThat(keys).containsExactly(namer.summaryKey("20240110", "輸送用機器", "Core30", "7203", "トヨタ自動車"));
        assertThat(client.calls()).singleElement()
            .satisfies(call -> assertThat(call.content()).isEqualTo("--- Document: 2024Q1 results ---\nLocal Toyota text"));
    }

    @Test
    void noDocumentsWritesNothing() {
        FakeSummarizationClient client = new FakeSummarizationClient();

        assertThat(service(client).generate("20240101", "20240103", GroupingFilter.none(), null)).isEmpty();
        assertThat(client.calls()).isEmpty();
    }

    @Test
    void reversedRangeIsRejected() {
        assertThatThrownBy(() -> service(new FakeSummarizationClient())
            .generate("20240105", "20240104", GroupingFilter.none(), null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    private CompanySummaryService service(FakeSummarizationClient client) {
        return new CompanySummaryService(
            new MetadataDocumentCatalog(store, namer, objectMapper),
            new DocumentGrouper(issuers),
            new PdfTextExtractor(store),
            new RetryingSummarizer(client, 1, Duration.ZERO),
            new PromptTemplates(),
            store,
            namer,
            new BoundedParallelRunner(4)
        );
    }

    private void writeSidecar(String date, List<Disclosure> stored) throws Exception {
        store.putText(namer.metadataKey(date),
            objectMapper.writeValueAsString(DailyMetadata.of(date, stored)), "application/json");
    }

    private static FakeSummarizationClient.Call callFor(FakeSummarizationClient client, String code) {
        return client.calls().stream()
            .filter(call -> call.userPrompt().contains("証券コード: " + code))
            .findFirst()
            .orElseThrow();
    }

    private static Disclosure doc(String code, String title, String path) {
        return new Disclosure("15:00", code, "", title, DocType.TANSHIN, "https://example.test/" + code + ".pdf", path);
    }
}
