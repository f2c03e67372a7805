package com.tdnet.insight.summarize;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.UncheckedIOException;
import java.util.Map;
import org.junit.jupiter.api.Test;

class PromptTemplatesTest {

    private final PromptTemplates templates = new PromptTemplates();

    @Test
    void largeCapsGetTheFullCompanyPrompt() {
        Map<String, String> values = Map.of("sector_name", "輸送用機器");

        String core = templates.companySystemPrompt("Core30", values);
        String small = templates.companySystemPrompt("Small 1", values);
        String unknown = templates.companySystemPrompt(null, values);

        assertThat(core).contains("## リスク要因").contains("輸送用機器");
        assertThat(small).doesNotContain("## リスク要因").contains("## 注目点");
        assertThat(unknown).isEqualTo(small);
        assertThat(templates.companySystemPrompt("Mid400", values)).isEqualTo(core);
    }

    @Test
    void userPromptPlaceholdersAreFilled() {
        String prompt = templates.companyUserPrompt(Map.of(
            "company_code", "7203",
            "company_name", "トヨタ自動車",
            "sector_name", "輸送用機器",
            "titles", "- 決算短信"));

        assertThat(prompt).contains("7203", "トヨタ自動車", "- 決算短信").doesNotContain("{{");
    }

    @Test
    void sectorAndTimeseriesTemplatesLoad() {
        assertThat(templates.sectorSystemPrompt(Map.of("sector_name", "銀行業_Core30", "count", "3")))
            .contains("銀行業_Core30", "3社");
        assertThat(templates.sectorUserPrompt(Map.of("summaries", "A\n\n---\n\nB"))).contains("A\n\n---\n\nB");
        assertThat(templates.timeseriesUserPrompt(Map.of("document_list", "1. **2024 Q1**: x.pdf")))
            .contains("1. **2024 Q1**: x.pdf");
        assertThat(templates.timeseriesSystemPrompt(Map.of())).isNotBlank();
    }

    @Test
    void unknownPlaceholdersAreLeftAlone() {
        assertThat(PromptTemplates.render("{{a}} and {{b}}", Map.of("a", "x"))).isEqualTo("x and {{b}}");
    }

    @Test
    void missingTemplateDirectoryFailsFast() {
        assertThatThrownBy(() -> new PromptTemplates("no-such-prompts/"))
            .isInstanceOf(UncheckedIOException.class)
            .hasMessageContaining("no-such-prompts/");
    }
}
