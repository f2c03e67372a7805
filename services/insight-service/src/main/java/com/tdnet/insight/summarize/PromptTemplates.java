package com.tdnet.insight.summarize;

import com.tdnet.common.issuer.SizeClass;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import org.springframework.core.io.ClassPathResource;

/**
 * Prompt templates under {@code prompts/} on the classpath, read once at construction.
 * Placeholders are written {@code {{name}}}; unknown placeholders are left as they are.
 */
public class PromptTemplates {

    static final String COMPANY_SYSTEM = "company_summary_system.md";
    static final String COMPANY_SYSTEM_SMALL = "company_summary_system_small.md";
    static final String COMPANY_USER = "company_summary_user.md";
    static final String SECTOR_SYSTEM = "sector_insight_system.md";
    static final String SECTOR_USER = "sector_insight_user.md";
    static final String TIMESERIES_SYSTEM = "timeseries_analysis_system.md";
    static final String TIMESERIES_USER = "timeseries_analysis_user.md";

    private final String companySystem;
    private final String companySystemSmall;
    private final String companyUser;
    private final String sectorSystem;
    private final String sectorUser;
    private final String timeseriesSystem;
    private final String timeseriesUser;

    public PromptTemplates() {
        this("prompts/");
    }

    PromptTemplates(String location) {
        this.companySystem = read(location + COMPANY_SYSTEM);
        this.companySystemSmall = read(location + COMPANY_SYSTEM_SMALL);
        this.companyUser = read(location + COMPANY_USER);
        this.sectorSystem = read(location + SECTOR_SYSTEM);
        this.sectorUser = read(location + SECTOR_USER);
        this.timeseriesSystem = read(location + TIMESERIES_SYSTEM);
        this.timeseriesUser = read(location + TIMESERIES_USER);
    }

    /**
     * Full prompt for Core30, Large70 and Mid400 issuers, the compact one for everything else.
     */
    public String companySystemPrompt(String size, Map<String, String> values) {
        return render(SizeClass.isLargeCap(size) ? companySystem : companySystemSmall, values);
    }

    public String companyUserPrompt(Map<String, String> values) {
        return render(companyUser, values);
    }

    public String sectorSystemPrompt(Map<String, String> values) {
        return render(sectorSystem, values);
    }

    public String sectorUserPrompt(Map<String, String> values) {
        return render(sectorUser, values);
    }

    public String timeseriesSystemPrompt(Map<String, String> values) {
        return render(timeseriesSystem, values);
    }

    public String timeseriesUserPrompt(Map<String, String> values) {
        return render(timeseriesUser, values);
    }

    public static String render(String template, Map<String, String> values) {
        String rendered = template;
        for (Map.Entry<String, String> entry : values.entrySet()) {
            String value = entry.getValue() == null ? "" : entry.getValue();
            rendered = rendered.replace("{{" + entry.getKey() + "}}", value);
        }
        return rendered;
    }

    private static String read(String path) {
        ClassPathResource resource = new ClassPathResource(path);
        try {
            return resource.getContentAsString(StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Prompt template not readable: " + path, e);
        }
    }
}
