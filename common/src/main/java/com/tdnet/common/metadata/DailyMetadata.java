package com.tdnet.common.metadata;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.tdnet.common.disclosure.Disclosure;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-date sidecar written next to the stored PDFs and read back by the insight stage.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DailyMetadata(
    String date,
    @JsonProperty("total_documents") int totalDocuments,
    @JsonProperty("document_types") Map<String, Integer> documentTypes,
    Map<String, Integer> companies,
    List<DocumentRecord> documents
) {
    public static DailyMetadata of(String date, List<Disclosure> stored) {
        Map<String, Integer> types = new LinkedHashMap<>();
        Map<String, Integer> companies = new LinkedHashMap<>();
        for (Disclosure disclosure : stored) {
            types.merge(disclosure.docType().wireName(), 1, Integer::sum);
            companies.merge(disclosure.code(), 1, Integer::sum);
        }
        List<DocumentRecord> documents = stored.stream().map(DocumentRecord::from).toList();
        return new DailyMetadata(date, documents.size(), types, companies, documents);
    }

    public List<Disclosure> toDisclosures() {
        return documents == null ? List.of() : documents.stream().map(DocumentRecord::toDisclosure).toList();
    }
}
