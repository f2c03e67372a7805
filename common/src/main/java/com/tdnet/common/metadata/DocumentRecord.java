package com.tdnet.common.metadata;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.tdnet.common.disclosure.Disclosure;
import com.tdnet.common.disclosure.DocType;

@JsonIgnoreProperties(ignoreUnknown = true)
public record DocumentRecord(
    String time,
    String code,
    @JsonProperty("company_name") String companyName,
    String title,
    @JsonProperty("doc_type") DocType docType,
    @JsonProperty("storage_path") @JsonAlias("gcs_path") String storagePath
) {
    public static DocumentRecord from(Disclosure disclosure) {
        return new DocumentRecord(
            disclosure.time(),
            disclosure.code(),
            disclosure.companyName(),
            disclosure.title(),
            disclosure.docType(),
            disclosure.storagePath()
        );
    }

    public Disclosure toDisclosure() {
        return new Disclosure(
            time,
            code == null ? "" : code,
            companyName == null ? "" : companyName,
            title == null ? "" : title,
            docType == null ? DocType.OTHER : docType,
            null,
            storagePath
        );
    }
}
