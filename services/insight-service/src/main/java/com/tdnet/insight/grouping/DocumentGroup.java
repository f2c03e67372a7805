package com.tdnet.insight.grouping;

import com.tdnet.common.disclosure.Disclosure;
import com.tdnet.common.issuer.IssuerInfo;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * All documents of one issuer within a summary run. Created on the issuer's first document; text and
 * summary are filled in as the run progresses.
 */
public class DocumentGroup {

    private final String code;
    private final String name;
    private final String sector;
    private final String size;
    private final List<Disclosure> documents = new ArrayList<>();
    private String combinedText = "";
    private String summary;

    public DocumentGroup(String code, IssuerInfo issuer) {
        this.code = code;
        this.name = issuer.name();
        this.sector = issuer.sector();
        this.size = issuer.size();
    }

    void add(Disclosure disclosure) {
        if (!code.equals(disclosure.normalizedCode())) {
            throw new IllegalArgumentException(
                "Document for " + disclosure.normalizedCode() + " does not belong to group " + code);
        }
        documents.add(disclosure);
    }

    public String getCode() {
        return code;
    }

    public String getName() {
        return name;
    }

    public String getSector() {
        return sector;
    }

    public String getSize() {
        return size;
    }

    public List<Disclosure> getDocuments() {
        return Collections.unmodifiableList(documents);
    }

    public String getCombinedText() {
        return combinedText;
    }

    public void setCombinedText(String combinedText) {
        this.combinedText = combinedText == null ? "" : combinedText;
    }

    public String getSummary() {
        return summary;
    }

    public void setSummary(String summary) {
        this.summary = summary;
    }

    public List<String> titles() {
        return documents.stream().map(Disclosure::title).toList();
    }
}
