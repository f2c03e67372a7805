package com.tdnet.insight.grouping;

import com.tdnet.common.disclosure.Disclosure;
import com.tdnet.common.issuer.IssuerDirectory;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class DocumentGrouper {

    private static final Logger LOGGER = LoggerFactory.getLogger(DocumentGrouper.class);

    private final IssuerDirectory issuers;

    public DocumentGrouper(IssuerDirectory issuers) {
        this.issuers = issuers;
    }

    /**
     * Groups by normalized issuer code in first-seen order. Documents rejected by the filter are dropped,
     * as are documents of new issuers once {@link GroupingFilter#maxGroups()} groups exist.
     */
    public List<DocumentGroup> group(List<Disclosure> documents, GroupingFilter filter) {
        Map<String, DocumentGroup> groups = new LinkedHashMap<>();
        int skipped = 0;
        for (Disclosure disclosure : documents) {
            if (!filter.accepts(disclosure)) {
                skipped++;
                continue;
            }
            String code = disclosure.normalizedCode();
            DocumentGroup group = groups.get(code);
            if (group == null) {
                if (!filter.hasRoomFor(groups.size())) {
                    skipped++;
                    continue;
                }
                group = new DocumentGroup(code, issuers.resolve(code));
                groups.put(code, group);
            }
            group.add(disclosure);
        }
        LOGGER.info("Grouped {} documents into {} issuers ({} skipped)", documents.size() - skipped, groups.size(), skipped);
        return new ArrayList<>(groups.values());
    }
}
