package com.tdnet.insight.catalog;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tdnet.common.disclosure.Disclosure;
import com.tdnet.common.metadata.DailyMetadata;
import com.tdnet.common.storage.ObjectStore;
import com.tdnet.common.storage.PathNamer;
import com.tdnet.common.storage.StorageException;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads the per-date metadata sidecars written by the ingestion service.
 */
public class MetadataDocumentCatalog implements DocumentCatalog {

    private static final Logger LOGGER = LoggerFactory.getLogger(MetadataDocumentCatalog.class);

    private final ObjectStore store;
    private final PathNamer namer;
    private final ObjectMapper objectMapper;

    public MetadataDocumentCatalog(ObjectStore store, PathNamer namer, ObjectMapper objectMapper) {
        this.store = store;
        this.namer = namer;
        this.objectMapper = objectMapper;
    }

    @Override
    public List<Disclosure> load(List<String> dates) {
        List<Disclosure> documents = new ArrayList<>();
        for (String date : dates) {
            String key = namer.metadataKey(date);
            try {
                if (!store.exists(key)) {
                    LOGGER.info("No metadata for {} at {}", date, key);
                    continue;
                }
                DailyMetadata metadata = objectMapper.readValue(store.readText(key), DailyMetadata.class);
                int before = documents.size();
                for (Disclosure disclosure : metadata.toDisclosures()) {
                    if (disclosure.storagePath() == null || disclosure.storagePath().isBlank()) {
                        LOGGER.debug("Skipping {} {}: no storage path", disclosure.code(), disclosure.title());
                        continue;
                    }
                    documents.add(disclosure);
                }
                LOGGER.info("Loaded {} documents for {}", documents.size() - before, date);
            } catch (JsonProcessingException | StorageException ex) {
                LOGGER.warn("Skipping {}: metadata at {} not readable: {}", date, key, ex.getMessage());
            }
        }
        return documents;
    }

    @Override
    public boolean isLocal() {
        return false;
    }
}
