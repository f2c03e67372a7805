package com.tdnet.ingestion.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tdnet.common.disclosure.Disclosure;
import com.tdnet.common.metadata.DailyMetadata;
import com.tdnet.common.storage.ObjectStore;
import com.tdnet.common.storage.PathNamer;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class MetadataSidecarWriter {

    private static final Logger LOGGER = LoggerFactory.getLogger(MetadataSidecarWriter.class);

    private final ObjectStore objectStore;
    private final PathNamer pathNamer;
    private final ObjectMapper objectMapper;

    public MetadataSidecarWriter(ObjectStore objectStore, PathNamer pathNamer, ObjectMapper objectMapper) {
        this.objectStore = objectStore;
        this.pathNamer = pathNamer;
        this.objectMapper = objectMapper;
    }

    /**
     * Writes the sidecar for {@code date} listing the stored documents and returns its key.
     */
    public String write(String date, List<Disclosure> stored) {
        DailyMetadata metadata = DailyMetadata.of(date, stored);
        String key = pathNamer.metadataKey(date);
        try {
            String json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(metadata);
            objectStore.putText(key, json, "application/json");
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize metadata for " + date, e);
        }
        LOGGER.info("Wrote metadata for {} ({} documents) to {}", date, metadata.totalDocuments(), key);
        return key;
    }
}
