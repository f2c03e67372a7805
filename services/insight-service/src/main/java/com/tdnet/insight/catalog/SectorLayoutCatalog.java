package com.tdnet.insight.catalog;

import com.tdnet.common.storage.ObjectStore;
import com.tdnet.common.storage.PathNamer;
import com.tdnet.common.storage.SectorKey;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Indexes PDFs stored with the sector layout as sector, then size class, then issuer code.
 */
public class SectorLayoutCatalog {

    private static final Logger LOGGER = LoggerFactory.getLogger(SectorLayoutCatalog.class);

    private final ObjectStore store;
    private final PathNamer namer;

    public SectorLayoutCatalog(ObjectStore store, PathNamer namer) {
        this.store = store;
        this.namer = namer;
    }

    public Map<String, Map<String, Map<String, List<String>>>> index() {
        Map<String, Map<String, Map<String, List<String>>>> index = new TreeMap<>();
        int files = 0;
        for (String key : store.list(namer.sectorsPrefix())) {
            Optional<SectorKey> parsed = namer.parseSectorKey(key);
            if (parsed.isEmpty()) {
                LOGGER.debug("Ignoring {} outside the sector layout", key);
                continue;
            }
            SectorKey sectorKey = parsed.get();
            index.computeIfAbsent(sectorKey.sector(), s -> new TreeMap<>())
                .computeIfAbsent(sectorKey.size(), s -> new TreeMap<>())
                .computeIfAbsent(sectorKey.code(), c -> new ArrayList<>())
                .add(key);
            files++;
        }
        LOGGER.info("Indexed {} sector-layout files across {} sectors", files, index.size());
        return index;
    }
}
