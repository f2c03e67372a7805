package com.tdnet.common.storage;

public record SectorKey(
    String sector,
    String size,
    String code,
    String key
) {
    public String fileName() {
        return key.substring(key.lastIndexOf('/') + 1);
    }
}
