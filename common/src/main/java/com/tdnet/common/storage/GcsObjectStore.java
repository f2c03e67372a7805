package com.tdnet.common.storage;

import com.google.cloud.storage.Blob;
import com.google.cloud.storage.BlobId;
import com.google.cloud.storage.BlobInfo;
import com.google.cloud.storage.Storage;
import com.google.cloud.storage.StorageException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Google Cloud Storage backed store; keys map one-to-one to blob names in a single bucket.
 */
public class GcsObjectStore implements ObjectStore {

    private static final String PDF = "application/pdf";

    private final Storage storage;
    private final String bucket;

    public GcsObjectStore(Storage storage, String bucket) {
        this.storage = storage;
        this.bucket = bucket;
    }

    @Override
    public String put(String key, Path source) {
        BlobInfo info = BlobInfo.newBuilder(BlobId.of(bucket, key))
            .setContentType(key.endsWith(".pdf") ? PDF : null)
            .build();
        try {
            storage.createFrom(info, source);
            return uri(key);
        } catch (IOException | StorageException e) {
            throw new com.tdnet.common.storage.StorageException("Failed to upload " + uri(key), e);
        }
    }

    @Override
    public String putText(String key, String text, String contentType) {
        BlobInfo info = BlobInfo.newBuilder(BlobId.of(bucket, key)).setContentType(contentType).build();
        try {
            storage.create(info, text.getBytes(StandardCharsets.UTF_8));
            return uri(key);
        } catch (StorageException e) {
            throw new com.tdnet.common.storage.StorageException("Failed to upload " + uri(key), e);
        }
    }

    @Override
    public void download(String key, Path target) {
        try {
            storage.downloadTo(BlobId.of(bucket, key), target);
        } catch (StorageException e) {
            throw new com.tdnet.common.storage.StorageException("Failed to download " + uri(key), e);
        }
    }

    @Override
    public String readText(String key) {
        try {
            return new String(storage.readAllBytes(BlobId.of(bucket, key)), StandardCharsets.UTF_8);
        } catch (StorageException e) {
            throw new com.tdnet.common.storage.StorageException("Failed to read " + uri(key), e);
        }
    }

    @Override
    public List<String> list(String prefix) {
        List<String> keys = new ArrayList<>();
        try {
            for (Blob blob : storage.list(bucket, Storage.BlobListOption.prefix(prefix)).iterateAll()) {
                if (!blob.getName().endsWith("/")) {
                    keys.add(blob.getName());
                }
            }
        } catch (StorageException e) {
            throw new com.tdnet.common.storage.StorageException("Failed to list " + uri(prefix), e);
        }
        keys.sort(null);
        return keys;
    }

    @Override
    public boolean exists(String key) {
        try {
            Blob blob = storage.get(BlobId.of(bucket, key));
            return blob != null && blob.exists();
        } catch (StorageException e) {
            throw new com.tdnet.common.storage.StorageException("Failed to stat " + uri(key), e);
        }
    }

    private String uri(String key) {
        return "gs://" + bucket + "/" + key;
    }
}
