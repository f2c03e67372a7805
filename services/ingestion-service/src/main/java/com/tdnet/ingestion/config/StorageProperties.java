package com.tdnet.ingestion.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "storage")
public class StorageProperties {

    public enum Type {
        LOCAL,
        GCS
    }

    @NotNull
    private Type type = Type.LOCAL;
    private String localRoot = "data/storage";
    private String bucket;
    private String basePath = "tdnet";

    @AssertTrue(message = "storage.bucket is required when storage.type is gcs")
    public boolean isBucketConfigured() {
        return type != Type.GCS || (bucket != null && !bucket.isBlank());
    }

    public Type getType() {
        return type;
    }

    public void setType(Type type) {
        this.type = type;
    }

    public String getLocalRoot() {
        return localRoot;
    }

    public void setLocalRoot(String localRoot) {
        this.localRoot = localRoot;
    }

    public String getBucket() {
        return bucket;
    }

    public void setBucket(String bucket) {
        this.bucket = bucket;
    }

    public String getBasePath() {
        return basePath;
    }

    public void setBasePath(String basePath) {
        this.basePath = basePath;
    }
}
