package com.tdnet.insight.config;

import com.google.cloud.storage.StorageOptions;
import com.tdnet.common.issuer.IssuerDirectory;
import com.tdnet.common.issuer.IssuerDirectoryLoader;
import com.tdnet.common.storage.GcsObjectStore;
import com.tdnet.common.storage.LocalObjectStore;
import com.tdnet.common.storage.ObjectStore;
import com.tdnet.common.storage.PathNamer;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class StorageConfig {

    private static final Logger LOGGER = LoggerFactory.getLogger(StorageConfig.class);

    @Bean
    ObjectStore objectStore(StorageProperties properties) {
        if (properties.getType() == StorageProperties.Type.GCS) {
            LOGGER.info("Reading disclosures from gs://{}/{}", properties.getBucket(), properties.getBasePath());
            return new GcsObjectStore(StorageOptions.getDefaultInstance().getService(), properties.getBucket());
        }
        LOGGER.info("Reading disclosures from local store {}", properties.getLocalRoot());
        return new LocalObjectStore(Path.of(properties.getLocalRoot()));
    }

    @Bean
    PathNamer pathNamer(StorageProperties properties) {
        return new PathNamer(properties.getBasePath());
    }

    @Bean
    IssuerDirectory issuerDirectory(IssuerProperties properties) {
        return new IssuerDirectoryLoader().load(Path.of(properties.getCsvPath()));
    }
}
