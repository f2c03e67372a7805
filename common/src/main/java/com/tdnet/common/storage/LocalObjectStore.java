package com.tdnet.common.storage;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.stream.Stream;

public class LocalObjectStore implements ObjectStore {

    private final Path basePath;

    public LocalObjectStore(Path basePath) {
        this.basePath = basePath.toAbsolutePath().normalize();
    }

    @Override
    public String put(String key, Path source) {
        Path target = resolve(key);
        try {
            Files.createDirectories(target.getParent());
            Files.copy(source, target, StandardCopyOption.REPLACE_EXISTING);
            return target.toString();
        } catch (IOException e) {
            throw new StorageException("Failed to store " + key, e);
        }
    }

    @Override
    public String putText(String key, String text, String contentType) {
        Path target = resolve(key);
        try {
            Files.createDirectories(target.getParent());
            Files.writeString(target, text, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
            return target.toString();
        } catch (IOException e) {
            throw new StorageException("Failed to store " + key, e);
        }
    }

    @Override
    public void download(String key, Path target) {
        Path source = resolve(key);
        try {
            Files.copy(source, target, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new StorageException("Failed to read " + key, e);
        }
    }

    @Override
    public String readText(String key) {
        try {
            return Files.readString(resolve(key), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new StorageException("Failed to read " + key, e);
        }
    }

    @Override
    public List<String> list(String prefix) {
        if (!Files.isDirectory(basePath)) {
            return List.of();
        }
        String safePrefix = prefix == null ? "" : prefix;
        try (Stream<Path> files = Files.walk(basePath)) {
            return files
                .filter(Files::isRegularFile)
                .map(this::toKey)
                .filter(key -> key.startsWith(safePrefix))
                .sorted()
                .toList();
        } catch (IOException e) {
            throw new StorageException("Failed to list " + safePrefix, e);
        }
    }

    @Override
    public boolean exists(String key) {
        return Files.isRegularFile(resolve(key));
    }

    private Path resolve(String key) {
        Path target = basePath.resolve(key).normalize();
        if (!target.startsWith(basePath)) {
            throw new StorageException("Key escapes storage root: " + key);
        }
        return target;
    }

    private String toKey(Path file) {
        return basePath.relativize(file).toString().replace(file.getFileSystem().getSeparator(), "/");
    }
}
