package me.golemcore.narrator.adapter.outbound.storage;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.narrator.infrastructure.config.NarratorProperties;
import me.golemcore.narrator.port.outbound.StoragePort;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.concurrent.CompletableFuture;
import java.util.regex.Pattern;

/**
 * Local filesystem implementation of {@link StoragePort}.
 *
 * <p>
 * Each key is stored as a JSON document {@code <key>.json} inside
 * {@code narrator.storage.directory} under the base path configured via
 * {@code narrator.storage.local.base-path}. Writes are crash-safe:
 * <ol>
 * <li>Write to a temporary file (.tmp suffix) and fsync it</li>
 * <li>Atomically rename the temporary file over the target</li>
 * </ol>
 * A crash therefore leaves either the previous or the new document, never a
 * torn one.
 *
 * @see me.golemcore.narrator.port.outbound.StoragePort
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LocalStorageAdapter implements StoragePort {

    private static final Pattern KEY_PATTERN = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._-]*");
    private static final String EXTENSION = ".json";

    private final NarratorProperties properties;
    private final ObjectMapper objectMapper;

    private Path basePath;
    private Path stateDir;

    @PostConstruct
    public void init() {
        String basePathStr = properties.getStorage().getLocal().getBasePath();
        this.basePath = Paths.get(basePathStr.replace("${user.home}", System.getProperty("user.home")))
                .toAbsolutePath().normalize();
        this.stateDir = basePath.resolve(properties.getStorage().getDirectory()).normalize();

        try {
            Files.createDirectories(stateDir);
            log.info("Local storage initialized at: {}", stateDir);
        } catch (IOException e) {
            log.error("Failed to create storage directory", e);
        }
    }

    @Override
    public <T> CompletableFuture<T> get(String key, Class<T> type) {
        return CompletableFuture.supplyAsync(() -> {
            Path filePath = resolvePath(key);
            if (!Files.exists(filePath)) {
                return null;
            }
            try {
                return objectMapper.readValue(Files.readString(filePath, StandardCharsets.UTF_8), type);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read key: " + key, e);
            }
        });
    }

    @Override
    public CompletableFuture<Void> set(String key, Object value) {
        return CompletableFuture.runAsync(() -> {
            Path targetPath = resolvePath(key);
            String json;
            try {
                json = objectMapper.writeValueAsString(value);
            } catch (JsonProcessingException e) {
                throw new IllegalArgumentException("Value for key " + key + " is not serializable", e);
            }
            writeAtomic(targetPath, json.getBytes(StandardCharsets.UTF_8));
        });
    }

    @Override
    public CompletableFuture<Void> delete(String key) {
        return CompletableFuture.runAsync(() -> {
            try {
                Files.deleteIfExists(resolvePath(key));
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to delete key: " + key, e);
            }
        });
    }

    private void writeAtomic(Path targetPath, byte[] bytes) {
        Path tempPath = targetPath.resolveSibling(targetPath.getFileName() + ".tmp");
        try {
            Files.createDirectories(stateDir);

            try (OutputStream os = Files.newOutputStream(tempPath,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.TRUNCATE_EXISTING,
                    StandardOpenOption.SYNC);
                    FileChannel channel = FileChannel.open(tempPath, StandardOpenOption.WRITE)) {
                os.write(bytes);
                os.flush();
                channel.force(true);
            }

            try {
                Files.move(tempPath, targetPath,
                        StandardCopyOption.REPLACE_EXISTING,
                        StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                log.warn("[Storage] Atomic move not supported, using regular move");
                Files.move(tempPath, targetPath, StandardCopyOption.REPLACE_EXISTING);
            }

            log.debug("[Storage] Atomic write completed: {}", targetPath.getFileName());
        } catch (IOException e) {
            try {
                Files.deleteIfExists(tempPath);
            } catch (IOException cleanupEx) {
                log.warn("[Storage] Failed to cleanup temp file: {}", tempPath);
            }
            throw new UncheckedIOException("Atomic write failed: " + targetPath.getFileName(), e);
        }
    }

    private Path resolvePath(String key) {
        if (key == null || !KEY_PATTERN.matcher(key).matches()) {
            throw new IllegalArgumentException("Invalid storage key: " + key);
        }
        Path resolved = stateDir.resolve(key + EXTENSION).normalize();
        if (!resolved.startsWith(stateDir)) {
            throw new IllegalArgumentException("Path traversal blocked: " + key);
        }
        return resolved;
    }
}
