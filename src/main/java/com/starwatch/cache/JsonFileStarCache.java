package com.starwatch.cache;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.starwatch.exception.StarCacheException;
import com.starwatch.model.StarredRepo;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;
import static java.nio.file.StandardCopyOption.REPLACE_EXISTING;

@Component
@Slf4j
public class JsonFileStarCache implements StarCache {

    private static final TypeReference<List<StarredRepo>> REPO_LIST = new TypeReference<>() {};

    private final Path cacheFile;
    private final ObjectMapper objectMapper;

    public JsonFileStarCache(
        @Value("${app.cache.file:stars.json}") Path cacheFile,
        ObjectMapper objectMapper
    ) {
        this.cacheFile = cacheFile;
        this.objectMapper = objectMapper;
    }

    @Override
    public Optional<List<StarredRepo>> read() {
        if (!Files.isRegularFile(cacheFile)) {
            log.debug("No cache snapshot at {}", cacheFile);
            return Optional.empty();
        }

        try {
            List<StarredRepo> repos = objectMapper.readValue(cacheFile.toFile(), REPO_LIST);
            if (repos == null) {
                return Optional.empty();
            }
            log.debug("Read {} repos from cache {}", repos.size(), cacheFile);
            return Optional.of(repos);
        } catch (IOException e) {
            log.warn("Ignoring unreadable cache snapshot {}: {}", cacheFile, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void write(List<StarredRepo> repos) {
        Path tmp = cacheFile.resolveSibling(cacheFile.getFileName() + ".tmp");
        try {
            Path parent = cacheFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), repos);
            moveIntoPlace(tmp);
            log.info("Cached {} repos to {}", repos.size(), cacheFile);
        } catch (IOException e) {
            throw new StarCacheException("Could not write cache snapshot " + cacheFile, e);
        }
    }

    private void moveIntoPlace(Path tmp) throws IOException {
        try {
            Files.move(tmp, cacheFile, REPLACE_EXISTING, ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, cacheFile, REPLACE_EXISTING);
        }
    }
}
