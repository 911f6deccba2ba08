package com.sceneanchor.infrastructure.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sceneanchor.domain.anchor.model.Fingerprint;
import com.sceneanchor.domain.anchor.model.FingerprintCollection;
import com.sceneanchor.domain.anchor.repository.FingerprintStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Keeps the fingerprint collection in a JSON file at a fixed relative path.
 * <p>
 * A missing or unreadable file means "no prior snapshot" and is never an error. Saving
 * writes a temp file next to the target and moves it over, so a crash mid-write leaves the
 * previous snapshot intact.
 * </p>
 * Entries with a missing offset or length are loaded with -1 so that the resolver rejects
 * them individually instead of the whole file failing.
 */
@Slf4j
@Component
public class JsonFingerprintStore implements FingerprintStore {

    public static final String DEFAULT_PATH = ".sceneanchor/fingerprints.json";

    private static final int MISSING = -1;

    private final ObjectMapper objectMapper;

    @Value("${anchor.store.path:" + DEFAULT_PATH + "}")
    private String path = DEFAULT_PATH;

    @Value("${anchor.store.persist-text:false}")
    private boolean persistText;

    @Autowired
    public JsonFingerprintStore(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public JsonFingerprintStore(ObjectMapper objectMapper, Path path, boolean persistText) {
        this.objectMapper = objectMapper;
        this.path = path.toString();
        this.persistText = persistText;
    }

    @Override
    public Optional<FingerprintCollection> load() {
        Path file = Path.of(path);
        if (!Files.exists(file)) {
            log.info("[FingerprintStore] no fingerprint file at {}, treating as first run", file);
            return Optional.empty();
        }

        try {
            FingerprintFile document = objectMapper.readValue(file.toFile(), FingerprintFile.class);
            if (document == null) {
                log.warn("[FingerprintStore] empty fingerprint file {}, treating as first run", file);
                return Optional.empty();
            }
            return Optional.of(toCollection(document));
        } catch (IOException | RuntimeException e) {
            log.warn("[FingerprintStore] unreadable fingerprint file {}, treating as first run: {}",
                    file, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void save(FingerprintCollection collection) {
        Path file = Path.of(path).toAbsolutePath();
        Path temp = null;
        try {
            Files.createDirectories(file.getParent());
            temp = Files.createTempFile(file.getParent(), file.getFileName().toString(), ".tmp");
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), toFile(collection));
            try {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
            log.debug("[FingerprintStore] wrote {} fingerprints to {}", collection.size(), file);
        } catch (IOException e) {
            throw new FingerprintStoreException("Failed to write fingerprint file " + file, e);
        } finally {
            deleteQuietly(temp);
        }
    }

    private FingerprintCollection toCollection(FingerprintFile document) {
        Map<String, Fingerprint> spans = new LinkedHashMap<>();
        if (document.spans() != null) {
            document.spans().forEach((key, entry) -> {
                if (entry == null) {
                    log.warn("[FingerprintStore] skipping empty entry {}", key);
                    return;
                }
                spans.put(key, toFingerprint(key, entry));
            });
        }
        Instant generatedAt = document.generatedAt() != null ? Instant.parse(document.generatedAt()) : null;
        return new FingerprintCollection(document.documentChecksum(), generatedAt, spans);
    }

    private Fingerprint toFingerprint(String key, FingerprintFile.Entry entry) {
        return new Fingerprint(
                key,
                entry.sha(),
                entry.offset() != null ? entry.offset() : MISSING,
                entry.len() != null ? entry.len() : MISSING,
                entry.pre(),
                entry.post(),
                entry.rareShingles() != null
                        ? entry.rareShingles().stream().filter(Objects::nonNull).toList()
                        : null,
                entry.text()
        );
    }

    private FingerprintFile toFile(FingerprintCollection collection) {
        Map<String, FingerprintFile.Entry> entries = new LinkedHashMap<>();
        for (Fingerprint fp : collection.spans().values()) {
            entries.put(fp.id(), new FingerprintFile.Entry(
                    fp.id(),
                    fp.contentHash(),
                    fp.offset(),
                    fp.length(),
                    fp.precedingContext(),
                    fp.followingContext(),
                    fp.rareShingles(),
                    persistText ? fp.text() : null
            ));
        }
        return new FingerprintFile(
                collection.documentChecksum(),
                collection.generatedAt() != null ? collection.generatedAt().toString() : null,
                entries
        );
    }

    private void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.debug("[FingerprintStore] could not remove temp file {}", temp, e);
        }
    }
}
