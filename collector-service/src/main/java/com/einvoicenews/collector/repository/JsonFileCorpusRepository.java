package com.einvoicenews.collector.repository;

import com.einvoicenews.collector.config.CollectorProperties;
import com.einvoicenews.collector.entity.Corpus;
import com.einvoicenews.collector.exception.CorpusStoreException;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Corpus kept as a single pretty-printed JSON document. Writes go to a sibling temp file
 * that is then moved over the target.
 */
@Slf4j
@Repository
public class JsonFileCorpusRepository implements CorpusRepository {

    private final Path path;
    private final ObjectMapper objectMapper;
    private final ObjectWriter writer;

    @Autowired
    public JsonFileCorpusRepository(CollectorProperties properties, ObjectMapper objectMapper) {
        this(Path.of(properties.getStore().getPath()), objectMapper);
    }

    public JsonFileCorpusRepository(Path path, ObjectMapper objectMapper) {
        this.path = path.toAbsolutePath();
        this.objectMapper = objectMapper.copy()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        DefaultPrettyPrinter printer = new DefaultPrettyPrinter()
                .withArrayIndenter(DefaultIndenter.SYSTEM_LINEFEED_INSTANCE);
        this.writer = this.objectMapper.writer(printer);
    }

    @Override
    public Corpus read() {
        if (!Files.exists(path)) {
            log.info("No corpus at {}, starting empty", path);
            return Corpus.empty();
        }
        try {
            if (Files.size(path) == 0) {
                log.warn("Corpus file {} is empty, starting empty", path);
                return Corpus.empty();
            }
            Corpus corpus = objectMapper.readValue(path.toFile(), Corpus.class);
            log.info("Loaded {} items from {}", corpus.items().size(), path);
            return corpus;
        } catch (IOException e) {
            throw CorpusStoreException.readFailed(path.toString(), e);
        }
    }

    @Override
    public void write(Corpus corpus) {
        Path tempFile = null;
        try {
            Path directory = path.getParent();
            Files.createDirectories(directory);
            tempFile = Files.createTempFile(directory, path.getFileName().toString(), ".tmp");
            writer.writeValue(tempFile.toFile(), corpus);
            moveIntoPlace(tempFile);
            tempFile = null;
            log.info("Saved {} items to {}", corpus.items().size(), path);
        } catch (IOException e) {
            throw CorpusStoreException.writeFailed(path.toString(), e);
        } finally {
            deleteQuietly(tempFile);
        }
    }

    private void moveIntoPlace(Path tempFile) throws IOException {
        try {
            Files.move(tempFile, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move not supported for {}, replacing in place", path);
            Files.move(tempFile, path, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void deleteQuietly(Path tempFile) {
        if (tempFile == null) {
            return;
        }
        try {
            Files.deleteIfExists(tempFile);
        } catch (IOException e) {
            log.warn("Could not remove temp file {}: {}", tempFile, e.getMessage());
        }
    }

    public Path getPath() {
        return path;
    }
}
