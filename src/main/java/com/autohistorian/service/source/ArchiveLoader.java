package com.autohistorian.service.source;

import com.autohistorian.config.AppProperties;
import com.autohistorian.model.Document;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.List;

/**
 * Archive months saved on disk as {@code {archive-dir}/{yyyy}-{MM}.json}. Either the raw
 * Archive API response ({@code response.docs}) or {@code {"articles": [...]}} is accepted on load;
 * {@link ArchiveCrawler} saves the raw response.
 */
@Component
public class ArchiveLoader {
    private static final Logger log = LoggerFactory.getLogger(ArchiveLoader.class);

    private final Path archiveDir;
    private final ObjectMapper objectMapper;
    private final NytDocumentMapper mapper;

    public ArchiveLoader(AppProperties appProperties, ObjectMapper objectMapper, NytDocumentMapper mapper) {
        this(Paths.get(appProperties.getArchiveDir() != null && !appProperties.getArchiveDir().isBlank()
                ? appProperties.getArchiveDir()
                : Paths.get(appProperties.getDataDir(), "archive").toString()), objectMapper, mapper);
    }

    public ArchiveLoader(Path archiveDir, ObjectMapper objectMapper, NytDocumentMapper mapper) {
        this.archiveDir = archiveDir;
        this.objectMapper = objectMapper;
        this.mapper = mapper;
    }

    public Path archiveFile(int year, int month) {
        return archiveDir.resolve(String.format("%04d-%02d.json", year, month));
    }

    public boolean hasMonth(int year, int month) {
        return Files.isRegularFile(archiveFile(year, month));
    }

    /** Writes one month's raw Archive API response, replacing any earlier copy whole. */
    public Path save(int year, int month, JsonNode archive) {
        Path file = archiveFile(year, month);
        Path tmp = null;
        try {
            Files.createDirectories(archiveDir);
            tmp = Files.createTempFile(archiveDir, file.getFileName().toString(), ".tmp");
            objectMapper.writeValue(tmp.toFile(), archive);
            try {
                Files.move(tmp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
            return file;
        } catch (IOException e) {
            throw new DocumentSourceException("Cannot write archive file " + file, e);
        } finally {
            if (tmp != null) {
                try {
                    Files.deleteIfExists(tmp);
                } catch (IOException e) {
                    log.warn("Could not remove temp file {}: {}", tmp, e.toString());
                }
            }
        }
    }

    public List<Document> load(int year, int month) {
        Path file = archiveFile(year, month);
        JsonNode root;
        try {
            root = objectMapper.readTree(file.toFile());
        } catch (IOException e) {
            throw new DocumentSourceException("Cannot read archive file " + file, e);
        }
        JsonNode docs = root.path("response").path("docs");
        if (!docs.isArray()) docs = root.path("articles");
        if (!docs.isArray()) {
            throw new DocumentSourceException("Archive file " + file + " has neither response.docs nor articles");
        }
        List<Document> out = mapper.mapAll(docs);
        log.info("Loaded {} documents from {}", out.size(), file);
        return out;
    }
}
