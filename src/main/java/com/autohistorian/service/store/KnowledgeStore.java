package com.autohistorian.service.store;

import com.autohistorian.config.AppProperties;
import com.autohistorian.model.Document;
import com.autohistorian.model.Event;
import com.autohistorian.model.ExtractionResult;
import com.autohistorian.model.Statement;
import com.autohistorian.model.StoreStats;
import com.autohistorian.model.TimelineItem;
import com.autohistorian.model.TopicIndex;
import com.autohistorian.model.TopicRef;
import com.autohistorian.model.TopicSummary;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * File-backed knowledge store.
 *
 * <p>Layout under {@code app.data-dir}:
 * - documents/{id}.json
 * - extractions/{documentId}.json
 * - topics/{slug}.json
 *
 * <p>Notes:
 * - Every file is rewritten whole: serialized to a temp file in the same directory, then moved over
 *   the target. A failed write leaves the previous file untouched.
 * - Saving an extraction result stages the result and all its topic indexes before moving any of
 *   them, so failing reads or serialization commit nothing. The moves themselves are separate
 *   renames; a rename failing part way leaves the earlier ones applied.
 * - Topic merges are read-merge-write under per-slug locks, so overlapping batches never lose
 *   each other's facts. Two names with the same slug share one index.
 * - Merging is idempotent: document ids are set-like and facts are unique by id.
 * - Blocking I/O; reactive callers should subscribe on {@code Schedulers.boundedElastic()}.
 */
@Service
public class KnowledgeStore {
    private static final Logger log = LoggerFactory.getLogger(KnowledgeStore.class);

    static final int MAX_SLUG_LENGTH = 100;
    private static final String JSON = ".json";

    private final ObjectMapper objectMapper;
    private final ObjectWriter writer;
    private final Path documentsDir;
    private final Path extractionsDir;
    private final Path topicsDir;
    private final ConcurrentHashMap<String, ReentrantLock> topicLocks = new ConcurrentHashMap<>();

    public KnowledgeStore(AppProperties appProperties, ObjectMapper objectMapper) {
        this(Paths.get(appProperties.getDataDir()), objectMapper);
    }

    public KnowledgeStore(Path dataDir, ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.writer = objectMapper.writerWithDefaultPrettyPrinter();
        this.documentsDir = dataDir.resolve("documents");
        this.extractionsDir = dataDir.resolve("extractions");
        this.topicsDir = dataDir.resolve("topics");
        try {
            Files.createDirectories(documentsDir);
            Files.createDirectories(extractionsDir);
            Files.createDirectories(topicsDir);
        } catch (IOException e) {
            throw new KnowledgeStoreException("Cannot create knowledge store under " + dataDir, e);
        }
        log.info("Knowledge store at {}", dataDir.toAbsolutePath());
    }

    // ---- writes ----

    public void saveDocument(Document document) {
        requireId(document.getId(), "document id");
        write(documentsDir.resolve(document.getId() + JSON), document);
    }

    public void saveExtractionResult(ExtractionResult result) {
        saveExtractionResult(result, null);
    }

    /**
     * Persist the result and merge it into every topic it references. With an override topic the
     * result is also merged into that topic when it does not already name it.
     *
     * <p>The result file and every merged topic index are staged as temp files before any of them is
     * moved into place, so a read or serialization failure commits none of the document's facts.
     */
    public void saveExtractionResult(ExtractionResult result, String topicOverride) {
        validate(result);
        Map<String, TopicTarget> targets = new TreeMap<>();
        for (TopicRef ref : result.getTopics()) {
            String name = ref.getName() != null ? ref.getName().trim() : "";
            if (!name.isEmpty()) targets.putIfAbsent(slugify(name), new TopicTarget(name, ref.getCategory()));
        }
        if (topicOverride != null && !topicOverride.isBlank()) {
            String name = topicOverride.trim();
            boolean referenced = targets.values().stream().anyMatch(t -> t.name.equals(name));
            if (!referenced) targets.putIfAbsent(slugify(name), new TopicTarget(name, "other"));
        }
        commit(result, targets);
    }

    private static final class TopicTarget {
        final String name;
        final String category;

        TopicTarget(String name, String category) {
            this.name = name;
            this.category = category != null && !category.isBlank() ? category : "other";
        }
    }

    /** Locks are taken in slug order (the map is sorted) so two commits never wait on each other in a cycle. */
    private void commit(ExtractionResult result, Map<String, TopicTarget> topics) {
        List<ReentrantLock> held = new ArrayList<>();
        Map<Path, Path> staged = new LinkedHashMap<>();
        try {
            for (String slug : topics.keySet()) {
                ReentrantLock lock = topicLocks.computeIfAbsent(slug, k -> new ReentrantLock());
                lock.lock();
                held.add(lock);
            }
            Path resultFile = extractionsDir.resolve(result.getDocumentId() + JSON);
            staged.put(resultFile, stage(resultFile, result));
            for (Map.Entry<String, TopicTarget> e : topics.entrySet()) {
                Path file = topicsDir.resolve(e.getKey() + JSON);
                TopicTarget target = e.getValue();
                TopicIndex index = readIfExists(file, TopicIndex.class)
                        .orElseGet(() -> new TopicIndex(target.name, target.category));
                merge(index, result);
                staged.put(file, stage(file, index));
            }
            for (Map.Entry<Path, Path> e : staged.entrySet()) {
                moveIntoPlace(e.getValue(), e.getKey());
            }
        } finally {
            staged.values().forEach(KnowledgeStore::deleteQuietly);
            for (int i = held.size() - 1; i >= 0; i--) held.get(i).unlock();
        }
    }

    private static void merge(TopicIndex index, ExtractionResult result) {
        if (!index.getDocumentIds().contains(result.getDocumentId())) {
            index.getDocumentIds().add(result.getDocumentId());
        }
        Set<String> eventIds = index.getEvents().stream().map(Event::getId).collect(Collectors.toSet());
        int addedEvents = 0;
        for (Event e : result.getEvents()) {
            if (e.getId() != null ? eventIds.add(e.getId()) : !index.getEvents().contains(e)) {
                index.getEvents().add(e);
                addedEvents++;
            }
        }
        Set<String> statementIds = index.getStatements().stream().map(Statement::getId).collect(Collectors.toSet());
        int addedStatements = 0;
        for (Statement s : result.getStatements()) {
            if (s.getId() != null ? statementIds.add(s.getId()) : !index.getStatements().contains(s)) {
                index.getStatements().add(s);
                addedStatements++;
            }
        }
        log.debug("Merged document {} into topic '{}' (+{} events, +{} statements)",
                result.getDocumentId(), index.getName(), addedEvents, addedStatements);
    }

    // ---- reads ----

    public Optional<Document> getDocument(String id) {
        return readIfExists(documentsDir.resolve(id + JSON), Document.class);
    }

    public Optional<ExtractionResult> getExtractionResult(String documentId) {
        return readIfExists(extractionsDir.resolve(documentId + JSON), ExtractionResult.class);
    }

    public Optional<TopicIndex> getTopicIndex(String topicName) {
        if (topicName == null || topicName.isBlank()) return Optional.empty();
        return readIfExists(topicsDir.resolve(slugify(topicName) + JSON), TopicIndex.class);
    }

    public List<Event> eventsForTopic(String topicName) {
        return getTopicIndex(topicName).map(TopicIndex::getEvents).orElseGet(ArrayList::new);
    }

    public List<Statement> statementsForTopic(String topicName) {
        return getTopicIndex(topicName).map(TopicIndex::getStatements).orElseGet(ArrayList::new);
    }

    public List<String> listTopicNames() {
        return allTopicIndices().stream().map(TopicIndex::getName).sorted().collect(Collectors.toList());
    }

    /** Topics ranked by coverage (documents + events + statements), highest first. */
    public List<TopicSummary> topicsSummary() {
        List<TopicSummary> out = new ArrayList<>();
        for (TopicIndex index : allTopicIndices()) {
            out.add(new TopicSummary(index.getName(), index.getCategory(), index.getDocumentIds().size(),
                    index.getEvents().size(), index.getStatements().size()));
        }
        out.sort(Comparator.comparingInt(TopicSummary::getCoverage).reversed()
                .thenComparing(TopicSummary::getName, Comparator.nullsFirst(Comparator.naturalOrder())));
        return out;
    }

    /**
     * Events and statements of a topic ordered by valid time (or observation time when
     * {@code useValidTime} is false). A missing valid time falls back to the observation time;
     * items with no time at all come first. Ties keep events before statements in merge order.
     */
    public List<TimelineItem> timeline(String topicName, boolean useValidTime) {
        TopicIndex index = getTopicIndex(topicName).orElseThrow(() -> new TopicNotFoundException(topicName));
        List<TimelineItem> items = new ArrayList<>();
        for (Event e : index.getEvents()) items.add(TimelineItem.of(e, useValidTime));
        for (Statement s : index.getStatements()) items.add(TimelineItem.of(s, useValidTime));
        items.sort(Comparator.comparing(TimelineItem::getTime, Comparator.nullsFirst(OffsetDateTime.timeLineOrder())));
        return items;
    }

    public StoreStats aggregateStats() {
        int events = 0;
        int statements = 0;
        List<TopicIndex> topics = allTopicIndices();
        for (TopicIndex index : topics) {
            events += index.getEvents().size();
            statements += index.getStatements().size();
        }
        return new StoreStats(countJson(documentsDir), countJson(extractionsDir), topics.size(), events, statements);
    }

    /**
     * Storage key for a topic name: trimmed, path-unsafe characters and whitespace replaced by
     * {@code _}, cut to {@value #MAX_SLUG_LENGTH} characters.
     */
    public static String slugify(String topicName) {
        String slug = topicName.trim().replaceAll("[/\\\\:*?\"<>|\\s]", "_");
        return slug.length() > MAX_SLUG_LENGTH ? slug.substring(0, MAX_SLUG_LENGTH) : slug;
    }

    // ---- internals ----

    private List<TopicIndex> allTopicIndices() {
        List<TopicIndex> out = new ArrayList<>();
        for (Path file : listJson(topicsDir)) {
            out.add(read(file, TopicIndex.class));
        }
        return out;
    }

    private static void validate(ExtractionResult result) {
        requireId(result.getDocumentId(), "extraction result document id");
        for (Event e : result.getEvents()) {
            if (e.getSourceDocumentId() == null || e.getSourceDocumentId().isBlank()) {
                throw new KnowledgeStoreException("Event " + e.getId() + " of document " + result.getDocumentId() + " has no source document");
            }
        }
        for (Statement s : result.getStatements()) {
            if (s.getSourceDocumentId() == null || s.getSourceDocumentId().isBlank()) {
                throw new KnowledgeStoreException("Statement " + s.getId() + " of document " + result.getDocumentId() + " has no source document");
            }
        }
    }

    private static void requireId(String id, String what) {
        if (id == null || id.isBlank()) throw new IllegalArgumentException(what + " is required");
        if (id.contains("/") || id.contains("\\") || id.contains("..")) {
            throw new IllegalArgumentException(what + " is not a valid file name: " + id);
        }
    }

    private void write(Path target, Object value) {
        Path tmp = stage(target, value);
        try {
            moveIntoPlace(tmp, target);
        } finally {
            deleteQuietly(tmp);
        }
    }

    /** Serializes {@code value} to a temp file next to {@code target}. */
    private Path stage(Path target, Object value) {
        Path tmp = null;
        try {
            tmp = Files.createTempFile(target.getParent(), target.getFileName().toString(), ".tmp");
            writer.writeValue(tmp.toFile(), value);
            return tmp;
        } catch (IOException e) {
            deleteQuietly(tmp);
            throw new KnowledgeStoreException("Failed to write " + target, e);
        }
    }

    private static void moveIntoPlace(Path tmp, Path target) {
        try {
            try {
                Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
            log.debug("Wrote {}", target);
        } catch (IOException e) {
            throw new KnowledgeStoreException("Failed to replace " + target, e);
        }
    }

    private static void deleteQuietly(Path tmp) {
        if (tmp == null) return;
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            log.warn("Could not remove temp file {}: {}", tmp, e.toString());
        }
    }

    private <T> T read(Path file, Class<T> type) {
        try {
            return objectMapper.readValue(file.toFile(), type);
        } catch (IOException e) {
            throw new KnowledgeStoreException("Failed to read " + file, e);
        }
    }

    private <T> Optional<T> readIfExists(Path file, Class<T> type) {
        if (!Files.exists(file)) return Optional.empty();
        return Optional.of(read(file, type));
    }

    private static List<Path> listJson(Path dir) {
        try (Stream<Path> files = Files.list(dir)) {
            return files.filter(p -> p.getFileName().toString().endsWith(JSON)).sorted().collect(Collectors.toList());
        } catch (IOException e) {
            throw new KnowledgeStoreException("Failed to list " + dir, e);
        }
    }

    private static int countJson(Path dir) {
        return listJson(dir).size();
    }
}
