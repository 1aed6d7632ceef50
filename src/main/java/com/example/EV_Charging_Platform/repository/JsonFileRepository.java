package com.example.EV_Charging_Platform.repository;

import com.example.EV_Charging_Platform.config.PlatformProperties;
import com.example.EV_Charging_Platform.model.PaymentIntent;
import com.example.EV_Charging_Platform.model.ReconciliationRecord;
import com.example.EV_Charging_Platform.model.Session;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Durable store for sessions, payment intents and reconciliation records.
 *
 * Each collection lives in memory and is written out as one JSON file on every save. Files are
 * written to a temp file first and moved over the previous version, so a crash mid-write leaves
 * the last complete snapshot in place.
 */
@Repository
public class JsonFileRepository {

    private static final Logger log = LoggerFactory.getLogger(JsonFileRepository.class);

    private final ObjectMapper objectMapper;
    private final Path dataDir;
    private final Path sessionsFile;
    private final Path intentsFile;
    private final Path recordsFile;

    private final Map<String, Session> sessions = new ConcurrentHashMap<>();
    private final Map<String, PaymentIntent> intents = new ConcurrentHashMap<>();
    private final Map<String, ReconciliationRecord> records = new ConcurrentHashMap<>();

    @Autowired
    public JsonFileRepository(ObjectMapper objectMapper, PlatformProperties properties) {
        this(objectMapper, Paths.get(properties.getStorage().getDataDir()));
    }

    public JsonFileRepository(ObjectMapper objectMapper, Path dataDir) {
        this.objectMapper = objectMapper;
        this.dataDir = dataDir;
        this.sessionsFile = dataDir.resolve("sessions.json");
        this.intentsFile = dataDir.resolve("payment_intents.json");
        this.recordsFile = dataDir.resolve("reconciliation_records.json");
    }

    @PostConstruct
    public void init() {
        try {
            Files.createDirectories(dataDir);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create data directory " + dataDir, e);
        }
        load(sessionsFile, Session.class, Session::getSessionId, sessions);
        load(intentsFile, PaymentIntent.class, PaymentIntent::getId, intents);
        load(recordsFile, ReconciliationRecord.class, ReconciliationRecord::getId, records);
        log.info("Loaded {} sessions, {} payment intents, {} reconciliation records from {}",
                sessions.size(), intents.size(), records.size(), dataDir.toAbsolutePath());
    }

    // Sessions

    public void saveSession(Session session) {
        synchronized (sessions) {
            sessions.put(session.getSessionId(), session);
            write(sessionsFile, sessions);
        }
    }

    public Optional<Session> findSession(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    public List<Session> findAllSessions() {
        return sorted(sessions.values(), Comparator.comparing(Session::getCreatedAt));
    }

    /**
     * Newest first
     */
    public List<Session> findSessionsByUser(String userId) {
        return sessions.values().stream()
                .filter(session -> userId.equals(session.getUserId()))
                .sorted(Comparator.comparing(Session::getCreatedAt).reversed()
                        .thenComparing(Session::getSessionId))
                .collect(Collectors.toList());
    }

    // Payment intents

    public void saveIntent(PaymentIntent intent) {
        synchronized (intents) {
            intents.put(intent.getId(), intent);
            write(intentsFile, intents);
        }
    }

    public Optional<PaymentIntent> findIntent(String paymentIntentId) {
        return Optional.ofNullable(intents.get(paymentIntentId));
    }

    public Optional<PaymentIntent> findIntentBySession(String sessionId) {
        return intents.values().stream()
                .filter(intent -> sessionId.equals(intent.getSessionId()))
                .findFirst();
    }

    public List<PaymentIntent> findIntentsByState(PaymentIntent.State state) {
        return intents.values().stream()
                .filter(intent -> intent.getState() == state)
                .sorted(Comparator.comparing(PaymentIntent::getCreatedAt))
                .collect(Collectors.toList());
    }

    // Reconciliation records

    public void saveRecord(ReconciliationRecord record) {
        synchronized (records) {
            records.put(record.getId(), record);
            write(recordsFile, records);
        }
    }

    public List<ReconciliationRecord> findOpenRecords() {
        return records.values().stream()
                .filter(record -> !record.isResolved())
                .sorted(Comparator.comparing(ReconciliationRecord::getCreatedAt))
                .collect(Collectors.toList());
    }

    public List<ReconciliationRecord> findRecordsBySession(String sessionId) {
        return records.values().stream()
                .filter(record -> sessionId.equals(record.getSessionId()))
                .sorted(Comparator.comparing(ReconciliationRecord::getCreatedAt))
                .collect(Collectors.toList());
    }

    // Files

    private <T> void load(Path file, Class<T> type, Function<T, String> idOf, Map<String, T> target) {
        if (!Files.exists(file)) {
            return;
        }
        try {
            List<T> items = objectMapper.readValue(file.toFile(),
                    objectMapper.getTypeFactory().constructCollectionType(List.class, type));
            items.forEach(item -> target.put(idOf.apply(item), item));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load " + file, e);
        }
    }

    private void write(Path file, Map<String, ?> contents) {
        Path temp = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), new ArrayList<>(contents.values()));
            try {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            log.error("Failed to save to {}", file, e);
            throw new UncheckedIOException("Failed to save " + file, e);
        }
    }

    private static <T> List<T> sorted(Collection<T> values, Comparator<T> order) {
        List<T> list = new ArrayList<>(values);
        list.sort(order);
        return list;
    }
}
