package com.evidex.core.repository;

import com.evidex.core.dao.AuditLogDao;
import com.evidex.core.dao.AuditLogRecord;
import com.evidex.core.db.DatabaseService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.util.List;
import java.util.Map;

/**
 * Append-only audit trail. Details are stored as a JSON object.
 */
@ApplicationScoped
public class AuditRepository {

    private static final Logger log = Logger.getLogger(AuditRepository.class);
    private static final TypeReference<Map<String, Object>> DETAILS_TYPE = new TypeReference<>() {
    };

    @Inject
    DatabaseService database;

    @Inject
    ObjectMapper objectMapper;

    @ConfigProperty(name = "evidex.audit.actor", defaultValue = "System")
    String defaultActor;

    /** Logs {@code action} as the configured actor. */
    public void log(String action, Long caseId, Map<String, Object> details) {
        log(action, caseId, defaultActor, details);
    }

    public void log(String action, Long caseId, String userName, Map<String, Object> details) {
        String json = details == null || details.isEmpty() ? null : serialize(details);
        String actor = userName == null ? defaultActor : userName;
        database.jdbi().useTransaction(handle ->
                handle.attach(AuditLogDao.class).insert(caseId, actor, action, json));
        log.debugf("Audit: %s case=%s by %s", action, caseId, actor);
    }

    public List<AuditEntry> getCaseLogs(long caseId, int limit) {
        return toEntries(database.jdbi().withExtension(AuditLogDao.class, dao -> dao.findByCase(caseId, limit)));
    }

    public List<AuditEntry> getLogsByAction(String action, int limit) {
        return toEntries(database.jdbi().withExtension(AuditLogDao.class, dao -> dao.findByAction(action, limit)));
    }

    public List<AuditEntry> getAllLogs(int limit) {
        return toEntries(database.jdbi().withExtension(AuditLogDao.class, dao -> dao.findAll(limit)));
    }

    private List<AuditEntry> toEntries(List<AuditLogRecord> records) {
        return records.stream()
                .map(r -> new AuditEntry(r.logId(), r.caseId(), r.userName(), r.action(),
                        deserialize(r.logId(), r.details()), r.loggedAt()))
                .toList();
    }

    private String serialize(Map<String, Object> details) {
        try {
            return objectMapper.writeValueAsString(details);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to serialize audit details", e);
        }
    }

    private Map<String, Object> deserialize(long logId, String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, DETAILS_TYPE);
        } catch (JsonProcessingException e) {
            log.warnf("Audit entry %d has unreadable details: %s", logId, e.getOriginalMessage());
            return Map.of("raw", json);
        }
    }
}
