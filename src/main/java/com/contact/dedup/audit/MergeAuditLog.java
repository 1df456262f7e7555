package com.contact.dedup.audit;

import com.contact.dedup.merge.MergeResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders a {@link MergeResult} as an audit document for the caller to persist.
 * Values longer than {@value #MAX_VALUE_LENGTH} characters are truncated.
 */
public class MergeAuditLog {

    static final int MAX_VALUE_LENGTH = 100;

    private final ObjectMapper objectMapper;

    public MergeAuditLog() {
        this(new ObjectMapper());
    }

    public MergeAuditLog(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Map<String, Object> toMap(MergeResult result) {
        Map<String, Object> log = new LinkedHashMap<>();
        log.put("merged_at", result.mergedAt().toString());
        log.put("merge_strategy", result.strategy().name());
        log.put("contact_id", result.mergedRecord().getId());
        log.put("contact_email", result.mergedRecord().getEmail());
        log.put("has_changes", result.hasChanges());
        log.put("change_summary", result.summary());

        List<Map<String, Object>> changes = new ArrayList<>();
        for (AuditEntry entry : result.auditTrail()) {
            Map<String, Object> change = new LinkedHashMap<>();
            change.put("field", entry.fieldName());
            change.put("old_value", truncate(entry.before()));
            change.put("new_value", truncate(entry.after()));
            change.put("change_type", entry.changeType().name());
            change.put("rule", entry.rule().name());
            change.put("reason", entry.reason());
            changes.add(change);
        }
        log.put("changes", changes);
        return log;
    }

    public String toJson(MergeResult result) {
        try {
            return objectMapper.writeValueAsString(toMap(result));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize merge audit log", e);
        }
    }

    private static String truncate(Object value) {
        if (value == null) {
            return null;
        }
        String text = String.valueOf(value);
        return text.length() > MAX_VALUE_LENGTH ? text.substring(0, MAX_VALUE_LENGTH) : text;
    }
}
