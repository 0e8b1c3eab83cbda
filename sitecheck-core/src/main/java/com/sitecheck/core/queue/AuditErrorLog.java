package com.sitecheck.core.queue;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sitecheck.common.util.ErrorMessages;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds the JSON stored in {@code audits.error_log}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AuditErrorLog {

    private final ObjectMapper objectMapper;

    public String build(String error, boolean timeout, String note) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("timestamp", Instant.now().toString());
        entry.put("error", ErrorMessages.truncate(error));
        entry.put("timeout", timeout);
        if (note != null) {
            entry.put("note", note);
        }
        try {
            return objectMapper.writeValueAsString(entry);
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize error log, storing plain message: {}", e.getMessage());
            return ErrorMessages.truncate(error);
        }
    }
}
