package net.kairos.adapter.jdbc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

public final class JdbcUtil {
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final TypeReference<LinkedHashMap<String, String>> HEADERS = new TypeReference<>() {};

    private JdbcUtil() {}

    public static Timestamp ts(Instant i) { return i == null ? null : Timestamp.from(i); }

    public static Instant toInstant(Timestamp ts) { return ts == null ? null : ts.toInstant(); }

    public static String yn(boolean b) { return b ? "Y" : "N"; }

    public static boolean isY(String s) { return "Y".equals(s); }

    /** Header maps are kept as a JSON object column; empty maps are stored as NULL. */
    public static String headersToJson(Map<String, String> headers) throws SQLException {
        if (headers == null || headers.isEmpty()) return null;
        try {
            return JSON.writeValueAsString(headers);
        } catch (JsonProcessingException e) {
            throw new SQLException("cannot serialize headers", e);
        }
    }

    public static Map<String, String> headersFromJson(String json) throws SQLException {
        if (json == null || json.isBlank()) return Map.of();
        try {
            return JSON.readValue(json, HEADERS);
        } catch (JsonProcessingException e) {
            throw new SQLException("corrupt header column: " + json, e);
        }
    }
}
