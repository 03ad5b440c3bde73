package org.javai.crashreport.payload;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.javai.crashreport.ExceptionRecord;
import org.javai.crashreport.ExceptionReport;
import org.javai.crashreport.HandledState;
import org.javai.crashreport.SeverityReason;
import org.javai.crashreport.StackFrame;
import org.javai.crashreport.session.Session;
import org.javai.crashreport.session.SessionCounts;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Projects typed reports and sessions into the key/value shape of the report payload.
 *
 * <p>Field names here are the payload's; nothing else in the library depends on them.
 */
public class PayloadSerializer {

    private final ObjectMapper objectMapper;

    public PayloadSerializer() {
        this(new ObjectMapper());
    }

    public PayloadSerializer(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    public Map<String, Object> toMap(ExceptionReport report) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("exceptions", report.exceptions().stream().map(this::toMap).toList());
        putHandledState(payload, report.handledState());
        if (!report.metadata().isEmpty()) {
            payload.put("metaData", new LinkedHashMap<>(report.metadata()));
        }
        return payload;
    }

    public Map<String, Object> toMap(ExceptionRecord record) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("errorClass", record.errorClass());
        payload.put("message", record.message());
        payload.put("stacktrace", toFrames(record.stackTrace()));
        return payload;
    }

    public Map<String, Object> toMap(Session session) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("id", session.id().toString());
        payload.put("startedAt", session.startedAt().toString());
        payload.put("events", toMap(session.events().snapshot()));
        return payload;
    }

    public Map<String, Object> toMap(SessionCounts counts) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("handled", counts.handled());
        payload.put("unhandled", counts.unhandled());
        return payload;
    }

    public String toJson(ExceptionReport report) throws JsonProcessingException {
        return objectMapper.writeValueAsString(toMap(report));
    }

    public String toJson(Session session) throws JsonProcessingException {
        return objectMapper.writeValueAsString(toMap(session));
    }

    private static void putHandledState(Map<String, Object> payload, HandledState state) {
        payload.put("unhandled", state.unhandled());
        payload.put("severity", state.severity().wireValue());

        SeverityReason reason = state.severityReason();
        Map<String, Object> reasonPayload = new LinkedHashMap<>();
        reasonPayload.put("type", reason.type().wireValue());
        if (reason.level() != null) {
            reasonPayload.put("attributes", Map.of("level", reason.level().wireValue()));
        }
        payload.put("severityReason", reasonPayload);
    }

    private static List<Map<String, Object>> toFrames(List<StackFrame> frames) {
        return frames.stream().map(PayloadSerializer::toFrame).toList();
    }

    private static Map<String, Object> toFrame(StackFrame frame) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("method", frame.method());
        if (frame.file() != null) {
            payload.put("file", frame.file());
        }
        if (frame.lineNumber() != null) {
            payload.put("lineNumber", frame.lineNumber());
        }
        return payload;
    }
}
