package net.openhours.adapter.jdbc.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import net.openhours.core.model.OutboxEvent;
import net.openhours.core.model.Window;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 감사 스냅샷 / outbox payload JSON 변환.
 * 날짜는 ISO 문자열, 윈도우는 wire 포맷 ("HH:MM:SS") 그대로.
 *
 * <pre>
 * snapshot: {"2025-03-10":[{"start":"09:00:00","end":"12:00:00"}]}
 * payload : {"instructorId":"i-1","weekStart":"2025-03-10","dates":["2025-03-10"],"version":"ab12.."}
 * </pre>
 */
public final class AvailabilityJson {
    private final ObjectMapper mapper;

    public AvailabilityJson() {
        this(new ObjectMapper());
    }

    public AvailabilityJson(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public String writeSnapshot(Map<LocalDate, List<Window>> byDate) throws JsonProcessingException {
        ObjectNode root = mapper.createObjectNode();
        byDate.forEach((date, windows) -> {
            ArrayNode arr = root.putArray(date.toString());
            for (Window w : windows) {
                arr.addObject().put("start", w.start()).put("end", w.end());
            }
        });
        return mapper.writeValueAsString(root);
    }

    public Map<LocalDate, List<Window>> readSnapshot(String json) throws JsonProcessingException {
        Map<LocalDate, List<Window>> out = new LinkedHashMap<>();
        if (json == null || json.isBlank()) return out;
        JsonNode root = mapper.readTree(json);
        for (Iterator<Map.Entry<String, JsonNode>> it = root.fields(); it.hasNext(); ) {
            Map.Entry<String, JsonNode> e = it.next();
            List<Window> windows = new ArrayList<>();
            for (JsonNode w : e.getValue()) {
                windows.add(Window.parse(w.path("start").asText(), w.path("end").asText()));
            }
            out.put(LocalDate.parse(e.getKey()), List.copyOf(windows));
        }
        return out;
    }

    public String writeDates(List<LocalDate> dates) throws JsonProcessingException {
        ArrayNode arr = mapper.createArrayNode();
        dates.forEach(d -> arr.add(d.toString()));
        return mapper.writeValueAsString(arr);
    }

    public List<LocalDate> readDates(String json) throws JsonProcessingException {
        List<LocalDate> out = new ArrayList<>();
        if (json == null || json.isBlank()) return out;
        for (JsonNode n : mapper.readTree(json)) {
            out.add(LocalDate.parse(n.asText()));
        }
        return out;
    }

    public String writeEventPayload(OutboxEvent e) throws JsonProcessingException {
        ObjectNode root = mapper.createObjectNode();
        root.put("instructorId", e.instructorId());
        root.put("weekStart", e.weekStart().toString());
        ArrayNode dates = root.putArray("dates");
        e.dates().forEach(d -> dates.add(d.toString()));
        root.put("version", e.version());
        return mapper.writeValueAsString(root);
    }

    public OutboxEvent readEvent(String eventId, String eventType, String payload, Instant createdAt)
            throws JsonProcessingException {
        JsonNode root = mapper.readTree(payload);
        List<LocalDate> dates = new ArrayList<>();
        for (JsonNode d : root.path("dates")) {
            dates.add(LocalDate.parse(d.asText()));
        }
        return new OutboxEvent(
                eventId,
                eventType,
                root.path("instructorId").asText(),
                LocalDate.parse(root.path("weekStart").asText()),
                List.copyOf(dates),
                root.path("version").asText(),
                createdAt
        );
    }
}
