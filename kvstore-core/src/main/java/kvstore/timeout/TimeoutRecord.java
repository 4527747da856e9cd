package kvstore.timeout;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Objects;

/**
 * Durable record of a scheduled timeout, stored in the {@code timeout} table under {@link #key()}.
 *
 * @param id        descriptor id the action is dispatched to
 * @param time      delay in milliseconds requested at scheduling time
 * @param datestamp epoch milliseconds at which the timeout was scheduled
 * @param outData   caller payload handed to the action
 */
public record TimeoutRecord(String id, long time, long datestamp, JsonNode outData) {

    public TimeoutRecord {
        Objects.requireNonNull(id, "id");
        if (time < 0) {
            throw new IllegalArgumentException("time must be >= 0");
        }
        outData = outData == null ? NullNode.getInstance() : outData;
    }

    /** Storage key: {@code <id>_<datestamp>}. */
    public String key() {
        return key(id, datestamp);
    }

    public static String key(String id, long datestamp) {
        return id + "_" + datestamp;
    }

    /** Epoch milliseconds at which the timeout is due. */
    public long dueAt() {
        return datestamp + time;
    }

    public ObjectNode toJson() {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put("id", id);
        node.put("time", time);
        node.put("datestamp", datestamp);
        node.set("outData", outData);
        return node;
    }

    /**
     * Reads a record written by {@link #toJson()}.
     *
     * @throws IllegalArgumentException if a field is missing or has the wrong type
     */
    public static TimeoutRecord fromJson(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException("timeout record must be an object");
        }
        JsonNode id = node.get("id");
        JsonNode time = node.get("time");
        JsonNode datestamp = node.get("datestamp");
        if (id == null || !id.isTextual() || id.asText().isEmpty()) {
            throw new IllegalArgumentException("timeout record has no id");
        }
        if (time == null || !time.isNumber()) {
            throw new IllegalArgumentException("timeout record " + id.asText() + " has no time");
        }
        if (datestamp == null || !datestamp.isNumber()) {
            throw new IllegalArgumentException("timeout record " + id.asText() + " has no datestamp");
        }
        return new TimeoutRecord(id.asText(), time.asLong(), datestamp.asLong(), node.get("outData"));
    }
}
