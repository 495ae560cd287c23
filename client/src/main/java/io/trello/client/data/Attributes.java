package io.trello.client.data;

import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.trello.util.Assert;
import io.trello.util.Utils;
import org.jspecify.annotations.Nullable;

/**
 * Current attribute values of one entity next to the baseline they were last loaded or
 * saved with. An attribute is dirty while its current value differs from the baseline,
 * so writing back the loaded value makes it clean again.
 * <p>
 * Values are compared as JSON: an absent attribute equals JSON null, and numbers are
 * equal when their values are, so {@code 16384} and {@code 16384.0} are the same.
 */
public final class Attributes {

    private static final Comparator<JsonNode> NUMERIC_VALUE = (left, right) -> {
        if (left.isNumber() && right.isNumber()) {
            return left.decimalValue().compareTo(right.decimalValue());
        }
        return left.equals(right) ? 0 : 1;
    };

    private final Schema schema;

    private ObjectNode current = Utils.OBJECT_MAPPER.createObjectNode();

    private ObjectNode baseline = Utils.OBJECT_MAPPER.createObjectNode();

    public Attributes(Schema schema) {
        this.schema = Assert.checkNotNullParam("schema", schema);
    }

    /**
     * Replaces every value with those in {@code json} and makes them the new baseline.
     *
     * @param json a JSON object; fields outside the schema are dropped
     */
    public void load(ObjectNode json) {
        ObjectNode loaded = Utils.OBJECT_MAPPER.createObjectNode();
        Iterator<Map.Entry<String, JsonNode>> fields = json.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (schema.contains(field.getKey())) {
                loaded.set(field.getKey(), field.getValue().deepCopy());
            }
        }
        current = loaded;
        baseline = loaded.deepCopy();
    }

    /**
     * @param name a schema attribute
     * @return the value, or null if the attribute is unset or JSON null
     */
    public @Nullable JsonNode get(String name) {
        schema.require(name);
        JsonNode value = current.get(name);
        return value == null || value.isNull() ? null : value;
    }

    public boolean has(String name) {
        return get(name) != null;
    }

    /**
     * @param name a writable schema attribute
     * @param value the new value, null to clear it
     * @throws IllegalArgumentException if the attribute is unknown or read-only
     */
    public void set(String name, @Nullable JsonNode value) {
        AttributeDefinition definition = schema.require(name);
        if (!definition.isWritable()) {
            throw new IllegalArgumentException("Attribute '" + name + "' is read-only");
        }
        current.set(name, value == null ? NullNode.getInstance() : value);
    }

    public Set<String> changed() {
        Set<String> changed = new LinkedHashSet<>();
        for (AttributeDefinition definition : schema.attributes()) {
            String name = definition.name();
            if (!sameValue(current.get(name), baseline.get(name))) {
                changed.add(name);
            }
        }
        return Collections.unmodifiableSet(changed);
    }

    static boolean sameValue(@Nullable JsonNode left, @Nullable JsonNode right) {
        boolean leftAbsent = left == null || left.isNull();
        boolean rightAbsent = right == null || right.isNull();
        if (leftAbsent || rightAbsent) {
            return leftAbsent == rightAbsent;
        }
        return left.equals(NUMERIC_VALUE, right);
    }

    public boolean isDirty() {
        return !changed().isEmpty();
    }

    /**
     * @return the current values of the dirty attributes
     */
    public ObjectNode changedValues() {
        ObjectNode values = Utils.OBJECT_MAPPER.createObjectNode();
        for (String name : changed()) {
            JsonNode value = current.get(name);
            values.set(name, value == null ? NullNode.getInstance() : value.deepCopy());
        }
        return values;
    }

    /**
     * @return a copy of every attribute currently set; cleared attributes are left out
     */
    public ObjectNode values() {
        ObjectNode values = Utils.OBJECT_MAPPER.createObjectNode();
        Iterator<Map.Entry<String, JsonNode>> fields = current.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!field.getValue().isNull()) {
                values.set(field.getKey(), field.getValue().deepCopy());
            }
        }
        return values;
    }

    public void markClean() {
        baseline = current.deepCopy();
    }
}
