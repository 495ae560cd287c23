package io.trello.client.data;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import io.trello.util.Assert;
import org.jspecify.annotations.Nullable;

/**
 * The attributes an entity type knows about. Reading or writing any other name is an
 * error, and fields of a server response outside the schema are not kept.
 * <p>
 * {@code id} is always present and read-only.
 */
public final class Schema {

    public static final String ID = "id";

    private final Map<String, AttributeDefinition> attributes;

    private Schema(Map<String, AttributeDefinition> attributes) {
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean contains(String name) {
        return attributes.containsKey(name);
    }

    public @Nullable AttributeDefinition get(String name) {
        return attributes.get(name);
    }

    /**
     * @param name the attribute name
     * @return its definition
     * @throws IllegalArgumentException if the schema has no such attribute
     */
    public AttributeDefinition require(String name) {
        AttributeDefinition definition = attributes.get(name);
        if (definition == null) {
            throw new IllegalArgumentException("Unknown attribute '" + name + "', expected one of " + attributes.keySet());
        }
        return definition;
    }

    public Collection<AttributeDefinition> attributes() {
        return attributes.values();
    }

    public static class Builder {
        private final Map<String, AttributeDefinition> attributes = new LinkedHashMap<>();

        private Builder() {
            readonly(ID);
        }

        public Builder attribute(String... names) {
            return add(AttributeDefinition.Access.READ_WRITE, names);
        }

        public Builder readonly(String... names) {
            return add(AttributeDefinition.Access.READONLY, names);
        }

        public Builder createOnly(String... names) {
            return add(AttributeDefinition.Access.CREATE_ONLY, names);
        }

        private Builder add(AttributeDefinition.Access access, String... names) {
            for (String name : names) {
                if (attributes.containsKey(name)) {
                    throw new IllegalArgumentException("Attribute '" + name + "' is declared twice");
                }
                attributes.put(name, new AttributeDefinition(name, access));
            }
            return this;
        }

        public Schema build() {
            return new Schema(attributes);
        }
    }
}
