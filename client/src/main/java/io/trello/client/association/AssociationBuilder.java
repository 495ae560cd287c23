package io.trello.client.association;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Supplier;

import io.trello.client.data.BasicData;
import io.trello.client.data.EntityType;
import io.trello.util.Assert;
import org.jspecify.annotations.Nullable;

/**
 * Entry point for declaring associations.
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * static final HasMany<Card> CARDS = AssociationBuilder.hasMany("cards", () -> Card.TYPE)
 *     .path("/boards/{id}/cards")
 *     .build();
 *
 * static final HasOne<Organization> ORGANIZATION = AssociationBuilder.hasOne("organization", () -> Organization.TYPE)
 *     .path("/organizations/{idOrganization}")
 *     .optional()
 *     .build();
 * }</pre>
 */
public final class AssociationBuilder {

    private AssociationBuilder() {
    }

    public static <T extends BasicData> HasOneBuilder<T> hasOne(String name, Supplier<EntityType<T>> target) {
        return new HasOneBuilder<>(name, target);
    }

    public static <T extends BasicData> HasManyBuilder<T> hasMany(String name, Supplier<EntityType<T>> target) {
        return new HasManyBuilder<>(name, target);
    }

    public abstract static class Base<T extends BasicData, B extends Base<T, B>> {
        final String name;
        final Supplier<EntityType<T>> target;
        @Nullable String path;
        final Map<String, String> params = new LinkedHashMap<>();

        Base(String name, Supplier<EntityType<T>> target) {
            this.name = Assert.checkNotBlankParam("name", name);
            this.target = Assert.checkNotNullParam("target", target);
        }

        abstract B self();

        /**
         * @param path the path template, with owner attributes as {@code {name}}
         */
        public B path(String path) {
            this.path = Assert.checkNotBlankParam("path", path);
            return self();
        }

        public B param(String name, String value) {
            params.put(Assert.checkNotBlankParam("name", name), Assert.checkNotNullParam("value", value));
            return self();
        }

        String requirePath() {
            if (path == null) {
                throw new IllegalStateException("Association '" + name + "' needs a path");
            }
            return path;
        }
    }

    public static final class HasOneBuilder<T extends BasicData> extends Base<T, HasOneBuilder<T>> {
        private boolean optional;

        HasOneBuilder(String name, Supplier<EntityType<T>> target) {
            super(name, target);
        }

        @Override
        HasOneBuilder<T> self() {
            return this;
        }

        public HasOneBuilder<T> optional() {
            this.optional = true;
            return this;
        }

        public HasOne<T> build() {
            return new HasOne<>(name, target, requirePath(), params, optional);
        }
    }

    public static final class HasManyBuilder<T extends BasicData> extends Base<T, HasManyBuilder<T>> {

        HasManyBuilder(String name, Supplier<EntityType<T>> target) {
            super(name, target);
        }

        @Override
        HasManyBuilder<T> self() {
            return this;
        }

        public HasMany<T> build() {
            return new HasMany<>(name, target, requirePath(), params);
        }
    }
}
