package io.trello.client.data;

import io.trello.util.Assert;

/**
 * One attribute of an entity schema.
 *
 * @param name the JSON field name as Trello sends and accepts it
 * @param access who may write the attribute and when it is sent
 */
public record AttributeDefinition(String name, Access access) {

    public enum Access {
        /** Settable, sent on create and on update. */
        READ_WRITE,
        /** Set by Trello only, never sent. */
        READONLY,
        /** Settable before the entity is created, sent on create only. */
        CREATE_ONLY
    }

    public AttributeDefinition {
        Assert.checkNotBlankParam("name", name);
        Assert.checkNotNullParam("access", access);
    }

    public boolean isWritable() {
        return access != Access.READONLY;
    }

    public boolean isSentOnCreate() {
        return access != Access.READONLY;
    }

    public boolean isSentOnUpdate() {
        return access == Access.READ_WRITE;
    }
}
