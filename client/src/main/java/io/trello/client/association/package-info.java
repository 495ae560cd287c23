/**
 * Lazily loaded relationships between entities.
 * <p>
 * An entity class declares its associations once, as static
 * {@link io.trello.client.association.HasOne} and {@link io.trello.client.association.HasMany}
 * constants built with {@link io.trello.client.association.AssociationBuilder}. Each entity
 * instance resolves an association on first access and keeps the result in an
 * {@link io.trello.client.association.AssociationSlot} until it is reloaded.
 */
@NullMarked
package io.trello.client.association;

import org.jspecify.annotations.NullMarked;
