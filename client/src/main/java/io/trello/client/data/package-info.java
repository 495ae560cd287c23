/**
 * Attribute-backed entities. An {@link io.trello.client.data.EntityType} describes one
 * kind of Trello object; {@link io.trello.client.data.BasicData} instances hold its
 * attributes, track which of them changed, and persist through a
 * {@link io.trello.client.TrelloClient}.
 */
@NullMarked
package io.trello.client.data;

import org.jspecify.annotations.NullMarked;
