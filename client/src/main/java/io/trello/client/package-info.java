/**
 * {@link io.trello.client.TrelloClient}, the blocking gateway every entity uses to reach
 * the Trello REST API.
 */
@NullMarked
package io.trello.client;

import org.jspecify.annotations.NullMarked;
