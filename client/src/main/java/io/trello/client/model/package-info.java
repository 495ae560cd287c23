/**
 * Trello entities: boards, lists, cards and the objects around them.
 */
@NullMarked
package io.trello.client.model;

import org.jspecify.annotations.NullMarked;
