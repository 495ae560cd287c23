/**
 * Vert.x based transport, selected under the name {@code vertx}.
 */
@NullMarked
package io.trello.client.http.vertx;

import org.jspecify.annotations.NullMarked;
