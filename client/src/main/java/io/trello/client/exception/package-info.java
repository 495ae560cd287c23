@NullMarked
package io.trello.client.exception;

import org.jspecify.annotations.NullMarked;
