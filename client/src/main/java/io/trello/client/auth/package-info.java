@NullMarked
package io.trello.client.auth;

import org.jspecify.annotations.NullMarked;
