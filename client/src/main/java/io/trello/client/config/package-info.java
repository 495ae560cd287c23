@NullMarked
package io.trello.client.config;

import org.jspecify.annotations.NullMarked;
