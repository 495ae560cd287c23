@NullMarked
package io.trello.client.http.jdk;

import org.jspecify.annotations.NullMarked;
