@NullMarked
package io.trello.client.net;

import org.jspecify.annotations.NullMarked;
