@NullMarked
package io.trello;

import org.jspecify.annotations.NullMarked;
