@NullMarked
package io.trello.util;

import org.jspecify.annotations.NullMarked;
