package io.trello.client.association;

import java.util.function.Supplier;

import io.trello.util.Assert;
import org.jspecify.annotations.Nullable;

/**
 * Per-instance cache of one association.
 * <p>
 * A slot resolves at most once. Both {@link State#RESOLVED} and {@link State#FAILED} are
 * final until {@link #reset()}: a failed slot rethrows the same exception on every access.
 * Access is synchronized, so threads racing on first access wait for a single resolution.
 *
 * @param <V> the cached value
 */
public final class AssociationSlot<V> {

    public enum State {
        UNRESOLVED,
        RESOLVING,
        RESOLVED,
        FAILED
    }

    private State state = State.UNRESOLVED;

    private @Nullable V value;

    private @Nullable RuntimeException failure;

    /**
     * @param resolver computes the value when the slot is unresolved
     * @return the cached or freshly resolved value
     * @throws IllegalStateException if called again from within {@code resolver}
     */
    public synchronized V get(Supplier<V> resolver) {
        switch (state) {
            case RESOLVED:
                return Assert.checkNotNullParam("value", value);
            case FAILED:
                throw Assert.checkNotNullParam("failure", failure);
            case RESOLVING:
                throw new IllegalStateException("Association is already being resolved");
            default:
                break;
        }
        state = State.RESOLVING;
        try {
            V resolved = Assert.checkNotNullParam("value", resolver.get());
            value = resolved;
            state = State.RESOLVED;
            return resolved;
        } catch (RuntimeException e) {
            failure = e;
            state = State.FAILED;
            throw e;
        }
    }

    /**
     * Forgets the cached value or failure.
     */
    public synchronized void reset() {
        if (state == State.RESOLVING) {
            throw new IllegalStateException("Cannot reset an association while it is being resolved");
        }
        state = State.UNRESOLVED;
        value = null;
        failure = null;
    }

    public synchronized State state() {
        return state;
    }
}
