package org.pak.backoff.core;

import lombok.extern.slf4j.Slf4j;
import org.pak.backoff.core.error.OverrideScopeException;

import java.util.HashMap;
import java.util.Map;

/**
 * Restores the override its namespace had when the scope was opened. Overrides of other namespaces are left as
 * they are, so scopes may be closed out of order. Closing twice has no effect.
 */
@Slf4j
public final class OverrideScope implements AutoCloseable {
    private final Namespace namespace;
    //null when the namespace had no override
    private final BackoffCalculatorFactory previous;
    private final Thread owner = Thread.currentThread();
    private boolean closed = false;

    OverrideScope(Namespace namespace, BackoffCalculatorFactory previous) {
        this.namespace = namespace;
        this.previous = previous;
    }

    @Override
    public void close() {
        if (Thread.currentThread() != owner) {
            throw new OverrideScopeException("Override scope opened in thread " + owner.getName()
                    + " cannot be closed in thread " + Thread.currentThread().getName());
        }

        if (closed) {
            log.warn("Override scope should be closed only once");
            return;
        }

        closed = true;

        var overrides = new HashMap<>(BackoffOverrides.current());
        if (previous == null) {
            overrides.remove(namespace);
        } else {
            overrides.put(namespace, previous);
        }
        BackoffOverrides.install(Map.copyOf(overrides));
    }
}
