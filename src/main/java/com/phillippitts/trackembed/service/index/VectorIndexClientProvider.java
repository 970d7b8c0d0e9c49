package com.phillippitts.trackembed.service.index;

import com.phillippitts.trackembed.exception.VectorIndexConnectionException;
import org.springframework.beans.BeansException;
import org.springframework.beans.factory.ObjectProvider;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Resolves the lazily created {@link VectorIndexClient} bean.
 *
 * <p>Creation is attempted again on every call until it succeeds once. A failed connect
 * surfaces as the underlying {@link VectorIndexConnectionException} rather than the container's
 * wrapping exception.
 */
public class VectorIndexClientProvider implements Supplier<VectorIndexClient> {

    private final ObjectProvider<VectorIndexClient> delegate;

    public VectorIndexClientProvider(ObjectProvider<VectorIndexClient> delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
    }

    /**
     * @throws VectorIndexConnectionException if the index cannot be connected to
     */
    @Override
    public VectorIndexClient get() {
        try {
            return delegate.getObject();
        } catch (BeansException e) {
            for (Throwable t = e; t != null; t = t.getCause()) {
                if (t instanceof VectorIndexConnectionException vce) {
                    throw vce;
                }
            }
            throw e;
        }
    }
}
