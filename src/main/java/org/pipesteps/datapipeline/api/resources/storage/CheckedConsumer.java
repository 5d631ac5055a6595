package org.pipesteps.datapipeline.api.resources.storage;

import java.io.IOException;

/**
 * A consumer that can throw {@link IOException}.
 * <p>
 * Used by {@link org.pipesteps.datapipeline.utils.AtomicFiles#write} so that callers can stream
 * content into a temporary file with ordinary I/O code.
 *
 * @param <T> the type of the input to the operation
 */
@FunctionalInterface
public interface CheckedConsumer<T> {

    /**
     * Performs this operation on the given argument.
     *
     * @param t the input argument
     * @throws IOException if the operation fails
     */
    void accept(T t) throws IOException;
}
