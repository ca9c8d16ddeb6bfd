package wikigate.core.model.content;

import wikigate.core.model.common.ErrorKind;

/**
 * Outcome of one item of a batch operation. A failed item never fails the batch.
 */
public sealed interface BatchItemResult<T> {

    record Success<T>(T value) implements BatchItemResult<T> {}

    /**
     * @param error failure message
     * @param kind  failure kind, or null for untyped failures
     */
    record Failure<T>(String error, ErrorKind kind) implements BatchItemResult<T> {}

    default boolean isSuccess() {
        return this instanceof Success;
    }
}
