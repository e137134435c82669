package io.paramfetch.error;

public interface ItemFailureLog extends AutoCloseable {
    void recordFailure(String itemKey, String scope, Exception e);
    @Override default void close() {}
}
