package io.paramfetch.core;

@FunctionalInterface
public interface ProgressSink {
    ProgressSink NONE = p -> { };

    void onProgress(ExecutionProgress progress);
}
