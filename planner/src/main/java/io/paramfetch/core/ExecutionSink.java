package io.paramfetch.core;

public interface ExecutionSink {
    ExecutionOutcome execute(ExecutionRequest request) throws Exception;
}
