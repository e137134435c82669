package io.paramfetch.coverage;

public class SliceIsolationException extends RuntimeException {
    public SliceIsolationException(String message, Throwable cause) {
        super(message, cause);
    }
}
