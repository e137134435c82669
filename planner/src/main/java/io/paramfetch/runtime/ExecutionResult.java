package io.paramfetch.runtime;

public record ExecutionResult(
        int success,
        int errors,
        int cacheHits,
        int apiFetches,
        long daysFetched,
        boolean aborted,
        int rateLimitRestarts,
        String abortReason
) {
    public static final ExecutionResult EMPTY = new ExecutionResult(0, 0, 0, 0, 0, false, 0, null);

    public ExecutionResult plus(ExecutionResult o) {
        return new ExecutionResult(success + o.success, errors + o.errors, cacheHits + o.cacheHits,
                apiFetches + o.apiFetches, daysFetched + o.daysFetched, aborted || o.aborted,
                rateLimitRestarts + o.rateLimitRestarts, abortReason != null ? abortReason : o.abortReason);
    }

    public String describe() {
        return String.format("success=%d errors=%d cached=%d fetched=%d days=%d restarts=%d%s",
                success, errors, cacheHits, apiFetches, daysFetched, rateLimitRestarts, aborted ? " aborted" : "");
    }
}
