package io.paramfetch.config;

import io.paramfetch.snapshot.SliceKeysPolicy;

import java.nio.file.Path;

public record PlannerConfig(
        Path cacheDir,
        int defaultMaturityDays,
        long refetchCooldownMinutes,
        long rateLimitCooldownMinutes,
        int maxRateLimitRestarts,
        Path failuresFile,
        SliceKeysPolicy sliceKeysPolicy,
        String workspaceRepository,
        String workspaceBranch
) {
    public static PlannerConfig fromEnv() {
        Path cache = Path.of(read("paramfetch.cache.dir", "PARAMFETCH_CACHE_DIR", "."));
        int maturity = Integer.parseInt(read("paramfetch.maturity.default.days", "PARAMFETCH_MATURITY_DEFAULT_DAYS", "30"));
        long refetch = Long.parseLong(read("paramfetch.refetch.cooldown.minutes", "PARAMFETCH_REFETCH_COOLDOWN_MINUTES", "720"));
        long rateLimit = Long.parseLong(read("paramfetch.ratelimit.cooldown.minutes", "PARAMFETCH_RATELIMIT_COOLDOWN_MINUTES", "61"));
        int restarts = Integer.parseInt(read("paramfetch.ratelimit.max.restarts", "PARAMFETCH_RATELIMIT_MAX_RESTARTS", "3"));
        Path failures = Path.of(read("paramfetch.failures.file", "PARAMFETCH_FAILURES_FILE", "./out/failures.jsonl"));
        SliceKeysPolicy keys = SliceKeysPolicy.fromWire(read("paramfetch.slice.keys.policy", "PARAMFETCH_SLICE_KEYS_POLICY", "mece_fulfilment_allowed"));
        String repo = read("paramfetch.workspace.repo", "PARAMFETCH_WORKSPACE_REPO", "local");
        String branch = read("paramfetch.workspace.branch", "PARAMFETCH_WORKSPACE_BRANCH", "main");
        return new PlannerConfig(cache, maturity, refetch, rateLimit, restarts, failures, keys, repo, branch);
    }

    private static String read(String property, String env, String def) {
        return System.getProperty(property, System.getenv().getOrDefault(env, def));
    }

    public PlannerConfig withCacheDir(Path dir) {
        return new PlannerConfig(dir, defaultMaturityDays, refetchCooldownMinutes, rateLimitCooldownMinutes,
                maxRateLimitRestarts, failuresFile, sliceKeysPolicy, workspaceRepository, workspaceBranch);
    }
}
