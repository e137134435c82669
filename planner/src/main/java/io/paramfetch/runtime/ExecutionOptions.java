package io.paramfetch.runtime;

import java.util.function.BooleanSupplier;

public record ExecutionOptions(Mode mode, boolean simulate, BooleanSupplier shouldAbort) {
    public enum Mode { AUTOMATED, MANUAL }

    public ExecutionOptions {
        mode = mode == null ? Mode.MANUAL : mode;
        shouldAbort = shouldAbort == null ? () -> false : shouldAbort;
    }

    public static ExecutionOptions manual() { return new ExecutionOptions(Mode.MANUAL, false, null); }
    public static ExecutionOptions automated() { return new ExecutionOptions(Mode.AUTOMATED, false, null); }
    public static ExecutionOptions dryRun() { return new ExecutionOptions(Mode.MANUAL, true, null); }

    public ExecutionOptions withAbort(BooleanSupplier abort) {
        return new ExecutionOptions(mode, simulate, abort);
    }
}
