package io.paramfetch.plan;

import io.paramfetch.model.FetchPlan;

public record PlanBuildResult(FetchPlan plan, PlanDiagnostics diagnostics) {}
