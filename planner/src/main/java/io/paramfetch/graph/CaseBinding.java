package io.paramfetch.graph;

public record CaseBinding(String caseId, String connection) {}
