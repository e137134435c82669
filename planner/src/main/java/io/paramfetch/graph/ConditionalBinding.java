package io.paramfetch.graph;

public record ConditionalBinding(String condition, ParamBinding p) {}
