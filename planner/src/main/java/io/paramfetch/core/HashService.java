package io.paramfetch.core;

/** Deterministic, run-stable short hash of a canonical query signature. */
public interface HashService {
    String shortHash(String canonicalSignature);
}
