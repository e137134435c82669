package io.paramfetch.core;

import java.util.Optional;

/**
 * Read-only view of the cache. Planning never writes through this interface.
 */
public interface FileStateAccessor {
    Optional<ParameterFile> parameterFile(String objectId);

    Optional<CaseFile> caseFile(String objectId);
}
