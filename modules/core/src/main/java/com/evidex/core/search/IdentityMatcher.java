package com.evidex.core.search;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Compares images against a reference photo loaded by
 * {@link IdentityMatcherFactory#forReference}.
 */
public interface IdentityMatcher {

    IdentityMatch match(Path image) throws IOException;
}
