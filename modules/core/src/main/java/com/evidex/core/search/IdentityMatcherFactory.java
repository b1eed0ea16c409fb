package com.evidex.core.search;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Entry point to the face-recognition collaborator. Provided as a CDI bean
 * by the deployment; search runs without identity matching when none exists.
 */
public interface IdentityMatcherFactory {

    /**
     * Loads the reference photo.
     *
     * @throws IOException if the photo cannot be read or holds no face
     */
    IdentityMatcher forReference(Path referencePhoto) throws IOException;
}
