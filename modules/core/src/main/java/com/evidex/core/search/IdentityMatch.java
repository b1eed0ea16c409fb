package com.evidex.core.search;

/**
 * Result of comparing one image against the reference photo.
 *
 * @param matched    true when the person was recognised
 * @param confidence confidence in percent (0-100)
 * @param matchCount faces in the image that matched
 */
public record IdentityMatch(boolean matched, double confidence, int matchCount) {

    public static final IdentityMatch NONE = new IdentityMatch(false, 0, 0);
}
