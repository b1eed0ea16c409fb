/**
 * Shared utilities for all Evidex modules.
 *
 * <p>Contains {@link com.evidex.util.ContentHash} (SHA-256) and the
 * {@link com.evidex.util.ContentHasher} used by lazy hash backfill.
 * No framework dependencies.
 */
package com.evidex.util;
