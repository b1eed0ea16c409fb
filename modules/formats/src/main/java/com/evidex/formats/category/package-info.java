/**
 * Forensic file categorization: an ordered, data-driven rule table that maps
 * a file's name, path and parent folder to one of the
 * {@link com.evidex.types.EvidenceCategory} values.
 */
package com.evidex.formats.category;
