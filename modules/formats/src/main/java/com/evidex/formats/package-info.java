/**
 * Forensic container formats: detection, streaming indexers over ZIP, TAR
 * and Android backup containers, transport codecs and file categorization.
 *
 * <p>Indexers never buffer entry content in memory. Listing reads
 * the ZIP central directory or TAR headers only; content is streamed on
 * extraction or single-entry reads.
 */
package com.evidex.formats;
