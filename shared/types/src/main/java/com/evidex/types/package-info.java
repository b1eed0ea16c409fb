/**
 * Pure Java value types shared across all Evidex modules.
 *
 * <p>Enums here carry the lowercase labels that are persisted in the case database
 * and exchanged over the HTTP surface. No framework dependencies.
 */
package com.evidex.types;
