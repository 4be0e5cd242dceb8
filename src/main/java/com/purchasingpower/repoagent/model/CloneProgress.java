package com.purchasingpower.repoagent.model;

/**
 * Progress notification for a repository load.
 *
 * @param phase   human readable phase, e.g. "Receiving objects"
 * @param percent 0..100, never decreasing within one load
 */
public record CloneProgress(String phase, int percent) {
}
