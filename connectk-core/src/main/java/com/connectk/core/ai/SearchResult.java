package com.connectk.core.ai;

import java.util.Objects;

/**
 * Result payload returned by {@link Searcher} implementations.
 *
 * @param move       the chosen column
 * @param iterations completed search iterations
 * @param timeLimited whether the search ran against a wall-clock budget
 * @param telemetry  root statistics and tree shape
 */
public record SearchResult(int move, long iterations, boolean timeLimited, SearchTelemetry telemetry) {

    public SearchResult {
        Objects.requireNonNull(telemetry, "telemetry");
    }
}
