package com.cellblock.remote;

import com.cellblock.wire.EvaluationResponse;

import java.util.List;

/**
 * Receives the asynchronous notifications of a {@link RuntimeServer}.
 */
public interface RuntimeOwner {

    void onEvaluationResponse(EvaluationResponse response);

    /**
     * The evaluator of {@code container} terminated abnormally.
     *
     * @param evaluations refs of the container that were accepted and will not be answered
     */
    void onContainerDown(String container, String message, List<String> evaluations);

    void onServerStopped(String serverId);
}
