package com.maestro.core.exception;

/**
 * A stage protocol stopped at a round or step boundary because a pause was requested.
 * Settled rounds stay on disk; the stage remains in progress and reruns on resume.
 */
public class StagePausedException extends MaestroException {

    private final String stageId;

    public StagePausedException(String stageId, String boundary) {
        super("Stage " + stageId + " paused after " + boundary);
        this.stageId = stageId;
    }

    public String stageId() {
        return stageId;
    }
}
