package com.momentumshift.common.exception;

/**
 * Base type for every failure raised by a pipeline stage. The stage name is
 * prefixed onto the message so a log line alone identifies where the moment
 * was rejected.
 */
public class MssException extends RuntimeException {
    private final String stage;

    public MssException(String stage, String message) {
        super("[" + stage + "] " + message);
        this.stage = stage;
    }

    public MssException(String stage, String message, Throwable cause) {
        super("[" + stage + "] " + message, cause);
        this.stage = stage;
    }

    public String getStage() {
        return stage;
    }
}
