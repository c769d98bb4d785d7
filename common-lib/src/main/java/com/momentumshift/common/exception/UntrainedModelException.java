package com.momentumshift.common.exception;

public class UntrainedModelException extends MssException {

    private final String modelVersion;

    public UntrainedModelException(String modelVersion) {
        super("OutcomePredictor", "Model version " + modelVersion + " has not been fit on any historical batch");
        this.modelVersion = modelVersion;
    }

    public String getModelVersion() {
        return modelVersion;
    }
}
