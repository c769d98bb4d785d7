package com.momentumshift.common.exception;

public class UnknownVersionException extends MssException {

    private final String version;

    public UnknownVersionException(String registry, String version) {
        super(registry, "Unknown version " + version);
        this.version = version;
    }

    public String getVersion() {
        return version;
    }
}
