package com.momentumshift.scoring.controller;

import java.util.UUID;

final class RunIds {

    private RunIds() {}

    /** The caller's run id, or a fresh one when the header is absent. */
    static String orNew(String header) {
        return header == null || header.isBlank() ? UUID.randomUUID().toString() : header;
    }
}
