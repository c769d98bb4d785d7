package com.momentumshift.scoring.registry;

import com.momentumshift.common.predict.VersionedModel;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;

/** Trajectory model versions. Starts with the untrained {@code model-v0}. */
@Component
public class ModelRegistry extends VersionRegistry<VersionedModel> {

    public static final String UNTRAINED_VERSION = "model-v0";

    public ModelRegistry(Clock clock) {
        super("model", "model-v", 1);
        register(VersionedModel.untrained(UNTRAINED_VERSION, Instant.now(clock)));
    }

    @Override
    protected String versionOf(VersionedModel entry) {
        return entry.version();
    }
}
