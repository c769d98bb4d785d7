package com.momentumshift.scoring.registry;

import com.momentumshift.common.model.ComposerWeights;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Composer weight versions, seeded with the configured initial set. */
@Component
public class WeightRegistry extends VersionRegistry<ComposerWeights> {

    private static final Logger log = LoggerFactory.getLogger(WeightRegistry.class);

    public WeightRegistry(ComposerWeights initialWeights) {
        super("weights", "weights-v", 2);
        register(initialWeights);
        log.info("Weight registry seeded. version={} w1={} w2={}",
                 initialWeights.version(), initialWeights.w1(), initialWeights.w2());
    }

    @Override
    protected String versionOf(ComposerWeights entry) {
        return entry.version();
    }
}
