package com.momentumshift.scoring.service;

import com.momentumshift.common.stats.PitchEvent;
import com.momentumshift.common.stats.RealizedShift;
import com.momentumshift.common.stats.RealizedShiftCalculator;
import com.momentumshift.scoring.dto.RealizedShiftRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.List;

/** Turns raw before/after tracking rows into a realized shift score for a ground-truth pipeline. */
@Service
public class RealizedShiftService {

    private static final Logger log = LoggerFactory.getLogger(RealizedShiftService.class);

    public Mono<RealizedShift> compute(RealizedShiftRequest request) {
        return Mono.fromCallable(() -> {
            if (request.playerId() == null || request.playerId().isBlank() || request.role() == null) {
                throw new IllegalArgumentException("playerId and role are required");
            }
            RealizedShift shift = RealizedShiftCalculator.forRole(request.playerId(), request.role(),
                rows(request.before()), rows(request.after()), request.weights());
            log.info("Realized shift computed. playerId={} role={} available={} score={}",
                     shift.playerId(), shift.role(), shift.available(), shift.score());
            return shift;
        });
    }

    private static List<PitchEvent> rows(List<PitchEvent> rows) {
        return rows == null ? List.of() : rows;
    }
}
