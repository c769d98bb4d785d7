package com.momentumshift.common.stats;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Average by count, base state and game stage.
 *
 * <p>Counts are read from the pitcher's side for pitchers: a pitcher is ahead when
 * strikes exceed balls. An even count needs at least one ball, so 0-0 is in no count
 * split. A split is present when any row falls into it; with rows but no at-bats its
 * average is 0. Innings 1–3 are early, 4–6 middle, 7 and later late.
 */
public final class SituationalSplits {

    public static final String AHEAD_COUNT    = "aheadCount";
    public static final String BEHIND_COUNT   = "behindCount";
    public static final String EVEN_COUNT     = "evenCount";
    public static final String BASES_EMPTY    = "basesEmpty";
    public static final String RISP           = "risp";
    public static final String EARLY_INNINGS  = "earlyInnings";
    public static final String MIDDLE_INNINGS = "middleInnings";
    public static final String LATE_INNINGS   = "lateInnings";

    private SituationalSplits() {}

    public static Map<String, SituationalSplit> batter(List<PitchEvent> rows) {
        return compute(rows, false);
    }

    public static Map<String, SituationalSplit> pitcher(List<PitchEvent> rows) {
        return compute(rows, true);
    }

    /** Average of the {@link #RISP} split, or null when no row had a runner in scoring position. */
    static Double risp(Map<String, SituationalSplit> splits) {
        SituationalSplit split = splits.get(RISP);
        return split == null ? null : split.average();
    }

    private static Map<String, SituationalSplit> compute(List<PitchEvent> rows, boolean pitcher) {
        Map<String, SituationalSplit> splits = new LinkedHashMap<>();

        List<PitchEvent> counted = rows.stream().filter(PitchEvent::countKnown).toList();
        Predicate<PitchEvent> hitterAhead  = r -> r.balls() > r.strikes();
        Predicate<PitchEvent> hitterBehind = r -> r.balls() < r.strikes();
        put(splits, AHEAD_COUNT,  counted, pitcher ? hitterBehind : hitterAhead);
        put(splits, BEHIND_COUNT, counted, pitcher ? hitterAhead : hitterBehind);
        put(splits, EVEN_COUNT,   counted, r -> r.balls().equals(r.strikes()) && r.balls() > 0);

        put(splits, BASES_EMPTY, rows, PitchEvent::basesEmpty);
        put(splits, RISP,        rows, PitchEvent::runnerInScoringPosition);

        List<PitchEvent> staged = rows.stream().filter(r -> r.inning() != null).toList();
        put(splits, EARLY_INNINGS,  staged, r -> r.inning() <= 3);
        put(splits, MIDDLE_INNINGS, staged, r -> r.inning() > 3 && r.inning() <= 6);
        put(splits, LATE_INNINGS,   staged, r -> r.inning() > 6);
        return Collections.unmodifiableMap(splits);
    }

    private static void put(Map<String, SituationalSplit> splits, String name,
                            List<PitchEvent> rows, Predicate<PitchEvent> filter) {
        List<PitchEvent> group = rows.stream().filter(filter).toList();
        if (group.isEmpty()) return;
        long atBats = group.stream().filter(PitchEvent::isAtBat).count();
        long hits = group.stream().filter(PitchEvent::isHit).count();
        splits.put(name, new SituationalSplit(atBats > 0 ? (double) hits / atBats : 0.0, (int) atBats));
    }
}
