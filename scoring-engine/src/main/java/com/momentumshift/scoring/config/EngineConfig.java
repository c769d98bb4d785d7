package com.momentumshift.scoring.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.momentumshift.common.context.ContextMultiplierFunction;
import com.momentumshift.common.context.StagedContextMultiplier;
import com.momentumshift.common.model.ComposerWeights;
import com.momentumshift.common.model.InsufficientHistoryPolicy;
import com.momentumshift.common.model.SentimentSourceType;
import com.momentumshift.common.predict.RidgeTrajectoryTrainer;
import com.momentumshift.common.predict.TrajectoryTrainer;
import com.momentumshift.common.settings.ContextSettings;
import com.momentumshift.common.settings.ImpactSettings;
import com.momentumshift.common.settings.MssSettings;
import com.momentumshift.common.settings.MultiplierSettings;
import com.momentumshift.common.settings.PredictionSettings;
import com.momentumshift.common.settings.SentimentSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Assembles the one immutable {@link MssSettings} instance from {@code mss.*} properties.
 * Every stage receives it explicitly; nothing downstream reads properties.
 */
@Configuration
public class EngineConfig {

    private static final Logger log = LoggerFactory.getLogger(EngineConfig.class);

    @Value("${mss.context.trailing-window}")
    private int trailingWindow;

    @Value("${mss.context.min-prior-appearances}")
    private int minPriorAppearances;

    @Value("${mss.context.insufficient-history-policy:FAIL}")
    private InsufficientHistoryPolicy insufficientHistoryPolicy;

    @Value("${mss.context.rookie-max-seasons}")
    private double rookieMaxSeasons;

    @Value("${mss.context.veteran-min-seasons}")
    private double veteranMinSeasons;

    @Value("${mss.context.plate-appearances-per-season}")
    private int plateAppearancesPerSeason;

    @Value("${mss.context.innings-per-season}")
    private double inningsPerSeason;

    @Value("${mss.impact.regular-season-weight}")
    private double regularSeasonWeight;

    @Value("${mss.impact.postseason-weight}")
    private double postseasonWeight;

    @Value("${mss.sentiment.half-life}")
    private Duration sentimentHalfLife;

    @Value("${mss.sentiment.media-weight:1.0}")
    private double mediaWeight;

    @Value("${mss.sentiment.fan-weight:1.0}")
    private double fanWeight;

    @Value("${mss.sentiment.social-weight:1.0}")
    private double socialWeight;

    @Value("${mss.composer.w1}")
    private double w1;

    @Value("${mss.composer.w2}")
    private double w2;

    @Value("${mss.composer.initial-version:weights-v1}")
    private String initialWeightVersion;

    @Value("${mss.multiplier.rookie}")
    private double rookieMultiplier;

    @Value("${mss.multiplier.prime}")
    private double primeMultiplier;

    @Value("${mss.multiplier.veteran}")
    private double veteranMultiplier;

    @Value("${mss.multiplier.form-slope}")
    private double formSlope;

    @Value("${mss.multiplier.form-cap}")
    private double formCap;

    @Value("${mss.prediction.horizon}")
    private int horizon;

    @Value("${mss.prediction.ridge-lambda}")
    private double ridgeLambda;

    @Value("${mss.prediction.interval-z}")
    private double intervalZ;

    @Value("${mss.prediction.min-samples:3}")
    private int minSamples;

    @Bean
    public MssSettings mssSettings() {
        MssSettings settings = new MssSettings(
            new ContextSettings(trailingWindow, minPriorAppearances, rookieMaxSeasons, veteranMinSeasons,
                plateAppearancesPerSeason, inningsPerSeason),
            insufficientHistoryPolicy,
            new ImpactSettings(regularSeasonWeight, postseasonWeight),
            new SentimentSettings(sentimentHalfLife, Map.of(
                SentimentSourceType.MEDIA,  mediaWeight,
                SentimentSourceType.FAN,    fanWeight,
                SentimentSourceType.SOCIAL, socialWeight)),
            new MultiplierSettings(rookieMultiplier, primeMultiplier, veteranMultiplier, formSlope, formCap),
            new PredictionSettings(horizon, ridgeLambda, intervalZ, minSamples));
        log.info("Engine settings loaded. trailingWindow={} minPriorAppearances={} policy={} horizon={}",
                 trailingWindow, minPriorAppearances, insufficientHistoryPolicy, horizon);
        return settings;
    }

    @Bean
    public ComposerWeights initialWeights(Clock clock) {
        return new ComposerWeights(initialWeightVersion, w1, w2, null, Instant.now(clock));
    }

    @Bean
    public ContextMultiplierFunction contextMultiplier(MssSettings mssSettings) {
        return new StagedContextMultiplier(mssSettings.multiplier());
    }

    @Bean
    public TrajectoryTrainer trajectoryTrainer() {
        return new RidgeTrajectoryTrainer();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
