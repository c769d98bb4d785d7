package com.momentumshift.common.predict;

import com.momentumshift.common.TestFixtures;
import com.momentumshift.common.exception.UntrainedModelException;
import com.momentumshift.common.model.MssResult;
import com.momentumshift.common.model.PlayerRole;
import com.momentumshift.common.model.PredictionFeatures;
import com.momentumshift.common.model.PredictionRecord;
import com.momentumshift.common.model.PredictionStatus;
import com.momentumshift.common.model.TrainingExample;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class OutcomePredictorTest {

    private final MssResult result = TestFixtures.result("m-001", "batter-1", 0.525, 0.2, 1.2, 0.300);

    private VersionedModel trained() {
        List<TrainingExample> examples = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            double s = i / 10.0;
            examples.add(new TrainingExample(new PredictionFeatures(s, 0.1 * i, 1.0, 0.250, PlayerRole.BATTER),
                List.of(0.250 + 0.05 * s, 0.250 + 0.04 * s, 0.250 + 0.03 * s, 0.250, 0.250)));
        }
        TrajectoryModel model = new RidgeTrajectoryTrainer().fit(examples, TestFixtures.predictionSettings());
        return new VersionedModel("model-v1", "model-v0", model, Instant.EPOCH);
    }

    @Test
    @DisplayName("untrained model version raises, never a zero-filled trajectory")
    void untrainedRaises() {
        VersionedModel untrained = VersionedModel.untrained("model-v0", Instant.EPOCH);

        UntrainedModelException e = assertThrows(UntrainedModelException.class,
            () -> OutcomePredictor.predict(result, untrained, TestFixtures.predictionSettings()));

        assertEquals("model-v0", e.getModelVersion());
    }

    @Test
    @DisplayName("trained model yields a PREDICTED record over the full horizon")
    void predicts() {
        PredictionRecord record = OutcomePredictor.predict(result, trained(), TestFixtures.predictionSettings());

        assertEquals(PredictionStatus.PREDICTED, record.status());
        assertEquals("model-v1", record.modelVersion());
        assertEquals("weights-v1", record.weightVersion());
        assertEquals(5, record.predicted().size());
        assertNull(record.observed());
        assertEquals(0.300, record.features().baseline());
    }

    @Test
    @DisplayName("missing sentiment (N = 0) predicts without error")
    void zeroNarrative() {
        MssResult quiet = TestFixtures.result("m-002", "batter-1", 0.3, 0.0, 1.0, 0.280);

        assertEquals(5, OutcomePredictor.predict(quiet, trained(), TestFixtures.predictionSettings()).predicted().size());
    }

    @Test
    @DisplayName("version metadata reflects the fitted model")
    void versionMetadata() {
        VersionedModel model = trained();

        assertTrue(model.trained());
        assertEquals(8, model.sampleCount());
        assertEquals(5, model.horizon());
        assertFalse(VersionedModel.untrained("model-v0", Instant.EPOCH).trained());
    }
}
