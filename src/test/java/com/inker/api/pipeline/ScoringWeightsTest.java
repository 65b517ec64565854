package com.inker.api.pipeline;

import com.inker.api.Scoring;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class ScoringWeightsTest {

	@Test
	void weightsMustAddUpToOne() {
		Assertions.assertThrows(IllegalArgumentException.class, () -> new ScoringWeights(0.5, 0.5, 0.5, 0, 0));
		Assertions.assertThrows(IllegalArgumentException.class, () -> new ScoringWeights(1.2, -0.2, 0, 0, 0),
				"negative weights are refused even if the sum works out");
		Assertions.assertDoesNotThrow(() -> new ScoringWeights(0.3333, 0.3333, 0.3334, 0, 0));
	}

	@Test
	void weighing() {
		var weights = ScoringWeights.defaults();
		Assertions.assertEquals(10.0, weights.weigh(10, 10, 10, 10, 10), 0.0001);
		Assertions.assertEquals(0.3 * 8 + 0.25 * 6 + 0.2 * 4 + 0.15 * 2 + 0.1 * 10,
				weights.weigh(new Scoring(8, 6, 4, 2, 10, 0, "ignored")), 0.0001,
				"the stored total plays no part in the weighing");
	}

}
