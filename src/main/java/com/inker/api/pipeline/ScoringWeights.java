package com.inker.api.pipeline;

import com.inker.api.Scoring;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * how much each scoring dimension counts toward a candidate's total. The weights must
 * each be non-negative and add up to one; anything else fails at startup.
 */
@ConfigurationProperties(prefix = "inker.scoring.weights")
public record ScoringWeights(@DefaultValue("0.3") double relevance, @DefaultValue("0.25") double originality,
		@DefaultValue("0.2") double depth, @DefaultValue("0.15") double clarity,
		@DefaultValue("0.1") double engagement) {

	static final double TOLERANCE = 0.001;

	public ScoringWeights {
		for (var weight : new double[] { relevance, originality, depth, clarity, engagement })
			if (weight < 0)
				throw new IllegalArgumentException("scoring weights must not be negative, but got " + weight);
		var sum = relevance + originality + depth + clarity + engagement;
		if (Math.abs(sum - 1.0) > TOLERANCE)
			throw new IllegalArgumentException("scoring weights must add up to 1.0, but they add up to " + sum);
	}

	public static ScoringWeights defaults() {
		return new ScoringWeights(0.3, 0.25, 0.2, 0.15, 0.1);
	}

	public double weigh(double relevance, double originality, double depth, double clarity, double engagement) {
		return relevance * this.relevance + originality * this.originality + depth * this.depth
				+ clarity * this.clarity + engagement * this.engagement;
	}

	public double weigh(Scoring scoring) {
		return this.weigh(scoring.relevance(), scoring.originality(), scoring.depth(), scoring.clarity(),
				scoring.engagement());
	}

}
