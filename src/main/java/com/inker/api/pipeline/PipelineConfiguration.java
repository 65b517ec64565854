package com.inker.api.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
class PipelineConfiguration {

	private final Logger log = LoggerFactory.getLogger(getClass());

	@Bean
	Pipeline pipeline(ObjectProvider<ArticleSource> sources, ObjectProvider<CandidateGenerator> generator,
			ObjectProvider<CandidateScorer> scorer, ObjectProvider<WinnerRefiner> refiner) {
		var fetcher = new CompositeArticleFetcher(sources.orderedStream().toList());
		return new Pipeline(fetcher, generator.getIfAvailable(this::unconfiguredGenerator),
				scorer.getIfAvailable(this::unconfiguredScorer), refiner.getIfAvailable(FrontMatterRefiner::new));
	}

	private CandidateGenerator unconfiguredGenerator() {
		this.log.warn("there is no CandidateGenerator bean, so every job will fail at the generation stage");
		return (articles, numCandidates) -> {
			throw new GenerationException("no candidate generator is configured");
		};
	}

	private CandidateScorer unconfiguredScorer() {
		this.log.warn("there is no CandidateScorer bean, so every job will fail at the scoring stage");
		return candidates -> {
			throw new ScoringException("no candidate scorer is configured");
		};
	}

}
