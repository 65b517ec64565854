package com.inker.api.pipeline;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.util.List;

/**
 * @param defaultTopics topics a job covers when it doesn't name any
 * @param defaultSources sources a job draws on when it doesn't name any
 * @param defaultNumCandidates candidates to generate when a submission doesn't say
 * @param defaultMaxResults articles per topic and source when a submission doesn't say
 */
@ConfigurationProperties(prefix = "inker.pipeline")
public record PipelineProperties(@DefaultValue("AI software engineering") List<String> defaultTopics,
		@DefaultValue({ "HACKER_NEWS", "WEB", "YOUTUBE" }) List<ArticleSourceType> defaultSources,
		@DefaultValue("3") int defaultNumCandidates, @DefaultValue("10") int defaultMaxResults) {
}
