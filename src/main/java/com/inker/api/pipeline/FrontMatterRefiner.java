package com.inker.api.pipeline;

import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.LinkedHashMap;

/**
 * wraps the candidate's content, unchanged, in a YAML front-matter block carrying its
 * topic, total score and sources.
 */
class FrontMatterRefiner implements WinnerRefiner {

	private final Yaml yaml;

	FrontMatterRefiner() {
		var options = new DumperOptions();
		options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
		this.yaml = new Yaml(options);
	}

	@Override
	public String refine(ScoredPost winner) {
		var candidate = winner.candidate();
		var frontMatter = new LinkedHashMap<String, Object>();
		frontMatter.put("topic", candidate.topic());
		frontMatter.put("score", BigDecimal.valueOf(winner.score().total()).setScale(2, RoundingMode.HALF_UP));
		frontMatter.put("sources", candidate.sources());
		return "---\n" + this.yaml.dump(frontMatter) + "---\n\n" + candidate.content();
	}

}
