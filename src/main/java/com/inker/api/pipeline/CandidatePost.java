package com.inker.api.pipeline;

import java.util.List;

public record CandidatePost(String title, String content, List<String> sources, String topic) {

	public CandidatePost {
		sources = sources == null ? List.of() : List.copyOf(sources);
	}

}
