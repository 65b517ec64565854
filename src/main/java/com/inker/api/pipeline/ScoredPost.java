package com.inker.api.pipeline;

import com.inker.api.Scoring;

public record ScoredPost(CandidatePost candidate, Scoring score) {
}
