package com.inker.api.feedback;

import com.inker.api.ApprovalStatus;
import com.inker.api.BlogPost;
import com.inker.api.HistoryAction;
import com.inker.api.JobHistoryEntry;
import com.inker.api.JobStats;
import com.inker.api.NotFoundException;
import com.inker.api.ValidationException;
import com.inker.api.pipeline.ScoringWeights;
import com.inker.api.storage.PostTransition;
import com.inker.api.storage.Storage;
import com.inker.api.utils.DateUtils;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
class DefaultFeedbackService implements FeedbackService {

	private static final Set<HistoryAction> DECISIONS = Set.of(HistoryAction.APPROVED, HistoryAction.REJECTED,
			HistoryAction.REVISION_REQUESTED);

	private final Logger log = LoggerFactory.getLogger(getClass());

	private final Storage storage;

	private final ScoringWeights weights;

	DefaultFeedbackService(Storage storage, ScoringWeights weights) {
		this.storage = storage;
		this.weights = weights;
	}

	@Override
	public FeedbackResponse approvePost(ApprovalRequest request) {
		var postId = requirePostId(request == null ? null : request.postId());
		var metadata = FeedbackMetadata.encode(List.of(), request.ratings());
		var transition = this.storage.approvePost(postId, request.actor(), request.feedback(), metadata);
		return this.respond(postId, transition);
	}

	@Override
	public FeedbackResponse rejectPost(RejectionRequest request) {
		var postId = requirePostId(request == null ? null : request.postId());
		requireFeedback(request.feedback(), "rejecting");
		var metadata = FeedbackMetadata.encode(request.categories(), request.ratings());
		var transition = this.storage.rejectPost(postId, request.actor(), request.feedback(), metadata);
		return this.respond(postId, transition);
	}

	@Override
	public FeedbackResponse requestRevision(RevisionRequest request) {
		var postId = requirePostId(request == null ? null : request.postId());
		requireFeedback(request.feedback(), "requesting a revision of");
		var metadata = FeedbackMetadata.encode(request.categories(), request.ratings());
		var transition = this.storage.requestRevision(postId, request.actor(), request.feedback(), metadata);
		return this.respond(postId, transition);
	}

	@Override
	public FeedbackResponse publishPost(String postId, @Nullable String actor) {
		var transition = this.storage.publishPost(requirePostId(postId), actor);
		return this.respond(postId, transition);
	}

	private FeedbackResponse respond(String postId, Optional<PostTransition> transition) {
		var done = transition.orElseThrow(() -> new NotFoundException("post", postId));
		var entry = done.historyEntry();
		this.log.info("post [{}] {} -> {} by {}", postId, done.previousStatus().value(), entry.newStatus(),
				entry.actor() == null ? "an anonymous editor" : entry.actor());
		return new FeedbackResponse(postId, done.previousStatus(), entry.newStatus(), entry.id());
	}

	private static String requirePostId(@Nullable String postId) {
		if (postId == null || postId.isBlank())
			throw new ValidationException("a post id is required");
		return postId;
	}

	private static void requireFeedback(@Nullable String feedback, String what) {
		if (feedback == null || feedback.isBlank())
			throw new ValidationException("feedback is required when " + what + " a post");
	}

	@Override
	public Optional<BlogPost> getPost(String postId) {
		return this.storage.getPost(postId);
	}

	@Override
	public List<BlogPost> listPosts(@Nullable ApprovalStatus status, @Nullable String topic, int limit, int offset) {
		return this.storage.listPosts(status, topic, limit, offset);
	}

	@Override
	public List<JobHistoryEntry> getPostHistory(String postId) {
		return this.storage.getPostHistory(postId);
	}

	@Override
	public List<FeedbackEntry> getPostFeedback(String postId) {
		var post = this.storage.getPost(postId).orElse(null);
		return this.feedback(postId, post);
	}

	private List<FeedbackEntry> feedback(String postId, @Nullable BlogPost post) {
		return this.storage.getPostHistory(postId)
			.stream()
			.filter(entry -> DECISIONS.contains(entry.action()))
			.map(entry -> new FeedbackEntry(entry.id(), postId, post == null ? entry.jobId() : post.jobId(),
					entry.action(), entry.feedback(), FeedbackMetadata.categories(entry.metadata()),
					FeedbackMetadata.ratings(entry.metadata()), entry.actor(),
					post == null ? null : post.scoring(), post == null ? null : post.topic(),
					post == null ? null : post.wordCount(), entry.createdAt()))
			.toList();
	}

	@Override
	public FeedbackStats getFeedbackStats() {
		var posts = this.allPosts();
		var entries = new ArrayList<FeedbackEntry>();
		var hoursToDecision = new ArrayList<Double>();
		for (var post : posts) {
			var feedback = this.feedback(post.id(), post);
			entries.addAll(feedback);
			if (!feedback.isEmpty())
				hoursToDecision.add(DateUtils.hoursBetween(post.createdAt(), feedback.get(0).createdAt()));
		}

		var approvals = count(entries, HistoryAction.APPROVED);
		var rejections = count(entries, HistoryAction.REJECTED);
		var revisions = count(entries, HistoryAction.REVISION_REQUESTED);

		var averageRatings = new EnumMap<FeedbackCategory, Double>(FeedbackCategory.class);
		entries.stream()
			.flatMap(entry -> entry.ratings().stream())
			.collect(Collectors.groupingBy(FeedbackRating::category,
					Collectors.averagingInt(FeedbackRating::score)))
			.forEach(averageRatings::put);

		var commonRejectionCategories = entries.stream()
			.filter(entry -> entry.action() != HistoryAction.APPROVED)
			.flatMap(entry -> entry.categories().stream())
			.collect(Collectors.groupingBy(Function.identity(), Collectors.counting()))
			.entrySet()
			.stream()
			.sorted(Map.Entry.<FeedbackCategory, Long>comparingByValue()
				.reversed()
				.thenComparing(Map.Entry.<FeedbackCategory, Long>comparingByKey()))
			.map(Map.Entry::getKey)
			.toList();

		var byTopic = new TreeMap<String, FeedbackStats.TopicFeedback>();
		posts.stream().collect(Collectors.groupingBy(BlogPost::topic)).forEach((topic, topicPosts) -> {
			var approved = countPosts(topicPosts, ApprovalStatus.APPROVED);
			byTopic.put(topic,
					new FeedbackStats.TopicFeedback(topicPosts.size(), approved,
							countPosts(topicPosts, ApprovalStatus.REJECTED),
							countPosts(topicPosts, ApprovalStatus.REVISION_REQUESTED),
							JobStats.percentage(approved, topicPosts.size())));
		});

		return new FeedbackStats(entries.size(), approvals, rejections, revisions,
				JobStats.percentage(countPosts(posts, ApprovalStatus.APPROVED), posts.size()),
				hoursToDecision.stream().mapToDouble(Double::doubleValue).average(), averageRatings,
				commonRejectionCategories, byTopic, this.averageScore(posts, ApprovalStatus.APPROVED),
				this.averageScore(posts, ApprovalStatus.REJECTED));
	}

	private OptionalDouble averageScore(List<BlogPost> posts, ApprovalStatus status) {
		return posts.stream()
			.filter(post -> post.approvalStatus() == status && post.scoring() != null)
			.mapToDouble(post -> this.weights.weigh(post.scoring()))
			.average();
	}

	@Override
	public List<LearningExample> getLearningData(int limit) {
		if (limit < 0)
			throw new ValidationException("limit must not be negative, but was " + limit);
		return this.allPosts()
			.stream()
			.filter(post -> post.approvalStatus() == ApprovalStatus.APPROVED
					|| post.approvalStatus() == ApprovalStatus.REJECTED)
			.sorted(Comparator.comparing(BlogPost::updatedAt).reversed())
			.limit(Math.min(limit, Storage.MAX_PAGE_SIZE))
			.map(post -> new LearningExample(post.id(), post.title(), post.topic(), post.approvalStatus(),
					post.approvalFeedback(), post.wordCount(), post.scoring(),
					post.scoring() == null ? null : this.weights.weigh(post.scoring())))
			.toList();
	}

	private List<BlogPost> allPosts() {
		var posts = new ArrayList<BlogPost>();
		for (var offset = 0;; offset += Storage.MAX_PAGE_SIZE) {
			var page = this.storage.listPosts(null, null, Storage.MAX_PAGE_SIZE, offset);
			posts.addAll(page);
			if (page.size() < Storage.MAX_PAGE_SIZE)
				return posts;
		}
	}

	private static long count(List<FeedbackEntry> entries, HistoryAction action) {
		return entries.stream().filter(entry -> entry.action() == action).count();
	}

	private static long countPosts(List<BlogPost> posts, ApprovalStatus status) {
		return posts.stream().filter(post -> post.approvalStatus() == status).count();
	}

}
