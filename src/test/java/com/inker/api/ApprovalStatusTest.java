package com.inker.api;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

class ApprovalStatusTest {

	@Test
	void transitionsAreClosed() {
		var allowed = Map.of( //
				ApprovalStatus.PENDING,
				Set.of(ApprovalStatus.APPROVED, ApprovalStatus.REJECTED, ApprovalStatus.REVISION_REQUESTED), //
				ApprovalStatus.REVISION_REQUESTED, Set.of(ApprovalStatus.PENDING, ApprovalStatus.APPROVED), //
				ApprovalStatus.APPROVED, Set.<ApprovalStatus>of(), //
				ApprovalStatus.REJECTED, Set.<ApprovalStatus>of());
		for (var from : ApprovalStatus.values())
			for (var to : EnumSet.allOf(ApprovalStatus.class))
				Assertions.assertEquals(allowed.get(from).contains(to), from.canTransitionTo(to),
						() -> from + " -> " + to);
	}

	@Test
	void jobTransitionsOnlyMoveForward() {
		for (var from : JobStatus.values())
			for (var to : JobStatus.values()) {
				var expected = !from.isTerminal() && (to == JobStatus.FAILED || to.ordinal() == from.ordinal() + 1);
				Assertions.assertEquals(expected, from.canTransitionTo(to), () -> from + " -> " + to);
			}
	}

}
