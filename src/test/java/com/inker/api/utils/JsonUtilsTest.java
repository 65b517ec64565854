package com.inker.api.utils;

import com.inker.api.Scoring;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

class JsonUtilsTest {

	@Test
	void stringCollections() {
		Assertions.assertEquals(List.of("a", "b"), JsonUtils.readStringList(JsonUtils.write(List.of("a", "b"))));
		Assertions.assertEquals(Map.of("k", "v"), JsonUtils.readStringMap(JsonUtils.write(Map.of("k", "v"))));
		Assertions.assertTrue(JsonUtils.readStringList(null).isEmpty(), "a null column reads as an empty list");
		Assertions.assertTrue(JsonUtils.readStringMap("  ").isEmpty(), "a blank column reads as an empty map");
	}

	@Test
	void records() {
		var scoring = new Scoring(8, 7, 6, 9, 5, 7.3, "solid");
		Assertions.assertEquals(scoring, JsonUtils.read(JsonUtils.write(scoring), Scoring.class));
	}

}
