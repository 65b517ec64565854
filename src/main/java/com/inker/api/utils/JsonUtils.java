package com.inker.api.utils;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.config.BeanDefinition;
import org.springframework.context.annotation.Role;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.stereotype.Component;

import java.io.UncheckedIOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * have Spring create an instance of this and we'll capture the {@link ObjectMapper om} in
 * a static variable. Until then (in plain unit tests, say) a default mapper with the
 * {@code java.time} module registered does the work.
 */
@Component
@Role(BeanDefinition.ROLE_INFRASTRUCTURE)
public class JsonUtils {

	private static final ParameterizedTypeReference<List<String>> STRING_LIST = new ParameterizedTypeReference<>() {
	};

	private static final ParameterizedTypeReference<Map<String, String>> STRING_MAP = new ParameterizedTypeReference<>() {
	};

	private static final AtomicReference<ObjectMapper> OBJECT_MAPPER_ATOMIC_REFERENCE = new AtomicReference<>(
			new ObjectMapper().findAndRegisterModules()
				.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES));

	JsonUtils(ObjectMapper objectMapper) {
		OBJECT_MAPPER_ATOMIC_REFERENCE.set(objectMapper);
	}

	public static ObjectMapper mapper() {
		return OBJECT_MAPPER_ATOMIC_REFERENCE.get();
	}

	public static <T> T read(String json, ParameterizedTypeReference<T> ptr) {
		var om = OBJECT_MAPPER_ATOMIC_REFERENCE.get();
		try {
			return om.readValue(json, om.getTypeFactory().constructType(ptr.getType()));
		} //
		catch (JsonProcessingException e) {
			throw new UncheckedIOException(e);
		}
	}

	public static <T> T read(String json, Class<T> clzz) {
		try {
			return OBJECT_MAPPER_ATOMIC_REFERENCE.get().readValue(json, clzz);
		} //
		catch (JsonProcessingException e) {
			throw new UncheckedIOException(e);
		}
	}

	public static String write(Object o) {
		try {
			return OBJECT_MAPPER_ATOMIC_REFERENCE.get().writeValueAsString(o);
		} //
		catch (JsonProcessingException e) {
			throw new UncheckedIOException(e);
		}
	}

	public static List<String> readStringList(String json) {
		if (json == null || json.isBlank())
			return List.of();
		return read(json, STRING_LIST);
	}

	public static Map<String, String> readStringMap(String json) {
		if (json == null || json.isBlank())
			return Map.of();
		return read(json, STRING_MAP);
	}

}
