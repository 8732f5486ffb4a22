package com.tryonai.backend.enums;

import com.fasterxml.jackson.annotation.JsonValue;
import com.tryonai.backend.exception.InvalidInputException;

import java.util.Arrays;
import java.util.stream.Collectors;

public enum GarmentCategory {
	UPPER_BODY("upper_body"),
	LOWER_BODY("lower_body"),
	DRESSES("dresses");

	public static final String DEFAULT_VALUE = "upper_body";

	private final String value;

	GarmentCategory(String value) {
		this.value = value;
	}

	@JsonValue
	public String getValue() {
		return value;
	}

	public static GarmentCategory fromValue(String raw) {
		if (raw != null) {
			String normalized = raw.trim().toLowerCase();
			for (GarmentCategory category : values()) {
				if (category.value.equals(normalized)) {
					return category;
				}
			}
		}
		throw new InvalidInputException(InvalidInputException.Reason.INVALID_INPUT,
				"Invalid category. Must be one of: " + allowedValues());
	}

	public static String allowedValues() {
		return Arrays.stream(values()).map(GarmentCategory::getValue).collect(Collectors.joining(", "));
	}
}
