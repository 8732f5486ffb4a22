package com.tryonai.backend.service.transform;

import com.tryonai.backend.enums.GarmentCategory;
import lombok.Builder;
import lombok.Value;

import java.util.UUID;

@Value
@Builder
public class TransformRequest {
	UUID sessionId;
	String subjectImageRef;
	String overlayImageRef;
	GarmentCategory category;
}
