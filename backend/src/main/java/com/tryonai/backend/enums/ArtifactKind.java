package com.tryonai.backend.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Kind of artifact attached to a session, with the folder it is stored under
 * and the tag used in its file name.
 */
@Getter
@RequiredArgsConstructor
public enum ArtifactKind {
	SUBJECT("users", "user"),
	OVERLAY("garments", "garment"),
	OUTPUT("outputs", "output");

	private final String folder;
	private final String tag;
}
