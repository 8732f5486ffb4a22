package com.tryonai.backend.service.transform;

import com.tryonai.backend.exception.TransformException;

import java.nio.file.Path;

/**
 * Produces the try-on image for a session. May block for seconds to minutes.
 */
public interface TransformClient {

	/**
	 * @return a temporary file holding the produced image; the caller owns and removes it
	 * @throws TransformException when the image could not be produced; its message is user safe
	 */
	Path run(TransformRequest request) throws TransformException;
}
