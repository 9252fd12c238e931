package org.springaicommunity.github.extractor;

/**
 * A submitted extraction request is missing a required scope field or carries a value
 * that cannot be used. Raised before any worker starts or any network call is made.
 */
public class ExtractionValidationException extends RuntimeException {

	public ExtractionValidationException(String message) {
		super(message);
	}

}
