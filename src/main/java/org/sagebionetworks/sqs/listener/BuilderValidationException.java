package org.sagebionetworks.sqs.listener;

/**
 * Thrown by {@link SqsListenerClientBuilder#build()} when a required field was
 * never set.
 *
 */
public class BuilderValidationException extends SqsListenerException {

	private static final long serialVersionUID = 1L;

	public BuilderValidationException(String message) {
		super(message);
	}

}
