package org.sagebionetworks.sqs.listener;

/**
 * Base of all checked exceptions raised by an SQS listener.
 *
 */
public class SqsListenerException extends Exception {

	private static final long serialVersionUID = 1L;

	public SqsListenerException(String message) {
		super(message);
	}

	public SqsListenerException(String message, Throwable cause) {
		super(message, cause);
	}

}
