package org.sagebionetworks.sqs.listener;

/**
 * Thrown when a receive request to SQS fails.
 *
 */
public class ReceiveMessagesException extends SqsListenerException {

	private static final long serialVersionUID = 1L;

	public ReceiveMessagesException(String queueUrl, Throwable cause) {
		super("Unable to receive messages from queue: " + queueUrl + ": " + cause.getMessage(), cause);
	}

}
