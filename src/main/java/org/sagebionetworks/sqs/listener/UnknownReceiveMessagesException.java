package org.sagebionetworks.sqs.listener;

/**
 * Thrown when SQS answers a receive request without a message list and the
 * listener is configured with {@link MissingMessagesPolicy#ERROR}.
 *
 */
public class UnknownReceiveMessagesException extends SqsListenerException {

	private static final long serialVersionUID = 1L;

	public UnknownReceiveMessagesException(String queueUrl) {
		super("Unable to receive messages from queue: " + queueUrl + ": response did not contain a message list");
	}

}
