package org.sagebionetworks.sqs.listener;

/**
 * Thrown when SQS fails to delete an acknowledged message.
 *
 */
public class AckMessageException extends SqsListenerException {

	private static final long serialVersionUID = 1L;

	public AckMessageException(String messageId, Throwable cause) {
		super("Unable to acknowledge message: " + messageId + ": " + cause.getMessage(), cause);
	}

}
