package org.sagebionetworks.sqs.listener;

/**
 * Thrown when a message without a receipt handle is acknowledged. SQS needs
 * the receipt handle to delete a message.
 *
 */
public class NoMessageHandleException extends SqsListenerException {

	private static final long serialVersionUID = 1L;

	public NoMessageHandleException(String messageId) {
		super("Message: " + messageId + " did not contain a message handle to use for acknowledging");
	}

}
