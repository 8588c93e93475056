package org.sagebionetworks.sqs.listener;

/**
 * Thrown when a request is sent to a listener that is not running.
 *
 */
public class ListenerStoppedException extends SqsListenerException {

	private static final long serialVersionUID = 1L;

	public ListenerStoppedException(String queueUrl) {
		super("Listener has stopped for queue: " + queueUrl);
	}

	public ListenerStoppedException(String queueUrl, Throwable cause) {
		super("Listener has stopped for queue: " + queueUrl, cause);
	}

}
