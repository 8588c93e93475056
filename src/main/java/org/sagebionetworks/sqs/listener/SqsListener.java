package org.sagebionetworks.sqs.listener;

/**
 * Binds the URL of an SQS queue to the {@link MessageHandler} that should be
 * called for each message received from that queue.
 *
 */
public class SqsListener {

	private final String queueUrl;
	private final MessageHandler handler;

	/**
	 * @param queueUrl
	 *            URL of the SQS queue to listen to.
	 * @param handler
	 *            Called for each message received from the queue.
	 */
	public SqsListener(String queueUrl, MessageHandler handler) {
		if (queueUrl == null) {
			throw new IllegalArgumentException("QueueUrl cannot be null");
		}
		if (handler == null) {
			throw new IllegalArgumentException("Handler cannot be null");
		}
		this.queueUrl = queueUrl;
		this.handler = handler;
	}

	public String getQueueUrl() {
		return queueUrl;
	}

	public MessageHandler getHandler() {
		return handler;
	}

	@Override
	public String toString() {
		return "SqsListener [queueUrl=" + queueUrl + "]";
	}

}
