package org.sagebionetworks.sqs.listener;

/**
 * What a poll should do when SQS answers a receive request without a list of
 * messages. SQS omits the list when the queue has nothing to deliver.
 *
 */
public enum MissingMessagesPolicy {

	/**
	 * Treat the response as a failed receive. The poll is logged as an error and
	 * abandoned until the next tick.
	 */
	ERROR,

	/**
	 * Treat the response as a batch of zero messages.
	 */
	EMPTY_BATCH

}
