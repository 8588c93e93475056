package org.sagebionetworks.sqs.listener;

import software.amazon.awssdk.services.sqs.model.Message;

/**
 * Callback invoked by a {@link SqsListenerWorker} for each message received
 * from the listener's queue. Implementations are usually lambdas.
 * 
 * Acknowledgment does not depend on the outcome of this call. When auto-ack
 * is enabled the message is deleted whether this returns normally or throws.
 * When auto-ack is disabled the caller must acknowledge each message with
 * {@link SqsListenerClient#acknowledgeMessage(Message)}.
 * 
 */
@FunctionalInterface
public interface MessageHandler {

	/**
	 * Handle a single message. Called on the worker's thread, one message at a
	 * time, in the order the messages were received. A slow handler delays the
	 * next poll of the queue.
	 * 
	 * @param message
	 *            The message as returned by SQS.
	 * @throws Exception
	 *             Any failure is logged and the next message is handled.
	 */
	public void handleMessage(Message message) throws Exception;

}
