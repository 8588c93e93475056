package org.sagebionetworks.sqs.listener;

import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;

import software.amazon.awssdk.services.sqs.SqsClient;
import software.amazon.awssdk.services.sqs.model.Message;

/**
 * The handle used to run a {@link SqsListenerWorker}. Build one with a
 * {@link SqsListenerClientBuilder}, then call {@link #start()} to poll the
 * queue until the application exits.
 *
 * When auto-ack is disabled, use {@link #acknowledgeMessage(Message)} to
 * delete handled messages. Otherwise the same messages are delivered again
 * once their visibility timeout expires.
 *
 * A client may be shared between threads. Every caller talks to the same
 * worker.
 *
 */
public class SqsListenerClient {

	final SqsListenerWorker worker;
	final SqsClient sqsClient;
	final boolean closeSqsClientOnStop;
	final AtomicBoolean started;

	SqsListenerClient(SqsListenerWorker worker, SqsClient sqsClient, boolean closeSqsClientOnStop) {
		super();
		if (worker == null) {
			throw new IllegalArgumentException("SqsListenerWorker cannot be null");
		}
		this.worker = worker;
		this.sqsClient = sqsClient;
		this.closeSqsClientOnStop = closeSqsClientOnStop;
		this.started = new AtomicBoolean(false);
	}

	/**
	 * Start polling and block until the listener stops. Without a call to
	 * {@link #stop()} from another thread this never returns.
	 *
	 * @throws IllegalStateException
	 *             If this client was already started.
	 * @throws InterruptedException
	 *             If the calling thread is interrupted while waiting. The
	 *             listener keeps running.
	 */
	public void start() throws InterruptedException {
		startAsync();
		worker.awaitTermination();
	}

	/**
	 * Start polling without blocking the calling thread.
	 *
	 * @throws IllegalStateException
	 *             If this client was already started.
	 */
	public void startAsync() {
		if (!started.compareAndSet(false, true)) {
			throw new IllegalStateException("SqsListenerClient for queue: " + getQueueUrl() + " can only be started once");
		}
		worker.start();
	}

	/**
	 * Stop polling. Messages already received are neither drained nor returned
	 * to the queue. Calling this more than once has no effect.
	 */
	public void stop() {
		worker.stop();
		if (closeSqsClientOnStop && sqsClient != null) {
			sqsClient.close();
		}
	}

	public boolean isRunning() {
		return worker.isRunning();
	}

	public String getQueueUrl() {
		return worker.queueUrl;
	}

	/**
	 * Delete a message from the queue. Only needed when auto-ack is disabled.
	 *
	 * The request waits for any poll cycle that is in progress. A handler may
	 * call this for the message it is handling. The delete then runs
	 * immediately on the handler's thread.
	 *
	 * @param message
	 *            A message received by this listener.
	 * @throws NoMessageHandleException
	 *             If the message has no receipt handle.
	 * @throws AckMessageException
	 *             If SQS fails to delete the message.
	 * @throws ListenerStoppedException
	 *             If the listener is not running.
	 * @throws InterruptedException
	 *             If the calling thread is interrupted while waiting.
	 */
	public void acknowledgeMessage(Message message) throws SqsListenerException, InterruptedException {
		if (worker.isCycleThread()) {
			worker.acknowledgeMessage(message);
			return;
		}
		Future<Void> future = worker.submitAcknowledge(message);
		try {
			future.get();
		} catch (CancellationException e) {
			throw new ListenerStoppedException(getQueueUrl(), e);
		} catch (ExecutionException e) {
			// convert to the cause if we can.
			Throwable cause = e.getCause();
			if (cause instanceof SqsListenerException) {
				throw (SqsListenerException) cause;
			}
			if (cause instanceof RuntimeException) {
				throw (RuntimeException) cause;
			}
			throw new SqsListenerException("Unexpected error acknowledging message: " + message.messageId(), cause);
		}
	}

}
