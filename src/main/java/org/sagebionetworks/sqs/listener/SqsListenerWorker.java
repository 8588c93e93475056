package org.sagebionetworks.sqs.listener;

import java.util.Collections;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import software.amazon.awssdk.services.sqs.SqsClient;
import software.amazon.awssdk.services.sqs.model.DeleteMessageRequest;
import software.amazon.awssdk.services.sqs.model.Message;
import software.amazon.awssdk.services.sqs.model.ReceiveMessageRequest;
import software.amazon.awssdk.services.sqs.model.ReceiveMessageResponse;

/**
 * Polls a single SQS queue on a timer and passes each received message to the
 * listener's {@link MessageHandler}.
 *
 * Each tick of the timer runs one cycle: receive a batch of messages, call the
 * handler for each message in order, then delete each handled message when
 * auto-ack is enabled. The timer is only re-armed once a cycle completes, so
 * the time between two polls is the check interval plus however long the
 * previous cycle took. Cycles never overlap.
 *
 * All work, including manual acknowledgments submitted with
 * {@link #submitAcknowledge(Message)}, runs on a single thread owned by this
 * worker. Failures within a cycle are logged and never stop the worker. Only
 * {@link #stop()} does that.
 *
 */
public class SqsListenerWorker {

	private static final Logger log = LogManager
			.getLogger(SqsListenerWorker.class);

	/**
	 * The states of a single poll cycle. STOPPED is terminal.
	 */
	public enum CycleState {
		IDLE, FETCHING, DISPATCHING, ACKNOWLEDGING, STOPPED
	}

	final SqsClient sqsClient;
	final SqsListener listener;
	final SqsListenerConfiguration configuration;
	final String queueUrl;
	final ScheduledExecutorService scheduler;
	final AtomicReference<CycleState> cycleState;
	volatile ScheduledFuture<?> pendingTimer;
	volatile Thread cycleThread;
	volatile boolean started;

	/**
	 * @param sqsClient
	 *            An SqsClient configured with credentials and region.
	 * @param listener
	 *            The queue to poll and the handler to call.
	 * @param configuration
	 *            Configuration information for this worker.
	 */
	public SqsListenerWorker(SqsClient sqsClient, SqsListener listener,
			SqsListenerConfiguration configuration) {
		this(sqsClient, listener, configuration, newScheduler(listener));
	}

	SqsListenerWorker(SqsClient sqsClient, SqsListener listener,
			SqsListenerConfiguration configuration,
			ScheduledExecutorService scheduler) {
		super();
		if (sqsClient == null) {
			throw new IllegalArgumentException("SqsClient cannot be null");
		}
		if (listener == null) {
			throw new IllegalArgumentException("SqsListener cannot be null");
		}
		if (configuration == null) {
			throw new IllegalArgumentException(
					"SqsListenerConfiguration cannot be null");
		}
		if (scheduler == null) {
			throw new IllegalArgumentException("Scheduler cannot be null");
		}
		this.sqsClient = sqsClient;
		this.listener = listener;
		this.configuration = configuration;
		this.queueUrl = listener.getQueueUrl();
		this.scheduler = scheduler;
		this.cycleState = new AtomicReference<CycleState>(CycleState.IDLE);
	}

	private static ScheduledExecutorService newScheduler(SqsListener listener) {
		if (listener == null) {
			throw new IllegalArgumentException("SqsListener cannot be null");
		}
		final String threadName = "sqs-listener-" + listener.getQueueUrl();
		return Executors.newSingleThreadScheduledExecutor(runnable -> new Thread(runnable, threadName));
	}

	/**
	 * Arm the timer for the first poll. The first poll happens one check
	 * interval from now.
	 */
	public synchronized void start() {
		if (started) {
			throw new IllegalStateException("SqsListenerWorker for queue: " + queueUrl + " has already been started");
		}
		if (isStopped()) {
			throw new IllegalStateException("SqsListenerWorker for queue: " + queueUrl + " has been stopped");
		}
		started = true;
		log.info("SqsListenerWorker started for queue: " + queueUrl + " with " + configuration);
		arm();
	}

	/**
	 * Stop polling. A cycle that is in progress is interrupted and nothing is
	 * drained. Acknowledgments still waiting for the worker thread are cancelled.
	 */
	public synchronized void stop() {
		if (cycleState.getAndSet(CycleState.STOPPED) == CycleState.STOPPED) {
			return;
		}
		ScheduledFuture<?> timer = pendingTimer;
		if (timer != null) {
			timer.cancel(false);
		}
		for (Runnable waiting : scheduler.shutdownNow()) {
			if (waiting instanceof Future) {
				((Future<?>) waiting).cancel(false);
			}
		}
		log.info("SqsListenerWorker stopped for queue: " + queueUrl);
	}

	/**
	 * Block until the worker's thread has terminated, which only happens after
	 * {@link #stop()}.
	 *
	 * @throws InterruptedException
	 */
	public void awaitTermination() throws InterruptedException {
		while (!scheduler.awaitTermination(1, TimeUnit.DAYS)) {
			log.debug("SqsListenerWorker still running for queue: " + queueUrl);
		}
	}

	/**
	 * @return True if the worker has been started and not yet stopped.
	 */
	public boolean isRunning() {
		return started && !isStopped() && !scheduler.isShutdown();
	}

	public boolean isStopped() {
		return cycleState.get() == CycleState.STOPPED;
	}

	public CycleState getCycleState() {
		return cycleState.get();
	}

	/**
	 * @return True if the current thread is running a poll cycle of this worker,
	 *         such as a handler calling back into the listener.
	 */
	public boolean isCycleThread() {
		return Thread.currentThread() == cycleThread;
	}

	/**
	 * Schedule the next tick one check interval from now.
	 */
	void arm() {
		if (isStopped()) {
			return;
		}
		try {
			pendingTimer = scheduler.schedule(this::tick,
					configuration.getCheckInterval().toMillis(),
					TimeUnit.MILLISECONDS);
		} catch (RejectedExecutionException e) {
			log.debug("Timer not armed for queue: " + queueUrl + " because the worker has stopped", e);
		}
	}

	/**
	 * Called by the timer. Runs one cycle then re-arms the timer, whatever the
	 * outcome of the cycle.
	 */
	void tick() {
		try {
			runCycle();
		} catch (Throwable e) {
			log.error("Unexpected error polling queue: " + queueUrl, e);
		} finally {
			arm();
		}
	}

	/**
	 * Run a single fetch, dispatch, acknowledge cycle on the calling thread.
	 * Does not re-arm the timer.
	 */
	public void runCycle() {
		if (isStopped()) {
			return;
		}
		cycleThread = Thread.currentThread();
		try {
			List<Message> messages = fetchMessages();
			dispatchMessages(messages);
			if (configuration.isAutoAck()) {
				acknowledgeMessages(messages);
			}
		} catch (SqsListenerException e) {
			log.error("Error when handling messages for queue: " + queueUrl, e);
		} finally {
			cycleThread = null;
			transitionTo(CycleState.IDLE);
		}
	}

	/**
	 * Receive one batch of messages from the queue. Only the queue URL is set on
	 * the request so the queue's own defaults apply.
	 *
	 * @return
	 * @throws ReceiveMessagesException
	 *             If the request to SQS fails.
	 * @throws UnknownReceiveMessagesException
	 *             If the response has no message list and the configured policy
	 *             is {@link MissingMessagesPolicy#ERROR}.
	 */
	List<Message> fetchMessages() throws SqsListenerException {
		transitionTo(CycleState.FETCHING);
		log.debug("Receiving messages from queue: " + queueUrl);
		ReceiveMessageResponse response;
		try {
			response = sqsClient.receiveMessage(ReceiveMessageRequest.builder()
					.queueUrl(queueUrl)
					.build());
		} catch (RuntimeException e) {
			throw new ReceiveMessagesException(queueUrl, e);
		}
		if (response == null || !response.hasMessages()) {
			if (configuration.getMissingMessagesPolicy() == MissingMessagesPolicy.EMPTY_BATCH) {
				return Collections.emptyList();
			}
			throw new UnknownReceiveMessagesException(queueUrl);
		}
		List<Message> messages = response.messages();
		log.debug("Received " + messages.size() + " message(s) from queue: " + queueUrl);
		return messages;
	}

	/**
	 * Pass each message to the handler in order. A failing handler does not
	 * prevent the remaining messages from being handled.
	 *
	 * @param messages
	 */
	void dispatchMessages(List<Message> messages) {
		transitionTo(CycleState.DISPATCHING);
		MessageHandler handler = listener.getHandler();
		for (Message message : messages) {
			if (isStopped()) {
				return;
			}
			try {
				handler.handleMessage(message);
			} catch (InterruptedException e) {
				if (isStopped()) {
					Thread.currentThread().interrupt();
					return;
				}
				// the flag stays clear so the deletes that follow are not aborted.
				log.error("Handler interrupted for message: " + message.messageId() + " from queue: " + queueUrl, e);
			} catch (Exception e) {
				log.error("Handler failed for message: " + message.messageId() + " from queue: " + queueUrl, e);
			}
		}
	}

	/**
	 * Delete each message that has a receipt handle. Each delete is independent
	 * of the others and failures are only logged.
	 *
	 * @param messages
	 */
	void acknowledgeMessages(List<Message> messages) {
		transitionTo(CycleState.ACKNOWLEDGING);
		for (Message message : messages) {
			if (isStopped()) {
				return;
			}
			if (message.receiptHandle() == null) {
				log.warn("Message: " + message.messageId() + " from queue: " + queueUrl + " has no receipt handle and will not be acknowledged");
				continue;
			}
			try {
				deleteMessage(message);
			} catch (RuntimeException e) {
				log.error("Unable to acknowledge message: " + message.messageId() + " from queue: " + queueUrl, e);
			}
		}
	}

	/**
	 * Delete the given message from the queue, reporting any failure to the
	 * caller.
	 *
	 * @param message
	 * @throws NoMessageHandleException
	 *             If the message has no receipt handle. SQS is not called.
	 * @throws AckMessageException
	 *             If the delete request to SQS fails, including a client that
	 *             has already been closed.
	 */
	public void acknowledgeMessage(Message message) throws NoMessageHandleException, AckMessageException {
		if (message == null) {
			throw new IllegalArgumentException("Message cannot be null");
		}
		if (message.receiptHandle() == null) {
			throw new NoMessageHandleException(message.messageId());
		}
		try {
			deleteMessage(message);
		} catch (RuntimeException e) {
			throw new AckMessageException(message.messageId(), e);
		}
	}

	/**
	 * Queue an acknowledgment to run on the worker's thread after any work
	 * already waiting there.
	 *
	 * @param message
	 * @return Completes when the message has been deleted. Fails with the
	 *         exception thrown by {@link #acknowledgeMessage(Message)} or is
	 *         cancelled if the worker stops first.
	 * @throws ListenerStoppedException
	 *             If the worker is not running.
	 */
	public Future<Void> submitAcknowledge(final Message message) throws ListenerStoppedException {
		if (!isRunning()) {
			throw new ListenerStoppedException(queueUrl);
		}
		try {
			return scheduler.submit(() -> {
				acknowledgeMessage(message);
				return null;
			});
		} catch (RejectedExecutionException e) {
			throw new ListenerStoppedException(queueUrl, e);
		}
	}

	/**
	 * Delete the given message from the queue.
	 *
	 * @param message
	 */
	protected void deleteMessage(Message message) {
		this.sqsClient.deleteMessage(DeleteMessageRequest.builder()
				.queueUrl(queueUrl)
				.receiptHandle(message.receiptHandle())
				.build());
	}

	private void transitionTo(CycleState next) {
		cycleState.getAndUpdate(current -> current == CycleState.STOPPED ? CycleState.STOPPED : next);
	}

}
