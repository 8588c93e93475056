package org.sagebionetworks.sqs.listener;

import java.time.Duration;

/**
 * Configuration information for a {@link SqsListenerWorker}. Every field has a
 * default so {@link Builder#build()} cannot fail.
 * 
 * <ul>
 * <li>checkInterval - How long to wait after one poll completes before the
 * next poll starts. Defaults to {@link #DEFAULT_CHECK_INTERVAL}.</li>
 * <li>autoAck - When true each message is deleted from the queue after the
 * handler is called. Defaults to true.</li>
 * <li>missingMessagesPolicy - How to treat a receive response without a
 * message list. Defaults to {@link MissingMessagesPolicy#ERROR}.</li>
 * </ul>
 *
 */
public class SqsListenerConfiguration {

	public static final Duration DEFAULT_CHECK_INTERVAL = Duration.ofSeconds(10);

	private final Duration checkInterval;
	private final boolean autoAck;
	private final MissingMessagesPolicy missingMessagesPolicy;

	private SqsListenerConfiguration(Builder builder) {
		this.checkInterval = builder.checkInterval;
		this.autoAck = builder.autoAck;
		this.missingMessagesPolicy = builder.missingMessagesPolicy;
	}

	/**
	 * A configuration with every field set to its default.
	 * 
	 * @return
	 */
	public static SqsListenerConfiguration defaults() {
		return builder().build();
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * The delay between the end of one poll and the start of the next.
	 * 
	 * @return
	 */
	public Duration getCheckInterval() {
		return checkInterval;
	}

	/**
	 * Should messages be deleted automatically once handled?
	 * 
	 * @return
	 */
	public boolean isAutoAck() {
		return autoAck;
	}

	public MissingMessagesPolicy getMissingMessagesPolicy() {
		return missingMessagesPolicy;
	}

	@Override
	public String toString() {
		return "SqsListenerConfiguration [checkInterval=" + checkInterval + ", autoAck=" + autoAck
				+ ", missingMessagesPolicy=" + missingMessagesPolicy + "]";
	}

	public static class Builder {

		private Duration checkInterval = DEFAULT_CHECK_INTERVAL;
		private boolean autoAck = true;
		private MissingMessagesPolicy missingMessagesPolicy = MissingMessagesPolicy.ERROR;

		private Builder() {
		}

		/**
		 * How long to wait after one poll completes before the next poll starts.
		 * 
		 * @param checkInterval
		 *            Must be positive.
		 * @return
		 */
		public Builder checkInterval(Duration checkInterval) {
			if (checkInterval == null) {
				throw new IllegalArgumentException("CheckInterval cannot be null");
			}
			if (checkInterval.isNegative() || checkInterval.isZero()) {
				throw new IllegalArgumentException("CheckInterval must be greater than zero");
			}
			this.checkInterval = checkInterval;
			return this;
		}

		/**
		 * When set to false, messages stay on the queue until they are passed to
		 * {@link SqsListenerClient#acknowledgeMessage(software.amazon.awssdk.services.sqs.model.Message)}.
		 * Unacknowledged messages are redelivered once their visibility timeout
		 * expires.
		 * 
		 * @param autoAck
		 * @return
		 */
		public Builder autoAck(boolean autoAck) {
			this.autoAck = autoAck;
			return this;
		}

		public Builder missingMessagesPolicy(MissingMessagesPolicy missingMessagesPolicy) {
			if (missingMessagesPolicy == null) {
				throw new IllegalArgumentException("MissingMessagesPolicy cannot be null");
			}
			this.missingMessagesPolicy = missingMessagesPolicy;
			return this;
		}

		public SqsListenerConfiguration build() {
			return new SqsListenerConfiguration(this);
		}
	}

}
