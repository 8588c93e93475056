package org.sagebionetworks.sqs.listener;

import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.http.SdkHttpClient;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.sqs.SqsClient;
import software.amazon.awssdk.services.sqs.SqsClientBuilder;

/**
 * Builds a {@link SqsListenerClient}. Exactly one {@link SqsListener} must be
 * provided. The {@link SqsListenerConfiguration} is optional and defaults to
 * {@link SqsListenerConfiguration#defaults()}.
 *
 * <pre>
 * SqsListenerClient client = SqsListenerClientBuilder.newBuilder(Region.US_EAST_1)
 * 		.listener(new SqsListener(queueUrl, message -&gt; log.info(message.body())))
 * 		.build();
 * client.start();
 * </pre>
 *
 */
public class SqsListenerClientBuilder {

	private final SqsClient sqsClient;
	private final SdkHttpClient httpClient;
	private final AwsCredentialsProvider credentialsProvider;
	private final Region region;
	private SqsListener listener;
	private SqsListenerConfiguration configuration;

	private SqsListenerClientBuilder(SqsClient sqsClient, SdkHttpClient httpClient,
			AwsCredentialsProvider credentialsProvider, Region region) {
		this.sqsClient = sqsClient;
		this.httpClient = httpClient;
		this.credentialsProvider = credentialsProvider;
		this.region = region;
	}

	/**
	 * Use the default AWS credentials chain and HTTP client for the given
	 * region. Each client built gets its own SqsClient, closed when that
	 * client stops.
	 *
	 * @param region
	 * @return
	 */
	public static SqsListenerClientBuilder newBuilder(Region region) {
		if (region == null) {
			throw new IllegalArgumentException("Region cannot be null");
		}
		return new SqsListenerClientBuilder(null, null, null, region);
	}

	/**
	 * Use explicit credentials and HTTP client for the given region. Each
	 * client built gets its own SqsClient, closed when that client stops. The
	 * HTTP client itself is left open.
	 *
	 * @param httpClient
	 *            Sends the signed requests to SQS.
	 * @param credentialsProvider
	 * @param region
	 * @return
	 */
	public static SqsListenerClientBuilder newBuilder(SdkHttpClient httpClient,
			AwsCredentialsProvider credentialsProvider, Region region) {
		if (httpClient == null) {
			throw new IllegalArgumentException("HttpClient cannot be null");
		}
		if (credentialsProvider == null) {
			throw new IllegalArgumentException("CredentialsProvider cannot be null");
		}
		if (region == null) {
			throw new IllegalArgumentException("Region cannot be null");
		}
		return new SqsListenerClientBuilder(null, httpClient, credentialsProvider, region);
	}

	/**
	 * Use an existing SqsClient. The client is not closed when the listener
	 * stops.
	 *
	 * @param sqsClient
	 * @return
	 */
	public static SqsListenerClientBuilder newBuilder(SqsClient sqsClient) {
		return new SqsListenerClientBuilder(sqsClient, null, null, null);
	}

	/**
	 * The queue to listen to and the handler to call for each message.
	 *
	 * @param listener
	 * @return
	 */
	public SqsListenerClientBuilder listener(SqsListener listener) {
		this.listener = listener;
		return this;
	}

	/**
	 * Optional. Defaults to {@link SqsListenerConfiguration#defaults()}.
	 *
	 * @param configuration
	 * @return
	 */
	public SqsListenerClientBuilder configuration(SqsListenerConfiguration configuration) {
		this.configuration = configuration;
		return this;
	}

	/**
	 * @return A client that has not been started.
	 * @throws BuilderValidationException
	 *             If the SqsClient or the listener is missing.
	 */
	public SqsListenerClient build() throws BuilderValidationException {
		if (sqsClient == null && region == null) {
			throw new BuilderValidationException("SqsClient must be set");
		}
		if (listener == null) {
			throw new BuilderValidationException("Listener must be set");
		}
		SqsListenerConfiguration config = configuration != null ? configuration : SqsListenerConfiguration.defaults();
		if (sqsClient != null) {
			return new SqsListenerClient(new SqsListenerWorker(sqsClient, listener, config), sqsClient, false);
		}
		SqsClient ownedClient = createSqsClient();
		return new SqsListenerClient(new SqsListenerWorker(ownedClient, listener, config), ownedClient, true);
	}

	private SqsClient createSqsClient() {
		SqsClientBuilder builder = SqsClient.builder().region(region);
		if (httpClient != null) {
			builder.httpClient(httpClient);
		}
		if (credentialsProvider != null) {
			builder.credentialsProvider(credentialsProvider);
		}
		return builder.build();
	}

}
