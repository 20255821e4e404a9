package com.questrail.cncsim.publish;

import com.questrail.cncsim.format.WireMessage;
import com.questrail.cncsim.time.Sleeper;
import com.questrail.cncsim.transport.ConnectionException;
import com.questrail.cncsim.transport.DeliveryException;
import com.questrail.cncsim.transport.TelemetrySink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * PublisherClient
 * =============================================================================
 * Reliable delivery on top of a single-attempt {@link TelemetrySink}.
 *
 * <h2>Retry</h2>
 * Each publish is attempted up to {@link RetryPolicy#maxAttempts()} times.
 * Between attempts the caller's thread sleeps for
 * {@link RetryPolicy#backoffFor(int)} through the injected {@link Sleeper}.
 * When the last attempt fails a {@link DeliveryException} naming the
 * destination and carrying the last cause is thrown.
 *
 * <h2>Connection</h2>
 * {@link #connect()} is attempted exactly once. A {@link ConnectionException}
 * propagates unchanged.
 *
 * <h2>Threading</h2>
 * Stateless apart from its collaborators; safe to call from the publish
 * executor's threads concurrently as long as the sink is.
 */
public final class PublisherClient
{
    private static final Logger log = LoggerFactory.getLogger(PublisherClient.class);

    private final TelemetrySink sink;
    private final RetryPolicy retryPolicy;
    private final Sleeper sleeper;

    public PublisherClient(TelemetrySink sink, RetryPolicy retryPolicy, Sleeper sleeper) {
        this.sink = Objects.requireNonNull(sink, "sink");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    public RetryPolicy retryPolicy() {
        return retryPolicy;
    }

    /**
     * @throws ConnectionException if the sink cannot connect
     */
    public void connect() {
        sink.connect();
    }

    public void publish(WireMessage message) {
        Objects.requireNonNull(message, "message");
        deliver(message.destination(), () -> sink.publish(message));
    }

    /**
     * Publishes {@code messages} as one unit; the whole batch is retried on
     * failure. An empty batch is a no-op.
     */
    public void publishBatch(List<WireMessage> messages) {
        Objects.requireNonNull(messages, "messages");
        if (messages.isEmpty()) {
            return;
        }
        List<WireMessage> batch = List.copyOf(messages);
        deliver("batch[" + batch.size() + "]", () -> sink.publishBatch(batch));
    }

    public void disconnect() {
        sink.disconnect();
    }

    private void deliver(String destination, Runnable attempt) {
        RuntimeException last = null;
        for (int n = 1; n <= retryPolicy.maxAttempts(); n++) {
            try {
                attempt.run();
                if (n > 1) {
                    log.debug("Delivered {} on attempt {}", destination, n);
                }
                return;
            } catch (RuntimeException e) {
                last = e;
                if (n == retryPolicy.maxAttempts()) {
                    log.warn("Attempt {}/{} for {} failed ({}); giving up",
                            n, retryPolicy.maxAttempts(), destination, e.getMessage());
                    break;
                }
                Duration delay = retryPolicy.backoffFor(n);
                log.warn("Attempt {}/{} for {} failed ({}); retrying in {} ms",
                        n, retryPolicy.maxAttempts(), destination, e.getMessage(), delay.toMillis());
                backoff(destination, delay, e);
            }
        }
        throw new DeliveryException(destination,
                "Failed to publish to " + destination + " after " + retryPolicy.maxAttempts()
                        + " attempts: " + (last == null ? "unknown" : last.getMessage()),
                last);
    }

    private void backoff(String destination, Duration delay, RuntimeException cause) {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            DeliveryException ex = new DeliveryException(destination,
                    "Interrupted while backing off for " + destination, ie);
            ex.addSuppressed(cause);
            throw ex;
        }
    }
}
