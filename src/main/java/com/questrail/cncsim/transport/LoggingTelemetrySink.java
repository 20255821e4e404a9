package com.questrail.cncsim.transport;

import com.questrail.cncsim.format.WireMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Dry-run sink: writes every message to the log instead of a transport.
 * Always connects and never fails.
 */
public final class LoggingTelemetrySink implements TelemetrySink
{
    private static final Logger log = LoggerFactory.getLogger(LoggingTelemetrySink.class);

    private final WirePayloadCodec codec;
    private final AtomicLong written = new AtomicLong();

    public LoggingTelemetrySink(WirePayloadCodec codec) {
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    @Override
    public void connect() {
        log.info("Logging sink ready (dry run, nothing leaves this process)");
    }

    @Override
    public void publish(WireMessage message) {
        written.incrementAndGet();
        log.info("{} {}", message.destination(), codec.payloadJson(message));
    }

    @Override
    public void publishBatch(List<WireMessage> messages) {
        log.info("Batch of {} messages", messages.size());
        for (WireMessage m : messages) {
            publish(m);
        }
    }

    @Override
    public void disconnect() {
        log.info("Logging sink closed after {} messages", written.get());
    }

    public long messagesWritten() {
        return written.get();
    }
}
