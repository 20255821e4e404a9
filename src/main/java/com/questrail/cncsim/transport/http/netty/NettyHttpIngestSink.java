package com.questrail.cncsim.transport.http.netty;

import com.questrail.cncsim.format.WireMessage;
import com.questrail.cncsim.time.WallClock;
import com.questrail.cncsim.transport.ConnectionException;
import com.questrail.cncsim.transport.DeliveryException;
import com.questrail.cncsim.transport.TelemetrySink;
import com.questrail.cncsim.transport.WirePayloadCodec;

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.*;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.http.*;
import io.netty.util.concurrent.DefaultThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * NettyHttpIngestSink
 * =============================================================================
 * Netty-backed {@link TelemetrySink} for an HTTP ingestion API.
 *
 * <h2>Endpoints</h2>
 * <ul>
 *   <li>{@code GET /health}, falling back to {@code GET /}: connectivity probe</li>
 *   <li>{@code POST /api/v1/data}: one {@code {topic, payload, metadata, timestamp}} envelope</li>
 *   <li>{@code POST /api/v1/data/batch}: {@code {messages:[...]}}</li>
 * </ul>
 * Any non-2xx status, I/O failure or timeout fails the attempt.
 *
 * <h2>Architectural Role</h2>
 * Pure transport adapter. It performs one HTTP exchange per call and never
 * retries; the publisher owns retry policy.
 *
 * <h2>Netty containment rule</h2>
 * Netty types (e.g., {@code Channel}, {@code EventLoopGroup}, {@code ByteBuf})
 * MUST NOT escape this package.
 *
 * <h2>Lifecycle</h2>
 * - {@link #connect()} creates the event loop group and probes the endpoint.
 *   A failed probe shuts the group down again before throwing.
 * - {@link #disconnect()} shuts the event loop group down.
 *
 * <p>Event loop threads are named {@code http-ingest-<port>-*}.</p>
 *
 * <p>Each exchange uses its own short-lived connection with
 * {@code Connection: close}. Calls block the caller until the response
 * arrives or {@code requestTimeout} elapses.</p>
 */
public final class NettyHttpIngestSink implements TelemetrySink
{
    private static final Logger log = LoggerFactory.getLogger(NettyHttpIngestSink.class);

    public static final String HEALTH_PATH = "/health";
    public static final String ROOT_PATH = "/";
    public static final String DATA_PATH = "/api/v1/data";
    public static final String BATCH_PATH = "/api/v1/data/batch";

    private static final int MAX_RESPONSE_BYTES = 1024 * 1024;
    private static final String USER_AGENT = "cnc-telemetry-simulator";

    private final String host;
    private final int port;
    private final String basePath;
    private final Duration requestTimeout;
    private final WirePayloadCodec codec;
    private final WallClock wallClock;

    private volatile EventLoopGroup group;

    public NettyHttpIngestSink(URI baseUri,
                               Duration requestTimeout,
                               WirePayloadCodec codec,
                               WallClock wallClock)
    {
        Objects.requireNonNull(baseUri, "baseUri");
        if (!"http".equalsIgnoreCase(baseUri.getScheme())) {
            throw new IllegalArgumentException("Only http:// ingestion URLs are supported: " + baseUri);
        }
        if (baseUri.getHost() == null) {
            throw new IllegalArgumentException("Ingestion URL has no host: " + baseUri);
        }
        this.host = baseUri.getHost();
        this.port = baseUri.getPort() == -1 ? 80 : baseUri.getPort();
        String path = baseUri.getPath() == null ? "" : baseUri.getPath();
        this.basePath = path.endsWith("/") ? path.substring(0, path.length() - 1) : path;
        this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
    }

    @Override
    public synchronized void connect()
    {
        if (group == null) {
            group = new NioEventLoopGroup(1, new DefaultThreadFactory(threadPoolName()));
        }
        try {
            probe();
        }
        catch (RuntimeException e) {
            EventLoopGroup g = group;
            group = null;
            g.shutdownGracefully(0, requestTimeout.toMillis(), TimeUnit.MILLISECONDS)
                    .awaitUninterruptibly(requestTimeout.toMillis());
            throw e;
        }
    }

    private void probe()
    {
        HttpResult health;
        try {
            health = exchange(HttpMethod.GET, HEALTH_PATH, null);
        }
        catch (IOException e) {
            health = null;
            log.debug("Health probe failed: {}", e.getMessage());
        }
        if (health != null && health.isSuccess()) {
            log.info("Connected to ingestion endpoint {}:{} (health {})", host, port, health.status());
            return;
        }

        try {
            HttpResult root = exchange(HttpMethod.GET, ROOT_PATH, null);
            if (!root.isSuccess()) {
                throw new ConnectionException("Ingestion endpoint " + host + ":" + port
                        + " answered " + root.status() + " to connectivity probe");
            }
            log.info("Connected to ingestion endpoint {}:{} (root {})", host, port, root.status());
        }
        catch (IOException e) {
            throw new ConnectionException("Ingestion endpoint " + host + ":" + port
                    + " unreachable: " + e.getMessage(), e);
        }
    }

    String threadPoolName()
    {
        return "http-ingest-" + port;
    }

    @Override
    public void publish(WireMessage message)
    {
        String body = codec.envelopeJson(message, wallClock.now().toEpochMilli());
        post(message.destination(), DATA_PATH, body);
    }

    @Override
    public void publishBatch(List<WireMessage> messages)
    {
        String body = codec.batchJson(messages, wallClock.now().toEpochMilli());
        post("batch[" + messages.size() + "]", BATCH_PATH, body);
    }

    @Override
    public synchronized void disconnect()
    {
        EventLoopGroup g = group;
        group = null;
        if (g != null) {
            g.shutdownGracefully(0, requestTimeout.toMillis(), TimeUnit.MILLISECONDS);
            log.info("Disconnected from ingestion endpoint {}:{}", host, port);
        }
    }

    private void post(String destination, String path, String body)
    {
        HttpResult result;
        try {
            result = exchange(HttpMethod.POST, path, body);
        }
        catch (IOException e) {
            throw new DeliveryException(destination, "POST " + path + " failed: " + e.getMessage(), e);
        }
        if (!result.isSuccess()) {
            throw new DeliveryException(destination,
                    "POST " + path + " answered " + result.status() + ": " + result.body());
        }
    }

    /**
     * Performs one HTTP exchange and blocks for the response.
     */
    HttpResult exchange(HttpMethod method, String path, String body) throws IOException
    {
        EventLoopGroup g = group;
        if (g == null) {
            throw new IOException("sink not connected");
        }

        CompletableFuture<HttpResult> result = new CompletableFuture<>();
        Bootstrap bootstrap = new Bootstrap()
                .group(g)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) requestTimeout.toMillis())
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        ChannelPipeline p = ch.pipeline();
                        p.addLast(new HttpClientCodec());
                        p.addLast(new HttpObjectAggregator(MAX_RESPONSE_BYTES));
                        p.addLast(new ResponseHandler(result));
                    }
                });

        FullHttpRequest request = buildRequest(method, basePath + path, body);
        ChannelFuture connectFuture = bootstrap.connect(host, port);
        connectFuture.addListener((ChannelFutureListener) f -> {
            if (f.isSuccess()) {
                f.channel().writeAndFlush(request).addListener((ChannelFutureListener) w -> {
                    if (!w.isSuccess()) {
                        result.completeExceptionally(w.cause());
                        w.channel().close();
                    }
                });
            }
            else {
                request.release();
                result.completeExceptionally(f.cause());
            }
        });

        try {
            return result.get(requestTimeout.toMillis(), TimeUnit.MILLISECONDS);
        }
        catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            throw new IOException(method + " " + path + ": " + cause.getMessage(), cause);
        }
        catch (TimeoutException e) {
            connectFuture.channel().close();
            throw new IOException(method + " " + path + " timed out after " + requestTimeout.toMillis() + " ms", e);
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            connectFuture.channel().close();
            throw new IOException(method + " " + path + " interrupted", e);
        }
    }

    private FullHttpRequest buildRequest(HttpMethod method, String uri, String body)
    {
        ByteBuf content = body == null
                ? Unpooled.EMPTY_BUFFER
                : Unpooled.copiedBuffer(body, StandardCharsets.UTF_8);

        FullHttpRequest request = new DefaultFullHttpRequest(HttpVersion.HTTP_1_1, method, uri, content);
        HttpHeaders headers = request.headers();
        headers.set(HttpHeaderNames.HOST, host + ":" + port);
        headers.set(HttpHeaderNames.USER_AGENT, USER_AGENT);
        headers.set(HttpHeaderNames.CONNECTION, HttpHeaderValues.CLOSE);
        headers.set(HttpHeaderNames.CONTENT_LENGTH, content.readableBytes());
        if (body != null) {
            headers.set(HttpHeaderNames.CONTENT_TYPE, HttpHeaderValues.APPLICATION_JSON);
        }
        return request;
    }

    /**
     * Status and body of one HTTP response.
     */
    record HttpResult(int status, String body)
    {
        boolean isSuccess() {
            return status >= 200 && status < 300;
        }
    }

    /**
     * ResponseHandler
     * -------------------------------------------------------------------------
     * Completes the exchange future with the aggregated response, or with the
     * failure that closed the channel first.
     */
    private static final class ResponseHandler extends SimpleChannelInboundHandler<FullHttpResponse>
    {
        private final CompletableFuture<HttpResult> result;

        ResponseHandler(CompletableFuture<HttpResult> result)
        {
            this.result = result;
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, FullHttpResponse response)
        {
            String body = response.content().toString(StandardCharsets.UTF_8);
            result.complete(new HttpResult(response.status().code(), body));
            ctx.close();
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx) throws Exception
        {
            result.completeExceptionally(new IOException("connection closed before response"));
            super.channelInactive(ctx);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            result.completeExceptionally(cause);
            ctx.close();
        }
    }
}
