/*
 * Copyright 2026 The Netty Project
 *
 * The Netty Project licenses this file to you under the Apache License,
 * version 2.0 (the "License"); you may not use this file except in compliance
 * with the License. You may obtain a copy of the License at:
 *
 *   https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS, WITHOUT
 * WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied. See the
 * License for the specific language governing permissions and limitations
 * under the License.
 */
package io.dnsi.client;

import io.netty.channel.EventLoopGroup;
import io.netty.handler.codec.dns.DnsRecordType;
import io.netty.handler.codec.dns.DnsResponse;
import io.netty.util.concurrent.EventExecutor;
import io.netty.util.concurrent.Future;
import io.netty.util.concurrent.FutureListener;
import io.netty.util.concurrent.Promise;
import io.netty.util.concurrent.PromiseNotifier;
import io.netty.util.internal.logging.InternalLogger;
import io.netty.util.internal.logging.InternalLoggerFactory;

import java.util.ArrayList;
import java.util.List;

import static io.netty.util.internal.ObjectUtil.checkNotNull;

/**
 * Dispatches requests to an ordered list of {@link Server}s.
 * <p>
 * The servers are tried one after the other: the first successful answer completes the request, a failure moves
 * on to the next server, and if every server failed the error of the last one is reported. Each server is first
 * given the chance to fall back within its own transport (a truncated UDP response is retried over TCP).
 * <p>
 * The client keeps no per-request state; all methods may be called concurrently.
 */
public final class Client {

    private static final InternalLogger logger = InternalLoggerFactory.getInstance(Client.class);

    private final EventExecutor executor;
    private final DnsExchanger exchanger;

    /**
     * Creates a new client performing its exchanges on NIO channels of the given group.
     */
    public Client(EventLoopGroup group) {
        this(group.next(), new NettyDnsExchanger(group));
    }

    /**
     * Creates a new client.
     *
     * @param executor the executor notifying the listeners of the returned futures
     * @param exchanger the transport primitives to perform the exchanges with
     */
    public Client(EventExecutor executor, DnsExchanger exchanger) {
        this.executor = checkNotNull(executor, "executor");
        this.exchanger = checkNotNull(exchanger, "exchanger");
    }

    /**
     * Asks the given servers for records of the given type at the given name, with recursion desired.
     */
    public Future<Answer> query(List<Server> servers, String name, DnsRecordType type) {
        return request(servers, RequestMessage.builder(name, type).build());
    }

    /**
     * Sends the request to the servers in order and returns the first answer.
     *
     * @throws DnsClientConfigurationException if no server is given or a TLS server has no TLS hostname
     */
    public Future<Answer> request(final List<Server> servers, final RequestMessage request) {
        checkServers(servers, false);
        checkNotNull(request, "request");

        final Promise<Answer> promise = executor.newPromise();
        request0(servers, 0, request, promise);
        return promise;
    }

    private void request0(final List<Server> servers, final int index, final RequestMessage request,
                          final Promise<Answer> promise) {
        final Server server = servers.get(index);
        requestServer0(server, request).addListener(new FutureListener<Answer>() {
            @Override
            public void operationComplete(Future<Answer> future) {
                if (future.isSuccess()) {
                    Answer answer = future.getNow();
                    if (!promise.trySuccess(answer)) {
                        answer.release();
                    }
                } else if (index + 1 < servers.size()) {
                    logger.debug("{} failed for {}, trying the next server", request, server, future.cause());
                    request0(servers, index + 1, request, promise);
                } else {
                    promise.tryFailure(future.cause());
                }
            }
        });
    }

    /**
     * Sends the request to a single server, including the fallback of its transport.
     *
     * @throws DnsClientConfigurationException if the server uses TLS and has no TLS hostname
     */
    public Future<Answer> requestServer(Server server, RequestMessage request) {
        checkServer(checkNotNull(server, "server"), false);
        checkNotNull(request, "request");
        return requestServer0(server, request);
    }

    private Future<Answer> requestServer0(Server server, RequestMessage request) {
        switch (server.transport()) {
            case UDP:
                return requestDatagram(server, request, false);
            case UDP_TCP:
                return requestDatagram(server, request, true);
            case TCP:
                return requestStream(server, request, Protocol.TCP);
            case TLS:
                return requestStream(server, request, Protocol.TLS);
            default:
                throw new Error("unexpected transport: " + server.transport());
        }
    }

    private Future<Answer> requestDatagram(final Server server, final RequestMessage request,
                                           final boolean tcpOnTruncation) {
        final Promise<Answer> promise = executor.newPromise();
        final Stats stats = new Stats(server.address(), Protocol.UDP);
        exchanger.datagram(server, request).addListener(new FutureListener<DnsResponse>() {
            @Override
            public void operationComplete(Future<DnsResponse> future) {
                if (!future.isSuccess()) {
                    promise.tryFailure(future.cause());
                    return;
                }
                DnsResponse response = future.getNow();
                if (tcpOnTruncation && response.isTruncated()) {
                    logger.debug("Truncated response to {} from {}, retrying over TCP", request, server.address());
                    response.release();
                    requestStream(server, request, Protocol.TCP).addListener(
                            new PromiseNotifier<Answer, Future<Answer>>(promise));
                    return;
                }
                stats.finish();
                if (!promise.trySuccess(new Answer(response, stats))) {
                    response.release();
                }
            }
        });
        return promise;
    }

    private Future<Answer> requestStream(final Server server, final RequestMessage request, Protocol protocol) {
        final Promise<Answer> promise = executor.newPromise();
        final Stats stats = new Stats(server.address(), protocol);
        exchanger.stream(server, request, protocol == Protocol.TLS).addListener(new FutureListener<DnsStream>() {
            @Override
            public void operationComplete(Future<DnsStream> future) {
                if (future.isSuccess()) {
                    collect(future.getNow(), request.isStreaming(), new ArrayList<DnsResponse>(1), stats, promise);
                } else {
                    promise.tryFailure(future.cause());
                }
            }
        });
        return promise;
    }

    private static void collect(final DnsStream stream, final boolean streaming, final List<DnsResponse> messages,
                                final Stats stats, final Promise<Answer> promise) {
        stream.receive().addListener(new FutureListener<DnsResponse>() {
            @Override
            public void operationComplete(Future<DnsResponse> future) {
                if (!future.isSuccess()) {
                    for (DnsResponse message : messages) {
                        message.release();
                    }
                    stream.close();
                    promise.tryFailure(future.cause());
                    return;
                }
                DnsResponse response = future.getNow();
                if (response != null) {
                    messages.add(response);
                    if (streaming) {
                        collect(stream, true, messages, stats, promise);
                        return;
                    }
                }
                stream.close();
                if (messages.isEmpty()) {
                    promise.tryFailure(new DnsExchangeException(
                            stream.remoteAddress(), "no response received from " + stream.remoteAddress()));
                    return;
                }
                stats.finish();
                Answer answer = new Answer(messages, stats);
                if (!promise.trySuccess(answer)) {
                    answer.release();
                }
            }
        });
    }

    /**
     * Sends a request which may be answered by several messages, such as a zone transfer, and returns a handle
     * on the stream of messages of the first server that accepted the request.
     *
     * @throws DnsClientConfigurationException if no server is given, a server does not use a stream transport,
     *                                         or a TLS server has no TLS hostname
     */
    public Future<ResponseStream> requestMulti(final List<Server> servers, final RequestMessage request) {
        checkServers(servers, true);
        checkNotNull(request, "request");

        final Promise<ResponseStream> promise = executor.newPromise();
        requestMulti0(servers, 0, request, promise);
        return promise;
    }

    private void requestMulti0(final List<Server> servers, final int index, final RequestMessage request,
                               final Promise<ResponseStream> promise) {
        final Server server = servers.get(index);
        final Stats stats = new Stats(server.address(), server.transport() == Transport.TLS ? Protocol.TLS
                                                                                              : Protocol.TCP);
        exchanger.stream(server, request, server.transport() == Transport.TLS).addListener(
                new FutureListener<DnsStream>() {
                    @Override
                    public void operationComplete(Future<DnsStream> future) {
                        if (future.isSuccess()) {
                            DnsStream stream = future.getNow();
                            if (!promise.trySuccess(new ResponseStream(executor, stream, stats))) {
                                stream.close();
                            }
                        } else if (index + 1 < servers.size()) {
                            logger.debug("{} failed for {}, trying the next server", request, server,
                                         future.cause());
                            requestMulti0(servers, index + 1, request, promise);
                        } else {
                            promise.tryFailure(future.cause());
                        }
                    }
                });
    }

    private static void checkServers(List<Server> servers, boolean streamOnly) {
        checkNotNull(servers, "servers");
        if (servers.isEmpty()) {
            throw new DnsClientConfigurationException("no server to send the request to");
        }
        for (Server server : servers) {
            checkServer(checkNotNull(server, "server"), streamOnly);
        }
    }

    private static void checkServer(Server server, boolean streamOnly) {
        if (streamOnly && !server.transport().isStream()) {
            throw new DnsClientConfigurationException(
                    "requests with multiple responses require a stream transport (TCP or TLS): " + server);
        }
        if (server.transport() == Transport.TLS && server.tlsHostname() == null) {
            throw new DnsClientConfigurationException("a TLS hostname is required for TLS transport: " + server);
        }
    }
}
