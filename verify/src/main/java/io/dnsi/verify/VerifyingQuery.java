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
package io.dnsi.verify;

import io.dnsi.client.Answer;
import io.dnsi.client.Client;
import io.dnsi.client.DnsClientConfigurationException;
import io.dnsi.client.RequestMessage;
import io.dnsi.client.Server;
import io.netty.util.concurrent.EventExecutor;
import io.netty.util.concurrent.Future;
import io.netty.util.concurrent.FutureListener;
import io.netty.util.concurrent.Promise;
import io.netty.util.internal.logging.InternalLogger;
import io.netty.util.internal.logging.InternalLoggerFactory;

import java.util.List;

import static io.netty.util.internal.ObjectUtil.checkNotNull;

/**
 * Sends a query and optionally checks its answer against the answer of the authoritative name servers of the
 * queried name.
 * <p>
 * Only a failure of the query itself fails the returned future. A failed verification still delivers the answer,
 * with the cause available from {@link VerifiedAnswer#verificationCause()}.
 */
public final class VerifyingQuery {

    private static final InternalLogger logger = InternalLoggerFactory.getInstance(VerifyingQuery.class);

    private final EventExecutor executor;
    private final Client client;
    private final AuthoritativeResolver resolver;

    public VerifyingQuery(EventExecutor executor, Client client, AuthoritativeResolver resolver) {
        this.executor = checkNotNull(executor, "executor");
        this.client = checkNotNull(client, "client");
        this.resolver = checkNotNull(resolver, "resolver");
    }

    /**
     * Sends the request to the given servers.
     *
     * @param verify whether to compare the answer with the answer of the authoritative servers
     * @param force whether to send zone transfer requests, which are otherwise refused
     * @throws DnsClientConfigurationException if the request is a zone transfer and {@code force} is not set, or
     *                                         the servers cannot be used
     */
    public Future<VerifiedAnswer> execute(List<Server> servers, final RequestMessage request, final boolean verify,
                                          boolean force) {
        checkNotNull(request, "request");
        if (request.isStreaming() && !force) {
            throw new DnsClientConfigurationException(
                    "refusing to send a " + request.type().name() + " query for " + request.name() +
                    ", use a zone transfer instead");
        }
        final Promise<VerifiedAnswer> promise = executor.newPromise();
        client.request(servers, request).addListener(new FutureListener<Answer>() {
            @Override
            public void operationComplete(Future<Answer> future) {
                if (!future.isSuccess()) {
                    promise.tryFailure(future.cause());
                    return;
                }
                Answer answer = future.getNow();
                if (verify) {
                    verify(request, answer, promise);
                } else {
                    complete(promise, VerifiedAnswer.unverified(answer));
                }
            }
        });
        return promise;
    }

    private void verify(final RequestMessage request, final Answer answer, final Promise<VerifiedAnswer> promise) {
        resolver.resolve(request.name()).addListener(new FutureListener<List<Server>>() {
            @Override
            public void operationComplete(Future<List<Server>> future) {
                if (!future.isSuccess()) {
                    fail(promise, answer, future.cause());
                    return;
                }
                List<Server> servers = future.getNow();
                logger.debug("Asking the authoritative servers {} for {}", servers, request);
                RequestMessage authoritativeRequest = RequestMessage.builder(request.name(), request.type())
                                                                    .dnsClass(request.dnsClass())
                                                                    .build();
                client.request(servers, authoritativeRequest).addListener(new FutureListener<Answer>() {
                    @Override
                    public void operationComplete(Future<Answer> future) {
                        if (!future.isSuccess()) {
                            fail(promise, answer, new DnsVerificationException(
                                    "authoritative query for " + request.name() + " failed", future.cause()));
                            return;
                        }
                        Answer authoritativeAnswer = future.getNow();
                        AnswerDiff.Result diff = AnswerDiff.diff(authoritativeAnswer.message(), answer.message());
                        complete(promise, VerifiedAnswer.verified(answer, authoritativeAnswer, diff));
                    }
                });
            }
        });
    }

    private static void fail(Promise<VerifiedAnswer> promise, Answer answer, Throwable cause) {
        logger.debug("Verification of {} failed", answer, cause);
        complete(promise, VerifiedAnswer.failed(answer, cause));
    }

    private static void complete(Promise<VerifiedAnswer> promise, VerifiedAnswer result) {
        if (!promise.trySuccess(result)) {
            result.release();
        }
    }
}
