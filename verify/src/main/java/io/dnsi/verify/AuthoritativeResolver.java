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

import io.dnsi.client.ClientDefaults;
import io.dnsi.client.DnsRecords;
import io.dnsi.client.Server;
import io.dnsi.client.Transport;
import io.netty.handler.codec.CorruptedFrameException;
import io.netty.handler.codec.dns.DnsRecord;
import io.netty.handler.codec.dns.DnsRecordType;
import io.netty.handler.codec.dns.DnsResponse;
import io.netty.handler.codec.dns.DnsSection;
import io.netty.util.concurrent.EventExecutor;
import io.netty.util.concurrent.Future;
import io.netty.util.concurrent.FutureListener;
import io.netty.util.concurrent.Promise;
import io.netty.util.concurrent.PromiseCombiner;
import io.netty.util.internal.logging.InternalLogger;
import io.netty.util.internal.logging.InternalLoggerFactory;

import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static io.netty.util.internal.ObjectUtil.checkNotNull;

/**
 * Finds the authoritative name servers of the zone a name belongs to, starting from nothing but the recursive
 * resolvers of the host:
 * <ol>
 *     <li>the SOA record of the name gives the apex of its zone,</li>
 *     <li>the NS records at the apex give the names of the name servers,</li>
 *     <li>the addresses of all name servers are looked up concurrently,</li>
 *     <li>each address becomes a {@link Server} on port 53 using {@link Transport#UDP_TCP}.</li>
 * </ol>
 * A failure in any step fails the whole resolution with a {@link DnsVerificationException}.
 */
public final class AuthoritativeResolver {

    private static final InternalLogger logger = InternalLoggerFactory.getInstance(AuthoritativeResolver.class);

    private final EventExecutor executor;
    private final StubResolver resolver;
    private final Duration timeout;
    private final int retries;
    private final int udpPayloadSize;

    /**
     * Creates a new resolver producing servers with the default timeout, retries and payload size.
     */
    public AuthoritativeResolver(EventExecutor executor, StubResolver resolver) {
        this(executor, resolver, ClientDefaults.DEFAULT_TIMEOUT, ClientDefaults.DEFAULT_RETRIES,
             ClientDefaults.DEFAULT_UDP_PAYLOAD_SIZE);
    }

    /**
     * Creates a new resolver.
     *
     * @param executor the executor notifying the listeners of the returned futures
     * @param resolver the resolver asked during the resolution
     * @param timeout the timeout of the resulting servers
     * @param retries the retries of the resulting servers
     * @param udpPayloadSize the UDP payload size of the resulting servers
     */
    public AuthoritativeResolver(EventExecutor executor, StubResolver resolver, Duration timeout, int retries,
                                 int udpPayloadSize) {
        this.executor = checkNotNull(executor, "executor");
        this.resolver = checkNotNull(resolver, "resolver");
        this.timeout = checkNotNull(timeout, "timeout");
        this.retries = retries;
        this.udpPayloadSize = udpPayloadSize;
    }

    /**
     * Returns the authoritative servers for the zone of the given name.
     */
    public Future<List<Server>> resolve(String name) {
        final String qname = DnsNames.toAbsolute(checkNotNull(name, "name"));
        final Promise<List<Server>> promise = executor.newPromise();
        resolver.query(qname, DnsRecordType.SOA).addListener(new FutureListener<DnsResponse>() {
            @Override
            public void operationComplete(Future<DnsResponse> future) {
                if (!future.isSuccess()) {
                    promise.tryFailure(new DnsVerificationException(
                            "SOA query for " + qname + " failed", future.cause()));
                    return;
                }
                DnsResponse response = future.getNow();
                String apex;
                try {
                    apex = findApex(qname, response);
                } finally {
                    response.release();
                }
                if (apex == null) {
                    promise.tryFailure(new DnsVerificationException("no SOA record for " + qname));
                    return;
                }
                logger.debug("Apex of {} is {}", qname, apex);
                resolveNameServers(apex, promise);
            }
        });
        return promise;
    }

    private void resolveNameServers(final String apex, final Promise<List<Server>> promise) {
        resolver.query(apex, DnsRecordType.NS).addListener(new FutureListener<DnsResponse>() {
            @Override
            public void operationComplete(Future<DnsResponse> future) {
                if (!future.isSuccess()) {
                    promise.tryFailure(new DnsVerificationException(
                            "NS query for " + apex + " failed", future.cause()));
                    return;
                }
                DnsResponse response = future.getNow();
                final Set<String> names;
                try {
                    names = nsNames(apex, response);
                } finally {
                    response.release();
                }
                if (names.isEmpty()) {
                    promise.tryFailure(new DnsVerificationException("no NS records for " + apex));
                    return;
                }
                logger.debug("Name servers of {}: {}", apex, names);
                executor.execute(new Runnable() {
                    @Override
                    public void run() {
                        resolveAddresses(apex, names, promise);
                    }
                });
            }
        });
    }

    private void resolveAddresses(final String apex, Set<String> names, final Promise<List<Server>> promise) {
        final List<Future<List<InetAddress>>> lookups = new ArrayList<Future<List<InetAddress>>>(names.size());
        PromiseCombiner combiner = new PromiseCombiner(executor);
        for (String name : names) {
            Future<List<InetAddress>> lookup = resolver.lookupHost(name);
            lookups.add(lookup);
            combiner.add(lookup);
        }
        Promise<Void> aggregate = executor.newPromise();
        aggregate.addListener(new FutureListener<Void>() {
            @Override
            public void operationComplete(Future<Void> future) {
                if (!future.isSuccess()) {
                    promise.tryFailure(new DnsVerificationException(
                            "address lookup of the name servers of " + apex + " failed", future.cause()));
                    return;
                }
                Set<InetAddress> addresses = new LinkedHashSet<InetAddress>();
                for (Future<List<InetAddress>> lookup : lookups) {
                    addresses.addAll(lookup.getNow());
                }
                if (addresses.isEmpty()) {
                    promise.tryFailure(new DnsVerificationException(
                            "no addresses for the name servers of " + apex));
                    return;
                }
                promise.trySuccess(toServers(addresses));
            }
        });
        combiner.finish(aggregate);
    }

    private List<Server> toServers(Set<InetAddress> addresses) {
        List<Server> servers = new ArrayList<Server>(addresses.size());
        for (InetAddress address : addresses) {
            servers.add(Server.builder(new InetSocketAddress(address, Server.DEFAULT_PORT))
                              .transport(Transport.UDP_TCP)
                              .timeout(timeout)
                              .retries(retries)
                              .udpPayloadSize(udpPayloadSize)
                              .build());
        }
        return Collections.unmodifiableList(servers);
    }

    /**
     * Returns the apex of the zone of {@code qname} according to the given response to a SOA query, or
     * {@code null} if the response holds no SOA record.
     * <p>
     * If the first SOA record of the answer section is owned by {@code qname}, {@code qname} is the apex. Otherwise
     * the owner of the first SOA record of the authority section is.
     */
    static String findApex(String qname, DnsResponse response) {
        DnsRecord soa = firstSoa(response, DnsSection.ANSWER);
        if (soa != null && DnsNames.equals(soa.name(), qname)) {
            return DnsNames.toAbsolute(qname);
        }
        soa = firstSoa(response, DnsSection.AUTHORITY);
        return soa == null ? null : DnsNames.toAbsolute(soa.name());
    }

    private static DnsRecord firstSoa(DnsResponse response, DnsSection section) {
        int count = response.count(section);
        for (int i = 0; i < count; i++) {
            DnsRecord record = response.recordAt(section, i);
            if (record.dnsClass() == DnsRecord.CLASS_IN && DnsRecords.isType(record, DnsRecordType.SOA)) {
                return record;
            }
        }
        return null;
    }

    /**
     * Returns the name server names of the NS records at {@code apex} in the answer section of the given response.
     */
    static Set<String> nsNames(String apex, DnsResponse response) {
        Set<String> names = new LinkedHashSet<String>();
        int count = response.count(DnsSection.ANSWER);
        for (int i = 0; i < count; i++) {
            DnsRecord record = response.recordAt(DnsSection.ANSWER, i);
            if (record.dnsClass() != DnsRecord.CLASS_IN || !DnsRecords.isType(record, DnsRecordType.NS) ||
                !DnsNames.equals(record.name(), apex)) {
                continue;
            }
            try {
                names.add(DnsNames.toAbsolute(DnsRecords.targetName(record)));
            } catch (CorruptedFrameException e) {
                logger.debug("Ignoring malformed NS record {}", record, e);
            }
        }
        return names;
    }
}
