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

import io.dnsi.client.Client;
import io.dnsi.client.DnsClientConfigurationException;
import io.dnsi.client.DnsExchanger;
import io.dnsi.client.RequestMessage;
import io.dnsi.client.Server;
import io.dnsi.client.Transport;
import io.netty.handler.codec.dns.DnsRecordType;
import io.netty.handler.codec.dns.DnsResponse;
import io.netty.util.concurrent.Future;
import io.netty.util.concurrent.ImmediateEventExecutor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.function.Executable;
import org.mockito.ArgumentCaptor;

import java.net.InetSocketAddress;
import java.net.UnknownHostException;
import java.util.Collections;
import java.util.List;

import static io.dnsi.verify.Records.a;
import static io.dnsi.verify.Records.response;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

public class VerifyingQueryTest {

    private static final RequestMessage QUERY = RequestMessage.builder("example.com", DnsRecordType.A)
                                                              .recursionDesired(false)
                                                              .build();

    private final Server recursive = Server.builder(new InetSocketAddress("192.0.2.53", 53)).build();
    private final Server authoritative = Server.builder(new InetSocketAddress("198.51.100.1", 53)).build();
    private final List<Server> recursiveServers = Collections.singletonList(recursive);

    private DnsExchanger exchanger;
    private AuthoritativeResolver resolver;
    private VerifyingQuery query;

    @BeforeEach
    public void setUp() {
        exchanger = mock(DnsExchanger.class);
        resolver = mock(AuthoritativeResolver.class);
        Client client = new Client(ImmediateEventExecutor.INSTANCE, exchanger);
        query = new VerifyingQuery(ImmediateEventExecutor.INSTANCE, client, resolver);
    }

    private static <T> Future<T> succeeded(T value) {
        return ImmediateEventExecutor.INSTANCE.newSucceededFuture(value);
    }

    private static <T> Future<T> failed(Throwable cause) {
        return ImmediateEventExecutor.INSTANCE.newFailedFuture(cause);
    }

    @Test
    public void testZoneTransferIsRefusedUnlessForced() {
        assertThrows(DnsClientConfigurationException.class, new Executable() {
            @Override
            public void execute() {
                query.execute(recursiveServers, RequestMessage.axfr("example.com"), false, false);
            }
        });
        verifyNoInteractions(exchanger, resolver);
    }

    @Test
    public void testWithoutVerification() {
        DnsResponse response = response(a("example.com", "93.184.216.34"));
        when(exchanger.datagram(eq(recursive), any(RequestMessage.class))).thenReturn(succeeded(response));

        VerifiedAnswer result = query.execute(recursiveServers, QUERY, false, false).getNow();

        assertSame(response, result.answer().message());
        assertFalse(result.isVerified());
        assertNull(result.diff());
        assertNull(result.verificationCause());
        verifyNoInteractions(resolver);
        assertTrue(result.release());
        assertEquals(0, response.refCnt());
    }

    @Test
    public void testDiffAgainstAuthoritativeAnswer() {
        DnsResponse primary = response(a("example.com", "93.184.216.34"));
        DnsResponse fromAuthority = response(a("example.com", "93.184.216.34"), a("example.com", "93.184.216.35"));
        when(exchanger.datagram(eq(recursive), any(RequestMessage.class))).thenReturn(succeeded(primary));
        when(exchanger.datagram(eq(authoritative), any(RequestMessage.class))).thenReturn(succeeded(fromAuthority));
        when(resolver.resolve("example.com")).thenReturn(
                VerifyingQueryTest.<List<Server>>succeeded(Collections.singletonList(authoritative)));

        VerifiedAnswer result = query.execute(recursiveServers, QUERY, true, false).getNow();

        assertTrue(result.isVerified());
        assertSame(primary, result.answer().message());
        assertSame(fromAuthority, result.authoritativeAnswer().message());
        assertEquals(2, result.diff().items().size());
        assertEquals("  example.com. IN A 93.184.216.34", result.diff().items().get(0).toString());
        assertEquals("- example.com. IN A 93.184.216.35", result.diff().items().get(1).toString());

        ArgumentCaptor<RequestMessage> captor = ArgumentCaptor.forClass(RequestMessage.class);
        verify(exchanger).datagram(eq(authoritative), captor.capture());
        RequestMessage sent = captor.getValue();
        assertEquals(QUERY.name(), sent.name());
        assertEquals(QUERY.type(), sent.type());
        assertEquals(QUERY.dnsClass(), sent.dnsClass());
        assertTrue(sent.isRecursionDesired());

        result.release();
        assertEquals(0, primary.refCnt());
        assertEquals(0, fromAuthority.refCnt());
    }

    @Test
    public void testResolutionFailureKeepsAnswer() {
        DnsResponse primary = response(a("example.com", "93.184.216.34"));
        DnsVerificationException failure = new DnsVerificationException("no SOA record for example.com.");
        when(exchanger.datagram(eq(recursive), any(RequestMessage.class))).thenReturn(succeeded(primary));
        when(resolver.resolve(anyString())).thenReturn(VerifyingQueryTest.<List<Server>>failed(failure));

        Future<VerifiedAnswer> future = query.execute(recursiveServers, QUERY, true, false);

        assertTrue(future.isSuccess());
        VerifiedAnswer result = future.getNow();
        assertSame(primary, result.answer().message());
        assertFalse(result.isVerified());
        assertSame(failure, result.verificationCause());
        verify(exchanger, never()).datagram(eq(authoritative), any(RequestMessage.class));
        result.release();
    }

    @Test
    public void testAuthoritativeQueryFailureKeepsAnswer() {
        DnsResponse primary = response(a("example.com", "93.184.216.34"));
        when(exchanger.datagram(eq(recursive), any(RequestMessage.class))).thenReturn(succeeded(primary));
        when(exchanger.datagram(eq(authoritative), any(RequestMessage.class))).thenReturn(
                VerifyingQueryTest.<DnsResponse>failed(new UnknownHostException("unreachable")));
        when(resolver.resolve("example.com")).thenReturn(
                VerifyingQueryTest.<List<Server>>succeeded(Collections.singletonList(authoritative)));

        VerifiedAnswer result = query.execute(recursiveServers, QUERY, true, false).getNow();

        assertInstanceOf(DnsVerificationException.class, result.verificationCause());
        assertSame(primary, result.answer().message());
        assertNull(result.authoritativeAnswer());
        result.release();
    }

    @Test
    public void testQueryFailureFailsFuture() {
        Server other = Server.builder(new InetSocketAddress("192.0.2.54", 53)).transport(Transport.UDP).build();
        UnknownHostException failure = new UnknownHostException("unreachable");
        when(exchanger.datagram(eq(other), any(RequestMessage.class))).thenReturn(
                VerifyingQueryTest.<DnsResponse>failed(failure));

        Future<VerifiedAnswer> future = query.execute(Collections.singletonList(other), QUERY, true, false);

        assertSame(failure, future.cause());
        verifyNoInteractions(resolver);
    }
}
