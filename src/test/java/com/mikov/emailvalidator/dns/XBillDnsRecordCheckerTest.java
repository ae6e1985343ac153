package com.mikov.emailvalidator.dns;

import com.mikov.emailvalidator.cache.MxRecordCache;
import com.mikov.emailvalidator.services.MxLookupService;
import org.junit.jupiter.api.Test;
import org.mockito.stubbing.Answer;
import org.xbill.DNS.ARecord;
import org.xbill.DNS.DClass;
import org.xbill.DNS.Flags;
import org.xbill.DNS.MXRecord;
import org.xbill.DNS.Message;
import org.xbill.DNS.Name;
import org.xbill.DNS.Rcode;
import org.xbill.DNS.Resolver;
import org.xbill.DNS.Section;
import org.xbill.DNS.Type;

import java.io.IOException;
import java.net.InetAddress;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class XBillDnsRecordCheckerTest {

    private final Resolver resolver = mock(Resolver.class);
    private final XBillDnsRecordChecker checker = new XBillDnsRecordChecker(resolver);

    @Test
    void blankDomainHasNoRecords() {
        assertEquals(DnsLookupStatus.NOT_FOUND, checker.lookup("", DnsRecordType.MX));
        assertEquals(DnsLookupStatus.NOT_FOUND, checker.lookup(null, DnsRecordType.A));
        assertFalse(checker.hasRecords(" ", DnsRecordType.AAAA));
        verifyNoInteractions(resolver);
    }

    @Test
    void unparsableNameIsReportedAsFailureWithoutThrowing() {
        final var tooLongLabel = "a".repeat(64) + ".com";

        assertEquals(DnsLookupStatus.LOOKUP_FAILED, checker.lookup(tooLongLabel, DnsRecordType.MX));
        assertFalse(checker.hasRecords(tooLongLabel, DnsRecordType.MX));
        verifyNoInteractions(resolver);
    }

    @Test
    void answerWithRecordsIsFound() throws IOException {
        when(resolver.send(any(Message.class))).thenAnswer(found());

        assertEquals(DnsLookupStatus.FOUND, checker.lookup("found-example.com", DnsRecordType.MX));
        assertTrue(checker.hasRecords("found-example.com", DnsRecordType.A));
    }

    @Test
    void nxdomainIsNotFound() throws IOException {
        when(resolver.send(any(Message.class))).thenAnswer(rcode(Rcode.NXDOMAIN));

        assertEquals(DnsLookupStatus.NOT_FOUND, checker.lookup("missing-example.com", DnsRecordType.MX));
    }

    @Test
    void emptyAnswerIsNotFound() throws IOException {
        when(resolver.send(any(Message.class))).thenAnswer(rcode(Rcode.NOERROR));

        assertEquals(DnsLookupStatus.NOT_FOUND, checker.lookup("nomx-example.com", DnsRecordType.MX));
    }

    @Test
    void serverFailureIsLookupFailure() throws IOException {
        when(resolver.send(any(Message.class))).thenAnswer(rcode(Rcode.SERVFAIL));

        assertEquals(DnsLookupStatus.LOOKUP_FAILED, checker.lookup("broken-example.com", DnsRecordType.MX));
        assertFalse(checker.hasRecords("broken-example.com", DnsRecordType.MX));
    }

    @Test
    void networkErrorIsLookupFailure() throws IOException {
        when(resolver.send(any(Message.class))).thenThrow(new IOException("unreachable"));

        assertEquals(DnsLookupStatus.LOOKUP_FAILED, checker.lookup("offline-example.com", DnsRecordType.MX));
    }

    @Test
    void resolverRuntimeErrorIsLookupFailureWithoutThrowing() throws IOException {
        when(resolver.send(any(Message.class))).thenThrow(new IllegalStateException("resolver exploded"));

        assertEquals(DnsLookupStatus.LOOKUP_FAILED, checker.lookup("crash-example.com", DnsRecordType.MX));
        assertFalse(checker.hasRecords("crash-example.com", DnsRecordType.A));
    }

    @Test
    void everyLookupReachesTheResolver() throws IOException {
        when(resolver.send(any(Message.class)))
                .thenAnswer(found())
                .thenAnswer(rcode(Rcode.NXDOMAIN));

        assertEquals(DnsLookupStatus.FOUND, checker.lookup("changing-example.com", DnsRecordType.MX));
        assertEquals(DnsLookupStatus.NOT_FOUND, checker.lookup("changing-example.com", DnsRecordType.MX));
        verify(resolver, times(2)).send(any(Message.class));
    }

    @Test
    void clearedMxCacheSeesChangedResolverAnswer() throws IOException {
        when(resolver.send(any(Message.class)))
                .thenAnswer(found())
                .thenAnswer(rcode(Rcode.NXDOMAIN));
        final var service = new MxLookupService(checker, new MxRecordCache(true));

        assertTrue(service.hasValidMX("changing-example.com"));
        assertTrue(service.hasValidMX("changing-example.com"));
        verify(resolver, times(1)).send(any(Message.class));

        service.clearCache();

        assertFalse(service.hasValidMX("changing-example.com"));
        verify(resolver, times(2)).send(any(Message.class));
    }

    @Test
    void addressChecksAreRepeatedOnEveryCall() throws IOException {
        when(resolver.send(any(Message.class))).thenAnswer(found());
        final var service = new MxLookupService(checker, new MxRecordCache(true));

        assertTrue(service.hasValidDNS("web-example.com"));
        assertTrue(service.hasValidDNS("web-example.com"));

        verify(resolver, times(2)).send(any(Message.class));
    }

    private static Answer<Message> found() {
        return invocation -> {
            final Message query = invocation.getArgument(0);
            final var response = reply(query, Rcode.NOERROR);
            final var name = query.getQuestion().getName();
            if (query.getQuestion().getType() == Type.MX) {
                response.addRecord(new MXRecord(name, DClass.IN, 3600, 10,
                        Name.fromConstantString("mail.example.com.")), Section.ANSWER);
            } else {
                response.addRecord(new ARecord(name, DClass.IN, 3600,
                        InetAddress.getByAddress(new byte[]{(byte) 192, 0, 2, 1})), Section.ANSWER);
            }
            return response;
        };
    }

    private static Answer<Message> rcode(final int rcode) {
        return invocation -> reply(invocation.getArgument(0), rcode);
    }

    private static Message reply(final Message query, final int rcode) {
        final var response = new Message(query.getHeader().getID());
        response.getHeader().setFlag(Flags.QR);
        response.getHeader().setFlag(Flags.AA);
        response.getHeader().setRcode(rcode);
        response.addRecord(query.getQuestion(), Section.QUESTION);
        return response;
    }
}
