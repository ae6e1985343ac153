package com.mikov.emailvalidator.dns;

import org.xbill.DNS.Type;

public enum DnsRecordType {
    MX(Type.MX),
    A(Type.A),
    AAAA(Type.AAAA);

    private final int type;

    DnsRecordType(final int type) {
        this.type = type;
    }

    public int getType() {
        return type;
    }
}
