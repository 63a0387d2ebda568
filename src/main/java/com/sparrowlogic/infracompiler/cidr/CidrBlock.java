package com.sparrowlogic.infracompiler.cidr;

import java.util.Objects;

/**
 * An IPv4 address with a prefix length. The address is kept as given, host bits included;
 * network and broadcast addresses are derived on demand.
 */
public final class CidrBlock {

    private final Ipv4Address address;
    private final int prefixLength;

    private CidrBlock(Ipv4Address address, int prefixLength) {
        this.address = address;
        this.prefixLength = prefixLength;
    }

    public static CidrBlock of(Ipv4Address address, int prefixLength) {
        Objects.requireNonNull(address, "address");
        if (prefixLength < 0 || prefixLength > 32) {
            throw new InvalidPrefixException(prefixLength);
        }
        return new CidrBlock(address, prefixLength);
    }

    public static CidrBlock parse(String cidr) {
        if (cidr == null || cidr.isBlank()) {
            throw new IllegalArgumentException("CIDR cannot be blank");
        }
        var trimmed = cidr.trim();
        int slash = trimmed.indexOf('/');
        if (slash < 0 || slash != trimmed.lastIndexOf('/')) {
            throw new IllegalArgumentException("Invalid CIDR block: " + cidr);
        }
        int prefix;
        try {
            prefix = Integer.parseInt(trimmed.substring(slash + 1));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid CIDR prefix in " + cidr, e);
        }
        return of(Ipv4Address.parse(trimmed.substring(0, slash)), prefix);
    }

    public Ipv4Address address() {
        return address;
    }

    public int prefixLength() {
        return prefixLength;
    }

    public Ipv4Address networkAddress() {
        return new Ipv4Address(address.value() & mask());
    }

    public Ipv4Address broadcastAddress() {
        return new Ipv4Address(address.value() | ~mask());
    }

    public boolean contains(Ipv4Address ip) {
        return networkAddress().compareTo(ip) <= 0 && ip.compareTo(broadcastAddress()) <= 0;
    }

    // shifting an int by 32 is a no-op in Java, so /0 is special-cased
    private int mask() {
        return prefixLength == 0 ? 0 : 0xFFFFFFFF << (32 - prefixLength);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CidrBlock other)) {
            return false;
        }
        return prefixLength == other.prefixLength && address.equals(other.address);
    }

    @Override
    public int hashCode() {
        return Objects.hash(address, prefixLength);
    }

    @Override
    public String toString() {
        return address + "/" + prefixLength;
    }
}
