package com.sparrowlogic.infracompiler.cidr;

import java.util.regex.Pattern;

/**
 * IPv4 address held as its big-endian 32-bit value. Comparisons treat the value as unsigned.
 */
public record Ipv4Address(int value) implements Comparable<Ipv4Address> {

    private static final Pattern DECIMAL_OCTET = Pattern.compile("[0-9]{1,3}");

    public static final Ipv4Address ANY = new Ipv4Address(0);
    public static final Ipv4Address BROADCAST = new Ipv4Address(0xFFFFFFFF);

    public static Ipv4Address of(int a, int b, int c, int d) {
        return new Ipv4Address(checkOctet(a) << 24 | checkOctet(b) << 16 | checkOctet(c) << 8 | checkOctet(d));
    }

    public static Ipv4Address parse(String text) {
        if (text == null) {
            throw new IllegalArgumentException("IPv4 address cannot be null");
        }
        var parts = text.trim().split("\\.", -1);
        if (parts.length != 4) {
            throw new IllegalArgumentException("Invalid IPv4 address: " + text);
        }
        var octets = new int[4];
        for (int i = 0; i < 4; i++) {
            if (!DECIMAL_OCTET.matcher(parts[i]).matches()) {
                throw new IllegalArgumentException("Invalid IPv4 address: " + text);
            }
            octets[i] = Integer.parseInt(parts[i]);
        }
        return of(octets[0], octets[1], octets[2], octets[3]);
    }

    public int octet(int index) {
        if (index < 0 || index > 3) {
            throw new IndexOutOfBoundsException("Octet index must be 0..3, got " + index);
        }
        return (value >>> (24 - 8 * index)) & 0xFF;
    }

    public long unsignedValue() {
        return Integer.toUnsignedLong(value);
    }

    @Override
    public int compareTo(Ipv4Address other) {
        return Integer.compareUnsigned(value, other.value);
    }

    @Override
    public String toString() {
        return octet(0) + "." + octet(1) + "." + octet(2) + "." + octet(3);
    }

    private static int checkOctet(int octet) {
        if (octet < 0 || octet > 255) {
            throw new IllegalArgumentException("Octet out of range: " + octet);
        }
        return octet;
    }
}
