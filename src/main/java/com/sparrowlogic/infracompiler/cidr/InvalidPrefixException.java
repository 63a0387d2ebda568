package com.sparrowlogic.infracompiler.cidr;

public class InvalidPrefixException extends IllegalArgumentException {

    private final int prefixLength;

    public InvalidPrefixException(int prefixLength) {
        super("Prefix length must be between 0 and 32, got " + prefixLength);
        this.prefixLength = prefixLength;
    }

    public int prefixLength() {
        return prefixLength;
    }
}
