package com.sparrowlogic.infracompiler.model;

public enum Permission {
    FULL_CONTROL,
    WRITE,
    WRITE_ACP,
    READ,
    READ_ACP;

    public String value() {
        return name();
    }
}
