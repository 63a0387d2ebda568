package com.sparrowlogic.infracompiler.service;

public class VpcNotFoundException extends RuntimeException {

    public VpcNotFoundException(String vpcId) {
        super("VPC not found: " + vpcId);
    }
}
