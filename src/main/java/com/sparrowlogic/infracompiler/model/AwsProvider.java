package com.sparrowlogic.infracompiler.model;

import java.util.Objects;

public record AwsProvider(Region region) {

    public AwsProvider {
        Objects.requireNonNull(region, "region");
    }
}
