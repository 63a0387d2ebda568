package com.sparrowlogic.infracompiler.model;

import java.util.Arrays;
import java.util.Optional;

public enum AvailabilityZone {
    US_EAST_1A(Region.US_EAST_1, "us-east-1a"),
    US_EAST_1B(Region.US_EAST_1, "us-east-1b"),
    US_EAST_1C(Region.US_EAST_1, "us-east-1c"),
    US_EAST_1D(Region.US_EAST_1, "us-east-1d"),
    US_EAST_1E(Region.US_EAST_1, "us-east-1e"),
    US_EAST_1F(Region.US_EAST_1, "us-east-1f"),
    US_EAST_2A(Region.US_EAST_2, "us-east-2a"),
    US_EAST_2B(Region.US_EAST_2, "us-east-2b"),
    US_EAST_2C(Region.US_EAST_2, "us-east-2c"),
    US_WEST_1A(Region.US_WEST_1, "us-west-1a"),
    US_WEST_1C(Region.US_WEST_1, "us-west-1c"),
    US_WEST_2A(Region.US_WEST_2, "us-west-2a"),
    US_WEST_2B(Region.US_WEST_2, "us-west-2b"),
    US_WEST_2C(Region.US_WEST_2, "us-west-2c"),
    US_WEST_2D(Region.US_WEST_2, "us-west-2d"),
    EU_WEST_1A(Region.EU_WEST_1, "eu-west-1a"),
    EU_WEST_1B(Region.EU_WEST_1, "eu-west-1b"),
    EU_WEST_1C(Region.EU_WEST_1, "eu-west-1c"),
    EU_CENTRAL_1A(Region.EU_CENTRAL_1, "eu-central-1a"),
    EU_CENTRAL_1B(Region.EU_CENTRAL_1, "eu-central-1b"),
    EU_CENTRAL_1C(Region.EU_CENTRAL_1, "eu-central-1c"),
    AP_SOUTH_1A(Region.AP_SOUTH_1, "ap-south-1a"),
    AP_SOUTH_1B(Region.AP_SOUTH_1, "ap-south-1b"),
    AP_SOUTH_1C(Region.AP_SOUTH_1, "ap-south-1c"),
    AP_SOUTHEAST_1A(Region.AP_SOUTHEAST_1, "ap-southeast-1a"),
    AP_SOUTHEAST_1B(Region.AP_SOUTHEAST_1, "ap-southeast-1b"),
    AP_SOUTHEAST_1C(Region.AP_SOUTHEAST_1, "ap-southeast-1c");

    private final Region region;
    private final String code;

    AvailabilityZone(Region region, String code) {
        this.region = region;
        this.code = code;
    }

    public Region region() {
        return region;
    }

    public String code() {
        return code;
    }

    public static Optional<AvailabilityZone> fromCode(String code) {
        return Arrays.stream(values()).filter(z -> z.code.equals(code)).findFirst();
    }

    @Override
    public String toString() {
        return code;
    }
}
