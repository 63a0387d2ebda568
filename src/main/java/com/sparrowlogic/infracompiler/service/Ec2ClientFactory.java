package com.sparrowlogic.infracompiler.service;

import com.sparrowlogic.infracompiler.model.Region;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.auth.credentials.ProfileCredentialsProvider;
import software.amazon.awssdk.services.ec2.Ec2Client;

@Component
public class Ec2ClientFactory {

    private final String defaultProfile;

    public Ec2ClientFactory(@Value("${infracompiler.aws.default-profile:}") String defaultProfile) {
        this.defaultProfile = defaultProfile;
    }

    public Ec2Client create(String profile, Region region) {
        var effectiveProfile = profile != null && !profile.isBlank() ? profile : defaultProfile;
        var credentialsProvider = effectiveProfile != null && !effectiveProfile.isBlank() ?
            ProfileCredentialsProvider.create(effectiveProfile) :
            ProfileCredentialsProvider.create();

        return Ec2Client.builder()
            .credentialsProvider(credentialsProvider)
            .region(software.amazon.awssdk.regions.Region.of(region.code()))
            .build();
    }
}
