package com.converge.cloud.aws;

import com.converge.cloud.CloudClient;
import com.converge.core.engine.ConvergeProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.ProfileCredentialsProvider;
import software.amazon.awssdk.regions.Region;

@Configuration
public class AwsConfig {

    @Bean(destroyMethod = "close")
    public AwsCloudClient cloudClient(ConvergeProperties properties, ObjectMapper objectMapper) {
        String profile = properties.getAws().getProfile();
        AwsCredentialsProvider credentials = profile == null || profile.isBlank()
                ? DefaultCredentialsProvider.create()
                : ProfileCredentialsProvider.create(profile);
        return AwsCloudClient.create(Region.of(properties.getAws().getRegion()), credentials, objectMapper);
    }
}
