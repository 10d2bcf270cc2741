package com.task.formfill.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.textract.TextractClient;

@Configuration
public class AwsConfig {

    // Credentials come from the default provider chain (env vars, profile, instance role).
    @Bean(destroyMethod = "close")
    public TextractClient textractClient(@Value("${aws.textract.region:us-east-1}") String region) {
        return TextractClient.builder()
                .region(Region.of(region))
                .build();
    }
}
