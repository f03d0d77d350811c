package com.eyelevel.documentindexer.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.core.env.Profiles;
import org.springframework.util.StringUtils;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.core.retry.RetryMode;
import software.amazon.awssdk.core.retry.RetryPolicy;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;
import software.amazon.awssdk.services.s3.S3Configuration;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;

import java.net.URI;

/**
 * AWS SDK clients used by the storage accessor. Credentials come from static keys under the
 * "local" profile and from the default provider chain (IAM role) everywhere else.
 * <p>
 * Setting {@code aws.s3.endpoint} points both clients at an S3-compatible store (MinIO,
 * LocalStack) with path-style addressing.
 */
@Slf4j
@Configuration
public class AwsConfig {

    @Value("${aws.region}")
    private String awsRegion;

    @Value("${aws.access-key:}")
    private String accessKey;

    @Value("${aws.secret-key:}")
    private String secretKey;

    @Value("${aws.s3.retry-count:4}")
    private int s3RetryCount;

    @Value("${aws.s3.endpoint:}")
    private String s3Endpoint;

    @Bean
    public AwsCredentialsProvider awsCredentialsProvider(Environment environment) {
        if (environment.acceptsProfiles(Profiles.of("local"))) {
            log.info("Local profile active. Using StaticCredentialsProvider.");
            if (!StringUtils.hasText(accessKey) || !StringUtils.hasText(secretKey)) {
                throw new IllegalArgumentException(
                        "aws.access-key and aws.secret-key must be set for the 'local' profile.");
            }
            return StaticCredentialsProvider.create(AwsBasicCredentials.create(accessKey, secretKey));
        }
        log.info("Non-local profile active. Using DefaultCredentialsProvider.");
        return DefaultCredentialsProvider.create();
    }

    /**
     * Adaptive retry for S3 calls; throttling from S3 is absorbed here rather than failing a phase.
     */
    @Bean
    public ClientOverrideConfiguration clientOverrideConfiguration() {
        RetryPolicy adaptiveRetryPolicy = RetryPolicy.forRetryMode(RetryMode.ADAPTIVE).toBuilder()
                                                     .numRetries(s3RetryCount).build();
        return ClientOverrideConfiguration.builder().retryPolicy(adaptiveRetryPolicy).build();
    }

    @Bean
    public S3Client s3Client(AwsCredentialsProvider credentialsProvider,
                             ClientOverrideConfiguration clientOverrideConfig) {
        S3ClientBuilder builder = S3Client.builder()
                                          .credentialsProvider(credentialsProvider)
                                          .region(Region.of(awsRegion))
                                          .overrideConfiguration(clientOverrideConfig);
        if (StringUtils.hasText(s3Endpoint)) {
            log.info("Configuring S3Client for region {} against custom endpoint {}", awsRegion, s3Endpoint);
            builder.endpointOverride(URI.create(s3Endpoint)).forcePathStyle(true);
        } else {
            log.info("Configuring S3Client for region {}", awsRegion);
        }
        return builder.build();
    }

    /**
     * Presigner used to hand OCR providers a time-limited URL to the source document.
     */
    @Bean
    public S3Presigner s3Presigner(AwsCredentialsProvider credentialsProvider) {
        S3Presigner.Builder builder = S3Presigner.builder()
                                                 .region(Region.of(awsRegion))
                                                 .credentialsProvider(credentialsProvider);
        if (StringUtils.hasText(s3Endpoint)) {
            builder.endpointOverride(URI.create(s3Endpoint))
                   .serviceConfiguration(S3Configuration.builder().pathStyleAccessEnabled(true).build());
        }
        return builder.build();
    }
}
