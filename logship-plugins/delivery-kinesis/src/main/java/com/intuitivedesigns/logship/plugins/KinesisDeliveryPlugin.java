/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logship.plugins;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.intuitivedesigns.logship.config.ConfigurationException;
import com.intuitivedesigns.logship.config.OutputSettings;
import com.intuitivedesigns.logship.core.DeliveryAdapter;
import com.intuitivedesigns.logship.metrics.MetricsRuntime;
import com.intuitivedesigns.logship.output.KinesisDelivery;
import com.intuitivedesigns.logship.spi.DeliveryPlugin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.kinesis.KinesisClient;
import software.amazon.awssdk.services.kinesis.KinesisClientBuilder;
import software.amazon.awssdk.services.sts.StsClient;
import software.amazon.awssdk.services.sts.auth.StsAssumeRoleCredentialsProvider;
import software.amazon.awssdk.services.sts.model.AssumeRoleRequest;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Amazon Kinesis Data Streams delivery, selected with {@code delivery=KINESIS} (the default).
 */
public final class KinesisDeliveryPlugin implements DeliveryPlugin {

    private static final Logger log = LoggerFactory.getLogger(KinesisDeliveryPlugin.class);

    public static final String ID = "KINESIS";

    private static final String SESSION_NAME_PREFIX = "logship-kinesis-";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public DeliveryAdapter<?> create(OutputSettings settings, MetricsRuntime metrics) throws ConfigurationException {
        Objects.requireNonNull(settings, "settings");

        final Region region = Region.of(settings.region());
        final List<AutoCloseable> resources = new ArrayList<>();
        try {
            final AwsCredentialsProvider credentials = credentials(settings, region, resources);

            final KinesisClientBuilder builder = KinesisClient.builder()
                    .region(region)
                    .credentialsProvider(credentials);
            if (settings.endpoint() != null) {
                log.info("[kinesis {}] using endpoint override {}", settings.instanceId(), settings.endpoint());
                builder.endpointOverride(settings.endpoint());
            }

            return new KinesisDelivery(builder.build(), settings, new ObjectMapper(), metrics, resources);
        } catch (SdkException | IllegalArgumentException e) {
            closeQuietly(resources);
            throw new ConfigurationException("[kinesis " + settings.instanceId() + "] failed to create Kinesis client: "
                    + e.getMessage(), e);
        }
    }

    /**
     * The default provider chain, or an assumed role when {@code role_arn} is set.
     */
    private static AwsCredentialsProvider credentials(OutputSettings settings, Region region, List<AutoCloseable> resources) {
        if (settings.roleArn().isEmpty()) {
            return DefaultCredentialsProvider.create();
        }

        log.info("[kinesis {}] assuming role {}", settings.instanceId(), settings.roleArn());
        final StsClient sts = StsClient.builder()
                .region(region)
                .credentialsProvider(DefaultCredentialsProvider.create())
                .build();
        resources.add(sts);

        final StsAssumeRoleCredentialsProvider provider = StsAssumeRoleCredentialsProvider.builder()
                .stsClient(sts)
                .refreshRequest(AssumeRoleRequest.builder()
                        .roleArn(settings.roleArn())
                        .roleSessionName(SESSION_NAME_PREFIX + settings.instanceId())
                        .build())
                .build();
        // Close the provider before the client it refreshes through
        resources.add(0, provider);
        return provider;
    }

    private static void closeQuietly(List<AutoCloseable> resources) {
        for (AutoCloseable r : resources) {
            try {
                r.close();
            } catch (Exception e) {
                log.debug("close failed for {}", r, e);
            }
        }
    }
}
