/*
 * SPDX-License-Identifier: AGPL-3.0-only
 * Copyright (C) 2025-2026 DIY Accounting Ltd
 */

package co.uk.diyaccounting.preview.awssdk;

import static co.uk.diyaccounting.preview.utils.ResourceNameUtils.buildBucketObjectsArn;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.NotNull;
import software.amazon.awssdk.policybuilder.iam.IamConditionOperator;
import software.amazon.awssdk.policybuilder.iam.IamEffect;
import software.amazon.awssdk.policybuilder.iam.IamPolicy;
import software.amazon.awssdk.policybuilder.iam.IamPrincipalType;
import software.amazon.awssdk.policybuilder.iam.IamStatement;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.PutBucketPolicyRequest;

/**
 * Grants one distribution, and only that distribution, read access to the bucket objects.
 * Any existing bucket policy is replaced.
 */
public class BucketPolicyWriter {

    private static final Logger logger = LogManager.getLogger(BucketPolicyWriter.class);

    public static final String POLICY_VERSION = "2012-10-17";
    public static final String STATEMENT_ID = "AllowCloudFrontServicePrincipal";
    public static final String CLOUDFRONT_SERVICE_PRINCIPAL = "cloudfront.amazonaws.com";
    public static final String SOURCE_ARN_CONDITION_KEY = "AWS:SourceArn";

    private final S3Client s3Client;

    public BucketPolicyWriter(S3Client s3Client) {
        this.s3Client = s3Client;
    }

    public void attach(String bucketName, String distributionArn) {
        var policy = buildPolicy(bucketName, distributionArn);
        s3Client.putBucketPolicy(PutBucketPolicyRequest.builder()
                .bucket(bucketName)
                .policy(policy.toJson())
                .build());
        logger.info("Bucket {} policy allows reads from distribution {}", bucketName, distributionArn);
    }

    public static @NotNull IamPolicy buildPolicy(String bucketName, String distributionArn) {
        if (distributionArn == null || distributionArn.isBlank()) {
            throw new IllegalArgumentException("distributionArn must be non-empty");
        }
        return IamPolicy.builder()
                .version(POLICY_VERSION)
                .addStatement(IamStatement.builder()
                        .sid(STATEMENT_ID)
                        .effect(IamEffect.ALLOW)
                        .addPrincipal(IamPrincipalType.SERVICE, CLOUDFRONT_SERVICE_PRINCIPAL)
                        .addAction("s3:GetObject")
                        .addResource(buildBucketObjectsArn(bucketName))
                        .addCondition(IamConditionOperator.STRING_EQUALS, SOURCE_ARN_CONDITION_KEY, distributionArn)
                        .build())
                .build();
    }
}
