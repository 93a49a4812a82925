/*
 * SPDX-License-Identifier: AGPL-3.0-only
 * Copyright (C) 2025-2026 DIY Accounting Ltd
 */

package co.uk.diyaccounting.preview.awssdk;

import static co.uk.diyaccounting.preview.utils.ResourceNameUtils.buildFullyQualifiedName;
import static co.uk.diyaccounting.preview.utils.ResourceNameUtils.trimHostedZoneId;

import co.uk.diyaccounting.preview.errors.HostedZoneNotFoundException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import software.amazon.awssdk.services.route53.Route53Client;
import software.amazon.awssdk.services.route53.model.Change;
import software.amazon.awssdk.services.route53.model.ChangeAction;
import software.amazon.awssdk.services.route53.model.ChangeBatch;
import software.amazon.awssdk.services.route53.model.ChangeResourceRecordSetsRequest;
import software.amazon.awssdk.services.route53.model.ListHostedZonesByNameRequest;
import software.amazon.awssdk.services.route53.model.ListResourceRecordSetsRequest;
import software.amazon.awssdk.services.route53.model.RRType;
import software.amazon.awssdk.services.route53.model.ResourceRecord;
import software.amazon.awssdk.services.route53.model.ResourceRecordSet;

/**
 * Maintains the single CNAME that points an environment hostname at its distribution.
 */
public class DnsRecordManager {

    private static final Logger logger = LogManager.getLogger(DnsRecordManager.class);

    public static final long RECORD_TTL_SECONDS = 300L;

    private final Route53Client route53Client;

    public DnsRecordManager(Route53Client route53Client) {
        this.route53Client = route53Client;
    }

    /**
     * @return the hosted zone id without the "/hostedzone/" prefix
     * @throws HostedZoneNotFoundException if no zone is named exactly after the base domain
     */
    public String resolveZone(String baseDomain) {
        var zoneName = buildFullyQualifiedName(baseDomain);
        var response = route53Client.listHostedZonesByName(
                ListHostedZonesByNameRequest.builder().dnsName(baseDomain).build());
        // Results are ordered from dnsName onwards, so the first zone can be a different domain
        var zone = response.hostedZones().stream()
                .filter(z -> zoneName.equalsIgnoreCase(buildFullyQualifiedName(z.name())))
                .findFirst()
                .orElseThrow(() -> new HostedZoneNotFoundException(baseDomain));
        var zoneId = trimHostedZoneId(zone.id());
        logger.info("Hosted zone for {} is {}", baseDomain, zoneId);
        return zoneId;
    }

    public void upsert(String zoneId, String hostname, String target) {
        submit(
                zoneId,
                ChangeAction.UPSERT,
                ResourceRecordSet.builder()
                        .name(hostname)
                        .type(RRType.CNAME)
                        .ttl(RECORD_TTL_SECONDS)
                        .resourceRecords(ResourceRecord.builder().value(target).build())
                        .build());
        logger.info("CNAME {} -> {} upserted in zone {}", hostname, target, zoneId);
    }

    /**
     * Deletes the CNAME for the hostname. Route53 only accepts a delete that matches the existing
     * record exactly, so the record is read first and submitted as returned.
     *
     * @return false if there was no matching record
     */
    public boolean delete(String zoneId, String hostname) {
        var response = route53Client.listResourceRecordSets(ListResourceRecordSetsRequest.builder()
                .hostedZoneId(zoneId)
                .startRecordName(hostname)
                .startRecordType(RRType.CNAME)
                .maxItems("1")
                .build());
        if (!response.hasResourceRecordSets() || response.resourceRecordSets().isEmpty()) {
            logger.info("No DNS record found for {}", hostname);
            return false;
        }
        var recordSet = response.resourceRecordSets().get(0);
        if (!buildFullyQualifiedName(hostname).equalsIgnoreCase(recordSet.name()) || recordSet.type() != RRType.CNAME) {
            logger.info(
                    "No DNS record found for {}, next record is {} {}",
                    hostname,
                    recordSet.name(),
                    recordSet.typeAsString());
            return false;
        }
        submit(zoneId, ChangeAction.DELETE, recordSet);
        logger.info("CNAME {} deleted from zone {}", hostname, zoneId);
        return true;
    }

    private void submit(String zoneId, ChangeAction action, ResourceRecordSet recordSet) {
        route53Client.changeResourceRecordSets(ChangeResourceRecordSetsRequest.builder()
                .hostedZoneId(zoneId)
                .changeBatch(ChangeBatch.builder()
                        .changes(Change.builder()
                                .action(action)
                                .resourceRecordSet(recordSet)
                                .build())
                        .build())
                .build());
    }
}
