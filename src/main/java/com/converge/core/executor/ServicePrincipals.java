package com.converge.core.executor;

import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Computes the service principal a service uses in a region, following the
 * defaults the AWS CDK region-info tables apply.
 */
public final class ServicePrincipals {

    private static final Pattern SERVICE = Pattern.compile(
            "^([^.]+)(?:(?:\\.amazonaws\\.com(?:\\.cn)?)|(?:\\.c2s\\.ic\\.gov)|(?:\\.sc2s\\.sgov\\.gov))?$");

    private static final Set<String> US_ISO_EXCEPTIONS = Set.of("cloudhsm", "config", "states", "workspaces");
    private static final Set<String> US_ISOB_EXCEPTIONS = Set.of("dms", "states");

    private ServicePrincipals() {}

    /** URL suffix of a partition's service endpoints. */
    public static String urlSuffix(String partition) {
        return switch (partition) {
            case "aws-cn" -> "amazonaws.com.cn";
            case "aws-iso" -> "c2s.ic.gov";
            case "aws-iso-b" -> "sc2s.sgov.gov";
            default -> "amazonaws.com";
        };
    }

    public static String servicePrincipal(String service) {
        return servicePrincipal(service, "us-east-1", "amazonaws.com");
    }

    /**
     * @param service   service name such as {@code s3} or {@code s3.amazonaws.com}
     * @param region    region the principal is needed in
     * @param urlSuffix URL suffix of the region's partition
     */
    public static String servicePrincipal(String service, String region, String urlSuffix) {
        Matcher matcher = SERVICE.matcher(service);
        if (!matcher.matches()) {
            return service;
        }
        String name = matcher.group(1);

        if (region.startsWith("us-iso-") && US_ISO_EXCEPTIONS.contains(name)) {
            return "states".equals(name) ? name + ".amazonaws.com" : name + "." + urlSuffix;
        }
        if (region.startsWith("us-isob-") && US_ISOB_EXCEPTIONS.contains(name)) {
            return "states".equals(name) ? name + ".amazonaws.com" : name + "." + urlSuffix;
        }
        return switch (name) {
            case "codedeploy", "logs" -> name + "." + region + "." + urlSuffix;
            case "states" -> name + "." + region + ".amazonaws.com";
            case "ec2" -> name + "." + urlSuffix;
            default -> name + ".amazonaws.com";
        };
    }
}
