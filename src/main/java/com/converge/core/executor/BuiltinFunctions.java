package com.converge.core.executor;

import com.converge.cloud.CloudClient;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The fixed set of pure functions a plan can call.
 */
public class BuiltinFunctions {

    private final CloudClient client;

    public BuiltinFunctions(CloudClient client) {
        this.client = client;
    }

    /**
     * @param args already resolved arguments
     * @throws IllegalArgumentException for an unknown function or bad arguments
     */
    public Object call(String functionName, List<Object> args) {
        return switch (functionName) {
            case "parse_arn" -> parseArn(stringArg(functionName, args, 0));
            case "interrogate_profile" -> interrogateProfile();
            case "service_principal" -> servicePrincipal(args);
            default -> throw new IllegalArgumentException("Unknown builtin function: " + functionName);
        };
    }

    /**
     * Splits {@code arn:partition:service:region:account-id:resource}.
     */
    public static Map<String, String> parseArn(String arn) {
        String[] parts = arn.split(":", 6);
        if (parts.length < 5 || !"arn".equals(parts[0])) {
            throw new IllegalArgumentException("Not an ARN: " + arn);
        }
        Map<String, String> result = new LinkedHashMap<>();
        result.put("partition", parts[1]);
        result.put("service", parts[2]);
        result.put("region", parts[3]);
        result.put("account_id", parts[4]);
        return result;
    }

    private Map<String, String> interrogateProfile() {
        Map<String, String> result = new LinkedHashMap<>();
        result.put("partition", client.partitionName());
        result.put("region", client.regionName());
        return result;
    }

    private String servicePrincipal(List<Object> args) {
        String service = stringArg("service_principal", args, 0);
        String region = args.size() > 1 ? stringArg("service_principal", args, 1) : client.regionName();
        String urlSuffix = args.size() > 2 ? stringArg("service_principal", args, 2) : ServicePrincipals.urlSuffix(client.partitionName());
        return ServicePrincipals.servicePrincipal(service, region, urlSuffix);
    }

    private static String stringArg(String functionName, List<Object> args, int index) {
        if (args.size() <= index || args.get(index) == null) {
            throw new IllegalArgumentException(functionName + " expects an argument at position " + index);
        }
        return args.get(index).toString();
    }
}
