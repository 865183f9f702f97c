package io.fullerstack.ses.core.config;

import java.util.Objects;

/**
 * Identity of the monitored account, used for display fields and dedup keys.
 *
 * @param accountName            AWS account alias (e.g., "supercoolco")
 * @param region                 AWS region (e.g., "us-west-2")
 * @param environment            deployment environment (e.g., "prod")
 * @param serviceName            name of this monitor instance, prefix of every dedup key
 * @param sesConsoleUrl          link to the SES console dashboard
 * @param reputationDashboardUrl link to the SES reputation dashboard
 */
public record AccountContext(
    String accountName,
    String region,
    String environment,
    String serviceName,
    String sesConsoleUrl,
    String reputationDashboardUrl
) {

    public AccountContext {
        Objects.requireNonNull(accountName, "accountName cannot be null");
        Objects.requireNonNull(region, "region cannot be null");
        Objects.requireNonNull(environment, "environment cannot be null");
        Objects.requireNonNull(serviceName, "serviceName cannot be null");
        Objects.requireNonNull(sesConsoleUrl, "sesConsoleUrl cannot be null");
        Objects.requireNonNull(reputationDashboardUrl, "reputationDashboardUrl cannot be null");
        if (serviceName.isBlank()) {
            throw new IllegalArgumentException("serviceName cannot be blank");
        }
    }

    /**
     * Builds a context with the default service name and console links for the region.
     *
     * @param accountName account alias
     * @param region      AWS region
     * @param environment deployment environment
     * @param name        monitor name (e.g., "ses-account-monitor")
     * @return context with derived values
     */
    public static AccountContext of(String accountName, String region, String environment, String name) {
        return new AccountContext(
            accountName,
            region,
            environment,
            defaultServiceName(accountName, region, environment, name),
            defaultConsoleUrl(region),
            defaultReputationDashboardUrl(region));
    }

    static String defaultServiceName(String accountName, String region, String environment, String name) {
        return accountName + "-" + region + "-" + environment + "-" + name;
    }

    static String sesBaseUrl(String region) {
        return "https://" + region + ".console.aws.amazon.com/ses/home?region=" + region;
    }

    static String defaultConsoleUrl(String region) {
        return sesBaseUrl(region) + "#dashboard:";
    }

    static String defaultReputationDashboardUrl(String region) {
        return sesBaseUrl(region) + "#reputation-dashboard:";
    }

    /**
     * @return group name used by PagerDuty, e.g. {@code aws-supercoolco}
     */
    public String group() {
        return "aws-" + accountName;
    }
}
