package com.iksanov.surveyshield.node.config;

import com.iksanov.surveyshield.common.cluster.InstanceInfo;
import com.iksanov.surveyshield.common.exception.ConfigurationException;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Application configuration record for a submission node.
 * <p>
 * The instance secret and the admin token have no defaults: a node without them refuses to start.
 */
public record ApplicationConfig(
        InstanceInfo self,
        String bindHost,
        String instanceSecret,
        String adminToken,
        String dbUrl,
        String dbUser,
        String dbPassword,
        int dbPoolSize,
        Duration transferTimeout,
        DssConfig dss,
        ElectionConfig election
) {
    public ApplicationConfig {
        Objects.requireNonNull(self, "self");
        Objects.requireNonNull(dss, "dss");
        Objects.requireNonNull(election, "election");
        if (instanceSecret == null || instanceSecret.isBlank()) throw new ConfigurationException("Instance secret is not configured");
        if (adminToken == null || adminToken.isBlank()) throw new ConfigurationException("Admin token is not configured");
        if (dbUrl == null || dbUrl.isBlank()) throw new ConfigurationException("Database URL is not configured");
        if (dbPoolSize <= 0) throw new ConfigurationException("Database pool size must be > 0");
        if (transferTimeout == null || transferTimeout.isZero() || transferTimeout.isNegative())
            throw new ConfigurationException("Transfer timeout must be > 0");
    }

    public static ApplicationConfig fromEnv() {
        return from(System.getenv());
    }

    public static ApplicationConfig from(Map<String, String> env) {
        EnvVars vars = new EnvVars(env);
        String host = vars.get("SHIELD_HOSTNAME", vars.get("HOSTNAME", null));
        if (host == null) host = localHostName();
        InstanceInfo self;
        try {
            self = new InstanceInfo(host, vars.getInt("SHIELD_PORT", 8080));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid instance identity: " + e.getMessage(), e);
        }

        return new ApplicationConfig(
                self,
                vars.get("SHIELD_BIND_HOST", "0.0.0.0"),
                vars.require("SHIELD_INSTANCE_SECRET"),
                vars.require("SHIELD_ADMIN_TOKEN"),
                vars.require("SHIELD_DB_URL"),
                vars.get("SHIELD_DB_USER", null),
                vars.get("SHIELD_DB_PASSWORD", null),
                vars.getInt("SHIELD_DB_POOL_SIZE", 5),
                Duration.ofMillis(vars.getLong("TRANSFER_TIMEOUT_MS", 5_000)),
                DssConfig.from(env),
                ElectionConfig.from(env)
        );
    }

    public HttpServerConfig toHttpServerConfig() {
        HttpServerConfig defaults = HttpServerConfig.defaults();
        return new HttpServerConfig(bindHost, self.port(), defaults.bossThreads(), defaults.workerThreads(),
                defaults.businessThreads(), defaults.backlog(), defaults.maxContentLength(),
                defaults.shutdownQuietPeriodSeconds(), defaults.shutdownTimeoutSeconds());
    }

    private static String localHostName() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            throw new ConfigurationException("Cannot derive instance host; set SHIELD_HOSTNAME", e);
        }
    }

    @Override
    public String toString() {
        return String.format("ApplicationConfig[instance=%s, bind=%s, db=%s, pool=%d, transferTimeout=%dms, %s, %s]",
                self.instanceId(), bindHost, dbUrl, dbPoolSize, transferTimeout.toMillis(), dss, election);
    }
}
