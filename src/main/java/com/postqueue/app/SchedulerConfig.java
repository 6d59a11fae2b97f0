package com.postqueue.app;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.time.Duration;
import java.util.Map;
import java.util.Properties;
import java.util.Set;
import java.util.TreeMap;
import java.util.logging.Logger;

/**
 * Runtime settings for the scheduler process.
 *
 * <p>Values come from {@code scheduler.properties} on the classpath. Any key
 * can be overridden with a JVM system property of the same name, e.g.
 * {@code -Dcontrol.port=9090}.</p>
 *
 * <p><b>Keys:</b></p>
 * <ul>
 *   <li>{@code db.url}, {@code db.user}, {@code db.password}, {@code db.poolSize}</li>
 *   <li>{@code dispatch.threads}: firing threads for deliveries</li>
 *   <li>{@code control.port}: HTTP control surface</li>
 *   <li>{@code webhook.<target>}: webhook URL for a target</li>
 *   <li>{@code webhook.timeoutSeconds}, {@code webhook.username}</li>
 *   <li>{@code health.failureWindowHours}, {@code health.failureWarnThreshold}</li>
 * </ul>
 */
public class SchedulerConfig {
    private static final Logger logger = Logger.getLogger(SchedulerConfig.class.getName());

    public static final String RESOURCE = "/scheduler.properties";

    private static final String WEBHOOK_PREFIX = "webhook.";
    private static final Set<String> WEBHOOK_SETTINGS = Set.of("webhook.timeoutSeconds", "webhook.username");

    private final Properties properties;

    public SchedulerConfig(Properties properties) {
        this.properties = properties;
    }

    /**
     * Load the classpath defaults and apply system property overrides.
     */
    public static SchedulerConfig load() {
        Properties properties = new Properties();
        try (InputStream is = SchedulerConfig.class.getResourceAsStream(RESOURCE)) {
            if (is != null) {
                properties.load(is);
            } else {
                logger.warning(RESOURCE + " not found on classpath; using built-in defaults");
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read " + RESOURCE, e);
        }

        for (String name : System.getProperties().stringPropertyNames()) {
            if (name.startsWith("db.") || name.startsWith("dispatch.") || name.startsWith("control.")
                || name.startsWith(WEBHOOK_PREFIX) || name.startsWith("health.")) {
                properties.setProperty(name, System.getProperty(name));
            }
        }
        return new SchedulerConfig(properties);
    }

    public String getDbUrl() {
        return properties.getProperty("db.url", "jdbc:h2:./postqueue;AUTO_SERVER=TRUE");
    }

    public String getDbUser() {
        return properties.getProperty("db.user", "sa");
    }

    public String getDbPassword() {
        return properties.getProperty("db.password", "");
    }

    public int getDbPoolSize() {
        return getInt("db.poolSize", 10);
    }

    public int getDispatchThreads() {
        return getInt("dispatch.threads", 4);
    }

    public int getControlPort() {
        return getInt("control.port", 8080);
    }

    public Duration getWebhookTimeout() {
        return Duration.ofSeconds(getInt("webhook.timeoutSeconds", 10));
    }

    public String getWebhookUsername() {
        String username = properties.getProperty("webhook.username");
        return username == null || username.isBlank() ? null : username.trim();
    }

    /**
     * @return target name to webhook URL, sorted by target
     */
    public Map<String, URI> getWebhooks() {
        Map<String, URI> webhooks = new TreeMap<>();
        for (String name : properties.stringPropertyNames()) {
            if (!name.startsWith(WEBHOOK_PREFIX) || WEBHOOK_SETTINGS.contains(name)) {
                continue;
            }
            String url = properties.getProperty(name).trim();
            if (url.isEmpty()) {
                continue;
            }
            try {
                webhooks.put(name.substring(WEBHOOK_PREFIX.length()), URI.create(url));
            } catch (IllegalArgumentException e) {
                throw new IllegalStateException("Invalid webhook URL for " + name + ": " + url, e);
            }
        }
        return webhooks;
    }

    public int getFailureWindowHours() {
        return getInt("health.failureWindowHours", 24);
    }

    public int getFailureWarnThreshold() {
        return getInt("health.failureWarnThreshold", 5);
    }

    private int getInt(String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Setting " + key + " must be an integer, got: " + value, e);
        }
    }
}
