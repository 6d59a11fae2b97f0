package com.postqueue.dispatch;

import com.postqueue.core.DeliveryException;
import com.postqueue.core.DeliveryReceipt;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;
import java.util.logging.Logger;

/**
 * Delivers payloads by POSTing them to a per-target webhook URL.
 *
 * <p>A payload that is already a JSON object is sent as the request body, with
 * {@code username} filled in when the payload leaves it out. Anything else is
 * treated as plain text and wrapped as {@code {"content": payload}}.</p>
 *
 * <p>The receipt id is the {@code id} field of the response body when the
 * webhook returns one, otherwise a generated id.</p>
 */
public class WebhookDispatcher implements Dispatcher {
    private static final Logger logger = Logger.getLogger(WebhookDispatcher.class.getName());

    private final Map<String, URI> webhooks;
    private final String defaultUsername;
    private final Duration timeout;
    private final HttpClient client;
    private final Clock clock;

    public WebhookDispatcher(Map<String, URI> webhooks, String defaultUsername, Duration timeout) {
        this(webhooks, defaultUsername, timeout, Clock.systemUTC());
    }

    public WebhookDispatcher(Map<String, URI> webhooks, String defaultUsername, Duration timeout, Clock clock) {
        this.webhooks = new HashMap<>(webhooks);
        this.defaultUsername = defaultUsername;
        this.timeout = timeout;
        this.clock = clock;
        this.client = HttpClient.newBuilder()
            .connectTimeout(timeout)
            .build();
    }

    @Override
    public DeliveryReceipt deliver(String target, String payload) throws DeliveryException {
        URI webhook = webhooks.get(target);
        if (webhook == null) {
            throw new DeliveryException(target, "No webhook configured for target " + target);
        }

        String body = buildBody(payload);
        HttpRequest request = HttpRequest.newBuilder(webhook)
            .timeout(timeout)
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8))
            .build();

        HttpResponse<String> response;
        try {
            response = client.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new DeliveryException(target, "Webhook request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DeliveryException(target, "Interrupted while delivering to " + target, e);
        }

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw new DeliveryException(target, "Webhook returned HTTP " + status + describe(response.body()), status);
        }

        String messageId = receiptId(response.body());
        logger.fine("Webhook for " + target + " accepted message " + messageId);
        return new DeliveryReceipt(messageId, clock.instant());
    }

    /**
     * @return how many targets have a webhook configured
     */
    public int getWebhookCount() {
        return webhooks.size();
    }

    String buildBody(String payload) {
        String trimmed = payload != null ? payload.trim() : "";
        if (trimmed.startsWith("{")) {
            try {
                JSONObject json = new JSONObject(trimmed);
                if (defaultUsername != null && !json.has("username")) {
                    json.put("username", defaultUsername);
                }
                return json.toString();
            } catch (JSONException e) {
                // not an object after all; send it as text
                logger.fine("Payload looks like JSON but does not parse; sending as text");
            }
        }

        JSONObject json = new JSONObject();
        json.put("content", payload != null ? payload : "");
        if (defaultUsername != null) {
            json.put("username", defaultUsername);
        }
        return json.toString();
    }

    private String receiptId(String responseBody) {
        if (responseBody != null && !responseBody.isBlank()) {
            try {
                JSONObject json = new JSONObject(responseBody);
                if (json.has("id")) {
                    return String.valueOf(json.get("id"));
                }
            } catch (JSONException e) {
                logger.fine("Webhook response is not a JSON object; generating receipt id");
            }
        }
        return UUID.randomUUID().toString();
    }

    private static String describe(String body) {
        if (body == null || body.isBlank()) {
            return "";
        }
        return ": " + (body.length() > 200 ? body.substring(0, 200) + "..." : body);
    }
}
