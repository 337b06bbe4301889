package com.gprintex.rental.config;

import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.charset.StandardCharsets;

/**
 * Configuration properties for the DocuSign eSignature account.
 */
@ConfigurationProperties(prefix = "docusign")
public class DocuSignProperties {

    private static final Logger log = LoggerFactory.getLogger(DocuSignProperties.class);

    /**
     * REST base path, e.g. https://demo.docusign.net/restapi
     */
    private String basePath = "https://demo.docusign.net/restapi";

    /**
     * OAuth host used for the JWT grant.
     */
    private String oauthHost = "account-d.docusign.com";

    /**
     * Integration key (OAuth client id).
     */
    private String integrationKey;

    /**
     * Impersonated API user id.
     */
    private String userId;

    private String accountId;

    /**
     * RSA private key in PEM form.
     */
    private String privateKey;

    /**
     * Requested token lifetime in seconds.
     */
    private long tokenExpirySeconds = 3600;

    /**
     * Connect webhook URL registered on every envelope.
     */
    private String webhookUrl;

    /**
     * HMAC secret for Connect notifications. Verification is skipped when unset.
     */
    private String connectHmacSecret;

    /**
     * Connect and read timeout for provider calls, in milliseconds.
     */
    private int requestTimeout = 30000;

    // Getters and Setters

    public String getBasePath() {
        return basePath;
    }

    public void setBasePath(String basePath) {
        this.basePath = basePath;
    }

    public String getOauthHost() {
        return oauthHost;
    }

    public void setOauthHost(String oauthHost) {
        this.oauthHost = oauthHost;
    }

    public String getIntegrationKey() {
        return integrationKey;
    }

    public void setIntegrationKey(String integrationKey) {
        this.integrationKey = integrationKey;
    }

    public String getUserId() {
        return userId;
    }

    public void setUserId(String userId) {
        this.userId = userId;
    }

    public String getAccountId() {
        return accountId;
    }

    public void setAccountId(String accountId) {
        this.accountId = accountId;
    }

    public String getPrivateKey() {
        return privateKey;
    }

    public void setPrivateKey(String privateKey) {
        this.privateKey = privateKey;
    }

    public long getTokenExpirySeconds() {
        return tokenExpirySeconds;
    }

    public void setTokenExpirySeconds(long tokenExpirySeconds) {
        this.tokenExpirySeconds = tokenExpirySeconds;
    }

    public String getWebhookUrl() {
        return webhookUrl;
    }

    public void setWebhookUrl(String webhookUrl) {
        this.webhookUrl = webhookUrl;
    }

    public String getConnectHmacSecret() {
        return connectHmacSecret;
    }

    public void setConnectHmacSecret(String connectHmacSecret) {
        this.connectHmacSecret = connectHmacSecret;
    }

    public int getRequestTimeout() {
        return requestTimeout;
    }

    public void setRequestTimeout(int requestTimeout) {
        this.requestTimeout = requestTimeout;
    }

    /**
     * Private key bytes for the JWT grant. Escaped newlines from env files are restored.
     */
    public byte[] privateKeyBytes() {
        if (isBlank(privateKey)) {
            return new byte[0];
        }
        return privateKey.replace("\\n", "\n").getBytes(StandardCharsets.US_ASCII);
    }

    public boolean isHmacVerificationEnabled() {
        return !isBlank(connectHmacSecret);
    }

    /**
     * Validate configuration at startup.
     * Missing credentials only warn; token acquisition fails per request instead.
     */
    @PostConstruct
    public void validate() {
        if (isBlank(integrationKey) || isBlank(userId) || isBlank(accountId) || isBlank(privateKey)) {
            log.warn("DocuSign credentials incomplete - envelope submission will fail with AUTH_FAILED. " +
                "Set DOCUSIGN_INTEGRATION_KEY, DOCUSIGN_USER_ID, DOCUSIGN_ACCOUNT_ID and DOCUSIGN_PRIVATE_KEY.");
        }
        if (isBlank(webhookUrl)) {
            log.warn("DocuSign webhook URL is not configured - envelopes will be created without Connect notifications");
        }
        if (!isHmacVerificationEnabled()) {
            log.info("DocuSign Connect HMAC verification disabled");
        }
    }

    private boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
