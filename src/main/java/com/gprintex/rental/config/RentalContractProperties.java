package com.gprintex.rental.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Rental contract application configuration properties.
 */
@ConfigurationProperties(prefix = "rental")
public record RentalContractProperties(
    ServicesProperties services,
    GenerationProperties generation,
    SigningProperties signing,
    ReconciliationProperties reconciliation
) {
    public RentalContractProperties {
        services = services != null ? services : new ServicesProperties(null, null, null, null, null, null, null);
        generation = generation != null ? generation : new GenerationProperties(null, null, null, null);
        signing = signing != null ? signing : new SigningProperties(null, null, null);
        reconciliation = reconciliation != null ? reconciliation : new ReconciliationProperties(0, 0, 0, null);
    }

    /**
     * Read-only record services. Paths are URI templates with an {id} variable.
     */
    public record ServicesProperties(
        String profileUrl,
        String profilePath,
        String rentalUrl,
        String rentalPath,
        String equipmentUrl,
        String equipmentPath,
        Duration timeout
    ) {
        public ServicesProperties {
            if (profileUrl == null || profileUrl.isBlank()) profileUrl = "http://localhost:8008";
            if (profilePath == null || profilePath.isBlank()) profilePath = "/profile/profil/?user={id}";
            if (rentalUrl == null || rentalUrl.isBlank()) rentalUrl = "http://localhost:8015";
            if (rentalPath == null || rentalPath.isBlank()) rentalPath = "/rental/rental_requests/{id}/";
            if (equipmentUrl == null || equipmentUrl.isBlank()) equipmentUrl = "http://localhost:8006";
            if (equipmentPath == null || equipmentPath.isBlank()) equipmentPath = "/api/stuffs/{id}/";
            if (timeout == null || timeout.isZero() || timeout.isNegative()) timeout = Duration.ofSeconds(5);
        }

        public String profileUri() {
            return join(profileUrl, profilePath);
        }

        public String rentalUri() {
            return join(rentalUrl, rentalPath);
        }

        public String equipmentUri() {
            return join(equipmentUrl, equipmentPath);
        }

        private static String join(String base, String path) {
            var normalizedBase = base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
            return path.startsWith("/") ? normalizedBase + path : normalizedBase + "/" + path;
        }
    }

    public record GenerationProperties(
        String baseUrl,
        String model,
        String apiKey,
        Duration timeout
    ) {
        public GenerationProperties {
            if (baseUrl == null || baseUrl.isBlank()) baseUrl = "https://generativelanguage.googleapis.com";
            if (model == null || model.isBlank()) model = "gemini-2.0-flash";
            if (timeout == null || timeout.isZero() || timeout.isNegative()) timeout = Duration.ofSeconds(60);
        }
    }

    public record SigningProperties(
        String defaultReturnUrl,
        String emailSubject,
        String documentName
    ) {
        public SigningProperties {
            if (defaultReturnUrl == null || defaultReturnUrl.isBlank()) defaultReturnUrl = "http://localhost:5173/client/sign-status/";
            if (emailSubject == null || emailSubject.isBlank()) emailSubject = "Please Sign the Rental Contract";
            if (documentName == null || documentName.isBlank()) documentName = "Rental Contract";
        }
    }

    public record ReconciliationProperties(
        int maxUpdateAttempts,
        int consumerThreads,
        int maxRedeliveries,
        Duration redeliveryDelay
    ) {
        public ReconciliationProperties {
            if (maxUpdateAttempts <= 0) maxUpdateAttempts = 5;
            if (consumerThreads <= 0) consumerThreads = 2;
            if (maxRedeliveries <= 0) maxRedeliveries = 3;
            if (redeliveryDelay == null || redeliveryDelay.isNegative()) redeliveryDelay = Duration.ofSeconds(2);
        }
    }
}
