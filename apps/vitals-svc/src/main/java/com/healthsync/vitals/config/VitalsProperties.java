package com.healthsync.vitals.config;

import com.healthsync.vitals.model.OutlierMethod;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;

@ConfigurationProperties(prefix = "vitals")
public record VitalsProperties(
        Security security,
        Outliers outliers,
        Db db
) {

    @ConstructorBinding
    public VitalsProperties {
        if (security == null) {
            security = new Security(null, null, null, null);
        }
        if (outliers == null) {
            outliers = new Outliers(null, null, null);
        }
        if (db == null) {
            db = new Db(false);
        }
    }

    public record Security(String issuer, String audience, String devJwtSecret, String userClaim) {
        public Security {
            // userClaim picks the JWT claim that identifies the user; email unless configured otherwise
            if (userClaim == null || userClaim.isBlank()) {
                userClaim = "email";
            }
        }

        public boolean hasIssuer() {
            return issuer != null && !issuer.isBlank();
        }

        public boolean hasAudience() {
            return audience != null && !audience.isBlank();
        }

        public boolean hasDevJwtSecret() {
            return devJwtSecret != null && !devJwtSecret.isBlank();
        }
    }

    public record Outliers(OutlierMethod defaultMethod, Double zScoreThreshold, Double iqrMultiplier) {
        public Outliers {
            if (defaultMethod == null) {
                defaultMethod = OutlierMethod.IQR;
            }
            if (zScoreThreshold == null) {
                zScoreThreshold = 2.0d;
            }
            if (iqrMultiplier == null) {
                iqrMultiplier = 1.5d;
            }
            if (zScoreThreshold <= 0) {
                throw new IllegalArgumentException("zScoreThreshold must be positive");
            }
            if (iqrMultiplier <= 0) {
                throw new IllegalArgumentException("iqrMultiplier must be positive");
            }
        }
    }

    public record Db(boolean bootstrapEnabled) {
    }
}
