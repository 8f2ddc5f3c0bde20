package com.healthsync.vitals.config;

import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class StartupDiagnostics {
    private static final Logger log = LoggerFactory.getLogger(StartupDiagnostics.class);
    private final VitalsProperties props;

    public StartupDiagnostics(VitalsProperties props) {
        this.props = props;
    }

    @PostConstruct
    void logConfig() {
        // structural info only, never the secret itself
        var security = props.security();
        log.info("Startup diagnostics: issuer='{}', audience='{}', userClaim='{}', hasDevSecret={}",
                security.issuer(), security.audience(), security.userClaim(), security.hasDevJwtSecret());

        var outliers = props.outliers();
        log.info("Outlier config: defaultMethod={}, iqrMultiplier={}, zScoreThreshold={}",
                outliers.defaultMethod(), outliers.iqrMultiplier(), outliers.zScoreThreshold());
        log.info("DB config: bootstrapEnabled={}", props.db().bootstrapEnabled());
    }
}
