package com.bbthechange.gallery.config;

import com.google.auth.oauth2.GoogleCredentials;
import com.google.firebase.FirebaseApp;
import com.google.firebase.FirebaseOptions;
import com.google.firebase.auth.FirebaseAuth;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;

/**
 * Firebase Admin SDK wiring for ID-token verification.
 */
@Configuration
public class FirebaseConfig {

    private static final Logger logger = LoggerFactory.getLogger(FirebaseConfig.class);

    @Bean
    public FirebaseApp firebaseApp(IdentityProperties identityProperties) throws IOException {
        if (!FirebaseApp.getApps().isEmpty()) {
            logger.info("FirebaseApp already initialized, returning existing instance");
            return FirebaseApp.getInstance();
        }

        GoogleCredentials credentials;
        String credentialsPath = identityProperties.getCredentialsPath();
        if (credentialsPath != null && !credentialsPath.isBlank()) {
            logger.info("Initializing Firebase from service account file {}", credentialsPath);
            try (InputStream in = new FileInputStream(credentialsPath)) {
                credentials = GoogleCredentials.fromStream(in);
            }
        } else {
            logger.info("Initializing Firebase from application default credentials");
            credentials = GoogleCredentials.getApplicationDefault();
        }

        FirebaseOptions.Builder options = FirebaseOptions.builder().setCredentials(credentials);
        if (identityProperties.getProjectId() != null && !identityProperties.getProjectId().isBlank()) {
            options.setProjectId(identityProperties.getProjectId());
        }

        FirebaseApp app = FirebaseApp.initializeApp(options.build());
        logger.info("Firebase initialized for project {}", app.getOptions().getProjectId());
        return app;
    }

    @Bean
    public FirebaseAuth firebaseAuth(FirebaseApp firebaseApp) {
        return FirebaseAuth.getInstance(firebaseApp);
    }
}
