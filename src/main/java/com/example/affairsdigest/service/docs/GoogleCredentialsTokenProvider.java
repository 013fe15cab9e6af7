/**
 * Access tokens for the document API from a stored Google credentials file
 * (authorized user token or service account key). Tokens are refreshed when they expire.
 */

package com.example.affairsdigest.service.docs;

import com.google.auth.oauth2.AccessToken;
import com.google.auth.oauth2.GoogleCredentials;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

public class GoogleCredentialsTokenProvider implements AccessTokenProvider {
    public static final String DOCUMENTS_SCOPE = "https://www.googleapis.com/auth/documents";

    private final GoogleCredentials credentials;

    public GoogleCredentialsTokenProvider(GoogleCredentials credentials) {
        this.credentials = credentials;
    }

    public static GoogleCredentialsTokenProvider fromFile(Path credentialsFile) throws IOException {
        try (InputStream in = Files.newInputStream(credentialsFile)) {
            GoogleCredentials credentials = GoogleCredentials.fromStream(in).createScoped(List.of(DOCUMENTS_SCOPE));
            return new GoogleCredentialsTokenProvider(credentials);
        }
    }

    @Override
    public synchronized String getAccessToken() throws IOException {
        credentials.refreshIfExpired();
        AccessToken token = credentials.getAccessToken();
        if (token == null) {
            throw new IOException("No access token available from Google credentials");
        }
        return token.getTokenValue();
    }
}
