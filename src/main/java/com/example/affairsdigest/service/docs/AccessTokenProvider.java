package com.example.affairsdigest.service.docs;

import java.io.IOException;

public interface AccessTokenProvider {
    String getAccessToken() throws IOException;
}
