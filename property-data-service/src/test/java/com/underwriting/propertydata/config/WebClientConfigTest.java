package com.underwriting.propertydata.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class WebClientConfigTest {

    @Test
    @DisplayName("credentials in query strings are masked in request logs")
    void masksCredentials() {
        assertEquals("https://x/summary?api_key=***&address=1%20A%20St",
            WebClientConfig.sanitize("https://x/summary?api_key=secret&address=1%20A%20St"));
        assertEquals("https://x/property?token=***&city=DENVER",
            WebClientConfig.sanitize("https://x/property?token=abc123&city=DENVER"));
        assertEquals("https://x/q?APIKEY=***", WebClientConfig.sanitize("https://x/q?APIKEY=k"));
    }
}
