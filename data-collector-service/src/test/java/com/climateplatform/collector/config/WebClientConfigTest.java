package com.climateplatform.collector.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class WebClientConfigTest {

    @Test
    @DisplayName("credentials in query strings are masked for logging")
    void masksSecrets() {
        assertEquals("https://x.test/data?token=***&limit=10",
            WebClientConfig.maskSecrets("https://x.test/data?token=abc123&limit=10"));
        assertEquals("https://x.test/data?api_key=***",
            WebClientConfig.maskSecrets("https://x.test/data?api_key=s3cr3t"));
        assertEquals("https://x.test/data?apikey=***&date=2024-01-01",
            WebClientConfig.maskSecrets("https://x.test/data?apikey=K&date=2024-01-01"));
    }

    @Test
    @DisplayName("URLs without credentials are unchanged")
    void leavesOthersAlone() {
        String url = "https://power.larc.nasa.gov/api/temporal/daily/point?latitude=45.42";
        assertEquals(url, WebClientConfig.maskSecrets(url));
    }
}
