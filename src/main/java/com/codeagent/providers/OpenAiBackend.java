package com.codeagent.providers;

import java.net.http.HttpClient;
import java.time.Duration;

public class OpenAiBackend extends OpenAiCompatibleBackend {

    public static final String DEFAULT_BASE_URL = "https://api.openai.com/v1";

    public OpenAiBackend(String apiKey, String baseUrl, String model,
                         Duration requestTimeout, ResponseParser parser, HttpClient httpClient) {
        super(apiKey, baseUrl != null ? baseUrl : DEFAULT_BASE_URL, model, requestTimeout, parser, httpClient);
    }

    @Override
    public String id() {
        return "openai";
    }
}
