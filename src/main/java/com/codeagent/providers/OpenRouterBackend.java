package com.codeagent.providers;

import java.net.http.HttpClient;
import java.time.Duration;

public class OpenRouterBackend extends OpenAiCompatibleBackend {

    public static final String DEFAULT_BASE_URL = "https://openrouter.ai/api/v1";

    public OpenRouterBackend(String apiKey, String baseUrl, String model,
                             Duration requestTimeout, ResponseParser parser, HttpClient httpClient) {
        super(apiKey, baseUrl != null ? baseUrl : DEFAULT_BASE_URL, qualify(model),
                requestTimeout, parser, httpClient);
    }

    /** OpenRouter expects provider-prefixed ids such as {@code qwen/qwen2.5-coder-7b-instruct}. */
    static String qualify(String model) {
        if (!model.contains("/") && model.startsWith("qwen")) return "qwen/" + model;
        return model;
    }

    @Override
    public String id() {
        return "openrouter";
    }
}
