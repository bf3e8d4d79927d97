package com.codeagent.providers;

import com.codeagent.shared.config.BackendConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.function.Function;

/** Builds the backend named by {@code backend.type}, wrapped in retry handling. */
public final class BackendFactory {

    private static final Logger log = LoggerFactory.getLogger(BackendFactory.class);

    private BackendFactory() {}

    public static ModelBackend create(BackendConfig config) {
        return create(config, System::getenv, Sleeper.SYSTEM, RetryPolicy.Listener.NONE, null);
    }

    public static ModelBackend create(BackendConfig config, Function<String, String> env,
                                      Sleeper sleeper, RetryPolicy.Listener listener, HttpClient httpClient) {
        var base = switch (config.type()) {
            case "openrouter" -> new OpenRouterBackend(
                    apiKey(config, env, "OPENROUTER_API_KEY"), config.baseUrl(), requireModel(config),
                    Duration.ofSeconds(config.timeoutSeconds()), parser(config), httpClient);
            case "openai" -> new OpenAiBackend(
                    apiKey(config, env, "OPENAI_API_KEY"), config.baseUrl(), requireModel(config),
                    Duration.ofSeconds(config.timeoutSeconds()), parser(config), httpClient);
            case "noop" -> new NoToolBackend();
            default -> throw new IllegalArgumentException("Unsupported backend type: " + config.type());
        };
        RetryPolicy.Listener logging = (attempt, delay, error) -> {
            log.warn("Backend {} transient failure (retry {} in {} ms): {}",
                    base.id(), attempt, delay.toMillis(), error.getMessage());
            listener.onRetry(attempt, delay, error);
        };
        return new RetryingBackend(base, new RetryPolicy(config.retry(), sleeper, logging));
    }

    private static ResponseParser parser(BackendConfig config) {
        return new ResponseParser(config.extractInlineToolCalls() ? new InlineToolCallExtractor() : null);
    }

    private static String requireModel(BackendConfig config) {
        if (config.model() == null || config.model().isBlank()) {
            throw new IllegalArgumentException("Missing model id in agent spec backend.model");
        }
        return config.model();
    }

    private static String apiKey(BackendConfig config, Function<String, String> env, String defaultEnv) {
        var envName = config.apiKeyEnv() != null ? config.apiKeyEnv() : defaultEnv;
        var key = env.apply(envName);
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException(envName + " is required for backend " + config.type());
        }
        return key;
    }
}
