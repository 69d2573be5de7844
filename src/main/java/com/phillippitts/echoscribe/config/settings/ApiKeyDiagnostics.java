package com.phillippitts.echoscribe.config.settings;

import com.phillippitts.echoscribe.util.LogSanitizer;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-service API key status with operator-facing instructions for fixing a missing key.
 */
public final class ApiKeyDiagnostics {

    /**
     * Status of one service's credential.
     *
     * @param valid whether the key is present and well-formed
     * @param error what is wrong and how to fix it; {@code null} when valid
     */
    public record KeyStatus(boolean valid, String error) {

        static KeyStatus ok() {
            return new KeyStatus(true, null);
        }

        static KeyStatus invalid(String error) {
            return new KeyStatus(false, error);
        }
    }

    private ApiKeyDiagnostics() {
    }

    /**
     * Checks the OpenAI and Hugging Face keys.
     *
     * @return statuses keyed by service ({@code openai}, {@code huggingface}), in that order
     */
    public static Map<String, KeyStatus> evaluate(AiServiceSettings settings) {
        Map<String, KeyStatus> results = new LinkedHashMap<>();

        String openAiKey = settings.openai().apiKey();
        if (!AiServiceSettings.isPresent(openAiKey)) {
            results.put("openai", KeyStatus.invalid(
                    missingKeyMessage("OpenAI", "OPENAI_API_KEY", AiServiceRules.OPENAI_KEYS_URL)));
        } else if (!openAiKey.startsWith("sk-")) {
            results.put("openai", KeyStatus.invalid(
                    "OPENAI_API_KEY must start with \"sk-\". Please check your API key format (received: "
                            + LogSanitizer.mask(openAiKey) + ")."));
        } else {
            results.put("openai", KeyStatus.ok());
        }

        String hfKey = settings.huggingface().apiKey();
        if (!AiServiceSettings.isPresent(hfKey)) {
            results.put("huggingface", KeyStatus.invalid(
                    missingKeyMessage("Hugging Face", "HUGGINGFACE_API_KEY", AiServiceRules.HUGGINGFACE_TOKENS_URL)));
        } else if (hfKey.length() <= 10) {
            results.put("huggingface", KeyStatus.invalid(
                    "HUGGINGFACE_API_KEY appears to be invalid. Please check your API key."));
        } else {
            results.put("huggingface", KeyStatus.ok());
        }

        return results;
    }

    /**
     * Multi-line help text for a missing API key.
     */
    public static String missingKeyMessage(String service, String keyName, String url) {
        return String.join(System.lineSeparator(),
                "Missing API Key: " + keyName,
                "",
                "The " + service + " service requires an API key to function properly.",
                "",
                "To fix this:",
                "1. Get your API key from: " + url,
                "2. Add it to your .env file: " + keyName + "=your_api_key_here",
                "3. Restart the application",
                "",
                "Without this key, " + service + " features will not work.");
    }
}
