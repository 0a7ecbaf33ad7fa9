package ru.oparin.drawer.service.adapter;

import java.util.List;

/**
 * Константы форматов API бэкендов генерации.
 */
public final class AdapterConstants {

    private AdapterConstants() {
        throw new UnsupportedOperationException("Utility class");
    }

    public static final String BEARER_PREFIX = "Bearer ";
    public static final String DATA_URL_PREFIX = "data:";
    public static final String DATA_URL_SEPARATOR = ";base64,";

    /**
     * Маркер конца SSE потока.
     */
    public static final String STREAM_DONE = "[DONE]";

    /**
     * Значение ключа для бэкендов без авторизации: такой ключ не передается в запросе.
     */
    public static final String NO_AUTH_PLACEHOLDER = "none";

    /**
     * Нужно ли передавать ключ бэкенду.
     */
    public static boolean hasCredential(String secret) {
        return secret != null && !secret.isBlank() && !NO_AUTH_PLACEHOLDER.equalsIgnoreCase(secret.trim());
    }

    public static final class Chat {
        private Chat() {
            throw new UnsupportedOperationException("Utility class");
        }

        public static final String ROLE_USER = "user";
        public static final String TYPE_TEXT = "text";
        public static final String TYPE_IMAGE_URL = "image_url";
    }

    public static final class Gemini {
        private Gemini() {
            throw new UnsupportedOperationException("Utility class");
        }

        public static final String GENERATE_SUFFIX = ":generateContent";
        public static final String STREAM_GENERATE_SUFFIX = ":streamGenerateContent";
        public static final String KEY_PARAM = "key";
        public static final String ALT_PARAM = "alt";
        public static final String ALT_SSE = "sse";
        public static final List<String> RESPONSE_MODALITIES = List.of("TEXT", "IMAGE");
        public static final String BLOCK_NONE = "BLOCK_NONE";
        public static final List<String> HARM_CATEGORIES = List.of(
                "HARM_CATEGORY_HARASSMENT",
                "HARM_CATEGORY_HATE_SPEECH",
                "HARM_CATEGORY_SEXUALLY_EXPLICIT",
                "HARM_CATEGORY_DANGEROUS_CONTENT");
    }

    public static final class Images {
        private Images() {
            throw new UnsupportedOperationException("Utility class");
        }

        public static final String RESPONSE_FORMAT_URL = "url";
        public static final String DEFAULT_SIZE = "2K";
    }
}
