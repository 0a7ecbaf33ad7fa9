package ru.oparin.drawer.service.adapter;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;
import ru.oparin.drawer.model.domain.ImagePayload;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Поиск изображения в ответах бэкендов разных форматов.
 * <p>
 * Порядок проверки: {@code data[]} (images API), {@code choices[0]} (chat completions),
 * {@code candidates[0]} (Gemini). Первое найденное изображение побеждает.
 */
@Slf4j
@UtilityClass
public class ImageContentParser {

    private static final Pattern MARKDOWN_IMAGE = Pattern.compile("!\\[.*?]\\((.*?)\\)");
    private static final Pattern IMAGE_URL = Pattern.compile(
            "https?://\\S+\\.(?:png|jpg|jpeg|gif|webp|bmp|ico|tiff?)(?:\\?\\S*)?", Pattern.CASE_INSENSITIVE);
    private static final Pattern ANY_URL = Pattern.compile("https?://\\S+");
    private static final Pattern DATA_URL = Pattern.compile("data:(image/\\w+);base64,([a-zA-Z0-9+/=\\n]+)");
    private static final List<String> NON_IMAGE_URL_KEYWORDS = List.of("dashboard", "login", "signin", "register", "admin");

    /**
     * Найти изображение в JSON ответе или в отдельном событии потока.
     *
     * @param body ответ бэкенда
     * @return найденное изображение или null
     */
    public static ImagePayload extract(JsonNode body) {
        if (body == null || !body.isObject()) {
            return null;
        }
        ImagePayload payload = fromImagesData(body);
        if (payload == null) {
            payload = fromChoices(body);
        }
        if (payload == null) {
            payload = fromCandidates(body);
        }
        return payload;
    }

    /**
     * Формат images API: {@code data[].url}, {@code data[].b64_json}, а в событиях потока
     * те же поля на верхнем уровне.
     */
    public static ImagePayload fromImagesData(JsonNode body) {
        JsonNode data = body.path("data");
        if (data.isArray()) {
            for (JsonNode item : data) {
                ImagePayload payload = fromUrlOrB64(item);
                if (payload != null) {
                    return payload;
                }
            }
        }
        return fromUrlOrB64(body);
    }

    /**
     * Формат chat completions: {@code choices[0].delta|message}.
     */
    public static ImagePayload fromChoices(JsonNode body) {
        JsonNode choices = body.path("choices");
        if (!choices.isArray() || choices.isEmpty()) {
            return null;
        }
        JsonNode choice = choices.get(0);
        JsonNode content = null;
        JsonNode delta = choice.path("delta");
        if (delta.has("content")) {
            content = delta.get("content");
        }
        JsonNode message = choice.path("message");
        if ((content == null || content.isNull()) && message.has("content")) {
            content = message.get("content");
        }

        ImagePayload payload = fromMessageImages(message.path("images"));
        if (payload == null) {
            payload = fromMessageImages(delta.path("images"));
        }
        if (payload != null) {
            return payload;
        }

        if (content == null || content.isNull()) {
            return null;
        }
        if (content.isArray()) {
            return fromContentArray(content);
        }
        if (content.isTextual()) {
            return fromText(content.asText());
        }
        return null;
    }

    /**
     * Формат Gemini: {@code candidates[0].content.parts[]} с inlineData или data URL в тексте.
     */
    public static ImagePayload fromCandidates(JsonNode body) {
        JsonNode candidates = body.path("candidates");
        if (!candidates.isArray() || candidates.isEmpty()) {
            return null;
        }
        JsonNode parts = candidates.get(0).path("content").path("parts");
        if (!parts.isArray()) {
            return null;
        }
        for (JsonNode part : parts) {
            JsonNode inlineData = part.has("inlineData") ? part.get("inlineData") : part.path("inline_data");
            String data = textOrNull(inlineData.path("data"));
            if (data != null) {
                String mimeType = textOrNull(inlineData.has("mimeType")
                        ? inlineData.get("mimeType") : inlineData.path("mime_type"));
                return ImagePayload.ofBase64(data, mimeType);
            }
            String text = textOrNull(part.path("text"));
            if (text != null) {
                ImagePayload payload = fromDataUrlInText(text);
                if (payload != null) {
                    return payload;
                }
            }
        }
        return null;
    }

    /**
     * Найти изображение в текстовом ответе: markdown картинка, ссылка на файл изображения,
     * любая ссылка кроме служебных страниц, data URL.
     */
    public static ImagePayload fromText(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        Matcher markdown = MARKDOWN_IMAGE.matcher(text);
        if (markdown.find()) {
            return fromReference(markdown.group(1));
        }
        Matcher imageUrl = IMAGE_URL.matcher(text);
        if (imageUrl.find()) {
            return ImagePayload.ofUrl(imageUrl.group());
        }
        Matcher anyUrl = ANY_URL.matcher(text);
        if (anyUrl.find()) {
            String url = anyUrl.group();
            String lower = url.toLowerCase(Locale.ROOT);
            if (NON_IMAGE_URL_KEYWORDS.stream().noneMatch(lower::contains)) {
                return ImagePayload.ofUrl(url);
            }
            log.warn("Пропущена ссылка, не похожая на изображение: {}", url);
        }
        return fromDataUrlInText(text);
    }

    /**
     * Разобрать ссылку на изображение: data URL или обычный URL.
     */
    public static ImagePayload fromReference(String reference) {
        if (reference == null || reference.isBlank()) {
            return null;
        }
        String trimmed = reference.trim();
        if (trimmed.startsWith(AdapterConstants.DATA_URL_PREFIX)) {
            int separator = trimmed.indexOf(AdapterConstants.DATA_URL_SEPARATOR);
            if (separator < 0) {
                return null;
            }
            String mimeType = trimmed.substring(AdapterConstants.DATA_URL_PREFIX.length(), separator);
            String data = trimmed.substring(separator + AdapterConstants.DATA_URL_SEPARATOR.length());
            return ImagePayload.ofBase64(data, mimeType.isEmpty() ? null : mimeType);
        }
        if (trimmed.startsWith("http://") || trimmed.startsWith("https://")) {
            return ImagePayload.ofUrl(trimmed);
        }
        return null;
    }

    private static ImagePayload fromMessageImages(JsonNode images) {
        if (!images.isArray()) {
            return null;
        }
        for (JsonNode image : images) {
            ImagePayload payload = fromReference(textOrNull(image.path("image_url").path("url")));
            if (payload == null) {
                payload = fromReference(textOrNull(image.path("url")));
            }
            if (payload != null) {
                return payload;
            }
        }
        return null;
    }

    private static ImagePayload fromContentArray(JsonNode content) {
        for (JsonNode item : content) {
            String type = item.path("type").asText("");
            ImagePayload payload = switch (type) {
                case "image" -> fromImageObject(item.path("image"));
                case "image_url" -> fromReference(textOrNull(item.path("image_url").path("url")));
                case "text" -> {
                    String text = textOrNull(item.path("text"));
                    Matcher markdown = text != null ? MARKDOWN_IMAGE.matcher(text) : null;
                    yield markdown != null && markdown.find() ? fromReference(markdown.group(1)) : null;
                }
                default -> null;
            };
            if (payload != null) {
                return payload;
            }
        }
        log.debug("Содержимое ответа в виде массива, но изображение не найдено");
        return null;
    }

    private static ImagePayload fromImageObject(JsonNode image) {
        String data = textOrNull(image.path("data"));
        if (data != null) {
            ImagePayload fromDataUrl = data.startsWith(AdapterConstants.DATA_URL_PREFIX) ? fromReference(data) : null;
            return fromDataUrl != null ? fromDataUrl : ImagePayload.ofBase64(data, textOrNull(image.path("mime_type")));
        }
        return fromReference(textOrNull(image.path("url")));
    }

    private static ImagePayload fromUrlOrB64(JsonNode node) {
        if (!node.isObject()) {
            return null;
        }
        String url = textOrNull(node.path("url"));
        if (url != null) {
            ImagePayload payload = fromReference(url);
            if (payload != null) {
                return payload;
            }
        }
        String b64 = textOrNull(node.path("b64_json"));
        return b64 != null ? ImagePayload.ofBase64(b64, null) : null;
    }

    private static ImagePayload fromDataUrlInText(String text) {
        Matcher dataUrl = DATA_URL.matcher(text);
        if (dataUrl.find()) {
            return ImagePayload.ofBase64(dataUrl.group(2).replace("\n", ""), dataUrl.group(1));
        }
        return null;
    }

    private static String textOrNull(JsonNode node) {
        if (node == null || !node.isTextual()) {
            return null;
        }
        String value = node.asText();
        return value.isEmpty() ? null : value;
    }
}
