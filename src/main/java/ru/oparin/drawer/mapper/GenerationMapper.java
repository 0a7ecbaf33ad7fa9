package ru.oparin.drawer.mapper;

import jakarta.validation.ValidationException;
import org.springframework.stereotype.Component;
import ru.oparin.drawer.model.domain.GenerationRequest;
import ru.oparin.drawer.model.domain.GenerationResult;
import ru.oparin.drawer.model.domain.SourceImage;
import ru.oparin.drawer.model.dto.generate.GenerateRq;
import ru.oparin.drawer.model.dto.generate.GenerateRs;
import ru.oparin.drawer.util.ImageMimeDetector;

import java.util.Base64;

/**
 * Преобразование запроса и результата генерации между DTO и доменными объектами.
 */
@Component
public class GenerationMapper {

    private static final String DATA_URL_PREFIX = "data:";
    private static final String BASE64_SEPARATOR = ";base64,";

    public GenerationRequest toRequest(GenerateRq rq) {
        GenerationRequest.GenerationRequestBuilder builder = GenerationRequest.builder()
                .prompt(rq.getPrompt() != null ? rq.getPrompt().trim() : null)
                .channel(rq.getChannel() != null && !rq.getChannel().isBlank() ? rq.getChannel().trim() : null);
        if (rq.getImages() != null) {
            for (GenerateRq.SourceImageDTO image : rq.getImages()) {
                builder.image(toSourceImage(image));
            }
        }
        return builder.build();
    }

    public GenerateRs toResponse(GenerationResult result) {
        return GenerateRs.builder()
                .image(Base64.getEncoder().encodeToString(result.getImage()))
                .mimeType(result.getMimeType())
                .channel(result.getChannel())
                .credential(result.getCredential())
                .attempts(result.getAttempts())
                .build();
    }

    /**
     * Декодировать изображение из base64 или data URL. MIME тип берется из запроса,
     * из data URL или определяется по содержимому.
     */
    private SourceImage toSourceImage(GenerateRq.SourceImageDTO image) {
        String data = image.getData().trim();
        String declaredMime = image.getMimeType();
        if (data.startsWith(DATA_URL_PREFIX)) {
            int separator = data.indexOf(BASE64_SEPARATOR);
            if (separator < 0) {
                throw new ValidationException("Изображение в формате data URL должно быть закодировано в base64");
            }
            if (declaredMime == null || declaredMime.isBlank()) {
                declaredMime = data.substring(DATA_URL_PREFIX.length(), separator);
            }
            data = data.substring(separator + BASE64_SEPARATOR.length());
        }
        byte[] bytes;
        try {
            bytes = Base64.getMimeDecoder().decode(data);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Некорректные base64 данные изображения");
        }
        if (bytes.length == 0) {
            throw new ValidationException("Пустое изображение");
        }
        return new SourceImage(bytes, ImageMimeDetector.resolve(declaredMime, bytes));
    }
}
