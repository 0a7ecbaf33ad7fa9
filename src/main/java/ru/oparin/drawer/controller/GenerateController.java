package ru.oparin.drawer.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import ru.oparin.drawer.mapper.GenerationMapper;
import ru.oparin.drawer.model.dto.generate.GenerateRq;
import ru.oparin.drawer.model.dto.generate.GenerateRs;
import ru.oparin.drawer.service.DispatchEngine;

@Slf4j
@RestController
@RequiredArgsConstructor
@Tag(name = "Генерация", description = "Генерация изображений через доступные каналы")
public class GenerateController {

    private final DispatchEngine dispatchEngine;
    private final GenerationMapper generationMapper;

    @Operation(summary = "Сгенерировать изображение",
            description = "Генерирует изображение по промпту и исходным изображениям. Канал и ключ выбираются " +
                    "автоматически с переключением при ошибках, либо используется указанный канал.")
    @PostMapping("/generate")
    public Mono<ResponseEntity<GenerateRs>> generate(@Valid @RequestBody GenerateRq request) {
        log.info("Запрос генерации: промпт длиной {}, изображений {}, канал {}",
                request.getPrompt().length(), request.getImages() != null ? request.getImages().size() : 0,
                request.getChannel() != null ? request.getChannel() : "авто");
        return Mono.fromCallable(() -> generationMapper.toRequest(request))
                .flatMap(dispatchEngine::generate)
                .map(generationMapper::toResponse)
                .map(ResponseEntity::ok);
    }
}
