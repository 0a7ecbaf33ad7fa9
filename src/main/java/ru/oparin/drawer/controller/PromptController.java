package ru.oparin.drawer.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import ru.oparin.drawer.model.dto.admin.MessageResponse;
import ru.oparin.drawer.model.dto.admin.PromptDTO;
import ru.oparin.drawer.service.PromptPresetService;

import java.util.List;

/**
 * Контроллер именованных промптов.
 */
@RequiredArgsConstructor
@RestController
@RequestMapping("/admin/prompts")
@Tag(name = "Промпты", description = "API для работы с именованными промптами")
public class PromptController {

    private final PromptPresetService promptPresetService;

    @Operation(summary = "Получить все промпты")
    @GetMapping
    public Mono<ResponseEntity<List<PromptDTO>>> getPrompts() {
        return Mono.fromCallable(() -> promptPresetService.list().entrySet().stream()
                        .map(entry -> new PromptDTO(entry.getKey(), entry.getValue()))
                        .toList())
                .map(ResponseEntity::ok);
    }

    @Operation(summary = "Получить промпт по имени")
    @GetMapping("/{name}")
    public Mono<ResponseEntity<PromptDTO>> getPrompt(@PathVariable String name) {
        return Mono.fromCallable(() -> new PromptDTO(name, promptPresetService.get(name)))
                .map(ResponseEntity::ok);
    }

    @Operation(summary = "Сохранить промпт", description = "Промпт с тем же именем заменяется.")
    @PostMapping
    public Mono<ResponseEntity<MessageResponse>> savePrompt(@Valid @RequestBody PromptDTO request) {
        return Mono.fromCallable(() -> promptPresetService.save(request.getName(), request.getText()))
                .map(replaced -> ResponseEntity.ok(new MessageResponse(
                        String.format("Промпт %s %s", request.getName(), replaced ? "обновлен" : "добавлен"))));
    }

    @Operation(summary = "Удалить промпт")
    @DeleteMapping("/{name}")
    public Mono<ResponseEntity<MessageResponse>> deletePrompt(@PathVariable String name) {
        return Mono.fromRunnable(() -> promptPresetService.delete(name))
                .thenReturn(ResponseEntity.ok(new MessageResponse(String.format("Промпт %s удален", name))));
    }
}
