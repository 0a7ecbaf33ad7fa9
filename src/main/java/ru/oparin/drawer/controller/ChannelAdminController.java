package ru.oparin.drawer.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import ru.oparin.drawer.model.dto.admin.*;
import ru.oparin.drawer.service.ChannelAdminService;
import ru.oparin.drawer.service.DispatchMetricsService;

import java.util.List;

/**
 * Контроллер управления каналами и ключами.
 */
@Slf4j
@RestController
@RequestMapping("/admin")
@RequiredArgsConstructor
@Tag(name = "Каналы и ключи", description = "API для управления каналами генерации и их ключами")
public class ChannelAdminController {

    private final ChannelAdminService adminService;
    private final DispatchMetricsService metricsService;

    @Operation(summary = "Получить все каналы")
    @GetMapping("/channels")
    public Mono<ResponseEntity<List<ChannelDTO>>> getChannels() {
        return Mono.fromCallable(adminService::listChannels)
                .map(ResponseEntity::ok);
    }

    @Operation(summary = "Добавить канал",
            description = "URL должен соответствовать формату: /chat/completions, :generateContent или /images/generations. " +
                    "Для GENERATE_CONTENT модель задается в URL.")
    @PostMapping("/channels")
    public Mono<ResponseEntity<ChannelDTO>> addChannel(@Valid @RequestBody AddChannelRequest request) {
        return Mono.fromCallable(() -> adminService.addChannel(request))
                .map(channel -> ResponseEntity.status(HttpStatus.CREATED).body(channel));
    }

    @Operation(summary = "Удалить канал")
    @DeleteMapping("/channels/{name}")
    public Mono<ResponseEntity<MessageResponse>> removeChannel(@PathVariable String name) {
        return Mono.fromRunnable(() -> adminService.removeChannel(name))
                .thenReturn(ResponseEntity.ok(new MessageResponse(String.format("Канал %s удален", name))));
    }

    @Operation(summary = "Включить или отключить канал")
    @PutMapping("/channels/{name}/enabled")
    public Mono<ResponseEntity<ChannelDTO>> setEnabled(@PathVariable String name, @RequestParam boolean value) {
        return Mono.fromCallable(() -> adminService.setEnabled(name, value))
                .map(ResponseEntity::ok);
    }

    @Operation(summary = "Включить или отключить потоковый режим канала")
    @PutMapping("/channels/{name}/streaming")
    public Mono<ResponseEntity<ChannelDTO>> setStreaming(@PathVariable String name, @RequestParam boolean value) {
        return Mono.fromCallable(() -> adminService.setStreaming(name, value))
                .map(ResponseEntity::ok);
    }

    @Operation(summary = "Сменить модель канала",
            description = "Для GENERATE_CONTENT модель заменяется в URL канала.")
    @PutMapping("/channels/{name}/model")
    public Mono<ResponseEntity<ChannelDTO>> updateModel(@PathVariable String name,
                                                        @Valid @RequestBody UpdateModelRequest request) {
        return Mono.fromCallable(() -> adminService.updateModel(name, request.getModel()))
                .map(ResponseEntity::ok);
    }

    @Operation(summary = "Установить приоритет канала", description = "Меньшее значение означает более раннюю попытку.")
    @PutMapping("/channels/{name}/priority")
    public Mono<ResponseEntity<ChannelDTO>> setPriority(@PathVariable String name, @RequestParam int value) {
        return Mono.fromCallable(() -> adminService.setPriority(name, value))
                .map(ResponseEntity::ok);
    }

    @Operation(summary = "Получить ключи канала", description = "Значения ключей замаскированы.")
    @GetMapping("/channels/{name}/credentials")
    public Mono<ResponseEntity<List<CredentialDTO>>> getCredentials(@PathVariable String name) {
        return Mono.fromCallable(() -> adminService.listCredentials(name))
                .map(ResponseEntity::ok);
    }

    @Operation(summary = "Добавить ключи в канал", description = "Дубликаты и пустые значения пропускаются.")
    @PostMapping("/channels/{name}/credentials")
    public Mono<ResponseEntity<CredentialsAddedDTO>> addCredentials(@PathVariable String name,
                                                                    @Valid @RequestBody CredentialsRequest request) {
        return Mono.fromCallable(() -> adminService.addCredentials(name, request.getCredentials()))
                .map(ResponseEntity::ok);
    }

    @Operation(summary = "Удалить ключ канала по номеру")
    @DeleteMapping("/channels/{name}/credentials/{index}")
    public Mono<ResponseEntity<MessageResponse>> removeCredential(@PathVariable String name, @PathVariable int index) {
        return Mono.fromRunnable(() -> adminService.removeCredential(name, index))
                .thenReturn(ResponseEntity.ok(new MessageResponse(
                        String.format("Ключ #%d канала %s удален", index, name))));
    }

    @Operation(summary = "Установить порог отключения ключа", description = "-1 означает \"никогда не отключать\".")
    @PutMapping("/channels/{name}/credentials/{index}/threshold")
    public Mono<ResponseEntity<CredentialDTO>> setThreshold(@PathVariable String name, @PathVariable int index,
                                                            @Valid @RequestBody SetThresholdRequest request) {
        return Mono.fromCallable(() -> adminService.setThreshold(name, index, request.getThreshold()))
                .map(ResponseEntity::ok);
    }

    @Operation(summary = "Сбросить счетчики ошибок всех ключей канала")
    @PostMapping("/channels/{name}/credentials/reset")
    public Mono<ResponseEntity<MessageResponse>> resetChannelCredentials(@PathVariable String name) {
        return Mono.fromCallable(() -> adminService.resetCredentials(name, null))
                .map(count -> ResponseEntity.ok(new MessageResponse(
                        String.format("Сброшены счетчики ключей канала %s", name), count)));
    }

    @Operation(summary = "Сбросить счетчик ошибок ключа")
    @PostMapping("/channels/{name}/credentials/{index}/reset")
    public Mono<ResponseEntity<MessageResponse>> resetCredential(@PathVariable String name, @PathVariable int index) {
        return Mono.fromCallable(() -> adminService.resetCredentials(name, index))
                .map(count -> ResponseEntity.ok(new MessageResponse(
                        String.format("Сброшен счетчик ключа #%d канала %s", index, name), count)));
    }

    @Operation(summary = "Сбросить счетчики ошибок всех ключей во всех каналах")
    @PostMapping("/credentials/reset")
    public Mono<ResponseEntity<MessageResponse>> resetAllCredentials() {
        return Mono.fromCallable(adminService::resetAllCredentials)
                .map(count -> ResponseEntity.ok(new MessageResponse("Сброшены счетчики всех ключей", count)));
    }

    @Operation(summary = "Импортировать ключи",
            description = "Ключи с префиксом сторонних прокси (sk-) попадают в сторонний канал, остальные в основной.")
    @PostMapping("/credentials")
    public Mono<ResponseEntity<CredentialsAddedDTO>> importCredentials(@Valid @RequestBody CredentialsRequest request) {
        return Mono.fromCallable(() -> adminService.importCredentials(request.getCredentials()))
                .map(ResponseEntity::ok);
    }

    @Operation(summary = "Получить статистику диспетчеризации")
    @GetMapping("/stats")
    public Mono<ResponseEntity<DispatchStatsDTO>> getStats() {
        return Mono.fromCallable(metricsService::getStats)
                .map(ResponseEntity::ok);
    }
}
