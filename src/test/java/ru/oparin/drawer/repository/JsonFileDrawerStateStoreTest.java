package ru.oparin.drawer.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import ru.oparin.drawer.model.enums.ChannelFormat;
import ru.oparin.drawer.model.state.ChannelState;
import ru.oparin.drawer.model.state.CredentialState;
import ru.oparin.drawer.model.state.DrawerState;

import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonFileDrawerStateStoreTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void missingFileMeansNoSavedState() {
        JsonFileDrawerStateStore store = new JsonFileDrawerStateStore(tempDir.resolve("absent.json"), objectMapper);

        assertThat(store.load()).isEmpty();
    }

    @Test
    void savedStateIsLoadedBack() {
        Path file = tempDir.resolve("nested/dir/state.json");
        JsonFileDrawerStateStore store = new JsonFileDrawerStateStore(file, objectMapper);
        Map<String, String> prompts = new LinkedHashMap<>();
        prompts.put("cat", "a cat in a space suit");
        DrawerState state = DrawerState.builder()
                .channels(List.of(ChannelState.builder()
                        .name("google")
                        .format(ChannelFormat.GENERATE_CONTENT)
                        .url("https://generativelanguage.googleapis.com/v1beta/models/m:generateContent")
                        .enabled(false)
                        .priority(3)
                        .credentials(List.of(
                                CredentialState.builder().value("AIzaSy-1").threshold(5).failureCount(2).build(),
                                CredentialState.builder().value("AIzaSy-2").threshold(-1).failureCount(0).build()))
                        .build()))
                .prompts(prompts)
                .build();

        store.save(state);
        Optional<DrawerState> loaded = store.load();

        assertThat(Files.exists(file)).isTrue();
        assertThat(loaded).isPresent();
        ChannelState channel = loaded.get().getChannels().get(0);
        assertThat(channel.getName()).isEqualTo("google");
        assertThat(channel.getFormat()).isEqualTo(ChannelFormat.GENERATE_CONTENT);
        assertThat(channel.isEnabled()).isFalse();
        assertThat(channel.getPriority()).isEqualTo(3);
        assertThat(channel.getCredentials()).extracting(CredentialState::getFailureCount).containsExactly(2, 0);
        assertThat(channel.getCredentials()).extracting(CredentialState::getThreshold).containsExactly(5, -1);
        assertThat(loaded.get().getPrompts()).containsEntry("cat", "a cat in a space suit");
    }

    @Test
    void saveReplacesPreviousFileWithoutLeavingTemporaryFiles() throws Exception {
        Path file = tempDir.resolve("state.json");
        JsonFileDrawerStateStore store = new JsonFileDrawerStateStore(file, objectMapper);

        store.save(DrawerState.builder().build());
        store.save(DrawerState.builder().prompts(new LinkedHashMap<>(Map.of("p", "text"))).build());

        assertThat(store.load().get().getPrompts()).containsOnlyKeys("p");
        try (var files = Files.list(tempDir)) {
            assertThat(files.map(path -> path.getFileName().toString())).containsExactly("state.json");
        }
    }

    @Test
    void failedReplaceRemovesTemporaryFile() throws Exception {
        Path file = tempDir.resolve("state.json");
        Files.createDirectories(file);
        Files.writeString(file.resolve("occupied"), "x");
        JsonFileDrawerStateStore store = new JsonFileDrawerStateStore(file, objectMapper);

        assertThatThrownBy(() -> store.save(DrawerState.builder().build()))
                .isInstanceOf(UncheckedIOException.class);
        try (var files = Files.list(tempDir)) {
            assertThat(files.map(path -> path.getFileName().toString())).containsExactly("state.json");
        }
    }

    @Test
    void corruptedFileIsReportedAsError() throws Exception {
        Path file = tempDir.resolve("state.json");
        Files.writeString(file, "{not json");

        JsonFileDrawerStateStore store = new JsonFileDrawerStateStore(file, objectMapper);

        assertThatThrownBy(store::load).isInstanceOf(UncheckedIOException.class);
    }
}
