package ru.oparin.drawer.model.state;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Полное сохраняемое состояние шлюза: каналы в порядке добавления и промпты.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DrawerState {

    @Builder.Default
    private List<ChannelState> channels = new ArrayList<>();

    @Builder.Default
    private Map<String, String> prompts = new LinkedHashMap<>();
}
