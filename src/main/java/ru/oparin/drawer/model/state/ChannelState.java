package ru.oparin.drawer.model.state;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import ru.oparin.drawer.model.enums.ChannelFormat;

import java.util.ArrayList;
import java.util.List;

/**
 * Сохраняемое состояние канала вместе с его ключами.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChannelState {
    private String name;
    private ChannelFormat format;
    private boolean enabled;
    private boolean streaming;
    private String url;
    private String model;
    private int priority;

    @Builder.Default
    private List<CredentialState> credentials = new ArrayList<>();
}
