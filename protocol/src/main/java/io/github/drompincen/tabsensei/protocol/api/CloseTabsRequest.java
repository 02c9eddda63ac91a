package io.github.drompincen.tabsensei.protocol.api;

import java.util.List;

public record CloseTabsRequest(List<Long> tabIds) {
    public CloseTabsRequest {
        tabIds = tabIds != null ? List.copyOf(tabIds) : List.of();
    }
}
