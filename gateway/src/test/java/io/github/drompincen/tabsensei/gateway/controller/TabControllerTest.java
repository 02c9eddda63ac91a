package io.github.drompincen.tabsensei.gateway.controller;

import io.github.drompincen.tabsensei.protocol.api.CloseReport;
import io.github.drompincen.tabsensei.protocol.api.CloseTabsRequest;
import io.github.drompincen.tabsensei.runtime.coordinator.Coordinator;
import io.github.drompincen.tabsensei.runtime.coordinator.FocusResult;
import io.github.drompincen.tabsensei.runtime.tab.TabHost;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static java.util.concurrent.CompletableFuture.completedFuture;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class TabControllerTest {

    @Mock private Coordinator coordinator;
    @Mock private TabHost tabHost;

    private TabController controller;

    @BeforeEach
    void setUp() {
        controller = new TabController(coordinator, tabHost);
    }

    @Test
    void closeReturnsThePartialReport() {
        CloseReport report = new CloseReport(List.of(1L), List.of(2L));
        when(coordinator.applyClose(List.of(1L, 2L))).thenReturn(completedFuture(report));

        assertThat(controller.close(new CloseTabsRequest(List.of(1L, 2L))).join()).isEqualTo(report);
    }

    @Test
    void staleFocusReportsNotFocused() {
        when(coordinator.applyFocus(5L)).thenReturn(completedFuture(FocusResult.STALE));

        assertThat(controller.focus(5L).join()).containsEntry("tabId", 5L).containsEntry("focused", false);
    }

    @Test
    void toggleReportsTheNewOverlayState() {
        when(coordinator.toggleOverlay(5L)).thenReturn(completedFuture(true));

        assertThat(controller.toggleOverlay(5L).join()).containsEntry("open", true);
    }
}
