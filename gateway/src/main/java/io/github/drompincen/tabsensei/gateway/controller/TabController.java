package io.github.drompincen.tabsensei.gateway.controller;

import io.github.drompincen.tabsensei.protocol.api.CloseReport;
import io.github.drompincen.tabsensei.protocol.api.CloseTabsRequest;
import io.github.drompincen.tabsensei.runtime.coordinator.Coordinator;
import io.github.drompincen.tabsensei.runtime.coordinator.FocusResult;
import io.github.drompincen.tabsensei.runtime.tab.TabHost;
import io.github.drompincen.tabsensei.runtime.tab.TabInfo;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

@RestController
@RequestMapping("/api/tabs")
public class TabController {

    private final Coordinator coordinator;
    private final TabHost tabHost;

    public TabController(Coordinator coordinator, TabHost tabHost) {
        this.coordinator = coordinator;
        this.tabHost = tabHost;
    }

    @GetMapping
    public List<TabInfo> list() {
        return tabHost.tabs();
    }

    /** Best effort: the report lists closed and failed ids, and the succeeded part is never undone. */
    @PostMapping("/close")
    public CompletableFuture<CloseReport> close(@RequestBody CloseTabsRequest req) {
        return coordinator.applyClose(req.tabIds());
    }

    @PostMapping("/{id}/focus")
    public CompletableFuture<Map<String, Object>> focus(@PathVariable long id) {
        return coordinator.applyFocus(id)
                .<Map<String, Object>>thenApply(result -> Map.of("tabId", id, "focused", result == FocusResult.FOCUSED));
    }

    @PostMapping("/{id}/overlay/toggle")
    public CompletableFuture<Map<String, Object>> toggleOverlay(@PathVariable long id) {
        return coordinator.toggleOverlay(id).<Map<String, Object>>thenApply(open -> Map.of("tabId", id, "open", open));
    }
}
