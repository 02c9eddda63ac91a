package io.github.drompincen.tabsensei.runtime.panel;

import io.github.drompincen.tabsensei.persistence.store.SharedStore;
import io.github.drompincen.tabsensei.runtime.config.EngineSettings;
import io.github.drompincen.tabsensei.runtime.context.ContextLoop;
import io.github.drompincen.tabsensei.runtime.transcript.TranscriptStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Open panels of this process, each on its own loop.
 */
@Component
public class PanelRegistry {

    private static final Logger log = LoggerFactory.getLogger(PanelRegistry.class);

    private final CoordinatorLink link;
    private final TranscriptStore transcripts;
    private final SharedStore store;
    private final EngineSettings settings;
    private final Map<String, Entry> panels = new ConcurrentHashMap<>();

    public PanelRegistry(CoordinatorLink link, TranscriptStore transcripts, SharedStore store,
                         EngineSettings settings) {
        this.link = link;
        this.transcripts = transcripts;
        this.store = store;
        this.settings = settings;
    }

    public PanelSession open(String panelId, Long hostTabId, PanelView view) {
        ContextLoop loop = ContextLoop.create("panel-" + panelId);
        PanelSession session = new PanelSession(panelId, hostTabId, link, transcripts, store, view, settings, loop);
        Entry previous = panels.put(panelId, new Entry(session, loop));
        if (previous != null) shutdown(previous);
        session.mount();
        log.info("Panel {} opened ({} open)", panelId, panels.size());
        return session;
    }

    public Optional<PanelSession> get(String panelId) {
        return Optional.ofNullable(panels.get(panelId)).map(Entry::session);
    }

    public void close(String panelId) {
        Entry entry = panels.remove(panelId);
        if (entry != null) {
            shutdown(entry);
            log.info("Panel {} closed ({} open)", panelId, panels.size());
        }
    }

    public boolean anyOpen() {
        return !panels.isEmpty();
    }

    public int size() {
        return panels.size();
    }

    private void shutdown(Entry entry) {
        entry.session().unmount();
        // Let the unmount run before the loop goes away.
        entry.loop().execute(entry.loop()::close);
    }

    private record Entry(PanelSession session, ContextLoop loop) {}
}
