package io.github.drompincen.tabsensei.persistence.stream;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.tabsensei.persistence.document.StoreEntryDocument;
import io.github.drompincen.tabsensei.persistence.repository.StoreEntryRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class StoreChangeStreamTailerTest {

    @Mock private MongoTemplate mongoTemplate;
    @Mock private StoreEntryRepository repository;

    private StoreChangeStreamTailer tailer;
    private final List<StoreChange> seen = new ArrayList<>();

    @BeforeEach
    void setUp() {
        tailer = new StoreChangeStreamTailer(mongoTemplate, repository, new ObjectMapper());
        tailer.addListener(seen::add);
    }

    @Test
    void valueEntryBecomesChange() {
        tailer.notifyListeners(new StoreEntryDocument("flag", "true", Instant.now()));

        assertThat(seen).hasSize(1);
        assertThat(seen.get(0).removed()).isFalse();
        assertThat(seen.get(0).value().asBoolean()).isTrue();
    }

    @Test
    void tombstoneBecomesRemoval() {
        tailer.notifyListeners(new StoreEntryDocument("flag", null, Instant.now()));

        assertThat(seen).singleElement().satisfies(change -> assertThat(change.removed()).isTrue());
    }

    @Test
    void unreadableEntryIsSkipped() {
        tailer.notifyListeners(new StoreEntryDocument("flag", "{not json", Instant.now()));

        assertThat(seen).isEmpty();
    }

    @Test
    void pollingDeliversWritesSharingTheLastTimestamp() {
        Instant start = Instant.parse("2026-01-01T10:00:00Z");
        Instant tick = start.plusMillis(5);
        StoreEntryDocument first = new StoreEntryDocument("a", "1", tick);
        StoreEntryDocument sameMillisecond = new StoreEntryDocument("b", "2", tick);
        when(repository.findByUpdatedAtGreaterThanEqualOrderByUpdatedAtAsc(start)).thenReturn(List.of(first));
        when(repository.findByUpdatedAtGreaterThanEqualOrderByUpdatedAtAsc(tick))
                .thenReturn(List.of(first, sameMillisecond));
        StoreChangeStreamTailer.PollCursor cursor = new StoreChangeStreamTailer.PollCursor(start);

        tailer.pollOnce(cursor);
        tailer.pollOnce(cursor);

        assertThat(seen).extracting(StoreChange::key).containsExactly("a", "b");
    }

    @Test
    void pollingRedeliversKeyRewrittenWithinTheSameMillisecond() {
        Instant tick = Instant.parse("2026-01-01T10:00:00Z");
        when(repository.findByUpdatedAtGreaterThanEqualOrderByUpdatedAtAsc(tick))
                .thenReturn(List.of(new StoreEntryDocument("a", "1", tick)))
                .thenReturn(List.of(new StoreEntryDocument("a", null, tick)));
        StoreChangeStreamTailer.PollCursor cursor = new StoreChangeStreamTailer.PollCursor(tick);

        tailer.pollOnce(cursor);
        tailer.pollOnce(cursor);

        assertThat(seen).extracting(StoreChange::removed).containsExactly(false, true);
    }
}
