package io.github.drompincen.tabsensei.protocol.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class ReasoningReplyTest {

    private final ObjectMapper mapper = new ObjectMapper().findAndRegisterModules();

    @Test
    void readsSnakeCaseReply() throws Exception {
        String json = """
                {"reply":"Opening it","mode":"multi","focus_tab_id":12,"close_candidates":[3,4],
                 "reminder":{"text":"stretch","fire_at":"2025-03-01T10:00:00Z","recurring":false},
                 "price_watch":{"product":"Kettle","url":"https://shop.example/k","price":49.9},
                 "session_epoch":"e-42","confidence":0.7}
                """;

        ReasoningReply reply = mapper.readValue(json, ReasoningReply.class);

        assertThat(reply.mode()).isEqualTo(DispatchMode.MULTI);
        assertThat(reply.focusTabId()).isEqualTo(12L);
        assertThat(reply.closeCandidates()).containsExactly(3L, 4L);
        assertThat(reply.reminder().fireAt()).isEqualTo(Instant.parse("2025-03-01T10:00:00Z"));
        assertThat(reply.priceWatch().threshold()).isNull();
        assertThat(reply.sessionEpoch()).isEqualTo("e-42");
    }

    @Test
    void unknownOrMissingModeMeansSingle() throws Exception {
        assertThat(mapper.readValue("{\"reply\":\"x\",\"mode\":\"shopping\"}", ReasoningReply.class).mode())
                .isEqualTo(DispatchMode.SINGLE);
        ReasoningReply bare = mapper.readValue("{\"reply\":\"x\"}", ReasoningReply.class);
        assertThat(bare.mode()).isEqualTo(DispatchMode.SINGLE);
        assertThat(bare.closeCandidates()).isEmpty();
    }

    @Test
    void outcomeCarriesStatusTag() throws Exception {
        String json = mapper.writeValueAsString(new QueryOutcome.TimedOut("c1", "Still working"));

        assertThat(json).contains("\"status\":\"timed_out\"");
        assertThat(mapper.readValue(json, QueryOutcome.class)).isInstanceOf(QueryOutcome.TimedOut.class);
    }
}
