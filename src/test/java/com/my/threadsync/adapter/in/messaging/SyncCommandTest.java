package com.my.threadsync.adapter.in.messaging;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SyncCommandTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void parses_json_and_ignores_unknown_fields() throws Exception {
        SyncCommand command = objectMapper.readValue(
                "{\"commandId\":\"c-1\",\"action\":\"sync_thread\",\"threadTs\":\"1.1\",\"extra\":true}",
                SyncCommand.class);

        assertThat(command.toAction()).isEqualTo(CommandAction.SYNC_THREAD);
        assertThat(command.requireThreadTs()).isEqualTo("1.1");
    }

    @Test
    void command_id_is_required() {
        assertThatThrownBy(() -> new SyncCommand(" ", "STATUS", null, null, null))
                .isInstanceOf(InvalidCommandException.class);
    }

    @Test
    void unknown_action_is_rejected() {
        SyncCommand command = new SyncCommand("c-1", "REBOOT", null, null, null);

        assertThatThrownBy(command::toAction)
                .isInstanceOf(InvalidCommandException.class)
                .hasMessageContaining("REBOOT");
    }

    @Test
    void missing_argument_names_the_field() {
        SyncCommand command = new SyncCommand("c-1", "SET_PROMPT", "1.1", "", null);

        assertThatThrownBy(command::requirePrompt).hasMessageContaining("prompt");
    }
}
