package com.livemux.peer;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("PeerConnection Tests")
class PeerConnectionTest {

    @Test
    @DisplayName("Should parse ids, names and ordered sources")
    void shouldParseConnections() {
        List<PeerConnection> connections = PeerConnection.parseAll(
                "berlin|Berlin|10.0.0.1:6557, 10.0.0.2:6557 ; paris||/run/naemon/live");

        assertThat(connections).hasSize(2);
        assertThat(connections.get(0).getId()).isEqualTo("berlin");
        assertThat(connections.get(0).getName()).isEqualTo("Berlin");
        assertThat(connections.get(0).getSources()).containsExactly("10.0.0.1:6557", "10.0.0.2:6557");
        assertThat(connections.get(1).getName()).isEqualTo("paris");
        assertThat(connections.get(1).getSources()).containsExactly("/run/naemon/live");
    }

    @Test
    @DisplayName("Should accept an empty setting")
    void shouldAcceptEmptyValue() {
        assertThat(PeerConnection.parseAll("")).isEmpty();
        assertThat(PeerConnection.parseAll(null)).isEmpty();
        assertThat(PeerConnection.parseAll(" ; ")).isEmpty();
    }

    @Test
    @DisplayName("Should reject malformed entries and duplicate ids")
    void shouldRejectInvalidConnections() {
        assertThatThrownBy(() -> PeerConnection.parseAll("berlin|10.0.0.1:6557"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("expected id|name|source1,source2");
        assertThatThrownBy(() -> PeerConnection.parseAll("a|A|x:1;a|B|y:1"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Duplicate connection id a");
    }
}
