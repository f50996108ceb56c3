// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pylon.rpc.internal;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.net.URI;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class RpcUtilsTest {

    @ParameterizedTest
    @ValueSource(strings = {"ws://localhost:26657/websocket", "wss://rpc.example.com/websocket", "WSS://example.com"})
    void acceptsWebSocketUrls(String url) {
        URI uri = RpcUtils.validateUrl(url, RpcUtils.WS_SCHEMES);

        assertEquals(url, uri.toString());
    }

    @Test
    void rejectsHttpUrl() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> RpcUtils.validateUrl("http://localhost:26657", RpcUtils.WS_SCHEMES));

        assertTrue(ex.getMessage().contains("unsupported url scheme 'http'"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "  ", "ws:///path", "not a uri"})
    void rejectsMalformedUrls(String url) {
        assertThrows(IllegalArgumentException.class, () -> RpcUtils.validateUrl(url, RpcUtils.WS_SCHEMES));
    }

    @Test
    void readsIntegersEncodedAsStringsOrNumbers() throws Exception {
        assertEquals(12, RpcUtils.longValue(RpcUtils.MAPPER.readTree("\"12\"")));
        assertEquals(12, RpcUtils.longValue(RpcUtils.MAPPER.readTree("12")));
        assertThrows(NumberFormatException.class, () -> RpcUtils.longValue(RpcUtils.MAPPER.readTree("\"abc\"")));
        assertThrows(NumberFormatException.class, () -> RpcUtils.longValue(null));
    }
}
