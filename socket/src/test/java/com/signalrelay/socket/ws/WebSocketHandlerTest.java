package com.signalrelay.socket.ws;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class WebSocketHandlerTest {

    @Test
    @DisplayName("UTF-8 payload in a binary frame decodes to its text")
    void testDecodeValidUtf8() {
        String json = "{\"type\":\"offer\",\"sdp\":\"é\"}";
        ByteBuf content = Unpooled.wrappedBuffer(json.getBytes(StandardCharsets.UTF_8));

        assertEquals(json, WebSocketHandler.decode(content));
        // Decoding must not consume the frame
        assertEquals(json.getBytes(StandardCharsets.UTF_8).length, content.readableBytes());
    }

    @Test
    @DisplayName("Invalid UTF-8 is reported instead of replaced")
    void testDecodeInvalidUtf8() {
        ByteBuf content = Unpooled.wrappedBuffer(new byte[]{(byte) 0xFF, (byte) 0xFE});

        assertNull(WebSocketHandler.decode(content));
    }
}
