package com.cellblock.wire;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FramesTest {

    @Test
    @DisplayName("a frame is one line of JSON with type, ref and body")
    void encodesSingleLine() {
        String line = Frames.encode(Frame.of("evaluate", "r1",
                new EvaluationRequest("a", "e1", "print(\"x\")\nx", List.of(), Map.of())));

        assertFalse(line.contains("\n"));
        Frame decoded = Frames.decode(line);
        assertEquals("evaluate", decoded.type());
        assertEquals("r1", decoded.ref());
        assertEquals("print(\"x\")\nx", decoded.bodyAs(EvaluationRequest.class).code());
    }

    @Test
    @DisplayName("class binaries travel as base64 and arrive intact")
    void binaryPayload() {
        var unit = new CodeUnit("a.B", new byte[]{(byte) 0xCA, (byte) 0xFE, 0, 10, 13});

        Frame decoded = Frames.decode(Frames.encode(Frame.of("load_code", unit)));

        assertEquals(unit, decoded.bodyAs(CodeUnit.class));
        assertNull(decoded.ref());
    }

    @Test
    void replies() {
        Frame ok = Frames.reply("r", 42);
        Frame failed = Frames.error("r", "nope");

        assertTrue(ok.body().get("ok").asBoolean());
        assertEquals(42, ok.body().get("value").asInt());
        assertFalse(failed.body().get("ok").asBoolean());
        assertEquals("nope", failed.text("error"));
    }

    @Test
    void rejectsNonFrames() {
        assertThrows(WireException.class, () -> Frames.decode("not json"));
        assertThrows(WireException.class, () -> Frames.decode("[1, 2]"));
        assertThrows(WireException.class, () -> Frames.decode("{\"ref\": \"x\"}"));
    }

    @Test
    void malformedBodyIsAWireError() {
        Frame frame = Frames.decode("{\"type\": \"load_code\", \"body\": {\"name\": \"a.B\", \"binary\": {\"x\": 1}}}");

        assertThrows(WireException.class, () -> frame.bodyAs(CodeUnit.class));
    }

    private static <T> T viaFrame(Object value, Class<T> type) {
        return Frames.decode(Frames.encode(Frame.of("value", "r", value))).bodyAs(type);
    }

    @Nested
    @DisplayName("value records on the wire")
    class ValueRecords {

        @Test
        @DisplayName("a successful response arrives without an error")
        void successResponse() {
            var sent = EvaluationResponse.success(new Locator("a", "e1"), "42", 3);

            EvaluationResponse received = viaFrame(sent, EvaluationResponse.class);

            assertEquals(sent, received);
            assertFalse(received.failed());
            assertNull(received.error());
        }

        @Test
        @DisplayName("a failed response keeps its message and printed output")
        void failureResponse() {
            var sent = EvaluationResponse.failure(new Locator("a", "e2"), "hi\n", "line 2: boom", 5);

            EvaluationResponse received = viaFrame(sent, EvaluationResponse.class);

            assertEquals(sent, received);
            assertTrue(received.failed());
            assertEquals("line 2: boom", received.error());
        }

        @Test
        @DisplayName("only record components are written")
        void responseFields() {
            var json = Frames.MAPPER.valueToTree(EvaluationResponse.success(new Locator("a", "e1"), "1", 0));

            assertTrue(json.get("error").isNull());
            assertFalse(json.has("locator"));
        }

        @Test
        void requestWithParents() {
            var sent = new EvaluationRequest("b", "e3", "x", List.of(new Locator("a", "e2"), new Locator("a", "e1")),
                    Map.of("trace", true));

            EvaluationRequest received = viaFrame(sent, EvaluationRequest.class);

            assertEquals(sent, received);
            assertEquals(new Locator("b", "e3"), received.locator());
        }

        @Test
        void intellisense() {
            var request = new IntellisenseRequest("completion", "to", List.of(new Locator("a", "e1")));
            var items = IntellisenseResponse.ofItems("completion", List.of("total", "top"));
            var content = IntellisenseResponse.ofContent("format", "x = 1");

            assertEquals(request, viaFrame(request, IntellisenseRequest.class));
            assertEquals(items, viaFrame(items, IntellisenseResponse.class));
            assertEquals(content, viaFrame(content, IntellisenseResponse.class));
        }

        @Test
        void serverHandle() {
            var handle = new ServerHandle("server-1", new NodeAddress("127.0.0.1", 4711));

            assertEquals(handle, viaFrame(handle, ServerHandle.class));
        }
    }
}
