package com.agentdeck.core.protocol;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProtocolDecoderTest {

    private final ProtocolDecoder decoder = new ProtocolDecoder();

    @Nested
    @DisplayName("malformed input")
    class MalformedInput {

        @Test
        @DisplayName("non-JSON line decodes to nothing")
        void nonJson() {
            assertTrue(decoder.decodeLine("this is not json").isEmpty());
        }

        @Test
        @DisplayName("blank and null lines decode to nothing")
        void blank() {
            assertTrue(decoder.decodeLine("").isEmpty());
            assertTrue(decoder.decodeLine(null).isEmpty());
        }

        @Test
        @DisplayName("JSON without a type decodes to nothing")
        void missingType() {
            assertTrue(decoder.decodeLine("{\"message\":{}}").isEmpty());
        }

        @Test
        @DisplayName("JSON array decodes to nothing")
        void array() {
            assertTrue(decoder.decodeLine("[1,2,3]").isEmpty());
        }

        @Test
        @DisplayName("unknown type keeps the raw line")
        void unknownType() {
            String raw = "{\"type\":\"telemetry\",\"value\":42}";
            List<ResponseFragment> fragments = decoder.decodeLine(raw);

            assertEquals(1, fragments.size());
            var unknown = assertInstanceOf(ResponseFragment.Unknown.class, fragments.get(0));
            assertEquals("telemetry", unknown.type());
            assertEquals(raw, unknown.raw());
        }
    }

    @Nested
    @DisplayName("assistant lines")
    class AssistantLines {

        @Test
        @DisplayName("expands multi-block content in block order")
        void expandsBlocks() {
            String line = """
                    {"type":"assistant","message":{"id":"msg_1","stop_reason":"tool_use","content":[
                      {"type":"text","text":"Let me look."},
                      {"type":"tool_use","id":"toolu_1","name":"Read","input":{"file_path":"/p/a.txt"}},
                      {"type":"tool_use","id":"toolu_2","name":"Bash","input":{"command":"ls"}}
                    ]}}""".replace("\n", "");
            DecodedLine decoded = decoder.decode(line);

            assertEquals("msg_1", decoded.messageId());
            assertEquals(3, decoded.fragments().size());
            var text = assertInstanceOf(ResponseFragment.Text.class, decoded.fragments().get(0));
            assertEquals("Let me look.", text.content());
            assertTrue(text.cumulative());
            assertNull(text.stopReason());
            var read = assertInstanceOf(ResponseFragment.ToolUse.class, decoded.fragments().get(1));
            assertEquals("Read", read.toolName());
            assertEquals("toolu_1", read.toolUseId());
            assertEquals("/p/a.txt", read.parameters().get("file_path"));
            var bash = assertInstanceOf(ResponseFragment.ToolUse.class, decoded.fragments().get(2));
            assertEquals("toolu_2", bash.toolUseId());
        }

        @Test
        @DisplayName("stop reason is carried by the last text block")
        void stopReasonOnLastBlock() {
            String line = "{\"type\":\"assistant\",\"message\":{\"id\":\"m\",\"stop_reason\":\"end_turn\","
                    + "\"content\":[{\"type\":\"text\",\"text\":\"a\"},{\"type\":\"text\",\"text\":\"b\"}]}}";
            List<ResponseFragment> fragments = decoder.decodeLine(line);

            assertNull(((ResponseFragment.Text) fragments.get(0)).stopReason());
            assertEquals("end_turn", ((ResponseFragment.Text) fragments.get(1)).stopReason());
        }

        @Test
        @DisplayName("thinking blocks are skipped")
        void skipsThinking() {
            String line = "{\"type\":\"assistant\",\"message\":{\"content\":["
                    + "{\"type\":\"thinking\",\"thinking\":\"hmm\"},{\"type\":\"text\",\"text\":\"ok\"}]}}";
            List<ResponseFragment> fragments = decoder.decodeLine(line);

            assertEquals(1, fragments.size());
            assertEquals("ok", ((ResponseFragment.Text) fragments.get(0)).content());
        }

        @Test
        @DisplayName("usage is read from message.usage")
        void messageUsage() {
            String line = "{\"type\":\"assistant\",\"usage\":{\"input_tokens\":999},\"message\":{\"content\":[],"
                    + "\"usage\":{\"input_tokens\":10,\"output_tokens\":5,\"cache_read_input_tokens\":3,"
                    + "\"cache_creation_input_tokens\":2}}}";
            DecodedLine decoded = decoder.decode(line);

            assertEquals(new TokenUsage(10, 5, 3, 2), decoded.usage());
        }

        @Test
        @DisplayName("usage falls back to the top-level field")
        void topLevelUsage() {
            String line = "{\"type\":\"assistant\",\"message\":{\"content\":[]},\"usage\":{\"input_tokens\":7}}";
            assertEquals(7, decoder.decode(line).usage().inputTokens());
        }

        @Test
        @DisplayName("all-zero usage counts as no usage")
        void zeroUsage() {
            String line = "{\"type\":\"assistant\",\"message\":{\"content\":[],"
                    + "\"usage\":{\"input_tokens\":0,\"output_tokens\":0}}}";
            DecodedLine decoded = decoder.decode(line);

            assertFalse(decoded.hasUsage());
            assertSame(TokenUsage.NONE, decoded.usage());
        }
    }

    @Nested
    @DisplayName("user lines")
    class UserLines {

        @Test
        @DisplayName("meta and replayed lines are dropped")
        void dropsMetaAndReplay() {
            assertTrue(decoder.decodeLine("{\"type\":\"user\",\"isMeta\":true,\"message\":{\"content\":\"x\"}}").isEmpty());
            assertTrue(decoder.decodeLine("{\"type\":\"user\",\"isReplay\":true,\"message\":{\"content\":\"x\"}}").isEmpty());
        }

        @Test
        @DisplayName("one tool result per tool_result block")
        void toolResults() {
            String line = "{\"type\":\"user\",\"message\":{\"content\":["
                    + "{\"type\":\"tool_result\",\"tool_use_id\":\"t1\",\"content\":\"file body\"},"
                    + "{\"type\":\"tool_result\",\"tool_use_id\":\"t2\",\"is_error\":true,"
                    + "\"content\":[{\"type\":\"text\",\"text\":\"line 1\"},{\"type\":\"text\",\"text\":\"line 2\"}]}]}}";
            List<ResponseFragment> fragments = decoder.decodeLine(line);

            assertEquals(2, fragments.size());
            var first = (ResponseFragment.ToolResult) fragments.get(0);
            assertEquals("t1", first.toolUseId());
            assertEquals("file body", first.content());
            assertFalse(first.error());
            assertFalse(first.orphaned());
            var second = (ResponseFragment.ToolResult) fragments.get(1);
            assertTrue(second.error());
            assertEquals("line 1\nline 2", second.content());
        }

        @Test
        @DisplayName("plain user text becomes a user message")
        void plainText() {
            List<ResponseFragment> fragments = decoder.decodeLine(
                    "{\"type\":\"user\",\"message\":{\"role\":\"user\",\"content\":\"hello\"}}");

            var message = assertInstanceOf(ResponseFragment.UserMessage.class, fragments.get(0));
            assertEquals("hello", message.content());
        }

        @Test
        @DisplayName("compact summary is flagged and transcript-only by default")
        void compactSummary() {
            List<ResponseFragment> fragments = decoder.decodeLine(
                    "{\"type\":\"user\",\"isCompactSummary\":true,\"message\":{\"content\":\"Summary of earlier work\"}}");

            var summary = assertInstanceOf(ResponseFragment.CompactSummary.class, fragments.get(0));
            assertEquals("Summary of earlier work", summary.content());
            assertTrue(summary.visibleInTranscriptOnly());
        }
    }

    @Nested
    @DisplayName("system, result and stream lines")
    class OtherLines {

        @Test
        @DisplayName("compact boundary carries trigger and pre-compaction tokens")
        void compactBoundary() {
            List<ResponseFragment> fragments = decoder.decodeLine(
                    "{\"type\":\"system\",\"subtype\":\"compact_boundary\",\"compactMetadata\":{\"trigger\":\"manual\",\"preTokens\":12000}}");

            var boundary = assertInstanceOf(ResponseFragment.CompactBoundary.class, fragments.get(0));
            assertEquals("manual", boundary.trigger());
            assertEquals(12000, boundary.preTokens());
        }

        @Test
        @DisplayName("compact boundary defaults to an automatic trigger")
        void compactBoundaryDefaults() {
            var boundary = (ResponseFragment.CompactBoundary) decoder.decodeLine(
                    "{\"type\":\"system\",\"subtype\":\"compact_boundary\",\"compact_metadata\":{\"pre_tokens\":5}}").get(0);

            assertEquals("auto", boundary.trigger());
            assertEquals(5, boundary.preTokens());
        }

        @Test
        @DisplayName("init line becomes meta with the session id")
        void init() {
            DecodedLine decoded = decoder.decode(
                    "{\"type\":\"system\",\"subtype\":\"init\",\"session_id\":\"s-1\",\"model\":\"m\",\"tools\":[\"Read\",\"Bash\"]}");

            var meta = assertInstanceOf(ResponseFragment.Meta.class, decoded.fragments().get(0));
            assertEquals("init", meta.subtype());
            assertEquals(List.of("Read", "Bash"), meta.data().get("tools"));
            assertEquals("s-1", decoded.sessionId());
        }

        @Test
        @DisplayName("successful result completes the turn with cost and usage")
        void successResult() {
            DecodedLine decoded = decoder.decode(
                    "{\"type\":\"result\",\"subtype\":\"success\",\"total_cost_usd\":0.25,\"usage\":{\"input_tokens\":4,\"output_tokens\":6}}");

            var completion = assertInstanceOf(ResponseFragment.Completion.class, decoded.fragments().get(0));
            assertEquals("end_turn", completion.stopReason());
            assertEquals(0.25, completion.costUsd(), 1e-9);
            assertEquals(new TokenUsage(4, 6, 0, 0), decoded.usage());
        }

        @Test
        @DisplayName("error result decodes to an error")
        void errorResult() {
            var error = (ResponseFragment.Error) decoder.decodeLine(
                    "{\"type\":\"result\",\"subtype\":\"error_max_turns\",\"is_error\":true}").get(0);

            assertEquals("error_max_turns", error.message());
        }

        @Test
        @DisplayName("content block delta decodes to partial text")
        void streamDelta() {
            var text = (ResponseFragment.Text) decoder.decodeLine(
                    "{\"type\":\"stream_event\",\"event\":{\"type\":\"content_block_delta\",\"delta\":{\"type\":\"text_delta\",\"text\":\"Hel\"}}}").get(0);

            assertTrue(text.partial());
            assertEquals("Hel", text.content());
        }

        @Test
        @DisplayName("message start declares the message id without fragments")
        void messageStart() {
            DecodedLine decoded = decoder.decode(
                    "{\"type\":\"stream_event\",\"event\":{\"type\":\"message_start\",\"message\":{\"id\":\"msg_9\"}}}");

            assertTrue(decoded.fragments().isEmpty());
            assertEquals("msg_9", decoded.messageId());
        }

        @Test
        @DisplayName("error line decodes to an error fragment")
        void errorLine() {
            var error = (ResponseFragment.Error) decoder.decodeLine(
                    "{\"type\":\"error\",\"error\":{\"message\":\"overloaded\"}}").get(0);

            assertEquals("overloaded", error.message());
        }
    }

    @Nested
    @DisplayName("control requests")
    class ControlRequests {

        @Test
        @DisplayName("can_use_tool request is decoded for the permission gate")
        void canUseTool() {
            DecodedLine decoded = decoder.decode("{\"type\":\"control_request\",\"request_id\":\"req-1\",\"request\":"
                    + "{\"subtype\":\"can_use_tool\",\"tool_name\":\"Bash\",\"input\":{\"command\":\"rm -rf build\"},"
                    + "\"tool_use_id\":\"toolu_7\"}}");

            assertTrue(decoded.isControlRequest());
            assertTrue(decoded.fragments().isEmpty());
            ControlRequest request = decoded.controlRequest();
            assertTrue(request.isToolPermission());
            assertEquals("req-1", request.requestId());
            assertEquals("Bash", request.toolName());
            assertEquals("rm -rf build", request.input().get("command"));
            assertEquals("toolu_7", request.toolUseId());
        }

        @Test
        @DisplayName("control responses echoed by the agent are ignored")
        void controlResponse() {
            DecodedLine decoded = decoder.decode("{\"type\":\"control_response\",\"response\":{}}");

            assertFalse(decoded.isControlRequest());
            assertTrue(decoded.fragments().isEmpty());
        }
    }
}
