package com.agentdeck.core.permission;

import com.agentdeck.core.permission.BashCommandParser.CommandType;
import com.agentdeck.core.permission.BashCommandParser.ParsedCommand;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BashCommandParserTest {

    @Nested
    @DisplayName("parse")
    class Parse {

        @Test
        @DisplayName("splits on control operators and newlines")
        void operators() {
            List<ParsedCommand> parts = BashCommandParser.parse("make && make test || echo failed; ls\npwd");

            assertEquals(List.of("make", "make test", "echo failed", "ls", "pwd"),
                    parts.stream().map(ParsedCommand::command).toList());
            assertTrue(parts.stream().allMatch(p -> p.type() == CommandType.SIMPLE));
        }

        @Test
        @DisplayName("pipeline stages are pipeline parts")
        void pipeline() {
            List<ParsedCommand> parts = BashCommandParser.parse("cat log.txt | grep ERROR | wc -l");

            assertEquals(3, parts.size());
            assertTrue(parts.stream().allMatch(p -> p.type() == CommandType.PIPELINE_PART));
        }

        @Test
        @DisplayName("cd is recognised")
        void cd() {
            List<ParsedCommand> parts = BashCommandParser.parse("cd src && ls");

            assertEquals(CommandType.CD, parts.get(0).type());
            assertEquals(CommandType.SIMPLE, parts.get(1).type());
        }

        @Test
        @DisplayName("operators inside quotes or escaped do not split")
        void quotes() {
            assertEquals(1, BashCommandParser.parse("echo 'a && b'").size());
            assertEquals(1, BashCommandParser.parse("echo \"a | b; c\"").size());
            assertEquals(1, BashCommandParser.parse("echo a \\; b").size());
        }

        @Test
        @DisplayName("a lone ampersand runs the next command in the foreground")
        void backgroundOperator() {
            assertEquals(List.of("dart pub get", "rm -rf /"), commands("dart pub get & rm -rf /"));
            assertEquals(List.of("sleep 5"), commands("sleep 5 &"));
            assertEquals(List.of("make", "make test"), commands("make &&make test"));
        }

        @Test
        @DisplayName("ampersands of redirections do not split")
        void redirectionAmpersands() {
            assertEquals(List.of("ls 2>&1"), commands("ls 2>&1"));
            assertEquals(List.of("ls &> /dev/null"), commands("ls &> /dev/null"));
            assertEquals(List.of("cat <&3"), commands("cat <&3"));
        }

        @Test
        @DisplayName("|& pipes both output streams into the next stage")
        void pipeBoth() {
            List<ParsedCommand> parts = BashCommandParser.parse("make |& grep error");
            assertEquals(List.of("make", "grep error"), parts.stream().map(ParsedCommand::command).toList());
            assertTrue(parts.stream().allMatch(p -> p.type() == CommandType.PIPELINE_PART));
        }

        @Test
        @DisplayName("blank input has no commands")
        void blank() {
            assertTrue(BashCommandParser.parse("  ").isEmpty());
            assertTrue(BashCommandParser.parse(null).isEmpty());
        }
    }

    @Test
    @DisplayName("cd stays within the working directory only for relative or nested targets")
    void cdWithinWorkingDir() {
        assertTrue(BashCommandParser.isCdWithinWorkingDir("cd src/main", "/work/app"));
        assertTrue(BashCommandParser.isCdWithinWorkingDir("cd /work/app/lib", "/work/app"));
        assertFalse(BashCommandParser.isCdWithinWorkingDir("cd ..", "/work/app"));
        assertFalse(BashCommandParser.isCdWithinWorkingDir("cd ~/x", "/work/app"));
        assertFalse(BashCommandParser.isCdWithinWorkingDir("cd", "/work/app"));
        assertFalse(BashCommandParser.isCdWithinWorkingDir("cd /work/application", "/work/app"));
    }

    @Test
    @DisplayName("command substitution is found outside single quotes")
    void substitution() {
        assertTrue(BashCommandParser.hasCommandSubstitution("echo $(date)"));
        assertTrue(BashCommandParser.hasCommandSubstitution("echo \"`date`\""));
        assertFalse(BashCommandParser.hasCommandSubstitution("echo '$(date)'"));
        assertFalse(BashCommandParser.hasCommandSubstitution("echo $HOME"));
    }

    @Test
    @DisplayName("process substitution counts as command substitution")
    void processSubstitution() {
        assertTrue(BashCommandParser.hasCommandSubstitution("cat <(rm -rf /tmp/x)"));
        assertTrue(BashCommandParser.hasCommandSubstitution("diff a >(tee b)"));
        assertFalse(BashCommandParser.hasCommandSubstitution("echo '<(x)'"));
    }

    private static List<String> commands(String command) {
        return BashCommandParser.parse(command).stream().map(ParsedCommand::command).toList();
    }
}
