package com.agentdeck.core.permission;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SafeCommandsTest {

    @Test
    @DisplayName("read-only commands are safe")
    void safe() {
        for (String command : List.of("ls -la", "pwd", "git status", "git log --oneline", "npm ls",
                "grep -r foo src", "find . -name '*.java'", "cat README.md 2>/dev/null", "ls 2>&1",
                "ls &> /dev/null", "grep '>' notes.txt", "sed -n '1,5p' build.log", "env", "printenv PATH",
                "git branch -a", "git remote -v", "npm version")) {
            assertTrue(SafeCommands.isCommandSafe(command), command);
        }
    }

    @Test
    @DisplayName("commands that change things are not safe")
    void unsafe() {
        for (String command : List.of("rm -rf /", "git push", "git", "npm install", "find . -delete",
                "find . -exec rm {} ;", "sed -i s/a/b/ f.txt", "echo hi > out.txt",
                "awk 'BEGIN{system(\"id\")}'", "cat $(ls)", "")) {
            assertFalse(SafeCommands.isCommandSafe(command), command);
        }
    }

    @Test
    @DisplayName("any redirection into a file is unsafe")
    void redirections() {
        for (String command : List.of("ls &> /home/user/.bashrc", "ls nonexistent 2> /home/user/.bashrc",
                "cat a >> b", "ls 3>out", "ls >| out", "ls >&out", "echo x >\"/dev/null2\"")) {
            assertTrue(SafeCommands.writesToFile(command), command);
            assertFalse(SafeCommands.isCommandSafe(command), command);
        }
        assertFalse(SafeCommands.writesToFile("ls 2>&1 >/dev/null"));
        assertFalse(SafeCommands.writesToFile("ls 2>&-"));
    }

    @Test
    @DisplayName("commands that run or write through their arguments are unsafe")
    void indirectExecution() {
        for (String command : List.of("env rm -rf /", "env FOO=1 sh", "cat <(rm -rf /tmp/x)",
                "sed 's/a/b/w /tmp/out' f.txt", "sed '1e rm -rf /' f.txt", "sed 's/x/id/e' f.txt",
                "awk '{print > \"out\"}' f.txt", "awk '{print | \"sh\"}' f.txt",
                "find . -fprint out.txt", "git branch -D main", "git remote add origin x",
                "git reflog expire --all", "npm version major")) {
            assertFalse(SafeCommands.isCommandSafe(command), command);
        }
    }

    @Test
    @DisplayName("output filters are safe only as filters")
    void outputFilters() {
        assertTrue(SafeCommands.isSafeOutputFilter("head -20"));
        assertTrue(SafeCommands.isSafeOutputFilter("grep -v DEBUG"));
        assertFalse(SafeCommands.isSafeOutputFilter("xargs rm"));
        assertFalse(SafeCommands.isSafeOutputFilter("tee out.txt"));
        assertFalse(SafeCommands.isSafeOutputFilter("sed -i s/a/b/"));
        assertFalse(SafeCommands.isSafeOutputFilter("grep x > out.txt"));
        assertFalse(SafeCommands.isSafeOutputFilter("sed 's/a/b/w out.txt'"));
    }
}
