package com.agentdeck.session;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Runs the agent as a child process of this JVM.
 */
@Component
public class LocalAgentProcessLauncher implements AgentProcessLauncher {

    private static final Logger log = LoggerFactory.getLogger(LocalAgentProcessLauncher.class);

    @Override
    public AgentProcess launch(AgentProcessRequest request) {
        ProcessBuilder builder = new ProcessBuilder(request.command())
                .directory(request.workingDirectory().toFile());
        builder.environment().putAll(request.environment());
        try {
            Process process = builder.start();
            log.info("Started agent {} (pid {}) in {}", request.agentId(), process.pid(), request.workingDirectory());
            return new LocalAgentProcess(process);
        } catch (IOException e) {
            throw new ProcessStartException("Failed to start '" + request.command().get(0) + "': " + e.getMessage(), e);
        }
    }

    static final class LocalAgentProcess implements AgentProcess {

        private final Process process;
        private final BufferedWriter stdin;

        LocalAgentProcess(Process process) {
            this.process = process;
            this.stdin = new BufferedWriter(new OutputStreamWriter(process.getOutputStream(), StandardCharsets.UTF_8));
        }

        @Override
        public InputStream stdout() {
            return process.getInputStream();
        }

        @Override
        public InputStream stderr() {
            return process.getErrorStream();
        }

        @Override
        public synchronized void writeLine(String line) throws IOException {
            stdin.write(line);
            stdin.write('\n');
            stdin.flush();
        }

        @Override
        public boolean isAlive() {
            return process.isAlive();
        }

        @Override
        public void terminate() {
            process.destroy();
        }

        @Override
        public void forceTerminate() {
            process.destroyForcibly();
        }

        @Override
        public boolean waitFor(Duration timeout) throws InterruptedException {
            return process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
        }

        @Override
        public int exitCode() {
            return process.isAlive() ? -1 : process.exitValue();
        }

        @Override
        public long pid() {
            return process.pid();
        }
    }
}
