package com.docuvision.pipeline.service.extraction.office;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs an external helper with a hard timeout. Both output streams are drained on their own
 * threads so a chatty process cannot block on a full pipe.
 */
@Component
public class ProcessExecutor {

    private static final Logger log = LoggerFactory.getLogger(ProcessExecutor.class);

    /**
     * Cap on captured stderr; stdout is the payload and is bounded by the input document.
     */
    private static final int MAX_STDERR_BYTES = 16 * 1024;

    public ProcessResult execute(List<String> command, long timeoutSeconds, String processName)
            throws IOException, InterruptedException {
        Process process = new ProcessBuilder(command).start();
        ExecutorService drains = Executors.newFixedThreadPool(2);
        try {
            Future<byte[]> stdout = drains.submit(() -> readAll(process.getInputStream(), Integer.MAX_VALUE));
            Future<byte[]> stderr = drains.submit(() -> readAll(process.getErrorStream(), MAX_STDERR_BYTES));

            if (!process.waitFor(timeoutSeconds, TimeUnit.SECONDS)) {
                process.destroyForcibly();
                throw new ProcessTimeoutException(processName + " process timed out after " + timeoutSeconds + " seconds");
            }
            return new ProcessResult(process.exitValue(),
                    new String(await(stdout, processName), StandardCharsets.UTF_8),
                    new String(await(stderr, processName), StandardCharsets.UTF_8).trim());
        } finally {
            drains.shutdownNow();
        }
    }

    private byte[] await(Future<byte[]> output, String processName) throws IOException, InterruptedException {
        try {
            return output.get(5, TimeUnit.SECONDS);
        } catch (ExecutionException | TimeoutException e) {
            throw new IOException("Failed to read " + processName + " output", e);
        }
    }

    private static byte[] readAll(InputStream stream, int limit) throws IOException {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        byte[] chunk = new byte[8192];
        int read;
        try (InputStream in = stream) {
            while ((read = in.read(chunk)) != -1) {
                int room = limit - buffer.size();
                if (room > 0) {
                    buffer.write(chunk, 0, Math.min(room, read));
                }
            }
        } catch (IOException e) {
            log.debug("Process stream closed early", e);
            throw e;
        }
        return buffer.toByteArray();
    }

    public record ProcessResult(int exitCode, String stdout, String stderr) {
    }

    public static class ProcessTimeoutException extends IOException {

        public ProcessTimeoutException(String message) {
            super(message);
        }
    }
}
