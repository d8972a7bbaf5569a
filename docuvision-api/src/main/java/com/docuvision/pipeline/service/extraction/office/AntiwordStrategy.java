package com.docuvision.pipeline.service.extraction.office;

import com.docuvision.pipeline.service.extraction.ExtractionStrategy;
import com.docuvision.pipeline.service.extraction.FailureKind;
import com.docuvision.pipeline.service.extraction.StrategyResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

@Component
public class AntiwordStrategy implements ExtractionStrategy {

    private static final Logger log = LoggerFactory.getLogger(AntiwordStrategy.class);

    private final ProcessExecutor processExecutor;
    private final String command;
    private final long timeoutSeconds;

    public AntiwordStrategy(ProcessExecutor processExecutor,
                            @Value("${docuvision.antiword.command:antiword}") String command,
                            @Value("${docuvision.antiword.timeout-seconds:60}") long timeoutSeconds) {
        this.processExecutor = processExecutor;
        this.command = command;
        this.timeoutSeconds = timeoutSeconds;
    }

    @Override
    public String name() {
        return "antiword";
    }

    @Override
    public StrategyResult attempt(Path file) {
        try {
            ProcessExecutor.ProcessResult result = processExecutor.execute(List.of(command, file.toString()), timeoutSeconds, "antiword");
            if (result.exitCode() != 0) {
                return StrategyResult.failed(FailureKind.ENGINE_FAILURE,
                        "antiword exited with code " + result.exitCode() + (result.stderr().isBlank() ? "" : ": " + result.stderr()));
            }
            return StrategyResult.success(result.stdout());
        } catch (ProcessExecutor.ProcessTimeoutException e) {
            log.error("antiword timed out on {}", file);
            return StrategyResult.failed(FailureKind.ENGINE_FAILURE, e.getMessage());
        } catch (IOException e) {
            log.error("antiword could not process {}", file, e);
            return StrategyResult.failed(FailureKind.ENGINE_MISSING, "antiword could not be run: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return StrategyResult.failed(FailureKind.ENGINE_FAILURE, "antiword was interrupted");
        }
    }
}
