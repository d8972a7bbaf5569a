package com.docuvision.pipeline.service.extraction;

import java.util.List;

/**
 * Terminal value of one pipeline invocation. Library exceptions never escape through an
 * outcome; they are mapped into {@link Failure} with a {@link FailureKind}.
 */
public sealed interface ExtractionOutcome
        permits ExtractionOutcome.Success, ExtractionOutcome.Unsupported, ExtractionOutcome.Failure, ExtractionOutcome.ManifestIngested {

    boolean successful();

    String describe();

    static ExtractionOutcome success(ExtractionResult result) {
        return new Success(result);
    }

    static ExtractionOutcome unsupported(String format) {
        return new Unsupported(format);
    }

    static ExtractionOutcome failure(FailureKind kind, String message) {
        return new Failure(kind, message);
    }

    record Success(ExtractionResult result) implements ExtractionOutcome {

        @Override
        public boolean successful() {
            return true;
        }

        @Override
        public String describe() {
            return "extracted " + result.text().length() + " characters using " + result.strategyUsed();
        }
    }

    record Unsupported(String format) implements ExtractionOutcome {

        @Override
        public boolean successful() {
            return true;
        }

        @Override
        public String describe() {
            return "format '" + format + "' is not supported for text extraction, skipped";
        }
    }

    record Failure(FailureKind kind, String message) implements ExtractionOutcome {

        @Override
        public boolean successful() {
            return false;
        }

        @Override
        public String describe() {
            return kind + ": " + message;
        }
    }

    record ManifestIngested(String shape, List<ExtractionOutcome> outcomes) implements ExtractionOutcome {

        public ManifestIngested {
            outcomes = outcomes == null ? List.of() : List.copyOf(outcomes);
        }

        public long failures() {
            return outcomes.stream().filter(outcome -> !outcome.successful()).count();
        }

        @Override
        public boolean successful() {
            return true;
        }

        @Override
        public String describe() {
            return "manifest " + shape + " referenced " + outcomes.size() + " document(s), " + failures() + " failed";
        }
    }
}
