package com.docuvision.pipeline.service.host;

import com.docuvision.pipeline.model.ActionResponse;
import com.docuvision.pipeline.service.DocumentRef;
import com.docuvision.pipeline.service.ExtractionService;
import com.docuvision.pipeline.service.IngestionException;
import com.docuvision.pipeline.service.extraction.ExtractionOutcome;
import com.docuvision.pipeline.service.extraction.ExtractionResult;
import com.docuvision.pipeline.service.extraction.FailureKind;
import com.docuvision.pipeline.service.fetch.FetchException;
import com.docuvision.pipeline.service.fetch.FetchedFile;
import com.docuvision.pipeline.service.fetch.RemoteFetcher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.RejectedExecutionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ResourceProcessingServiceTest {

    private static final String RESOURCE_ID = "abc1234567";

    @TempDir
    Path tempDir;

    @Mock
    private DocumentCatalog documentCatalog;

    @Mock
    private RemoteFetcher remoteFetcher;

    @Mock
    private ExtractionService extractionService;

    private ResourceProcessingService service;

    @BeforeEach
    void setUp() {
        service = new ResourceProcessingService(documentCatalog, new ResourceStorage(tempDir.toString()), remoteFetcher,
                extractionService, Runnable::run);
    }

    @Test
    void uploadedResourceIsReadFromTheFileStore() {
        when(documentCatalog.describe(RESOURCE_ID)).thenReturn(
                new DocumentRecord(RESOURCE_ID, "pkg-1", "Notice", "PDF", "notice.pdf", true));
        when(extractionService.process(any())).thenReturn(
                ExtractionOutcome.success(new ExtractionResult("text", "pdf-text-layer", List.of())));

        ActionResponse response = service.processResource(RESOURCE_ID);

        assertThat(response.success()).isTrue();
        assertThat(response.message()).startsWith("Text extraction completed for resource " + RESOURCE_ID);
        ArgumentCaptor<DocumentRef> captor = ArgumentCaptor.forClass(DocumentRef.class);
        verify(extractionService).process(captor.capture());
        DocumentRef document = captor.getValue();
        assertThat(document.localPath()).isEqualTo(tempDir.resolve("resources/abc/123/4567"));
        assertThat(document.declaredFormat()).isEqualTo("PDF");
        assertThat(document.sourceNameOrUrl()).isEqualTo("notice.pdf");
        assertThat(document.collectionId()).isEqualTo("pkg-1");
        verifyNoInteractions(remoteFetcher);
    }

    @Test
    void extractionFailureBecomesBadRequest() {
        when(documentCatalog.describe(RESOURCE_ID)).thenReturn(
                new DocumentRecord(RESOURCE_ID, "pkg-1", "Notice", "PDF", "notice.pdf", true));
        when(extractionService.process(any())).thenReturn(
                ExtractionOutcome.failure(FailureKind.FILE_NOT_FOUND, "File not found: /x"));

        assertThatThrownBy(() -> service.processResource(RESOURCE_ID))
                .isInstanceOf(IngestionException.class)
                .hasMessage("Error processing resource: File not found: /x")
                .satisfies(error -> assertThat(((IngestionException) error).status()).isEqualTo(HttpStatus.BAD_REQUEST));
    }

    @Test
    void unsupportedFormatIsNotAnError() {
        when(documentCatalog.describe(RESOURCE_ID)).thenReturn(
                new DocumentRecord(RESOURCE_ID, "pkg-1", "Data", "CSV", "data.csv", true));
        when(extractionService.process(any())).thenReturn(ExtractionOutcome.unsupported("CSV"));

        ActionResponse response = service.processResource(RESOURCE_ID);

        assertThat(response.success()).isTrue();
        assertThat(response.message()).contains("not supported");
    }

    @Test
    void linkedResourceIsDownloadedAndCleanedUp() throws IOException {
        Path download = Files.writeString(tempDir.resolve("download.tmp"), "%PDF");
        when(documentCatalog.describe(RESOURCE_ID)).thenReturn(
                new DocumentRecord(RESOURCE_ID, "pkg-1", "Remote", "", "https://portal.example/notice.pdf", false));
        when(remoteFetcher.fetch("https://portal.example/notice.pdf", "")).thenReturn(new FetchedFile(download, "notice.pdf"));
        when(extractionService.process(any())).thenReturn(
                ExtractionOutcome.success(new ExtractionResult("text", "pdf-text-layer", List.of())));

        service.processResource(RESOURCE_ID);

        ArgumentCaptor<DocumentRef> captor = ArgumentCaptor.forClass(DocumentRef.class);
        verify(extractionService).process(captor.capture());
        assertThat(captor.getValue().localPath()).isEqualTo(download);
        assertThat(captor.getValue().sourceNameOrUrl()).isEqualTo("notice.pdf");
        assertThat(download).doesNotExist();
    }

    @Test
    void failedDownloadOfLinkedResourceIsReported() {
        when(documentCatalog.describe(RESOURCE_ID)).thenReturn(
                new DocumentRecord(RESOURCE_ID, "pkg-1", "Remote", "", "https://portal.example/notice.pdf", false));
        when(remoteFetcher.fetch("https://portal.example/notice.pdf", ""))
                .thenThrow(new FetchException(FailureKind.HTTP_ERROR, "Download failed with HTTP 503"));

        assertThatThrownBy(() -> service.processResource(RESOURCE_ID))
                .isInstanceOf(IngestionException.class)
                .hasMessageContaining("HTTP 503");
        verifyNoInteractions(extractionService);
    }

    @Test
    void handledEventsAreProcessedAndOthersIgnored() {
        when(documentCatalog.describe(RESOURCE_ID)).thenReturn(
                new DocumentRecord(RESOURCE_ID, "pkg-1", "Notice", "PDF", "notice.pdf", true));
        when(extractionService.process(any())).thenReturn(ExtractionOutcome.unsupported("PDF"));

        assertThat(service.submitEvent(RESOURCE_ID, "Created")).isTrue();
        assertThat(service.submitEvent(RESOURCE_ID, "deleted")).isFalse();

        verify(extractionService).process(any());
    }

    @Test
    void eventProcessingErrorsDoNotEscape() {
        when(documentCatalog.describe(RESOURCE_ID)).thenThrow(new IngestionException(HttpStatus.NOT_FOUND, "Resource not found"));

        assertThat(service.submitEvent(RESOURCE_ID, "updated")).isTrue();
    }

    @Test
    void fullEventQueueIsServiceUnavailable() {
        ResourceProcessingService saturated = new ResourceProcessingService(documentCatalog, new ResourceStorage(tempDir.toString()),
                remoteFetcher, extractionService, task -> {
                    throw new RejectedExecutionException("queue capacity reached");
                });

        assertThatThrownBy(() -> saturated.submitEvent(RESOURCE_ID, "created"))
                .isInstanceOf(IngestionException.class)
                .hasMessage("Event queue is full, retry later")
                .hasCauseInstanceOf(RejectedExecutionException.class)
                .satisfies(error -> assertThat(((IngestionException) error).status()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE));
        verifyNoInteractions(documentCatalog, extractionService);
    }
}
