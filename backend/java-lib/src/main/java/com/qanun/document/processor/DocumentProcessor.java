package com.qanun.document.processor;

import com.qanun.document.config.ProcessorConfig;
import com.qanun.document.extractor.ExtractedText;
import com.qanun.document.extractor.TextExtractor;
import com.qanun.document.legal.ArticleExtractor;
import com.qanun.document.legal.KeywordExtractor;
import com.qanun.document.legal.LawSourceDetector;
import com.qanun.document.legal.ReferenceExtractor;
import com.qanun.document.model.Article;
import com.qanun.document.model.BatchEntry;
import com.qanun.document.model.BatchResult;
import com.qanun.document.model.FailureKind;
import com.qanun.document.model.LawSourceMetadata;
import com.qanun.document.model.LawSourceOverrides;
import com.qanun.document.model.LegalDocumentException;
import com.qanun.document.model.ProcessingResult;
import com.qanun.document.model.ProcessingStatistics;
import com.qanun.document.text.ArabicTextUtility;
import com.qanun.document.text.DefaultArabicTextUtility;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs the Arabic legal document pipeline: text extraction, law-source
 * detection merged with caller overrides, then article segmentation.
 *
 * Instances hold no mutable state and may be shared between threads.
 */
public class DocumentProcessor {
    private static final Logger logger = LoggerFactory.getLogger(DocumentProcessor.class);

    private final TextExtractor textExtractor;
    private final LawSourceDetector lawSourceDetector;
    private final ArticleExtractor articleExtractor;
    private final ArabicTextUtility textUtility;
    private final ProcessorConfig config;
    private final Clock clock;

    public DocumentProcessor(TextExtractor textExtractor, LawSourceDetector lawSourceDetector,
            ArticleExtractor articleExtractor, ArabicTextUtility textUtility, ProcessorConfig config, Clock clock) {
        this.textExtractor = Objects.requireNonNull(textExtractor, "textExtractor");
        this.lawSourceDetector = Objects.requireNonNull(lawSourceDetector, "lawSourceDetector");
        this.articleExtractor = Objects.requireNonNull(articleExtractor, "articleExtractor");
        this.textUtility = Objects.requireNonNull(textUtility, "textUtility");
        this.config = Objects.requireNonNull(config, "config");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public static DocumentProcessor create() {
        return create(ProcessorConfig.defaults());
    }

    public static DocumentProcessor create(ProcessorConfig config) {
        return create(config, TextExtractor.withDefaultBackends(), new DefaultArabicTextUtility());
    }

    /**
     * Wire the default detectors around the given extractor and text utility.
     */
    public static DocumentProcessor create(ProcessorConfig config, TextExtractor textExtractor,
            ArabicTextUtility textUtility) {
        KeywordExtractor keywordExtractor = new KeywordExtractor(textUtility, config.getMaxKeywords());
        ArticleExtractor articleExtractor = new ArticleExtractor(textUtility, keywordExtractor,
                new ReferenceExtractor(), config.getMinArticleLength());
        return new DocumentProcessor(textExtractor, new LawSourceDetector(config.getDescriptionWindow()),
                articleExtractor, textUtility, config, Clock.systemUTC());
    }

    public ProcessingResult process(Path filePath) throws LegalDocumentException {
        return process(filePath, null);
    }

    /**
     * Process one document.
     *
     * @param filePath  .pdf, .docx or .doc file
     * @param overrides caller-supplied law metadata, may be {@code null}
     * @throws LegalDocumentException of kind EXTRACTION, EMPTY_TEXT or UNEXPECTED
     */
    public ProcessingResult process(Path filePath, LawSourceOverrides overrides) throws LegalDocumentException {
        Objects.requireNonNull(filePath, "filePath");
        String documentPath = filePath.toString();
        logger.info("Starting processing of Arabic legal document: {}", documentPath);

        try {
            ExtractedText extracted = textExtractor.extract(filePath);
            if (extracted.isBlank()) {
                throw new LegalDocumentException(FailureKind.EMPTY_TEXT,
                        "No text extracted from document", documentPath);
            }
            String text = extracted.getText();

            LawSourceMetadata detected = lawSourceDetector.detect(text);
            LawSourceMetadata lawSource = lawSourceDetector.merge(detected, overrides);

            List<Article> articles = articleExtractor.extract(text);
            long totalCharacters = articles.stream().mapToLong(Article::getContentLength).sum();

            ProcessingStatistics statistics = new ProcessingStatistics(articles.size(), totalCharacters,
                    clock.instant(), documentPath, textUtility.detectLanguage(text), extracted.getBackendName());

            logger.info("Processed {} - law source '{}', {} articles, {} characters",
                    documentPath, lawSource.getName(), articles.size(), totalCharacters);
            return new ProcessingResult(lawSource, articles, statistics);

        } catch (LegalDocumentException e) {
            throw e;
        } catch (Exception e) {
            throw new LegalDocumentException(FailureKind.UNEXPECTED,
                    "Failed to process document: " + e.getMessage(), documentPath, e);
        }
    }

    public BatchResult processBatch(List<Path> filePaths) {
        return processBatch(filePaths, null);
    }

    /**
     * Process several documents. A failing document becomes a failed entry and
     * never stops the others; entries follow the input order.
     */
    public BatchResult processBatch(List<Path> filePaths, LawSourceOverrides overrides) {
        Objects.requireNonNull(filePaths, "filePaths");
        List<BatchEntry> entries = config.isParallelBatch() && filePaths.size() > 1
                ? processInParallel(filePaths, overrides)
                : processSequentially(filePaths, overrides);

        BatchResult result = new BatchResult(entries);
        logger.info("Batch finished: {}", result.getStatistics());
        return result;
    }

    private List<BatchEntry> processSequentially(List<Path> filePaths, LawSourceOverrides overrides) {
        List<BatchEntry> entries = new ArrayList<>(filePaths.size());
        for (Path filePath : filePaths) {
            try {
                entries.add(BatchEntry.success(filePath.toString(), process(filePath, overrides)));
            } catch (LegalDocumentException e) {
                entries.add(failed(filePath, e.getMessage(), e.getKind()));
            } catch (RuntimeException e) {
                entries.add(failed(filePath, e.toString(), FailureKind.UNEXPECTED));
            }
        }
        return entries;
    }

    private List<BatchEntry> processInParallel(List<Path> filePaths, LawSourceOverrides overrides) {
        int workers = Math.min(config.getBatchWorkers(), filePaths.size());
        ExecutorService executor = Executors.newFixedThreadPool(workers, new BatchThreadFactory());
        List<BatchEntry> entries = new ArrayList<>(filePaths.size());

        try {
            List<Future<ProcessingResult>> futures = new ArrayList<>(filePaths.size());
            for (Path filePath : filePaths) {
                futures.add(executor.submit(() -> process(filePath, overrides)));
            }

            long timeoutMillis = config.getDocumentTimeout().toMillis();
            for (int i = 0; i < filePaths.size(); i++) {
                Path filePath = filePaths.get(i);
                Future<ProcessingResult> future = futures.get(i);

                if (Thread.currentThread().isInterrupted()) {
                    future.cancel(true);
                    entries.add(failed(filePath, "Batch interrupted before document finished", FailureKind.UNEXPECTED));
                    continue;
                }

                try {
                    entries.add(BatchEntry.success(filePath.toString(), future.get(timeoutMillis, TimeUnit.MILLISECONDS)));
                } catch (TimeoutException e) {
                    future.cancel(true);
                    entries.add(failed(filePath, String.format("Processing timed out after %d seconds",
                            config.getDocumentTimeout().getSeconds()), FailureKind.UNEXPECTED));
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause();
                    if (cause instanceof LegalDocumentException) {
                        LegalDocumentException failure = (LegalDocumentException) cause;
                        entries.add(failed(filePath, failure.getMessage(), failure.getKind()));
                    } else {
                        entries.add(failed(filePath, String.valueOf(cause), FailureKind.UNEXPECTED));
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    future.cancel(true);
                    entries.add(failed(filePath, "Batch interrupted before document finished", FailureKind.UNEXPECTED));
                }
            }
        } finally {
            executor.shutdownNow();
        }
        return entries;
    }

    private static BatchEntry failed(Path filePath, String error, FailureKind kind) {
        logger.warn("Failed to process {}: {}", filePath, error);
        return BatchEntry.failure(filePath.toString(), error, kind);
    }

    private static final class BatchThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "legal-batch-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
