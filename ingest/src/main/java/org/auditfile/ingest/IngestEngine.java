package org.auditfile.ingest;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.auditfile.ingest.emit.RecordEmitter;
import org.auditfile.ingest.fallback.FallbackIngester;
import org.auditfile.ingest.field.FieldResolver;
import org.auditfile.ingest.field.Vocabulary;
import org.auditfile.ingest.integrity.IntegrityChecker;
import org.auditfile.ingest.integrity.IntegrityFindings;
import org.auditfile.ingest.progress.CancellationToken;
import org.auditfile.ingest.progress.IngestStats;
import org.auditfile.ingest.progress.ProgressChannel;
import org.auditfile.ingest.progress.ProgressListener;
import org.auditfile.ingest.sink.SinkTarget;
import org.auditfile.ingest.stream.StreamingIngester;
import org.auditfile.util.source.SourceFormatException;
import org.auditfile.util.source.SourceHandle;
import org.auditfile.util.source.SourceReader;

/**
 * Ingests one audit file into a set of tables.
 *
 * <p>The streaming parser runs first. If it fails, whatever it wrote is discarded and
 * the document is read again by the fallback parser. The vocabulary and configuration
 * are read-only, so one engine may serve concurrent runs.
 */
public class IngestEngine {
  private static final Logger log = LogManager.getLogger(IngestEngine.class);

  public static final String VERSION = "1.0.0";

  private final IngestConfig config;
  private final Vocabulary vocabulary;
  private final FieldResolver resolver;

  public IngestEngine() {
    this(IngestConfig.load(), Vocabulary.load());
  }

  /**
   * Create engine.
   * @param config run settings
   * @param vocabulary tag vocabulary
   */
  public IngestEngine(IngestConfig config, Vocabulary vocabulary) {
    this.config = config;
    this.vocabulary = vocabulary;
    this.resolver = new FieldResolver(vocabulary.getAliases(), config.getResolveDepth());
  }

  public IngestConfig getConfig() {
    return config;
  }

  public RunOutcome ingest(Path source, SinkTarget target) {
    return ingest(source, target, null, null);
  }

  public RunOutcome ingest(Path source, SinkTarget target, ProgressListener listener) {
    return ingest(source, target, listener, null);
  }

  /**
   * Ingest a file.
   * @param source raw XML, gzip or zip file
   * @param target where the tables go
   * @param listener progress listener; may be null
   * @param token stop flag checked at each progress tick; may be null
   * @return what the run did
   * @throws SourceFormatException if the source cannot be opened as an audit file
   * @throws FallbackParsingException if both parsers fail
   * @throws UncheckedIOException if the run summary or diagnostics cannot be written
   */
  public RunOutcome ingest(Path source, SinkTarget target, ProgressListener listener,
      CancellationToken token) {
    log.info("Ingesting {} into {}", source, target.describe());
    IngestStats stats = new IngestStats(source.toString());
    IngestAttempt attempt;
    try (SourceHandle handle = SourceReader.open(source)) {
      log.info("Source {} ({})", handle.getDescription(), handle.getFormat());
      ProgressChannel progress = new ProgressChannel(stats, listener, token,
          config.getProgressEvents());
      attempt = stream(handle, target, stats, progress);
    }

    ParsePath path = ParsePath.STREAMING;
    String streamingFailure = null;
    RecordEmitter emitter = attempt.getEmitter();
    if (attempt.isFailed()) {
      streamingFailure = attempt.getFailure().getMessage();
      log.warn("Streaming parser failed, switching to fallback: {}", streamingFailure,
          attempt.getFailure());
      path = ParsePath.FALLBACK;
      stats = new IngestStats(source.toString());
      emitter = fallback(source, target, stats);
    }

    boolean cancelled = attempt.isCancelled();
    IntegrityFindings findings = IntegrityFindings.none();
    List<String> tables = new ArrayList<>(target.tables());
    try {
      if (cancelled) {
        log.warn("Run cancelled; integrity checks skipped");
      } else {
        findings = IntegrityChecker.check(emitter);
        tables.addAll(findings.writeTo(target));
      }
      RunOutcome outcome = new RunOutcome(path, cancelled, config.isWriteRaw(), findings,
          stats.snapshot(), tables, streamingFailure);
      target.writeSummary(outcome.toJson());
      log.info("Ingested {} via {} in {}s: {} elements, rows {}, findings {}", source, path,
          String.format("%.1f", outcome.getProgress().getElapsedSeconds()),
          outcome.getProgress().getEvents(), outcome.getProgress().getRows(),
          findings.toJson().encode());
      return outcome;
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  private RecordEmitter newEmitter(SinkTarget target, IngestStats stats) {
    return new RecordEmitter(target, vocabulary, resolver, stats, config.isWriteRaw(),
        config.getRawTextMax());
  }

  IngestAttempt stream(SourceHandle handle, SinkTarget target, IngestStats stats,
      ProgressChannel progress) {
    RecordEmitter emitter = newEmitter(target, stats);
    try {
      boolean cancelled;
      try {
        emitter.open();
        cancelled = new StreamingIngester(vocabulary, emitter, progress, stats)
            .run(handle.stream());
      } finally {
        emitter.close();
      }
      return cancelled ? IngestAttempt.cancelled(emitter) : IngestAttempt.completed(emitter);
    } catch (StreamingTraversalException e) {
      return IngestAttempt.failed(e);
    } catch (IOException | RuntimeException e) {
      return IngestAttempt.failed(new StreamingTraversalException(e.getMessage(), e));
    } catch (StackOverflowError e) {
      return IngestAttempt.failed(new StreamingTraversalException("Document nested too deeply",
          e));
    }
  }

  RecordEmitter fallback(Path source, SinkTarget target, IngestStats stats) {
    try {
      target.discard();
    } catch (IOException e) {
      throw new FallbackParsingException("Cannot discard streaming output: " + e.getMessage(),
          e);
    }
    RecordEmitter emitter = newEmitter(target, stats);
    try (SourceHandle handle = SourceReader.open(source)) {
      try {
        emitter.open();
        new FallbackIngester(vocabulary, emitter, stats).run(handle.stream());
      } finally {
        emitter.close();
      }
      return emitter;
    } catch (Exception e) {
      throw new FallbackParsingException("Fallback parser failed: " + e.getMessage(), e);
    } catch (StackOverflowError e) {
      throw new FallbackParsingException("Fallback parser failed: document nested too deeply",
          e);
    }
  }
}
