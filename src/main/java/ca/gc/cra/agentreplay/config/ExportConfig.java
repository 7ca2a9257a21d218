package ca.gc.cra.agentreplay.config;

import ca.gc.cra.agentreplay.application.port.ExportFormat;
import ca.gc.cra.agentreplay.validation.Paths;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Settings for the {@code export} command.
 * <p><strong>Output naming:</strong> when {@code out} is omitted the export is written next to the trace, with the
 * trace file's extension replaced by the format's ({@code run.jsonl} becomes {@code run.html}).</p>
 *
 * @since 0.1.0
 */
public final class ExportConfig {
  private final Path trace;
  private final ExportFormat format;
  private final Optional<Path> out;
  private final boolean allowOverwrite;

  /**
   * Creates an export configuration.
   *
   * @param trace trace file to export
   * @param format output format
   * @param out explicit destination; empty to derive one from {@code trace}
   * @param allowOverwrite whether an existing destination may be replaced
   */
  public ExportConfig(Path trace, ExportFormat format, Optional<Path> out, boolean allowOverwrite) {
    this.trace = Objects.requireNonNull(trace, "trace");
    this.format = Objects.requireNonNull(format, "format");
    this.out = Objects.requireNonNullElse(out, Optional.empty());
    this.allowOverwrite = allowOverwrite;
  }

  /**
   * Builds an export configuration from merged key/value settings.
   *
   * @param args settings; {@code trace} is required
   * @return configuration
   * @throws IllegalArgumentException if {@code trace} is missing or {@code format} is unsupported
   */
  public static ExportConfig fromMap(Map<String, String> args) {
    Objects.requireNonNull(args, "args");
    String rawTrace = args.get("trace");
    if (rawTrace == null || rawTrace.isBlank()) {
      throw new IllegalArgumentException("trace is required (trace=PATH)");
    }
    Path trace = Paths.parse("trace", rawTrace);
    ExportFormat format = ExportFormat.fromString(args.getOrDefault("format", "json"));
    String rawOut = args.get("out");
    Optional<Path> out = rawOut == null || rawOut.isBlank()
        ? Optional.empty()
        : Optional.of(Paths.parse("out", rawOut));
    boolean allowOverwrite = Boolean.parseBoolean(args.getOrDefault("allowOverwrite", "false").trim());
    return new ExportConfig(trace, format, out, allowOverwrite);
  }

  public Path trace() {
    return trace;
  }

  public ExportFormat format() {
    return format;
  }

  public boolean allowOverwrite() {
    return allowOverwrite;
  }

  /**
   * Resolves the destination file.
   *
   * @return explicit {@code out}, or the trace path with its extension replaced by the format's
   */
  public Path outputPath() {
    if (out.isPresent()) {
      return out.get();
    }
    String fileName = trace.getFileName().toString();
    int dot = fileName.lastIndexOf('.');
    String stem = dot > 0 ? fileName.substring(0, dot) : fileName;
    return trace.resolveSibling(stem + "." + format.extension());
  }
}
