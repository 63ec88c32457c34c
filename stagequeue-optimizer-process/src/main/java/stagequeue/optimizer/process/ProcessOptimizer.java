package stagequeue.optimizer.process;

import stagequeue.optimizer.Optimizer;
import stagequeue.optimizer.OptimizerException;
import stagequeue.optimizer.OptimizerRequest;
import stagequeue.optimizer.OptimizerResult;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link Optimizer} that runs an external script per call.
 *
 * <p>The request is written to the script's stdin as JSON; the script must print one JSON
 * result object to stdout and exit with status 0. A non-zero exit, a process that outlives
 * {@code timeout}, or unparseable output fails the call. Stdin, stdout and stderr go
 * through temp files so a chatty script cannot block on a full pipe.
 *
 * <pre>{@code
 * Optimizer pip = ProcessOptimizer.builder()
 *     .script("python/terminierung/pip.py")
 *     .workingDirectory(Path.of("/opt/scheduling"))
 *     .build();
 * }</pre>
 */
public final class ProcessOptimizer implements Optimizer {
  private static final Logger logger = Logger.getLogger(ProcessOptimizer.class.getName());

  public static final String DEFAULT_COMMAND = "python3";
  private static final int MAX_STDERR_CHARS = 2000;

  private final List<String> command;
  private final String name;
  private final Path workingDirectory;
  private final Duration timeout;
  private final JacksonOptimizerCodec codec;

  private ProcessOptimizer(Builder builder) {
    List<String> cmd = new ArrayList<>(builder.command);
    if (builder.script != null) {
      cmd.add(builder.script);
    }
    if (cmd.isEmpty()) {
      throw new IllegalArgumentException("command or script is required");
    }
    this.command = List.copyOf(cmd);
    this.name = builder.name != null ? builder.name
        : builder.script != null ? builder.script : String.join(" ", cmd);
    this.workingDirectory = builder.workingDirectory;
    this.timeout = Objects.requireNonNull(builder.timeout, "timeout");
    if (timeout.isZero() || timeout.isNegative()) {
      throw new IllegalArgumentException("timeout must be positive");
    }
    this.codec = builder.codec != null ? builder.codec : new JacksonOptimizerCodec();
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public String name() {
    return name;
  }

  List<String> command() {
    return command;
  }

  @Override
  public OptimizerResult optimize(OptimizerRequest request) throws IOException, InterruptedException {
    Path stdin = Files.createTempFile("stagequeue-opt-", ".in.json");
    Path stdout = Files.createTempFile("stagequeue-opt-", ".out.json");
    Path stderr = Files.createTempFile("stagequeue-opt-", ".err");
    try {
      Files.write(stdin, codec.encode(request));
      ProcessBuilder pb = new ProcessBuilder(command)
          .redirectInput(stdin.toFile())
          .redirectOutput(stdout.toFile())
          .redirectError(stderr.toFile());
      if (workingDirectory != null) {
        pb.directory(workingDirectory.toFile());
      }
      Process process = pb.start();
      int exitCode;
      try {
        if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
          throw new OptimizerException("Optimizer " + name + " did not finish within " + timeout);
        }
        exitCode = process.exitValue();
      } finally {
        if (process.isAlive()) {
          process.destroyForcibly();
        }
      }
      if (exitCode != 0) {
        throw new OptimizerException("Optimizer " + name + " exited with code " + exitCode + ": "
            + tail(Files.readString(stderr, StandardCharsets.UTF_8)));
      }
      if (logger.isLoggable(Level.FINE) && Files.size(stderr) > 0) {
        logger.fine("Optimizer " + name + " stderr: " + tail(Files.readString(stderr, StandardCharsets.UTF_8)));
      }
      return codec.decode(Files.readAllBytes(stdout));
    } finally {
      deleteQuietly(stdin);
      deleteQuietly(stdout);
      deleteQuietly(stderr);
    }
  }

  private static String tail(String text) {
    String trimmed = text.strip();
    return trimmed.length() <= MAX_STDERR_CHARS ? trimmed
        : "..." + trimmed.substring(trimmed.length() - MAX_STDERR_CHARS);
  }

  private static void deleteQuietly(Path file) {
    try {
      Files.deleteIfExists(file);
    } catch (IOException e) {
      logger.log(Level.FINE, "Could not delete temp file " + file, e);
    }
  }

  /** Builder for {@link ProcessOptimizer}. */
  public static final class Builder {
    private List<String> command = List.of(DEFAULT_COMMAND);
    private String script;
    private String name;
    private Path workingDirectory;
    private Duration timeout = Duration.ofSeconds(30);
    private JacksonOptimizerCodec codec;

    private Builder() {}

    /**
     * Interpreter and leading arguments. Default: {@code python3}.
     */
    public Builder command(List<String> command) {
      this.command = List.copyOf(command);
      return this;
    }

    /** Script path appended to the command; also the default {@link #name(String)}. */
    public Builder script(String script) {
      this.script = script;
      return this;
    }

    public Builder name(String name) {
      this.name = name;
      return this;
    }

    /** Directory relative script paths resolve against. Default: the JVM's working directory. */
    public Builder workingDirectory(Path workingDirectory) {
      this.workingDirectory = workingDirectory;
      return this;
    }

    /**
     * Hard limit after which the process is killed. The scheduler's own optimizer timeout
     * applies on top. Default: 30 seconds.
     */
    public Builder timeout(Duration timeout) {
      this.timeout = timeout;
      return this;
    }

    public Builder codec(JacksonOptimizerCodec codec) {
      this.codec = codec;
      return this;
    }

    public ProcessOptimizer build() {
      return new ProcessOptimizer(this);
    }
  }
}
