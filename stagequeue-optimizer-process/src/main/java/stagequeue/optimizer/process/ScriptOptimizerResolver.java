package stagequeue.optimizer.process;

import stagequeue.model.Stage;
import stagequeue.model.StageConfig;
import stagequeue.optimizer.Optimizer;
import stagequeue.optimizer.OptimizerResolver;

import java.nio.file.Path;
import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Resolves each stage to a {@link ProcessOptimizer} running the stage's configured script.
 *
 * <p>The per-factory {@link StageConfig#optimizerScript()} wins; otherwise the stage's
 * default script is used. A stage with neither releases in FIFO order. One optimizer
 * instance is kept per distinct script.
 */
public final class ScriptOptimizerResolver implements OptimizerResolver {
  private final List<String> command;
  private final Path workingDirectory;
  private final Duration processTimeout;
  private final JacksonOptimizerCodec codec;
  private final Map<Stage, String> defaultScripts;
  private final Map<String, Optimizer> optimizers = new ConcurrentHashMap<>();

  private ScriptOptimizerResolver(Builder builder) {
    this.command = builder.command;
    this.workingDirectory = builder.workingDirectory;
    this.processTimeout = builder.processTimeout;
    this.codec = builder.codec != null ? builder.codec : new JacksonOptimizerCodec();
    this.defaultScripts = new EnumMap<>(builder.defaultScripts);
  }

  /** Resolver with no default scripts: only stages with a configured script are optimized. */
  public ScriptOptimizerResolver() {
    this(builder());
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public Optimizer resolve(String factoryId, Stage stage, StageConfig config) {
    String script = config != null && config.optimizerScript() != null
        ? config.optimizerScript() : defaultScripts.get(stage);
    if (script == null || script.isBlank()) {
      return null;
    }
    return optimizers.computeIfAbsent(script.trim(), this::create);
  }

  private Optimizer create(String script) {
    return ProcessOptimizer.builder()
        .command(command)
        .script(script)
        .workingDirectory(workingDirectory)
        .timeout(processTimeout)
        .codec(codec)
        .build();
  }

  /** Builder for {@link ScriptOptimizerResolver}. */
  public static final class Builder {
    private List<String> command = List.of(ProcessOptimizer.DEFAULT_COMMAND);
    private Path workingDirectory;
    private Duration processTimeout = Duration.ofSeconds(30);
    private JacksonOptimizerCodec codec;
    private final Map<Stage, String> defaultScripts = new EnumMap<>(Stage.class);

    private Builder() {}

    public Builder command(List<String> command) {
      this.command = List.copyOf(command);
      return this;
    }

    public Builder workingDirectory(Path workingDirectory) {
      this.workingDirectory = workingDirectory;
      return this;
    }

    public Builder processTimeout(Duration processTimeout) {
      this.processTimeout = Objects.requireNonNull(processTimeout, "processTimeout");
      return this;
    }

    public Builder codec(JacksonOptimizerCodec codec) {
      this.codec = codec;
      return this;
    }

    /** Script used when a factory has not configured one for {@code stage}. */
    public Builder defaultScript(Stage stage, String script) {
      Objects.requireNonNull(stage, "stage");
      if (script == null || script.isBlank()) {
        defaultScripts.remove(stage);
      } else {
        defaultScripts.put(stage, script.trim());
      }
      return this;
    }

    public ScriptOptimizerResolver build() {
      return new ScriptOptimizerResolver(this);
    }
  }
}
