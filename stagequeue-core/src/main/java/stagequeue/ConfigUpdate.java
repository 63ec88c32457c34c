package stagequeue;

import stagequeue.model.Stage;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Partial update of a factory's stage configs. Stages not mentioned keep their settings.
 *
 * <pre>{@code
 * ConfigUpdate update = ConfigUpdate.builder()
 *     .releaseAfterMinutes(Stage.PRE_ACCEPTANCE, 30)
 *     .optimizerScript(Stage.PRE_ACCEPTANCE, "scripts/pap.py")
 *     .build();
 * }</pre>
 */
public final class ConfigUpdate {
  private final Map<Stage, Integer> releaseAfterMinutes;
  private final Map<Stage, String> optimizerScripts;

  private ConfigUpdate(Builder builder) {
    this.releaseAfterMinutes = Collections.unmodifiableMap(new EnumMap<>(builder.releaseAfterMinutes));
    this.optimizerScripts = Collections.unmodifiableMap(new EnumMap<>(builder.optimizerScripts));
  }

  public static Builder builder() {
    return new Builder();
  }

  public Map<Stage, Integer> releaseAfterMinutes() {
    return releaseAfterMinutes;
  }

  /** Script paths by stage; an empty string means "remove the script". */
  public Map<Stage, String> optimizerScripts() {
    return optimizerScripts;
  }

  public boolean touches(Stage stage) {
    return releaseAfterMinutes.containsKey(stage) || optimizerScripts.containsKey(stage);
  }

  public static final class Builder {
    private final Map<Stage, Integer> releaseAfterMinutes = new EnumMap<>(Stage.class);
    private final Map<Stage, String> optimizerScripts = new EnumMap<>(Stage.class);

    private Builder() {
    }

    public Builder releaseAfterMinutes(Stage stage, int minutes) {
      releaseAfterMinutes.put(Objects.requireNonNull(stage, "stage"), minutes);
      return this;
    }

    public Builder optimizerScript(Stage stage, String script) {
      optimizerScripts.put(Objects.requireNonNull(stage, "stage"), script == null ? "" : script);
      return this;
    }

    public ConfigUpdate build() {
      return new ConfigUpdate(this);
    }
  }
}
