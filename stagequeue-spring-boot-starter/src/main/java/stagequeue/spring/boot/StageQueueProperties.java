package stagequeue.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;
import stagequeue.jdbc.TableNames;
import stagequeue.optimizer.OptimizerBridge;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for the stage scheduler.
 *
 * @see StageQueueAutoConfiguration
 */
@ConfigurationProperties(prefix = "stagequeue")
public class StageQueueProperties {

  /**
   * Prefix of every table the JDBC stores use.
   */
  private String tablePrefix = TableNames.DEFAULT_PREFIX;

  private final Optimizer optimizer = new Optimizer();
  private final Metrics metrics = new Metrics();

  public String getTablePrefix() {
    return tablePrefix;
  }

  public void setTablePrefix(String tablePrefix) {
    this.tablePrefix = tablePrefix;
  }

  public Optimizer getOptimizer() {
    return optimizer;
  }

  public Metrics getMetrics() {
    return metrics;
  }

  public static class Optimizer {
    /**
     * Whether stages run their optimizer script. When false every release is FIFO.
     */
    private boolean enabled = true;

    /**
     * Upper bound for one optimizer call before falling back to FIFO.
     */
    private Duration timeout = OptimizerBridge.DEFAULT_TIMEOUT;

    /**
     * Hard limit after which a script process is killed. Defaults to {@code timeout}.
     */
    private Duration processTimeout;

    /**
     * Interpreter and leading arguments; the script path is appended.
     */
    private List<String> command = new ArrayList<>(List.of("python3"));

    /**
     * Directory relative script paths resolve against.
     */
    private String workingDirectory;

    /**
     * Default script per stage code (pap, pip, pipo), used when a factory has not
     * configured its own.
     */
    private Map<String, String> scripts = new LinkedHashMap<>();

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public Duration getTimeout() {
      return timeout;
    }

    public void setTimeout(Duration timeout) {
      this.timeout = timeout;
    }

    public Duration getProcessTimeout() {
      return processTimeout;
    }

    public void setProcessTimeout(Duration processTimeout) {
      this.processTimeout = processTimeout;
    }

    public List<String> getCommand() {
      return command;
    }

    public void setCommand(List<String> command) {
      this.command = command;
    }

    public String getWorkingDirectory() {
      return workingDirectory;
    }

    public void setWorkingDirectory(String workingDirectory) {
      this.workingDirectory = workingDirectory;
    }

    public Map<String, String> getScripts() {
      return scripts;
    }

    public void setScripts(Map<String, String> scripts) {
      this.scripts = scripts;
    }
  }

  public static class Metrics {
    private boolean enabled = true;
    private String namePrefix = "stagequeue";

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public String getNamePrefix() {
      return namePrefix;
    }

    public void setNamePrefix(String namePrefix) {
      this.namePrefix = namePrefix;
    }
  }
}
