package stagequeue.model;

/**
 * The three sequential scheduling stages a work item passes through.
 */
public enum Stage {
  PRE_ACCEPTANCE("PAP"),
  PRE_INSPECTION("PIP"),
  POST_INSPECTION("PIPO");

  private final String code;

  Stage(String code) {
    this.code = code;
  }

  /** Short code used in logs, metric tags and the persisted {@code stage} column. */
  public String code() {
    return code;
  }

  public static Stage fromCode(String code) {
    for (Stage stage : values()) {
      if (stage.code.equalsIgnoreCase(code) || stage.name().equalsIgnoreCase(code)) {
        return stage;
      }
    }
    throw new IllegalArgumentException("Unknown stage: " + code);
  }
}
