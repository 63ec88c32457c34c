package stagequeue.model;

/**
 * Distinguishes a raw optimizer run from the post-release summary record.
 */
public enum LogMode {
  OPTIMIZER_RUN,
  SUMMARY
}
