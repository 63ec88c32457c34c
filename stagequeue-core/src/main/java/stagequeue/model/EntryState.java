package stagequeue.model;

public enum EntryState {
  PENDING,
  ON_HOLD,
  HOLD_EXPIRED,
  RELEASED
}
