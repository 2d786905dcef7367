package io.dealmotion.autopilot.priority;

/**
 * Time-to-event bucket for time-sensitive proposals. The label is part of the dedupe key, so a
 * proposal raised in one bucket does not suppress a more urgent one raised later.
 */
public enum UrgencyWindow {
  DAY("24h", 0),
  HOURS("4h", 5),
  IMMINENT("1h", 15);

  private final String label;
  private final int boost;

  UrgencyWindow(String label, int boost) {
    this.label = label;
    this.boost = boost;
  }

  public String label() {
    return label;
  }

  int boost() {
    return boost;
  }

  /** At least 12 hours away is DAY, at least 2 hours is HOURS, anything closer is IMMINENT. */
  public static UrgencyWindow forHoursUntil(double hoursUntil) {
    if (hoursUntil >= 12) {
      return DAY;
    }
    if (hoursUntil >= 2) {
      return HOURS;
    }
    return IMMINENT;
  }
}
