package com.scholary.synthjobs.job;

/**
 * Validates job state transitions.
 *
 * <p>Terminal states never transition again, and no state moves backwards.
 */
public final class JobStateTransition {

  private JobStateTransition() {
    throw new UnsupportedOperationException("Utility class cannot be instantiated");
  }

  /**
   * @throws IllegalArgumentException if either state is null
   * @throws IllegalStateException if the transition is not allowed
   */
  public static void validate(JobState from, JobState to) {
    if (from == null || to == null) {
      throw new IllegalArgumentException(
          "States cannot be null (from: " + from + ", to: " + to + ")");
    }

    if (from.isTerminal()) {
      throw new IllegalStateException(
          String.format("Cannot transition from terminal state: %s -> %s", from, to));
    }

    boolean valid =
        switch (from) {
          case QUEUED -> to == JobState.SUBMITTING
              || to == JobState.FAILED
              || to == JobState.TIMED_OUT
              || to == JobState.CANCELLED;
          case SUBMITTING -> to == JobState.POLLING || to.isTerminal();
          case POLLING -> to.isTerminal();
          case SUCCEEDED, FAILED, TIMED_OUT, CANCELLED -> false;
        };

    if (!valid) {
      throw new IllegalStateException(
          String.format("Invalid state transition: %s -> %s", from, to));
    }
  }

  public static boolean isAllowed(JobState from, JobState to) {
    try {
      validate(from, to);
      return true;
    } catch (IllegalStateException e) {
      return false;
    }
  }
}
