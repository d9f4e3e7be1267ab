package io.b2mash.taskflow.task;

/**
 * Restricts a task list by assignee: everyone, nobody, or one specific assignee.
 *
 * @param mode which kind of restriction applies
 * @param assigneeId the assignee to keep, only set for {@link Mode#ASSIGNEE}
 */
public record AssigneeFilter(Mode mode, String assigneeId) {

  public static final AssigneeFilter ALL = new AssigneeFilter(Mode.ALL, null);
  public static final AssigneeFilter UNASSIGNED = new AssigneeFilter(Mode.UNASSIGNED, null);

  public enum Mode {
    ALL,
    UNASSIGNED,
    ASSIGNEE
  }

  public AssigneeFilter {
    if (mode == Mode.ASSIGNEE && (assigneeId == null || assigneeId.isBlank())) {
      throw new IllegalArgumentException("An assignee filter needs an assignee id");
    }
  }

  /** Parses the select value of the assignment filter: {@code all}, {@code unassigned} or an id. */
  public static AssigneeFilter parse(String value) {
    if (value == null || value.isBlank() || "all".equals(value)) {
      return ALL;
    }
    if ("unassigned".equals(value)) {
      return UNASSIGNED;
    }
    return new AssigneeFilter(Mode.ASSIGNEE, value);
  }

  public boolean matches(Task task) {
    return switch (mode) {
      case ALL -> true;
      case UNASSIGNED -> !task.isAssigned();
      case ASSIGNEE -> assigneeId.equals(task.assignedToId());
    };
  }
}
