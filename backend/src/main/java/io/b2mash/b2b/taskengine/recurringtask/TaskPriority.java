package io.b2mash.b2b.taskengine.recurringtask;

public enum TaskPriority {
  LOW,
  MEDIUM,
  HIGH,
  URGENT
}
