package io.b2mash.b2b.reportscheduler.validation;

/** Whether an entity is being created or updated. Required fields are only enforced on create. */
public enum ValidateMode {
  ON_CREATE,
  ON_UPDATE
}
