package io.b2mash.memberhours.exception;

/** Another work-hour entry already exists for the same member and calendar day. */
public class DuplicateEntryForDateException extends ApiException {

  public DuplicateEntryForDateException(String detail) {
    super(ErrorKind.DUPLICATE_ENTRY_FOR_DATE, "Duplicate entry", detail);
  }
}
