package io.b2mash.memberhours.exception;

public class CandidateNotInSetException extends ApiException {

  public CandidateNotInSetException(String detail) {
    super(ErrorKind.CANDIDATE_NOT_IN_SET, "Member not selectable", detail);
  }
}
