package io.b2mash.memberhours.exception;

public class DataUnavailableException extends ApiException {

  public DataUnavailableException(String detail) {
    super(ErrorKind.DATA_UNAVAILABLE, "Data unavailable", detail);
  }
}
