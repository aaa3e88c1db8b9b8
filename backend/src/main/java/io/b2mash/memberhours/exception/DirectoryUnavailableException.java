package io.b2mash.memberhours.exception;

/** The external member directory could not be reached or answered with a server error. */
public class DirectoryUnavailableException extends ApiException {

  public DirectoryUnavailableException(String detail) {
    super(ErrorKind.DIRECTORY_UNAVAILABLE, "Member directory unavailable", detail);
  }
}
