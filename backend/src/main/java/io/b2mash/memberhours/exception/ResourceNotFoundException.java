package io.b2mash.memberhours.exception;

public class ResourceNotFoundException extends ApiException {

  public ResourceNotFoundException(String resourceType, Object id) {
    super(
        ErrorKind.NOT_FOUND,
        resourceType + " not found",
        "No " + resourceType.toLowerCase() + " found with id " + id);
  }
}
