package com.cario.exam.app.exception;

/** A requested document, job or region does not exist. */
public class ResourceNotFoundException extends RuntimeException {

  public ResourceNotFoundException(String kind, String id) {
    super(kind + " not found: " + id);
  }
}
