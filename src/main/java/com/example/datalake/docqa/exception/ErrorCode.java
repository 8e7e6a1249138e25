package com.example.datalake.docqa.exception;

import org.springframework.http.HttpStatus;

public enum ErrorCode {
  VALIDATION_ERROR("E400", HttpStatus.BAD_REQUEST),
  NOT_FOUND("E404", HttpStatus.NOT_FOUND),
  CONFLICT("E409", HttpStatus.CONFLICT),
  UNSUPPORTED_MEDIA_TYPE("E415", HttpStatus.UNSUPPORTED_MEDIA_TYPE),
  UPSTREAM_UNAVAILABLE("E503", HttpStatus.SERVICE_UNAVAILABLE),
  INTERNAL_ERROR("E500", HttpStatus.INTERNAL_SERVER_ERROR);

  private final String code;
  private final HttpStatus status;

  ErrorCode(String code, HttpStatus status) {
    this.code = code;
    this.status = status;
  }

  public String getCode() { return code; }
  public HttpStatus getStatus() { return status; }
}
