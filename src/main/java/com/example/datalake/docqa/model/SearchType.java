package com.example.datalake.docqa.model;

/** Which lookup(s) produced a ranked passage. */
public enum SearchType {
  SEMANTIC("semantic"),
  KEYWORD("keyword"),
  HYBRID("hybrid");

  private final String code;

  SearchType(String code) {
    this.code = code;
  }

  public String code() {
    return code;
  }
}
