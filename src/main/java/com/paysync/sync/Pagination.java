package com.paysync.sync;

public record Pagination(boolean yearPartitioned, int firstPageIndex) {
  public static Pagination flat(int firstPageIndex) {
    return new Pagination(false, firstPageIndex);
  }

  public static Pagination yearly(int firstPageIndex) {
    return new Pagination(true, firstPageIndex);
  }
}
