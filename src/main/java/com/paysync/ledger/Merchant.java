package com.paysync.ledger;

public record Merchant(String name, String tel, String url, String imageUrl) {
  public static Merchant named(String name) {
    return new Merchant(name, null, null, null);
  }
}
