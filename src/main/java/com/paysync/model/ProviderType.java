package com.paysync.model;

public enum ProviderType {
  COUPANG,
  NAVER
}
