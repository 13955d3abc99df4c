package com.paysync.provider;

/** Detail payload layouts a provider may return. */
public enum PayloadShape {
  SIMPLE,
  MULTI_SUBORDER,
  UNRECOGNIZED
}
