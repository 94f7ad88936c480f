package com.onthegomap.tiledmap.util;

@FunctionalInterface
public interface FunctionThatThrows<I, O> {

  @SuppressWarnings("java:S112")
  O apply(I value) throws Exception;
}
