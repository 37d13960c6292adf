package com.mk.fx.qa.httpload.report;

/** Receives one event per completed request, successful or not. Called from worker threads. */
@FunctionalInterface
public interface ProgressListener {

  ProgressListener NONE = () -> {};

  void advance();
}
