package com.mos.notification.service;

/** MDC keys shared by the scheduled workers. */
final class WorkerMdc {

  static final String JOB_KEY = "job";

  private WorkerMdc() {}
}
