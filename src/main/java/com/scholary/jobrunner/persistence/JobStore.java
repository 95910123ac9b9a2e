package com.scholary.jobrunner.persistence;

import com.scholary.jobrunner.job.Job;
import java.util.List;
import java.util.function.Supplier;

/**
 * Best-effort durable side-channel for the job registry.
 *
 * <p>Implementations must never throw from any method: a storage fault is logged and swallowed so
 * that an in-memory job operation that already succeeded is never aborted by it. Losing a snapshot
 * only costs history after a restart.
 */
public interface JobStore {

  /**
   * Load the last persisted snapshot.
   *
   * @return jobs in their original insertion order, or an empty list if nothing usable is stored
   */
  List<Job> load();

  /**
   * Request that a full snapshot of the registry be persisted. May return before the write
   * reaches disk; the snapshot is taken when the write actually happens, so a write always
   * reflects every mutation that preceded the request.
   *
   * @param snapshot supplies every tracked job, in insertion order
   */
  void persist(Supplier<List<Job>> snapshot);

  /** Block until previously requested writes have been attempted. */
  default void flush() {}

  /** Release background resources. Pending writes are attempted first. */
  default void close() {}
}
