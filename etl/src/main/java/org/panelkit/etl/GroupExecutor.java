/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to you under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.panelkit.etl;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Runs a per-group computation over independent groups of rows.
 *
 * <p>Rows are partitioned by a group key, each group is handed to the
 * function (on a fixed-size worker pool when parallelism is above one), and
 * the group results are concatenated in ascending key order. Because the
 * output order depends only on the keys, the result is the same whatever
 * order the workers finish in.
 *
 * <h3>Usage Example</h3>
 * <pre>{@code
 * try (GroupExecutor executor = new GroupExecutor(4)) {
 *   List<Map<String, Object>> out = executor.apply(rows, Arrays.asList("gvkey"),
 *       (key, group) -> group.subList(group.size() - 1, group.size()));
 * }
 * }</pre>
 */
public class GroupExecutor implements AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(GroupExecutor.class);

  private final int parallelism;
  private final ExecutorService executor;

  /**
   * Per-group computation. Receives the normalized key and the group's rows
   * in input order; returns the rows to emit for the group.
   */
  @FunctionalInterface
  public interface GroupFunction {
    List<Map<String, Object>> apply(List<Object> key, List<Map<String, Object>> rows);
  }

  /**
   * Creates an executor.
   *
   * @param parallelism Number of worker threads; 1 or less runs groups inline
   */
  public GroupExecutor(int parallelism) {
    this.parallelism = Math.max(1, parallelism);
    this.executor = this.parallelism > 1
        ? Executors.newFixedThreadPool(this.parallelism)
        : null;
  }

  public static GroupExecutor sequential() {
    return new GroupExecutor(1);
  }

  public int getParallelism() {
    return parallelism;
  }

  /**
   * Partitions rows by key, preserving input order within each group.
   */
  public static Map<List<Object>, List<Map<String, Object>>> partition(
      List<Map<String, Object>> rows, List<String> keyColumns) {
    Map<List<Object>, List<Map<String, Object>>> groups =
        new LinkedHashMap<List<Object>, List<Map<String, Object>>>();
    for (Map<String, Object> row : rows) {
      List<Object> key = Values.keyOf(row, keyColumns);
      groups.computeIfAbsent(key, k -> new ArrayList<Map<String, Object>>()).add(row);
    }
    return groups;
  }

  /**
   * Applies the function to every group and concatenates results by ascending key.
   */
  public List<Map<String, Object>> apply(List<Map<String, Object>> rows,
      List<String> keyColumns, final GroupFunction function) {
    final Map<List<Object>, List<Map<String, Object>>> groups = partition(rows, keyColumns);
    List<List<Object>> keys = new ArrayList<List<Object>>(groups.keySet());
    keys.sort(Values.KEY_ORDER);
    LOGGER.debug("Processing {} rows in {} groups by {} (parallelism {})",
        rows.size(), keys.size(), keyColumns, parallelism);

    List<Map<String, Object>> out = new ArrayList<Map<String, Object>>(rows.size());
    if (executor == null) {
      for (List<Object> key : keys) {
        out.addAll(function.apply(key, groups.get(key)));
      }
      return out;
    }

    List<Future<List<Map<String, Object>>>> futures =
        new ArrayList<Future<List<Map<String, Object>>>>(keys.size());
    for (final List<Object> key : keys) {
      futures.add(executor.submit(new Callable<List<Map<String, Object>>>() {
        @Override public List<Map<String, Object>> call() {
          return function.apply(key, groups.get(key));
        }
      }));
    }
    for (Future<List<Map<String, Object>>> future : futures) {
      try {
        out.addAll(future.get());
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new IllegalStateException("Interrupted while processing groups", e);
      } catch (ExecutionException e) {
        Throwable cause = e.getCause();
        if (cause instanceof RuntimeException) {
          throw (RuntimeException) cause;
        }
        if (cause instanceof Error) {
          throw (Error) cause;
        }
        throw new IllegalStateException("Group computation failed", cause);
      }
    }
    return out;
  }

  @Override public void close() {
    if (executor != null) {
      executor.shutdown();
    }
  }
}
