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
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Resolves a raw link table between two identifier systems into a
 * one-to-one mapping.
 *
 * <p>Steps:
 * <ol>
 *   <li>Keep links whose quality score is in the accepted set (0 is best)
 *       and whose identifiers are both present.</li>
 *   <li>Collapse repeated (source, target) pairs to their best score.</li>
 *   <li>Drop every source identifier that still maps to more than one
 *       distinct target.</li>
 * </ol>
 *
 * <p>Losing coverage on an ambiguous identifier is preferred to linking it
 * to the wrong entity. Excluded identifiers are logged and counted as
 * {@link DiagnosticSummary.Condition#AMBIGUOUS_LINK}.
 *
 * <h3>Usage Example</h3>
 * <pre>{@code
 * EntityLinker linker = EntityLinker.builder()
 *     .sourceColumn("ticker")
 *     .targetColumn("permno")
 *     .scoreColumn("score")
 *     .acceptedScores(0, 1, 2)
 *     .build();
 * LinkResult result = linker.link(iclink, context);
 * }</pre>
 */
public class EntityLinker {

  private static final Logger LOGGER = LoggerFactory.getLogger(EntityLinker.class);

  private final String sourceColumn;
  private final String targetColumn;
  private final String scoreColumn;
  private final Set<Integer> acceptedScores;
  private final String outputName;

  private EntityLinker(Builder builder) {
    this.sourceColumn = builder.sourceColumn;
    this.targetColumn = builder.targetColumn;
    this.scoreColumn = builder.scoreColumn;
    this.acceptedScores = Collections.unmodifiableSet(
        new LinkedHashSet<Integer>(builder.acceptedScores));
    this.outputName = builder.outputName;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Resolves the link table.
   *
   * @param links Raw links with source, target and score columns
   * @param context Run context for diagnostics
   * @return Mapping table (source, target, score) sorted by source, and the
   *     excluded ambiguous identifiers
   */
  public LinkResult link(Table links, StageContext context) {
    String stage = "link:" + outputName;
    links.requireColumns(stage, sourceColumn, targetColumn, scoreColumn);

    // source -> (target -> best score); raw values kept for output
    Map<Object, Map<Object, Integer>> candidates = new LinkedHashMap<Object, Map<Object, Integer>>();
    Map<Object, Object> rawSources = new LinkedHashMap<Object, Object>();
    Map<Object, Object> rawTargets = new LinkedHashMap<Object, Object>();
    int rejected = 0;

    for (Map<String, Object> row : links.getRows()) {
      Object source = Values.normalizeKey(row.get(sourceColumn));
      Object target = Values.normalizeKey(row.get(targetColumn));
      Integer score = acceptedScore(row.get(scoreColumn));
      if (source == null || target == null || score == null) {
        rejected++;
        continue;
      }
      rawSources.putIfAbsent(source, row.get(sourceColumn));
      rawTargets.putIfAbsent(target, row.get(targetColumn));
      Map<Object, Integer> targets =
          candidates.computeIfAbsent(source, k -> new LinkedHashMap<Object, Integer>());
      Integer best = targets.get(target);
      if (best == null || score < best) {
        targets.put(target, score);
      }
    }

    List<Object> sources = new ArrayList<Object>(candidates.keySet());
    sources.sort(Values::compare);

    Table.Builder mapping = Table.builder(outputName,
        Arrays.asList(sourceColumn, targetColumn, scoreColumn));
    List<Object> ambiguous = new ArrayList<Object>();
    for (Object source : sources) {
      Map<Object, Integer> targets = candidates.get(source);
      if (targets.size() > 1) {
        ambiguous.add(rawSources.get(source));
        LOGGER.debug("Excluding ambiguous {} '{}': maps to {} {}",
            sourceColumn, source, targetColumn, targets.keySet());
        continue;
      }
      Map.Entry<Object, Integer> only = targets.entrySet().iterator().next();
      mapping.row(rawSources.get(source), rawTargets.get(only.getKey()), only.getValue());
    }

    context.getDiagnostics().record(DiagnosticSummary.Condition.AMBIGUOUS_LINK, ambiguous.size());
    if (!ambiguous.isEmpty()) {
      LOGGER.warn("Excluded {} ambiguous {} value(s) mapping to several {} values: {}",
          ambiguous.size(), sourceColumn, targetColumn, truncateForLog(ambiguous));
    }
    Table result = mapping.build();
    LOGGER.info("Linked {} {} value(s) to {} from {} raw links ({} rejected by score "
        + "or missing id, {} ambiguous)", result.size(), sourceColumn, targetColumn,
        links.size(), rejected, ambiguous.size());
    return new LinkResult(result, ambiguous, rejected, sourceColumn, targetColumn);
  }

  /**
   * Returns the integral score if it is in the allow-list, else null.
   */
  private Integer acceptedScore(Object raw) {
    Double score = Values.toDouble(raw);
    if (score == null || score != Math.rint(score)) {
      return null;
    }
    int value = score.intValue();
    return acceptedScores.contains(value) ? value : null;
  }

  private static String truncateForLog(List<Object> values) {
    if (values.size() <= 5) {
      return values.toString();
    }
    return values.subList(0, 5) + "... (" + values.size() + " total)";
  }

  /**
   * Builder for EntityLinker.
   */
  public static class Builder {
    private String sourceColumn;
    private String targetColumn;
    private String scoreColumn = "score";
    private Set<Integer> acceptedScores = new LinkedHashSet<Integer>(Arrays.asList(0, 1, 2));
    private String outputName = "links";

    public Builder sourceColumn(String sourceColumn) {
      this.sourceColumn = sourceColumn;
      return this;
    }

    public Builder targetColumn(String targetColumn) {
      this.targetColumn = targetColumn;
      return this;
    }

    public Builder scoreColumn(String scoreColumn) {
      this.scoreColumn = scoreColumn;
      return this;
    }

    public Builder acceptedScores(Integer... scores) {
      return acceptedScores(Arrays.asList(scores));
    }

    public Builder acceptedScores(Iterable<Integer> scores) {
      Set<Integer> set = new LinkedHashSet<Integer>();
      for (Integer score : scores) {
        set.add(score);
      }
      this.acceptedScores = set;
      return this;
    }

    public Builder outputName(String outputName) {
      this.outputName = outputName;
      return this;
    }

    public EntityLinker build() {
      if (sourceColumn == null || targetColumn == null) {
        throw new IllegalArgumentException("Link source and target columns are required");
      }
      if (acceptedScores.isEmpty()) {
        throw new IllegalArgumentException("At least one accepted link score is required");
      }
      return new EntityLinker(this);
    }
  }
}
