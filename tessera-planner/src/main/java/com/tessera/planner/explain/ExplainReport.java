/*
 * Copyright (c) 2023-2025 Burak Sezer
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.tessera.planner.explain;

import com.tessera.common.json.JSONUtil;
import com.tessera.planner.physical.PlanWarning;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Human and machine readable description of a physical plan.
 */
public record ExplainReport(String queryId, List<NodeReport> nodes, double totalCost, boolean costed,
                            List<PlanWarning> warnings, List<Recommendation> recommendations) {
    static final int PLANNER_VERSION = 1;

    public ExplainReport {
        nodes = List.copyOf(nodes);
        warnings = List.copyOf(warnings);
        recommendations = List.copyOf(recommendations);
    }

    /**
     * Renders the plan as an indented tree, one node per line, followed by warnings and recommendations.
     */
    public String toText() {
        StringBuilder builder = new StringBuilder();
        builder.append("Query ").append(queryId)
                .append(" (total cost ").append(format(totalCost))
                .append(costed ? "" : ", not costed").append(")\n");
        for (NodeReport node : nodes) {
            builder.append("  ".repeat(node.depth() + 1))
                    .append("#").append(node.id()).append(' ')
                    .append(node.operator());
            if (!node.detail().isEmpty()) {
                builder.append(' ').append(node.detail());
            }
            builder.append("  rows=").append(format(node.estimatedRows()))
                    .append(" cost=").append(format(node.estimatedCost()));
            if (node.actualRows() != null) {
                builder.append(" actual=").append(node.actualRows());
            }
            builder.append('\n');
        }
        for (PlanWarning warning : warnings) {
            builder.append("Warning: ").append(warning).append('\n');
        }
        for (Recommendation recommendation : recommendations) {
            builder.append("Recommendation: ").append(recommendation.message()).append('\n');
        }
        return builder.toString();
    }

    public Map<String, Object> toMap() {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("planner_version", PLANNER_VERSION);
        result.put("query_id", queryId);
        result.put("total_cost", totalCost);
        result.put("costed", costed);

        List<Map<String, Object>> nodeList = new ArrayList<>(nodes.size());
        for (NodeReport node : nodes) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("id", node.id());
            entry.put("logical_id", node.logicalId());
            entry.put("depth", node.depth());
            entry.put("operator", node.operator());
            entry.put("detail", node.detail());
            entry.put("estimated_rows", node.estimatedRows());
            entry.put("estimated_cost", node.estimatedCost());
            if (node.actualRows() != null) {
                entry.put("actual_rows", node.actualRows());
                entry.put("misestimate_ratio", node.ratio());
            }
            nodeList.add(entry);
        }
        result.put("nodes", nodeList);

        List<Map<String, Object>> warningList = new ArrayList<>(warnings.size());
        for (PlanWarning warning : warnings) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("code", warning.code());
            entry.put("subject", warning.subject());
            entry.put("message", warning.message());
            warningList.add(entry);
        }
        result.put("warnings", warningList);

        List<Map<String, Object>> recommendationList = new ArrayList<>(recommendations.size());
        for (Recommendation recommendation : recommendations) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("kind", recommendation.kind().name());
            entry.put("node_id", recommendation.nodeId());
            entry.put("subject", recommendation.subject());
            entry.put("message", recommendation.message());
            recommendationList.add(entry);
        }
        result.put("recommendations", recommendationList);
        return result;
    }

    public String toJson() {
        return JSONUtil.writeValueAsString(toMap());
    }

    public String toPrettyJson() {
        return JSONUtil.writeValueAsPrettyString(toMap());
    }

    private static String format(double value) {
        return String.format(Locale.ROOT, "%.1f", value);
    }
}
