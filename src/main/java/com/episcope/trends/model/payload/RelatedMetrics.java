package com.episcope.trends.model.payload;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Top and rising related items (queries or topics). Field names carry the item label,
 * e.g. {@code top_queries} / {@code rising_queries}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RelatedMetrics implements MetricPayload {

    private String itemLabel;
    private List<Map<String, Object>> top = new ArrayList<>();
    private List<Map<String, Object>> rising = new ArrayList<>();
    private String error;

    public static RelatedMetrics empty(String itemLabel, String error) {
        return new RelatedMetrics(itemLabel, new ArrayList<>(), new ArrayList<>(), error);
    }

    public boolean isEmpty() {
        return top.isEmpty() && rising.isEmpty();
    }

    @JsonValue
    public Map<String, Object> toJson() {
        Map<String, Object> json = new LinkedHashMap<>();
        json.put("top_" + itemLabel, top);
        json.put("rising_" + itemLabel, rising);
        json.put("total_top", top.size());
        json.put("total_rising", rising.size());
        if (error != null) {
            json.put("error", error);
        }
        return json;
    }
}
