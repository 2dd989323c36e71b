package com.iimsoft.vrpvalidator.validation.rule;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 一次线性扫描统计 id 出现的位置，保留首次出现的顺序。null id 不参与统计。
 */
final class IdOccurrences {

    private IdOccurrences() {
    }

    /**
     * @return id → positions in the given list, only for ids occurring more than once
     */
    static Map<String, List<Integer>> duplicates(List<String> ids) {
        Map<String, List<Integer>> positions = new LinkedHashMap<>();
        for (int i = 0; i < ids.size(); i++) {
            String id = ids.get(i);
            if (id == null) {
                continue;
            }
            positions.computeIfAbsent(id, k -> new ArrayList<>()).add(i);
        }
        positions.values().removeIf(p -> p.size() < 2);
        return positions;
    }
}
