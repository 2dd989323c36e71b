package com.iimsoft.vrpvalidator.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 领域对象里 list 的统一拷贝方式：null 视为空列表，元素允许为 null（由校验规则去发现问题）。
 */
final class DomainLists {

    private DomainLists() {
    }

    static <T> List<T> copyOf(List<T> source) {
        if (source == null || source.isEmpty()) {
            return Collections.emptyList();
        }
        return Collections.unmodifiableList(new ArrayList<>(source));
    }
}
