package com.mini.tableview.format;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 表头列名规范化
 * 空列名命名为 "Unnamed: i"，重复列名追加 ".1"、".2" 后缀
 */
public final class HeaderNames {

    private HeaderNames() {
    }

    public static List<String> normalize(List<String> raw) {
        List<String> names = new ArrayList<>(raw.size());
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < raw.size(); i++) {
            String name = raw.get(i) == null ? "" : raw.get(i).trim();
            if (name.isEmpty()) {
                name = "Unnamed: " + i;
            }
            String candidate = name;
            int suffix = 1;
            while (!seen.add(candidate)) {
                candidate = name + "." + suffix++;
            }
            names.add(candidate);
        }
        return names;
    }
}
