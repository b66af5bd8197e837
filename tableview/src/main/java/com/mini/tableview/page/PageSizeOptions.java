package com.mini.tableview.page;

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Locale;
import java.util.TreeSet;

/**
 * 可选页大小
 * 预设值供菜单展示，另外允许任意 >= 1 的自定义值
 */
public final class PageSizeOptions {
    public static final PageSizeOptions DEFAULT = new PageSizeOptions(ImmutableList.of(10, 25, 50, 100));

    private final ImmutableList<Integer> presets;

    public PageSizeOptions(List<Integer> presets) {
        TreeSet<Integer> sorted = new TreeSet<>();
        for (Integer size : presets) {
            if (size == null || size < 1) {
                throw new IllegalArgumentException("Page size option must be >= 1: " + size);
            }
            sorted.add(size);
        }
        this.presets = ImmutableList.copyOf(sorted);
    }

    public List<Integer> getPresets() {
        return presets;
    }

    public boolean isPreset(int pageSize) {
        return presets.contains(pageSize);
    }

    /**
     * 校验页大小（预设或自定义）并返回
     */
    public int select(int pageSize) {
        PagePlanner.validatePageSize(pageSize);
        return pageSize;
    }

    /**
     * 菜单文本，例如 "1,000 items per page"
     */
    public static String label(int pageSize) {
        return String.format(Locale.ROOT, "%,d items per page", pageSize);
    }

    @Override
    public String toString() {
        return "PageSizeOptions" + presets + " + custom >= 1";
    }
}
