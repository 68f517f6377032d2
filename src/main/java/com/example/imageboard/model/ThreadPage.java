package com.example.imageboard.model;

import java.util.List;

/**
 * 版块列表的一页
 * page 从 1 开始；超出范围的页码返回空列表而不是报错。
 */
public class ThreadPage {

    private final List<ThreadSummary> items;
    private final int page;
    private final boolean hasMore;

    public ThreadPage(List<ThreadSummary> items, int page, boolean hasMore) {
        this.items = items;
        this.page = page;
        this.hasMore = hasMore;
    }

    public List<ThreadSummary> getItems() { return items; }
    public int getPage() { return page; }
    public boolean isHasMore() { return hasMore; }
    public boolean isHasPrevious() { return page > 1; }
}
