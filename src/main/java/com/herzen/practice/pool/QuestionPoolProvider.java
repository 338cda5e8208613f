package com.herzen.practice.pool;

import com.herzen.practice.domain.DomainModels.Item;
import com.herzen.practice.domain.DomainModels.ItemFilter;

import java.util.List;

/**
 * Source of candidate items for a session. Ranking and truncation happen in the session store.
 */
public interface QuestionPoolProvider {

    List<Item> fetchItems(ItemFilter filter);

    /**
     * Receives an item whose running statistics changed. The default keeps the pool read-only.
     */
    default void recordItemStats(String courseId, Item item) {
    }
}
