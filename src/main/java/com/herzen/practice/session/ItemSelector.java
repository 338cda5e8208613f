package com.herzen.practice.session;

import com.herzen.practice.domain.DomainModels.FocusStrategy;
import com.herzen.practice.domain.DomainModels.Item;
import com.herzen.practice.domain.DomainModels.ItemFilter;
import com.herzen.practice.domain.DomainModels.SessionConfig;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Random;

/**
 * Filters candidates and ranks them by the configured focus strategy.
 */
public final class ItemSelector {

    private ItemSelector() {}

    public static boolean matches(ItemFilter filter, Item item) {
        boolean weekOk = filter.allWeeks() || filter.weeks().stream()
                .anyMatch(w -> item.week().toLowerCase(Locale.ROOT).contains(w.toLowerCase(Locale.ROOT)));
        return weekOk && filter.difficulty().accepts(item.difficulty());
    }

    public static List<Item> select(List<Item> candidates, ItemFilter filter, SessionConfig config, Random random) {
        List<Item> filtered = new ArrayList<>(candidates.stream().filter(i -> matches(filter, i)).toList());
        rank(filtered, config.focus(), random);
        return List.copyOf(filtered.subList(0, Math.min(config.numQuestions(), filtered.size())));
    }

    static void rank(List<Item> items, FocusStrategy focus, Random random) {
        switch (focus) {
            case WEAK_AREAS -> items.sort(Comparator.comparingDouble(Item::averageScore));
            case RECENT_CONTENT -> items.sort(Comparator.comparing(Item::week).reversed());
            case TAILORED_FOR_ME -> items.sort(Comparator.comparingDouble(ItemSelector::tailoredScore).reversed());
            default -> Collections.shuffle(items, random);
        }
    }

    static double tailoredScore(Item item) {
        return item.difficulty().weight() + (1 - item.averageScore()) * 2;
    }
}
