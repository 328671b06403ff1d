package br.com.ferroxide.chatstore.domain;

import org.springframework.data.domain.Sort;

public enum TimelineOrder {

    OLDEST_FIRST(Sort.Direction.ASC),
    NEWEST_FIRST(Sort.Direction.DESC);

    private final Sort.Direction direction;

    TimelineOrder(Sort.Direction direction) {
        this.direction = direction;
    }

    /** Sort by send time, then by id so messages sharing a timestamp keep insertion order. */
    public Sort toSort() {
        return Sort.by(direction, "sentAt").and(Sort.by(direction, "id"));
    }
}
