package com.takeaway.storefront.session;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Menu item id to requested quantity. Every stored quantity is at least 1; a mutation that
 * would leave an entry at zero or below removes it instead.
 */
public class SessionCart {

    public static final String ACTION_INC = "inc";
    public static final String ACTION_DEC = "dec";

    private final Map<Long, Integer> quantities = new LinkedHashMap<>();

    public synchronized int add(Long itemId) {
        int qty = quantities.getOrDefault(itemId, 0) + 1;
        quantities.put(itemId, qty);
        return qty;
    }

    /**
     * Applies {@code inc} or {@code dec}; any other action leaves the quantity as it was.
     *
     * @return the resulting quantity, 0 when the entry is absent afterwards
     */
    public synchronized int update(Long itemId, String action) {
        int qty = quantities.getOrDefault(itemId, 0);
        if (ACTION_INC.equals(action)) {
            qty += 1;
        } else if (ACTION_DEC.equals(action)) {
            qty -= 1;
        }

        if (qty <= 0) {
            quantities.remove(itemId);
            return 0;
        }
        quantities.put(itemId, qty);
        return qty;
    }

    public synchronized void remove(Long itemId) {
        quantities.remove(itemId);
    }

    public synchronized void clear() {
        quantities.clear();
    }

    public synchronized boolean isEmpty() {
        return quantities.isEmpty();
    }

    public synchronized int quantityOf(Long itemId) {
        return quantities.getOrDefault(itemId, 0);
    }

    /** Insertion-ordered copy, safe to iterate while other requests mutate the cart. */
    public synchronized Map<Long, Integer> snapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(quantities));
    }
}
