package com.vidnyan.sysml.domain.model;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Hands out process-unique element identifiers.
 */
public class ElementIdProvider {

    private final AtomicInteger next = new AtomicInteger(1);

    public int next() {
        return next.getAndIncrement();
    }
}
