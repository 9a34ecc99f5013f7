package com.pointer.store;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HashLocksTest {

    @Test
    void shouldHoldStripeOnlyInsideAction() {
        HashLocks locks = new HashLocks(4);

        boolean held = locks.withLock("abc", () -> locks.isHeldByCurrentThread("abc"));

        assertTrue(held);
        assertFalse(locks.isHeldByCurrentThread("abc"));
        assertEquals(4, locks.stripeCount());
    }

    @Test
    void shouldReleaseStripeWhenActionThrows() {
        HashLocks locks = new HashLocks(1);

        assertThrows(IllegalStateException.class, () -> locks.runWithLock("abc", () -> {
            throw new IllegalStateException("boom");
        }));

        assertFalse(locks.isHeldByCurrentThread("abc"));
        assertThrows(IllegalArgumentException.class, () -> new HashLocks(0));
    }
}
