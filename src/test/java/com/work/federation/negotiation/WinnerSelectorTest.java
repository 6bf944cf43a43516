package com.work.federation.negotiation;

import com.work.federation.model.Bid;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class WinnerSelectorTest {

    private static Bid bid(int index, long price) {
        return new Bid("service1", index, "0x00000000000000000000000000000000000000a" + index, BigInteger.valueOf(price));
    }

    @Test
    public void lowest_price_wins() {
        Bid winner = WinnerSelector.select(Arrays.asList(bid(0, 50), bid(1, 30), bid(2, 40)));

        assertEquals(1, winner.getBidIndex());
    }

    @Test
    public void tie_goes_to_the_earliest_bid() {
        Bid winner = WinnerSelector.select(Arrays.asList(bid(2, 30), bid(1, 30), bid(0, 45)));

        assertEquals(1, winner.getBidIndex());
    }

    @Test
    public void result_does_not_depend_on_input_order() {
        Bid a = WinnerSelector.select(Arrays.asList(bid(0, 7), bid(1, 3), bid(2, 3)));
        Bid b = WinnerSelector.select(Arrays.asList(bid(2, 3), bid(0, 7), bid(1, 3)));

        assertEquals(a, b);
    }

    @Test
    public void empty_bids_are_rejected() {
        assertThrows(IllegalArgumentException.class, () -> WinnerSelector.select(Collections.emptyList()));
        assertThrows(IllegalArgumentException.class, () -> WinnerSelector.select(null));
    }
}
