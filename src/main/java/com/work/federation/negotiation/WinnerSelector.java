package com.work.federation.negotiation;

import com.work.federation.model.Bid;

import java.util.Collection;
import java.util.Comparator;

/**
 * 胜者选择：价格最低者胜；同价取报价序号最小者（最早提交）。纯函数，结果只取决于报价集合。
 */
public final class WinnerSelector {

    private static final Comparator<Bid> ORDER = Comparator
            .comparing(Bid::getPrice)
            .thenComparingInt(Bid::getBidIndex);

    private WinnerSelector() {
        throw new AssertionError("工具类不允许实例化");
    }

    public static Bid select(Collection<Bid> bids) {
        if (bids == null || bids.isEmpty()) {
            throw new IllegalArgumentException("bids 不能为空");
        }
        return bids.stream().min(ORDER).orElseThrow(IllegalStateException::new);
    }
}
