package com.work.federation.model;

import java.math.BigInteger;
import java.util.Objects;

/**
 * 链上的一条报价。bidIndex 为该服务下的报价序号（从 0 开始），创建后不可变。
 */
public final class Bid {

    private final String serviceId;
    private final int bidIndex;
    private final String providerAddress;
    private final BigInteger price;

    public Bid(String serviceId, int bidIndex, String providerAddress, BigInteger price) {
        if (bidIndex < 0) {
            throw new IllegalArgumentException("bidIndex 不能为负数");
        }
        if (price == null || price.signum() < 0) {
            throw new IllegalArgumentException("price 不能为负数");
        }
        this.serviceId = serviceId;
        this.bidIndex = bidIndex;
        this.providerAddress = providerAddress;
        this.price = price;
    }

    public String getServiceId() {
        return serviceId;
    }

    public int getBidIndex() {
        return bidIndex;
    }

    public String getProviderAddress() {
        return providerAddress;
    }

    public BigInteger getPrice() {
        return price;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Bid)) return false;
        Bid bid = (Bid) o;
        return bidIndex == bid.bidIndex
                && Objects.equals(serviceId, bid.serviceId)
                && Objects.equals(providerAddress, bid.providerAddress)
                && price.equals(bid.price);
    }

    @Override
    public int hashCode() {
        return Objects.hash(serviceId, bidIndex, providerAddress, price);
    }

    @Override
    public String toString() {
        return "Bid{serviceId=" + serviceId + ", index=" + bidIndex + ", provider=" + providerAddress
                + ", price=" + price + "}";
    }
}
