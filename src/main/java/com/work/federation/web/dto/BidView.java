package com.work.federation.web.dto;

import com.work.federation.model.Bid;

import java.math.BigInteger;

public class BidView {

    private Integer bidIndex;
    private String providerAddress;
    private BigInteger price;

    public static BidView from(Bid bid) {
        BidView v = new BidView();
        v.setBidIndex(bid.getBidIndex());
        v.setProviderAddress(bid.getProviderAddress());
        v.setPrice(bid.getPrice());
        return v;
    }

    public Integer getBidIndex() {
        return bidIndex;
    }

    public void setBidIndex(Integer bidIndex) {
        this.bidIndex = bidIndex;
    }

    public String getProviderAddress() {
        return providerAddress;
    }

    public void setProviderAddress(String providerAddress) {
        this.providerAddress = providerAddress;
    }

    public BigInteger getPrice() {
        return price;
    }

    public void setPrice(BigInteger price) {
        this.price = price;
    }
}
