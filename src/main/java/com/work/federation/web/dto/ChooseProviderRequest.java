package com.work.federation.web.dto;

import javax.validation.constraints.Min;
import javax.validation.constraints.NotNull;

public class ChooseProviderRequest {

    @NotNull(message = "bidIndex 不能为空")
    @Min(value = 0, message = "bidIndex 不能为负")
    private Integer bidIndex;

    public Integer getBidIndex() {
        return bidIndex;
    }

    public void setBidIndex(Integer bidIndex) {
        this.bidIndex = bidIndex;
    }
}
