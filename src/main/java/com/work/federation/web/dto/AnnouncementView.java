package com.work.federation.web.dto;

import com.work.federation.model.ServiceAnnouncement;
import com.work.federation.model.ServiceRequirements;

public class AnnouncementView {

    private String serviceId;
    private String rawRequirements;
    private RequirementsPayload requirements;
    private Long blockNumber;
    private String txHash;

    public static AnnouncementView from(ServiceAnnouncement announcement) {
        AnnouncementView v = new AnnouncementView();
        v.setServiceId(announcement.getServiceId());
        v.setRawRequirements(announcement.getRawRequirements());
        ServiceRequirements parsed = announcement.getRequirements();
        if (parsed != null) {
            RequirementsPayload p = new RequirementsPayload();
            p.setServiceType(parsed.getServiceType());
            p.setBandwidthGbps(parsed.getBandwidthGbps());
            p.setRttLatencyMs(parsed.getRttLatencyMs());
            p.setComputeCpus(parsed.getComputeCpus());
            p.setComputeRamGb(parsed.getComputeRamGb());
            v.setRequirements(p);
        }
        v.setBlockNumber(announcement.getBlockNumber());
        v.setTxHash(announcement.getTxHash());
        return v;
    }

    public String getServiceId() {
        return serviceId;
    }

    public void setServiceId(String serviceId) {
        this.serviceId = serviceId;
    }

    public String getRawRequirements() {
        return rawRequirements;
    }

    public void setRawRequirements(String rawRequirements) {
        this.rawRequirements = rawRequirements;
    }

    public RequirementsPayload getRequirements() {
        return requirements;
    }

    public void setRequirements(RequirementsPayload requirements) {
        this.requirements = requirements;
    }

    public Long getBlockNumber() {
        return blockNumber;
    }

    public void setBlockNumber(Long blockNumber) {
        this.blockNumber = blockNumber;
    }

    public String getTxHash() {
        return txHash;
    }

    public void setTxHash(String txHash) {
        this.txHash = txHash;
    }
}
