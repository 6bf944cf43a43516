package com.work.federation.web.dto;

import com.work.federation.model.ServiceEndpoint;

/**
 * 服务端点（四项均可为空，链上以 "None" 表示）。
 */
public class EndpointPayload {

    private String serviceCatalogDb;
    private String topologyDb;
    private String nsdId;
    private String nsId;

    public static EndpointPayload from(ServiceEndpoint endpoint) {
        EndpointPayload p = new EndpointPayload();
        if (endpoint != null) {
            p.setServiceCatalogDb(endpoint.getServiceCatalogDb());
            p.setTopologyDb(endpoint.getTopologyDb());
            p.setNsdId(endpoint.getNsdId());
            p.setNsId(endpoint.getNsId());
        }
        return p;
    }

    public static ServiceEndpoint toEndpoint(EndpointPayload payload) {
        if (payload == null) {
            return ServiceEndpoint.EMPTY;
        }
        return new ServiceEndpoint(payload.serviceCatalogDb, payload.topologyDb, payload.nsdId, payload.nsId);
    }

    public String getServiceCatalogDb() {
        return serviceCatalogDb;
    }

    public void setServiceCatalogDb(String serviceCatalogDb) {
        this.serviceCatalogDb = serviceCatalogDb;
    }

    public String getTopologyDb() {
        return topologyDb;
    }

    public void setTopologyDb(String topologyDb) {
        this.topologyDb = topologyDb;
    }

    public String getNsdId() {
        return nsdId;
    }

    public void setNsdId(String nsdId) {
        this.nsdId = nsdId;
    }

    public String getNsId() {
        return nsId;
    }

    public void setNsId(String nsId) {
        this.nsId = nsId;
    }
}
