package com.work.federation.model;

import com.work.federation.core.support.ValidationUtils;

import java.util.Objects;

/**
 * 一侧（consumer 或 provider）的服务端点：服务目录库、拓扑库、NSD id、NS id。
 * 未设置的字段在链上编码为字面量 None。
 */
public final class ServiceEndpoint {

    public static final ServiceEndpoint EMPTY = new ServiceEndpoint(null, null, null, null);

    private final String serviceCatalogDb;
    private final String topologyDb;
    private final String nsdId;
    private final String nsId;

    public ServiceEndpoint(String serviceCatalogDb, String topologyDb, String nsdId, String nsId) {
        this.serviceCatalogDb = normalize(serviceCatalogDb);
        this.topologyDb = normalize(topologyDb);
        this.nsdId = normalize(nsdId);
        this.nsId = normalize(nsId);
    }

    /**
     * 从链上字符串构造，None 与空串都视为未设置。
     */
    public static ServiceEndpoint fromWire(String serviceCatalogDb, String topologyDb, String nsdId, String nsId) {
        return new ServiceEndpoint(serviceCatalogDb, topologyDb, nsdId, nsId);
    }

    public ServiceEndpoint validate() {
        if (serviceCatalogDb != null) {
            ValidationUtils.requireValidUrl(serviceCatalogDb, "service_catalog_db");
        }
        if (topologyDb != null) {
            ValidationUtils.requireValidUrl(topologyDb, "topology_db");
        }
        if (nsdId != null) {
            ValidationUtils.requireValidIdentifier(nsdId, "nsd_id");
        }
        if (nsId != null) {
            ValidationUtils.requireValidIdentifier(nsId, "ns_id");
        }
        return this;
    }

    public String catalogWire() {
        return wire(serviceCatalogDb);
    }

    public String topologyWire() {
        return wire(topologyDb);
    }

    public String nsdWire() {
        return wire(nsdId);
    }

    public String nsWire() {
        return wire(nsId);
    }

    public boolean isEmpty() {
        return serviceCatalogDb == null && topologyDb == null && nsdId == null && nsId == null;
    }

    private static String normalize(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() || ServiceRequirements.NONE.equals(trimmed) ? null : trimmed;
    }

    private static String wire(String value) {
        return value == null ? ServiceRequirements.NONE : value;
    }

    public String getServiceCatalogDb() {
        return serviceCatalogDb;
    }

    public String getTopologyDb() {
        return topologyDb;
    }

    public String getNsdId() {
        return nsdId;
    }

    public String getNsId() {
        return nsId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ServiceEndpoint)) return false;
        ServiceEndpoint that = (ServiceEndpoint) o;
        return Objects.equals(serviceCatalogDb, that.serviceCatalogDb)
                && Objects.equals(topologyDb, that.topologyDb)
                && Objects.equals(nsdId, that.nsdId)
                && Objects.equals(nsId, that.nsId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(serviceCatalogDb, topologyDb, nsdId, nsId);
    }

    @Override
    public String toString() {
        return "ServiceEndpoint{catalog=" + serviceCatalogDb + ", topology=" + topologyDb
                + ", nsd=" + nsdId + ", ns=" + nsId + "}";
    }
}
