package com.work.federation.model;

import com.work.federation.core.exception.MalformedInputException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class ServiceRequirementsTest {

    @Test
    public void unset_fields_are_written_as_none() {
        ServiceRequirements req = new ServiceRequirements("k8s_deployment", 10.0, 20, null, null);

        assertEquals("service_type=k8s_deployment; bandwidth_gbps=10.0; rtt_latency_ms=20; "
                + "compute_cpus=None; compute_ram_gb=None", req.format());
    }

    @Test
    public void parse_tolerates_whitespace_and_unknown_keys() {
        ServiceRequirements req = ServiceRequirements.parse(
                "  service_type = nginx ;bandwidth_gbps=2.5;; colour=blue; compute_cpus=4 ;compute_ram_gb=None");

        assertEquals("nginx", req.getServiceType());
        assertEquals(Double.valueOf(2.5), req.getBandwidthGbps());
        assertNull(req.getRttLatencyMs());
        assertEquals(Integer.valueOf(4), req.getComputeCpus());
        assertNull(req.getComputeRamGb());
    }

    @Test
    public void formatted_text_parses_back_to_an_equal_value() {
        ServiceRequirements req = new ServiceRequirements("k8s_deployment", null, 15, 2, 8);

        assertEquals(req, ServiceRequirements.parse(req.format()));
    }

    @Test
    public void malformed_text_is_rejected() {
        assertThrows(MalformedInputException.class, () -> ServiceRequirements.parse(""));
        assertThrows(MalformedInputException.class,
                () -> ServiceRequirements.parse("service_type=nginx; rtt_latency_ms=fast"));
        assertThrows(MalformedInputException.class, () -> ServiceRequirements.parse("service_type nginx"));
    }

    @Test
    public void validate_rejects_non_positive_numbers() {
        assertThrows(MalformedInputException.class,
                () -> new ServiceRequirements("nginx", 0.0, null, null, null).validate());
        assertThrows(MalformedInputException.class,
                () -> new ServiceRequirements("nginx", null, null, -2, null).validate());
        assertThrows(MalformedInputException.class,
                () -> new ServiceRequirements("bad type;", null, null, null, null).validate());
    }

    @Test
    public void blank_service_type_defaults_to_k8s_deployment() {
        assertEquals(ServiceRequirements.DEFAULT_SERVICE_TYPE, ServiceRequirements.ofType(" ").getServiceType());
    }

    @Test
    public void unset_or_none_service_type_falls_back_to_the_default() {
        ServiceRequirements none = ServiceRequirements.parse("service_type=None; bandwidth_gbps=1.0");
        ServiceRequirements missing = ServiceRequirements.parse("bandwidth_gbps=1.0; compute_cpus=None");

        assertEquals(ServiceRequirements.DEFAULT_SERVICE_TYPE, none.getServiceType());
        assertEquals(Double.valueOf(1.0), none.getBandwidthGbps());
        assertEquals(ServiceRequirements.DEFAULT_SERVICE_TYPE, missing.getServiceType());
        assertNull(missing.getComputeCpus());
    }
}
