package com.work.federation.core.support;

import com.work.federation.core.exception.MalformedInputException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class SubnetUtilsTest {

    @Test
    public void third_octet_is_replaced_by_identifier() {
        assertEquals("10.0.3.0/24", SubnetUtils.createSmallerSubnet("10.0.0.0/16", 3));
        assertEquals("172.20.255.0/24", SubnetUtils.createSmallerSubnet("172.20.0.0/16", 255));
    }

    @Test
    public void ip_range_skips_network_and_broadcast() {
        assertEquals("10.0.3.1-10.0.3.254", SubnetUtils.ipRange("10.0.3.0/24"));
        assertEquals("192.168.0.1-192.168.255.254", SubnetUtils.ipRange("192.168.17.4/16"));
    }

    @Test
    public void malformed_cidr_is_rejected() {
        assertThrows(MalformedInputException.class, () -> SubnetUtils.createSmallerSubnet("10.0.0.0", 1));
        assertThrows(MalformedInputException.class, () -> SubnetUtils.createSmallerSubnet("10.0.0.0/16", 256));
        assertThrows(MalformedInputException.class, () -> SubnetUtils.ipRange("300.0.0.0/24"));
        assertThrows(MalformedInputException.class, () -> SubnetUtils.ipRange("10.0.0.0/31"));
        assertThrows(MalformedInputException.class, () -> SubnetUtils.ipRange(null));
    }
}
