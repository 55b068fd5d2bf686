package com.wangbin.netboxsync.core.extract.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class VlanInterfaceTest {

    @Test
    void unitNumberBecomesVid() {
        VlanInterface vlan = VlanInterface.fromName("ae0.1000");
        assertEquals("ae0.1000", vlan.getName());
        assertEquals(1000, vlan.getVid());
        assertTrue(vlan.isMatched());

        assertEquals(999, VlanInterface.fromName("ae12.999").getVid());
        assertEquals(0, VlanInterface.fromName("ae3.0").getVid());
        assertTrue(VlanInterface.fromName("ae3.0").isMatched());
    }

    @Test
    void unparsableNameDefaultsToZeroVid() {
        VlanInterface vlan = VlanInterface.fromName("ge-0/0/1.100");
        assertEquals(0, vlan.getVid());
        assertFalse(vlan.isMatched());
    }

    @Test
    void unitOutOfIntRangeIsTreatedAsUnmatched() {
        VlanInterface vlan = VlanInterface.fromName("ae0.99999999999");
        assertEquals(0, vlan.getVid());
        assertFalse(vlan.isMatched());
    }
}
