package com.camsentinel.core.support;

import com.camsentinel.core.model.DeviceConfig;

public final class TestDevices {

    private TestDevices() {
    }

    public static DeviceConfig device(String name) {
        return DeviceConfig.builder()
                .name(name)
                .host("192.168.1." + (10 + Math.abs(name.hashCode() % 200)))
                .username("admin")
                .password("secret")
                .channel(0)
                .build();
    }
}
