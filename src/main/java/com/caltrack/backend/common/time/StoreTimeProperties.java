package com.caltrack.backend.common.time;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * application.yml:
 * app.store.*
 */
@ConfigurationProperties(prefix = "app.store")
public class StoreTimeProperties {

    /** zone that defines "calendar day" for daily logs; blank = JVM default */
    private String zone = "";

    public String getZone() { return zone; }
    public void setZone(String zone) { this.zone = zone; }
}
