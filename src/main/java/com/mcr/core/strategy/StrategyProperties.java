package com.mcr.core.strategy;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "mcr.strategy")
public class StrategyProperties {

    /** Resource pattern of the strategy graph files. */
    private String location = "classpath*:strategies/*.json";

    /** Strategy used for statements when the router has no recommendation. */
    private String defaultAssert = "direct-s1-assert";

    /** Strategy used for questions when the router has no recommendation. */
    private String defaultQuery = "direct-s1-query";

    public String getLocation() {
        return location;
    }

    public void setLocation(String location) {
        this.location = location;
    }

    public String getDefaultAssert() {
        return defaultAssert;
    }

    public void setDefaultAssert(String defaultAssert) {
        this.defaultAssert = defaultAssert;
    }

    public String getDefaultQuery() {
        return defaultQuery;
    }

    public void setDefaultQuery(String defaultQuery) {
        this.defaultQuery = defaultQuery;
    }
}
