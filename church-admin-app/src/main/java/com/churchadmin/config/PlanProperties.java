package com.churchadmin.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "churchadmin.plans")
public class PlanProperties {

    private int basicMemberLimit = 300;

    /**
     * Member ceiling for a subscription plan; premium is unlimited.
     */
    public int memberLimitFor(String plan) {
        if ("premium".equalsIgnoreCase(plan)) {
            return Integer.MAX_VALUE;
        }
        // basic, free and anything unknown share the basic ceiling
        return basicMemberLimit;
    }

    public int getBasicMemberLimit() {
        return basicMemberLimit;
    }

    public void setBasicMemberLimit(int basicMemberLimit) {
        this.basicMemberLimit = basicMemberLimit;
    }
}
