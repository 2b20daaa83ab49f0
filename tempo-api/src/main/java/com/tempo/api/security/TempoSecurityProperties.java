package com.tempo.api.security;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties(prefix = "tempo.security")
public record TempoSecurityProperties(

    /**
     * When true, POST /schedule/delete needs no token and checks no owner.
     * Set to false to require a bearer token and ownership of the schedule.
     */
    @DefaultValue("true") boolean openScheduleDelete

) {}
